package organ.converter.synth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import organ.converter.HwDocument;
import organ.converter.ProgressListener;
import organ.converter.graph.RecordStore;
import organ.converter.graph.TargetStore;
import organ.converter.model.ConversionLog;
import organ.converter.model.SourceRecord;
import organ.converter.model.TargetRecord;
import organ.converter.scan.MediaResolver;

class WindchestRegistryTest {

    @TempDir
    Path root;

    private final ConversionLog log = new ConversionLog();

    private RecordStore organWithSwellBox() throws Exception {
        return HwDocument.organ("x")
                .add("WindCompartment", "WindCompartmentID", "1", "Name", "Great wind")
                .add("WindCompartment", "WindCompartmentID", "2", "Name", "Swell wind")
                .add("ImageSet", "ImageSetID", "1", "Name", "Shoe")
                .add("ImageSetInstance", "ImageSetInstanceID", "7", "ImageSetID", "1")
                .add("ContinuousControl", "ControlID", "3", "Name", "Swell shoe", "ImageSetInstanceID", "7")
                .add("Enclosure", "EnclosureID", "1", "Name", "Swell box", "ShutterPositionContinuousControlID", "3",
                        "MinimumAmplitudePercent", "20")
                .add("Rank", "RankID", "1", "Name", "Mixed")
                .add("Pipe_SoundEngine01", "PipeID", "1", "RankID", "1", "NormalMIDINoteNumber", "36",
                        "WindSupply_SourceWindCompartmentID", "1")
                .add("Pipe_SoundEngine01", "PipeID", "2", "RankID", "1", "NormalMIDINoteNumber", "37",
                        "WindSupply_SourceWindCompartmentID", "2")
                .add("Pipe_SoundEngine01", "PipeID", "3", "RankID", "1", "NormalMIDINoteNumber", "38",
                        "WindSupply_SourceWindCompartmentID", "2")
                .add("EnclosurePipe", "EnclosureID", "1", "PipeID", "2")
                .add("EnclosurePipe", "EnclosureID", "1", "PipeID", "3")
                .link(log);
    }

    private SynthesisContext context(RecordStore store, TargetStore target) {
        return new SynthesisContext(store, target, log, ProgressListener.NONE, new MediaResolver(root, false, log), "");
    }

    @Test
    void oneWindchestPerDistinctTriple() throws Exception {
        final RecordStore store = organWithSwellBox();
        final TargetStore target = new TargetStore();
        final WindchestRegistry registry = context(store, target).windchests;

        final TargetRecord great = registry.windchestFor(store.find("Pipe_SoundEngine01", 1), null);
        final TargetRecord swell = registry.windchestFor(store.find("Pipe_SoundEngine01", 2), null);
        final TargetRecord swellAgain = registry.windchestFor(store.find("Pipe_SoundEngine01", 3), null);

        assertThat(swellAgain).isSameAs(swell);
        assertThat(great).isNotSameAs(swell);
        assertThat(great.get("Name")).isEqualTo("Great wind");
        assertThat(great.get("NumberOfEnclosures")).isEqualTo("0");
        assertThat(swell.get("Name")).isEqualTo("Swell wind / Swell shoe");
        assertThat(swell.get("NumberOfEnclosures")).isEqualTo("1");
        assertThat(swell.get("Enclosure001")).isEqualTo("001");

        final TargetRecord enclosure = target.get("Enclosure001");
        assertThat(enclosure.get("Name")).isEqualTo("Swell shoe");
        assertThat(enclosure.get("AmpMinimumLevel")).isEqualTo("20");
        assertThat(store.find("ContinuousControl", 3).targetId()).isEqualTo("Enclosure001");
    }

    @Test
    void resultDoesNotDependOnRequestOrder() throws Exception {
        final RecordStore forward = organWithSwellBox();
        final TargetStore forwardTarget = new TargetStore();
        final WindchestRegistry a = context(forward, forwardTarget).windchests;
        final SourceRecord pipe3 = forward.find("Pipe_SoundEngine01", 3);
        final String first = a.windchestFor(pipe3, null).get(WindchestRegistry.TRIPLE_ATTRIBUTE);
        a.windchestFor(forward.find("Pipe_SoundEngine01", 1), null);
        assertThat(a.windchestFor(pipe3, null).get(WindchestRegistry.TRIPLE_ATTRIBUTE)).isEqualTo(first);
        assertThat(forwardTarget.count("WindchestGroup")).isEqualTo(2);

        final RecordStore reverse = organWithSwellBox();
        final WindchestRegistry b = context(reverse, new TargetStore()).windchests;
        b.windchestFor(reverse.find("Pipe_SoundEngine01", 1), null);
        assertThat(b.windchestFor(reverse.find("Pipe_SoundEngine01", 3), null).get(WindchestRegistry.TRIPLE_ATTRIBUTE))
                .isEqualTo(first);
    }
}
