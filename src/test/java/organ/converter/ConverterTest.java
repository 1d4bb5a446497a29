package organ.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import organ.converter.model.ConversionLog;
import organ.converter.synth.ObjectSynthesizer;

class ConverterTest {

    @TempDir
    Path root;

    static HwDocument sampleOrgan() {
        return HwDocument.organ("Dorfkirche")
                .add("Division", "DivisionID", "1", "Name", "Great")
                .add("Division", "DivisionID", "2", "Name", "Pedal")
                .keyboard(1, "Great", 36, 56)
                .keyboard(2, "Pedal", 36, 30)
                .drawstop(10, "Gedackt 8")
                .drawstop(11, "Subbass 16")
                .drawstop(12, "Tremulant noise")
                .add("Stop", "StopID", "1", "Name", "Gedackt 8", "DivisionID", "1", "ControllingSwitchID", "10")
                .add("Stop", "StopID", "2", "Name", "Subbass 16", "DivisionID", "2", "ControllingSwitchID", "11")
                .add("Stop", "StopID", "3", "Name", "Stop noise", "DivisionID", "1", "ControllingSwitchID", "12")
                .rank(1, "Gedackt", 36, 91)
                .rank(2, "Subbass", 36, 65)
                .rank(3, "Noise", 60, 60)
                .add("StopRank", "StopID", "1", "RankID", "1")
                .add("StopRank", "StopID", "2", "RankID", "2")
                .add("StopRank", "StopID", "3", "RankID", "3", "ActionTypeCode", "22")
                .add("KeyAction", "SourceKeyboardID", "2", "DestKeyboardID", "1");
    }

    @Test
    void convertsDocumentNextToSampleSet() throws Exception {
        final Path source = sampleOrgan().write(root.resolve("OrganDefinitions/Dorfkirche.Organ_Hauptwerk_xml"));
        final ConversionLog log = new ConversionLog();

        final ConversionResult result = new Converter(log)
                .convert(source, ConversionOptions.defaults().withCheckFiles(false), ProgressListener.NONE);

        assertThat(result.targetFile()).isEqualTo(root.toAbsolutePath().normalize().resolve("Dorfkirche.organ"));
        assertThat(result.targetCount("Manual")).isEqualTo(3);
        assertThat(result.targetCount("Stop")).isEqualTo(3);
        assertThat(result.targetCount("Coupler")).isEqualTo(1);
        assertThat(result.silentLoopFile()).isNotNull().exists();
        assertThat(result.objectGraph().unresolvedReferences()).isEmpty();
        assertThat(log.count(ConversionLog.Severity.INTERNAL)).isZero();

        final String text = new String(Files.readAllBytes(result.targetFile()), StandardCharsets.UTF_8);
        assertThat(text).contains("[Manual000]\r\nName=Pedal\r\n");
        assertThat(text).contains("Pipe001=OrganInstallationPackages/000001/Pipes/Gedackt/36.wav\r\n");
        assertThat(text).contains("Pipe001=" + ObjectSynthesizer.SILENT_LOOP_FILE + "\r\n");
        assertThat(text).contains("NumberOfManuals=2\r\n");
    }

    @Test
    void explicitTargetGetsRelativeMediaPaths() throws Exception {
        final Path source = sampleOrgan().write(root.resolve("OrganDefinitions/Dorfkirche.Organ_Hauptwerk_xml"));
        final Path out = root.resolve("odf/Dorf");

        final ConversionResult result = new Converter(new ConversionLog())
                .convert(source, ConversionOptions.defaults().withCheckFiles(false).withTargetFile(out), null);

        assertThat(result.targetFile()).isEqualTo(root.resolve("odf/Dorf.organ"));
        final String text = Files.readString(result.targetFile(), StandardCharsets.UTF_8);
        assertThat(text).contains("Pipe001=../OrganInstallationPackages/000001/Pipes/Gedackt/36.wav\r\n");
        assertThat(result.silentLoopFile()).isEqualTo(root.resolve("odf").toAbsolutePath()
                .resolve(ObjectSynthesizer.SILENT_LOOP_FILE));
    }

    @Test
    void missingSamplesBecomeWarningsWhenChecked() throws Exception {
        final Path source = sampleOrgan().write(root.resolve("OrganDefinitions/Dorfkirche.Organ_Hauptwerk_xml"));
        final ConversionLog log = new ConversionLog();

        new Converter(log).convert(source, ConversionOptions.defaults(), ProgressListener.NONE);

        assertThat(log.contains(ConversionLog.Severity.WARNING, "media file not found")).isTrue();
    }

    @Test
    void missingSourceIsAnIoError() {
        assertThatThrownBy(() -> new Converter(new ConversionLog())
                .convert(root.resolve("none.xml"), ConversionOptions.defaults(), ProgressListener.NONE))
                .isInstanceOf(IOException.class);
    }

    @Test
    void targetFileUsesBaseNameUpToFirstDot() {
        final Path target = Converter.targetFile(Path.of("defs/My.Organ.Organ_Hauptwerk_xml"), root,
                ConversionOptions.defaults());
        assertThat(target).isEqualTo(root.resolve("My.organ"));
    }

    @Test
    void mediaPrefixIsRelativeToTargetDirectory() {
        assertThat(Converter.mediaPrefix(root.resolve("Organ.organ"), root)).isEmpty();
        assertThat(Converter.mediaPrefix(root.resolve("sub/dir/Organ.organ"), root)).isEqualTo("../../");
        assertThat(Converter.mediaPrefix(root.getParent().resolve("Organ.organ"), root))
                .isEqualTo(root.getFileName() + "/");
    }
}
