package organ.converter.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import organ.converter.ConversionException;
import organ.converter.HwDocument;
import organ.converter.graph.RecordStore;
import organ.converter.model.ConversionLog;
import organ.converter.model.SourceRecord;

class SourceLoaderTest {

    private final ConversionLog log = new ConversionLog();

    private RecordStore load(String xml) throws ConversionException {
        final RecordStore store = new RecordStore();
        new SourceLoader(AttributeDictionary.bundled(), log)
                .load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "doc", store);
        return store;
    }

    @Test
    void abbreviatedNamesAreExpandedAndIdsTaken() throws Exception {
        final RecordStore store = load("""
                <Hauptwerk FileFormat="Organ" FileFormatVersion="4.00">
                 <ObjectList ObjectType="_General"><o><a>Test Organ</a></o></ObjectList>
                 <ObjectList ObjectType="Keyboard">
                  <o><a>3</a><b>Swell</b><c>56</c></o>
                  <o><a>1</a><b>Great</b></o>
                 </ObjectList>
                </Hauptwerk>
                """);

        assertThat(store.root().attr("Identification_Name")).isEqualTo("Test Organ");
        final SourceRecord swell = store.find("Keyboard", 3);
        assertThat(swell.attr("Name")).isEqualTo("Swell");
        assertThat(swell.attr("KeyGen_NumberOfKeys")).isEqualTo("56");
        assertThat(store.ofType("Keyboard")).extracting(SourceRecord::id).containsExactly(1, 3);
    }

    @Test
    void recordsWithoutIdAreNumberedSequentially() throws Exception {
        final RecordStore store = HwDocument.organ("x")
                .add("KeyboardKey", "KeyboardID", "1", "NormalMIDINoteNumber", "36")
                .add("KeyboardKey", "KeyboardID", "1", "NormalMIDINoteNumber", "37")
                .link(log);

        assertThat(store.find("KeyboardKey", 1).attr("NormalMIDINoteNumber")).isEqualTo("36");
        assertThat(store.find("KeyboardKey", 2).attr("NormalMIDINoteNumber")).isEqualTo("37");
    }

    @Test
    void duplicateIdIsReassignedWithWarning() throws Exception {
        final RecordStore store = HwDocument.organ("x")
                .add("Stop", "StopID", "1", "Name", "A")
                .add("Stop", "StopID", "1", "Name", "B")
                .link(log);

        assertThat(store.count("Stop")).isEqualTo(2);
        assertThat(store.find("Stop", 2).attr("Name")).isEqualTo("B");
        assertThat(log.contains(ConversionLog.Severity.WARNING, "duplicate StopID=1")).isTrue();
    }

    @Test
    void unknownTypeIsDroppedAsInternalError() throws Exception {
        final RecordStore store = HwDocument.organ("x").add("Mystery", "Foo", "1").link(log);
        assertThat(store.hasType("Mystery")).isFalse();
        assertThat(log.contains(ConversionLog.Severity.INTERNAL, "Mystery")).isTrue();
    }

    @Test
    void wrongEnvelopeIsFatal() {
        assertThatThrownBy(() -> load("<Hauptwerk FileFormat=\"Component\"></Hauptwerk>"))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("not a Hauptwerk organ definition");
        assertThatThrownBy(() -> load("<Hauptwerk FileFormat=\"Organ\"><ObjectList ObjectType=\"_General\">"))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void missingRootRecordIsFatal() {
        assertThatThrownBy(() -> load("<Hauptwerk FileFormat=\"Organ\"></Hauptwerk>"))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("_General");
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path tmp) {
        assertThatThrownBy(() -> new SourceLoader(AttributeDictionary.bundled(), log)
                .load(tmp.resolve("none.Organ_Hauptwerk_xml"), new RecordStore()))
                .isInstanceOf(IOException.class);
    }
}
