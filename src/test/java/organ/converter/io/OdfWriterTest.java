package organ.converter.io;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import organ.converter.model.TargetRecord;

class OdfWriterTest {

    private static List<TargetRecord> records() {
        return List.of(
                new TargetRecord("Organ").set("ChurchName", "Test").set("HasPedals", false),
                new TargetRecord("Manual001").set("Name", "Great"));
    }

    @Test
    void rendersSectionsInOrderWithCrLf() {
        final String text = new OdfWriter("test.Organ_Hauptwerk_xml").render(records());

        assertThat(text).startsWith("; GrandOrgue organ definition converted from test.Organ_Hauptwerk_xml\r\n");
        assertThat(text).contains("\r\n[Organ]\r\nChurchName=Test\r\nHasPedals=N\r\n\r\n[Manual001]\r\nName=Great\r\n");
        assertThat(text.replace("\r\n", "")).doesNotContain("\n");
    }

    @Test
    void lineBreaksInValuesCannotStartNewAttributes() {
        final TargetRecord organ = new TargetRecord("Organ")
                .set("OrganComments", "line one\nHasPedals=Y\r\nline three\rend")
                .set("HasPedals", false);

        final String text = new OdfWriter("test").render(List.of(organ));

        assertThat(text).contains("\r\nOrganComments=line one HasPedals=Y line three end\r\n");
        assertThat(text.lines().filter(l -> l.startsWith("HasPedals="))).containsExactly("HasPedals=N");
        assertThat(OdfWriter.singleLine("plain")).isEqualTo("plain");
    }

    @Test
    void fileStartsWithByteOrderMark(@TempDir Path tmp) throws Exception {
        final Path file = tmp.resolve("out/test.organ");
        new OdfWriter("test").write(file, records());

        final byte[] bytes = Files.readAllBytes(file);
        assertThat(bytes).startsWith((byte) 0xEF, (byte) 0xBB, (byte) 0xBF);
        assertThat(new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8))
                .isEqualTo(new OdfWriter("test").render(records()));
    }

    @Test
    void organExtensionIsAppendedOnce() {
        assertThat(OdfWriter.withOrganExtension(Path.of("a/Test"))).isEqualTo(Path.of("a/Test.organ"));
        assertThat(OdfWriter.withOrganExtension(Path.of("a/Test.ORGAN"))).isEqualTo(Path.of("a/Test.ORGAN"));
    }
}
