package organ.converter.io;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import organ.converter.ConversionResult;
import organ.converter.check.OdfObjectGraph;
import organ.converter.model.ConversionLog;
import organ.converter.model.TargetRecord;

class ReportWriterTest {

    @TempDir
    Path tmp;

    private ConversionResult result() {
        final ConversionLog log = new ConversionLog();
        log.warn("Stop000004: missing attribute Name");
        final List<TargetRecord> records = List.of(
                new TargetRecord("Organ"),
                new TargetRecord("Manual001"),
                new TargetRecord("Switch001"));
        final OdfObjectGraph graph = OdfObjectGraph.build(records, log);
        return new ConversionResult(tmp.resolve("in.Organ_Hauptwerk_xml"), tmp.resolve("in.organ"), null,
                Map.of("Keyboard", 1, "Switch", 2), Map.of("Organ", 1, "Manual", 1, "Switch", 1), graph, log);
    }

    @Test
    void reportCarriesSchemaSummaryAndTree() throws Exception {
        final String json = new ReportWriter().render(result(), "2026-01-01T00:00:00Z");
        final JsonNode root = new ObjectMapper().readTree(json);

        assertThat(root.path("schema").asText()).isEqualTo(ReportWriter.SCHEMA_VERSION);
        assertThat(root.path("generatedAt").asText()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(root.path("silentLoop").isNull()).isTrue();
        assertThat(root.path("summary").path("sourceRecords").asInt()).isEqualTo(3);
        assertThat(root.path("summary").path("targetObjects").asInt()).isEqualTo(3);
        // one warning logged by hand, one for the unused switch
        assertThat(root.path("summary").path("warnings").asInt()).isEqualTo(2);
        assertThat(root.path("summary").path("unusedObjects").asInt()).isEqualTo(1);
        assertThat(root.path("objectTree").get(0).path("id").asText()).isEqualTo("Organ");
        assertThat(root.path("objectTree").get(0).path("children").get(0).path("id").asText()).isEqualTo("Manual001");
        assertThat(root.path("log").get(0).path("severity").asText()).isEqualTo("WARNING");
    }

    @Test
    void writeCreatesParentDirectories() throws Exception {
        final Path file = tmp.resolve("reports/run.json");
        new ReportWriter().write(file, result(), "now");
        assertThat(file).exists();
        assertThat(new ObjectMapper().readTree(file.toFile()).path("target").asText())
                .isEqualTo(tmp.resolve("in.organ").toString());
    }
}
