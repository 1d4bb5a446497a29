package organ.converter.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import organ.converter.ConversionResult;
import organ.converter.check.OdfObjectGraph;
import organ.converter.model.ConversionLog;

public final class ReportWriter {

    public static final String SCHEMA_VERSION = "odf-conversion/v1";

    private final ObjectMapper jsonMapper;

    public ReportWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Path file, ConversionResult result, String generatedAt) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        jsonMapper.writeValue(file.toFile(), report(result, generatedAt));
    }

    public String render(ConversionResult result, String generatedAt) throws IOException {
        return jsonMapper.writeValueAsString(report(result, generatedAt));
    }

    static Report report(ConversionResult result, String generatedAt) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(generatedAt, "generatedAt");
        final ConversionLog log = result.log();

        final List<LogEntry> entries = new ArrayList<>(log.entries().size());
        for (ConversionLog.Entry e : log.entries()) {
            entries.add(new LogEntry(e.severity().name(), e.message()));
        }
        final Summary summary = new Summary(
                result.sourceCounts().values().stream().mapToInt(Integer::intValue).sum(),
                result.targetCounts().values().stream().mapToInt(Integer::intValue).sum(),
                log.count(ConversionLog.Severity.WARNING),
                log.count(ConversionLog.Severity.ERROR),
                log.count(ConversionLog.Severity.INTERNAL),
                result.objectGraph().unresolvedReferences().size(),
                result.objectGraph().unusedObjects().size()
        );
        return new Report(
                SCHEMA_VERSION,
                generatedAt,
                result.sourceDocument().toString(),
                result.targetFile().toString(),
                result.silentLoopFile() == null ? null : result.silentLoopFile().toString(),
                summary,
                new TreeMap<>(result.sourceCounts()),
                new TreeMap<>(result.targetCounts()),
                result.objectGraph().tree(),
                entries
        );
    }

    // --- report records ---

    public record Report(
            String schema,
            String generatedAt,
            String source,
            String target,
            String silentLoop,
            Summary summary,
            Map<String, Integer> sourceRecords,
            Map<String, Integer> targetObjects,
            List<OdfObjectGraph.Node> objectTree,
            List<LogEntry> log
    ) {
    }

    public record Summary(
            int sourceRecords,
            int targetObjects,
            int warnings,
            int errors,
            int internalErrors,
            int unresolvedReferences,
            int unusedObjects
    ) {
    }

    public record LogEntry(
            String severity,
            String message
    ) {
    }
}
