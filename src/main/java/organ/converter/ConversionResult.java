package organ.converter;

import java.nio.file.Path;
import java.util.Map;

import organ.converter.check.OdfObjectGraph;
import organ.converter.model.ConversionLog;

/**
 * Outcome of one successful conversion run.
 *
 * @param sourceDocument converted document
 * @param targetFile     written organ definition file
 * @param silentLoopFile generated silent loop sample, or null when no noise needed it
 * @param sourceCounts   loaded source records per type
 * @param targetCounts   written target objects per id prefix
 * @param objectGraph    check graph over the written objects
 * @param log            run log
 */
public record ConversionResult(
        Path sourceDocument,
        Path targetFile,
        Path silentLoopFile,
        Map<String, Integer> sourceCounts,
        Map<String, Integer> targetCounts,
        OdfObjectGraph objectGraph,
        ConversionLog log
) {

    public ConversionResult {
        sourceCounts = Map.copyOf(sourceCounts);
        targetCounts = Map.copyOf(targetCounts);
    }

    public int targetCount(String prefix) {
        return targetCounts.getOrDefault(prefix, 0);
    }
}
