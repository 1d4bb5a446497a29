package organ.converter;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Run-time settings of one conversion.
 *
 * @param targetFile     target document, or null for {@code <sampleSetRoot>/<sourceBaseName>.organ}
 * @param checkFiles     probe referenced media files on disk
 * @param attributeTable attribute lookup table, or null for the bundled one
 * @param excludedLinks  linkage rules to skip, as {@code Type.Attribute}
 * @param reportFile     JSON report destination, or null for none
 */
public record ConversionOptions(
        Path targetFile,
        boolean checkFiles,
        Path attributeTable,
        Set<String> excludedLinks,
        Path reportFile
) {

    public static final String DEFAULT_EXCLUDED_LINK = "StopRank.AlternateRankID";

    public ConversionOptions {
        excludedLinks = Set.copyOf(Objects.requireNonNull(excludedLinks, "excludedLinks"));
    }

    public static ConversionOptions defaults() {
        return new ConversionOptions(null, true, null, Set.of(DEFAULT_EXCLUDED_LINK), null);
    }

    public ConversionOptions withTargetFile(Path file) {
        return new ConversionOptions(file, checkFiles, attributeTable, excludedLinks, reportFile);
    }

    public ConversionOptions withCheckFiles(boolean check) {
        return new ConversionOptions(targetFile, check, attributeTable, excludedLinks, reportFile);
    }
}
