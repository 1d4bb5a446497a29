package organ.converter.scan;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;

/**
 * Resolves media paths declared in the source document against the sample set on disk.
 * <p>
 * Paths are relative to the sample set root. Each segment is matched case-insensitively, so the
 * returned path carries the case found on disk. With checking disabled, paths are only normalized.
 */
public final class MediaResolver {

    public static final String PACKAGES_DIR = "OrganInstallationPackages";
    public static final String DEFINITIONS_DIR = "OrganDefinitions";

    private final Path sampleSetRoot;
    private final boolean checkFiles;
    private final ConversionLog log;
    private final Map<Path, Map<String, String>> listings = new HashMap<>();
    private final Map<String, String> resolved = new HashMap<>();

    public MediaResolver(Path sampleSetRoot, boolean checkFiles, ConversionLog log) {
        this.sampleSetRoot = Objects.requireNonNull(sampleSetRoot, "sampleSetRoot");
        this.checkFiles = checkFiles;
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Sample set root of a source document: the parent of its {@code OrganDefinitions} directory, or its
     * own directory for documents stored elsewhere.
     */
    public static Path sampleSetRootOf(Path sourceDocument) {
        final Path dir = sourceDocument.toAbsolutePath().normalize().getParent();
        if (dir == null) {
            return Path.of(".").toAbsolutePath().normalize();
        }
        final Path name = dir.getFileName();
        if (name != null && DEFINITIONS_DIR.equalsIgnoreCase(name.toString()) && dir.getParent() != null) {
            return dir.getParent();
        }
        return dir;
    }

    /**
     * Relative path of a file of an installation package, e.g.
     * {@code OrganInstallationPackages/000012/pipe/C.wav}.
     */
    public static String packagePath(int installationPackageId, String declared) {
        return PACKAGES_DIR + "/" + String.format("%06d", installationPackageId) + "/" + Ids.normalizePath(declared);
    }

    public Path sampleSetRoot() {
        return sampleSetRoot;
    }

    /**
     * Returns the path to write in the target document, or null when checking is enabled and the file
     * does not exist (a warning is logged once per path).
     */
    public String resolve(String relativePath) {
        final String normalized = Ids.normalizePath(relativePath);
        if (!checkFiles || normalized.isEmpty()) {
            return normalized;
        }
        if (resolved.containsKey(normalized)) {
            return resolved.get(normalized);
        }
        final String found = lookup(normalized);
        if (found == null) {
            log.warn("media file not found: " + normalized);
        }
        resolved.put(normalized, found);
        return found;
    }

    private String lookup(String normalized) {
        Path current = sampleSetRoot;
        final StringBuilder actual = new StringBuilder();
        for (String segment : normalized.split("/")) {
            final String match = listing(current).get(segment.toLowerCase(Locale.ROOT));
            if (match == null) {
                return null;
            }
            if (actual.length() > 0) {
                actual.append('/');
            }
            actual.append(match);
            current = current.resolve(match);
        }
        return Files.isRegularFile(current) ? actual.toString() : null;
    }

    private Map<String, String> listing(Path dir) {
        return listings.computeIfAbsent(dir, d -> {
            final Map<String, String> names = new HashMap<>();
            if (!Files.isDirectory(d)) {
                return names;
            }
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(d)) {
                for (Path p : entries) {
                    final String name = p.getFileName().toString();
                    final String lower = name.toLowerCase(Locale.ROOT);
                    // case variants: keep the lexicographically first one
                    names.merge(lower, name, (a, b) -> a.compareTo(b) <= 0 ? a : b);
                }
            } catch (IOException ex) {
                log.warn("cannot list directory " + d + ": " + ex.getMessage());
            }
            return names;
        });
    }
}
