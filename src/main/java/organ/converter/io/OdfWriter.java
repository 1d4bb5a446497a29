package organ.converter.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

import organ.converter.model.TargetRecord;

/**
 * Writes target records as an organ definition file: UTF-8 with byte order mark, an introductory comment, then
 * one {@code [ObjectID]} section per record in creation order.
 */
public final class OdfWriter {

    public static final String EXTENSION = ".organ";
    static final char BOM = '\uFEFF';
    static final String NEWLINE = "\r\n";

    private final String sourceName;

    /**
     * @param sourceName name of the converted document, quoted in the introductory comment
     */
    public OdfWriter(String sourceName) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
    }

    /**
     * Appends {@code .organ} unless the file name already ends with it.
     */
    public static Path withOrganExtension(Path file) {
        final String name = file.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            return file;
        }
        return file.resolveSibling(name + EXTENSION);
    }

    public void write(Path file, Collection<TargetRecord> records) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            bw.write(BOM);
            writeTo(bw, records);
        }
    }

    /**
     * The document text without byte order mark.
     */
    public String render(Collection<TargetRecord> records) {
        final StringWriter sw = new StringWriter();
        try {
            writeTo(sw, records);
        } catch (IOException e) {
            throw new IllegalStateException("StringWriter failed", e);
        }
        return sw.toString();
    }

    private void writeTo(Writer out, Collection<TargetRecord> records) throws IOException {
        out.write("; GrandOrgue organ definition converted from " + singleLine(sourceName) + NEWLINE);
        out.write("; Object and attribute order follows the conversion, not the alphabet." + NEWLINE);
        for (TargetRecord record : records) {
            out.write(NEWLINE);
            out.write("[" + record.id() + "]" + NEWLINE);
            for (var e : record.attributes().entrySet()) {
                out.write(e.getKey() + "=" + singleLine(e.getValue()) + NEWLINE);
            }
        }
    }

    /**
     * A value with its line breaks replaced by spaces; each attribute must stay on one line.
     */
    static String singleLine(String value) {
        if (value == null || (value.indexOf('\n') < 0 && value.indexOf('\r') < 0)) {
            return value;
        }
        return value.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
    }
}
