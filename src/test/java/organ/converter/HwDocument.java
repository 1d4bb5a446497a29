package organ.converter;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import organ.converter.graph.GraphLinker;
import organ.converter.graph.RecordStore;
import organ.converter.model.ConversionLog;
import organ.converter.scan.AttributeDictionary;
import organ.converter.scan.SourceLoader;

/**
 * Builds small source documents for tests. Attribute names are written in full.
 */
public final class HwDocument {

    private final Map<String, List<String[]>> groups = new LinkedHashMap<>();

    public static HwDocument organ(String name) {
        return new HwDocument()
                .add("_General", "Identification_Name", name)
                .add("InstallationPackage", "InstallationPackageID", "1", "Name", "Samples");
    }

    /**
     * Adds one element block; {@code attributes} alternates name and value.
     */
    public HwDocument add(String type, String... attributes) {
        if (attributes.length % 2 != 0) {
            throw new IllegalArgumentException("name/value pairs expected");
        }
        groups.computeIfAbsent(type, t -> new ArrayList<>()).add(attributes);
        return this;
    }

    public String xml() {
        final StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<Hauptwerk FileFormat=\"Organ\" FileFormatVersion=\"4.00\">\n");
        for (var e : groups.entrySet()) {
            sb.append(" <ObjectList ObjectType=\"").append(e.getKey()).append("\">\n");
            for (String[] block : e.getValue()) {
                sb.append("  <o>");
                for (int i = 0; i < block.length; i += 2) {
                    sb.append('<').append(block[i]).append('>')
                            .append(escape(block[i + 1]))
                            .append("</").append(block[i]).append('>');
                }
                sb.append("</o>\n");
            }
            sb.append(" </ObjectList>\n");
        }
        sb.append("</Hauptwerk>\n");
        return sb.toString();
    }

    public Path write(Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.writeString(file, xml(), StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Loads and links the document with the bundled table and default exclusions.
     */
    public RecordStore link(ConversionLog log) throws ConversionException {
        final RecordStore store = new RecordStore();
        new SourceLoader(AttributeDictionary.bundled(), log)
                .load(new ByteArrayInputStream(xml().getBytes(StandardCharsets.UTF_8)), "test", store);
        new GraphLinker(ConversionOptions.defaults().excludedLinks(), log, ProgressListener.NONE).link(store);
        return store;
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    // --- common fragments ---

    /**
     * A rank with one pipe per note in {@code [firstNote, lastNote]}, each with one layer and attack sample.
     * Record ids are derived from {@code rankId} so several ranks can coexist.
     */
    public HwDocument rank(int rankId, String name, int firstNote, int lastNote) {
        add("Rank", "RankID", str(rankId), "Name", name);
        for (int note = firstNote; note <= lastNote; note++) {
            final int pipeId = rankId * 1000 + note;
            add("Pipe_SoundEngine01", "PipeID", str(pipeId), "RankID", str(rankId), "NormalMIDINoteNumber", str(note));
            add("Pipe_SoundEngine01_Layer", "LayerID", str(pipeId), "PipeID", str(pipeId));
            add("Pipe_SoundEngine01_AttackSample", "UniqueID", str(pipeId), "LayerID", str(pipeId),
                    "SampleID", str(pipeId));
            add("Sample", "SampleID", str(pipeId), "InstallationPackageID", "1",
                    "SampleFilename", "Pipes\\" + name + "\\" + note + ".wav");
        }
        return this;
    }

    public HwDocument keyboard(int id, String name, int firstNote, int keys) {
        return add("Keyboard", "KeyboardID", str(id), "Name", name,
                "KeyGen_NumberOfKeys", str(keys), "KeyGen_MIDINoteNumberOfFirstKey", str(firstNote),
                "Hint_PrimaryAssociatedDivisionID", str(id));
    }

    public HwDocument drawstop(int switchId, String name) {
        return add("Switch", "SwitchID", str(switchId), "Name", name, "Clickable", "Y");
    }

    public static String str(int value) {
        return Integer.toString(value);
    }
}
