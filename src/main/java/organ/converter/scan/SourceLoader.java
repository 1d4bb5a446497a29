package organ.converter.scan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import organ.converter.ConversionException;
import organ.converter.graph.RecordStore;
import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;

/**
 * Reads a Hauptwerk organ definition into a {@link RecordStore}.
 * <p>
 * Expected shape:
 * <pre>
 * &lt;Hauptwerk FileFormat="Organ" FileFormatVersion="..."&gt;
 *   &lt;ObjectList ObjectType="Keyboard"&gt;
 *     &lt;o&gt;&lt;a&gt;1&lt;/a&gt;&lt;b&gt;Great&lt;/b&gt;&lt;/o&gt;
 *   &lt;/ObjectList&gt;
 * &lt;/Hauptwerk&gt;
 * </pre>
 * The store is cleared first and only filled once the whole document was read successfully.
 */
public final class SourceLoader {

    public static final String ENVELOPE_ELEMENT = "Hauptwerk";
    public static final String ENVELOPE_FORMAT = "Organ";
    public static final String GROUP_ELEMENT = "ObjectList";
    public static final String GROUP_TYPE_ATTRIBUTE = "ObjectType";

    private final AttributeDictionary dictionary;
    private final ConversionLog log;

    public SourceLoader(AttributeDictionary dictionary, ConversionLog log) {
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.log = Objects.requireNonNull(log, "log");
    }

    public void load(Path file, RecordStore store) throws IOException, ConversionException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(store, "store");
        store.clear();
        if (!Files.isRegularFile(file)) {
            throw new IOException("source document not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            load(in, file.toString(), store);
        }
    }

    public void load(InputStream in, String origin, RecordStore store) throws ConversionException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(store, "store");
        store.clear();

        final Map<String, List<Map<String, String>>> blocks = read(in, origin);

        final Map<String, TreeMap<Integer, SourceRecord>> loaded = new LinkedHashMap<>();
        for (var e : blocks.entrySet()) {
            final String type = e.getKey();
            final AttributeDictionary.TypeEntry entry = dictionary.entry(type);
            if (entry == null) {
                log.internal("record type " + type + " is not in attribute table " + dictionary.origin()
                        + ", " + e.getValue().size() + " record(s) dropped");
                continue;
            }
            loaded.put(type, number(type, entry, e.getValue()));
        }

        final TreeMap<Integer, SourceRecord> roots = loaded.get(SourceTypes.GENERAL);
        if (roots == null || roots.isEmpty()) {
            throw new ConversionException(origin + ": no " + SourceTypes.GENERAL + " record");
        }
        store.replaceAll(loaded);
        log.info("loaded " + store.size() + " records of " + loaded.size() + " types from " + origin);
    }

    /**
     * Raw element blocks per type, attribute names expanded later.
     */
    private Map<String, List<Map<String, String>>> read(InputStream in, String origin) throws ConversionException {
        final Map<String, List<Map<String, String>>> blocks = new LinkedHashMap<>();
        XMLStreamReader xml = null;
        try {
            xml = newFactory().createXMLStreamReader(in);
            xml.nextTag();
            if (!ENVELOPE_ELEMENT.equals(xml.getLocalName())
                    || !ENVELOPE_FORMAT.equals(xml.getAttributeValue(null, "FileFormat"))) {
                throw new ConversionException(origin + ": not a Hauptwerk organ definition (root element <"
                        + xml.getLocalName() + ">, FileFormat=" + xml.getAttributeValue(null, "FileFormat") + ")");
            }
            final String version = xml.getAttributeValue(null, "FileFormatVersion");
            if (version != null) {
                log.info(origin + ": file format version " + version);
            }

            while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
                if (!GROUP_ELEMENT.equals(xml.getLocalName())) {
                    throw new ConversionException(origin + ": unexpected element <" + xml.getLocalName()
                            + "> in envelope, line " + xml.getLocation().getLineNumber());
                }
                final String type = xml.getAttributeValue(null, GROUP_TYPE_ATTRIBUTE);
                if (type == null || type.isBlank()) {
                    throw new ConversionException(origin + ": " + GROUP_ELEMENT + " without " + GROUP_TYPE_ATTRIBUTE
                            + ", line " + xml.getLocation().getLineNumber());
                }
                final List<Map<String, String>> list = blocks.computeIfAbsent(type.trim(), t -> new ArrayList<>());
                while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
                    list.add(readBlock(xml));
                }
            }
            return blocks;
        } catch (XMLStreamException ex) {
            throw new ConversionException(origin + ": malformed document: " + ex.getMessage(), ex);
        } finally {
            if (xml != null) {
                try {
                    xml.close();
                } catch (XMLStreamException ex) {
                    log.warn(origin + ": close failed: " + ex.getMessage());
                }
            }
        }
    }

    private static Map<String, String> readBlock(XMLStreamReader xml) throws XMLStreamException {
        final Map<String, String> attributes = new LinkedHashMap<>();
        while (xml.nextTag() == XMLStreamConstants.START_ELEMENT) {
            final String name = xml.getLocalName();
            final String value = xml.getElementText();
            if (value != null && !value.isEmpty()) {
                attributes.put(name, value);
            }
        }
        return attributes;
    }

    private TreeMap<Integer, SourceRecord> number(String type, AttributeDictionary.TypeEntry entry,
                                                  List<Map<String, String>> rawBlocks) {
        final TreeMap<Integer, SourceRecord> records = new TreeMap<>();
        final boolean root = SourceTypes.GENERAL.equals(type);
        final List<Map<String, String>> unnumbered = new ArrayList<>();

        for (Map<String, String> raw : rawBlocks) {
            final Map<String, String> attributes = expand(entry, raw);
            if (root) {
                if (records.isEmpty()) {
                    records.put(0, new SourceRecord(type, 0, attributes));
                } else {
                    log.warn("additional " + type + " record ignored");
                }
                continue;
            }
            if (!entry.hasIdAttribute()) {
                unnumbered.add(attributes);
                continue;
            }
            final String rawId = attributes.get(entry.idAttribute());
            final Integer id = Ids.parsePositiveInt(rawId);
            if (id == null) {
                log.warn(type + ": " + (rawId == null ? "missing " : "invalid ") + entry.idAttribute()
                        + (rawId == null ? "" : "=" + rawId) + ", id assigned");
                unnumbered.add(attributes);
            } else if (records.containsKey(id)) {
                log.warn(type + ": duplicate " + entry.idAttribute() + "=" + id + ", id reassigned");
                unnumbered.add(attributes);
            } else {
                records.put(id, new SourceRecord(type, id, attributes));
            }
        }

        int next = 1;
        for (Map<String, String> attributes : unnumbered) {
            while (records.containsKey(next)) {
                next++;
            }
            records.put(next, new SourceRecord(type, next, attributes));
        }
        return records;
    }

    private static Map<String, String> expand(AttributeDictionary.TypeEntry entry, Map<String, String> raw) {
        final Map<String, String> out = new LinkedHashMap<>();
        for (var e : raw.entrySet()) {
            out.put(entry.expand(e.getKey()), e.getValue());
        }
        return out;
    }

    private static XMLInputFactory newFactory() {
        final XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }
}
