package organ.converter.scan;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import organ.converter.ConversionException;

/**
 * Per record type lookup table: abbreviation -> full attribute name, and the name of the id attribute.
 * <p>
 * Loaded from a JSON sidecar once per path and cached for the process lifetime.
 */
public final class AttributeDictionary {

    public static final String BUNDLED_RESOURCE = "/hw-object-attributes.json";
    private static final String NO_ID_ATTRIBUTE = "none";

    private static final Map<String, AttributeDictionary> CACHE = new ConcurrentHashMap<>();

    public record TypeEntry(String idAttribute, Map<String, String> abbreviations) {

        public TypeEntry {
            abbreviations = Collections.unmodifiableMap(new LinkedHashMap<>(abbreviations));
        }

        public String expand(String name) {
            return abbreviations.getOrDefault(name, name);
        }

        public boolean hasIdAttribute() {
            return idAttribute != null;
        }
    }

    private final String origin;
    private final Map<String, TypeEntry> types;

    AttributeDictionary(String origin, Map<String, TypeEntry> types) {
        this.origin = Objects.requireNonNull(origin, "origin");
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    /**
     * Table bundled with the converter.
     */
    public static AttributeDictionary bundled() throws ConversionException {
        final AttributeDictionary cached = CACHE.get(BUNDLED_RESOURCE);
        if (cached != null) {
            return cached;
        }
        try (InputStream in = AttributeDictionary.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new ConversionException("attribute table resource not found: " + BUNDLED_RESOURCE);
            }
            final AttributeDictionary dict = parse(BUNDLED_RESOURCE, new ObjectMapper().readTree(in));
            CACHE.putIfAbsent(BUNDLED_RESOURCE, dict);
            return CACHE.get(BUNDLED_RESOURCE);
        } catch (IOException ex) {
            throw new ConversionException("attribute table " + BUNDLED_RESOURCE + " is not readable: " + ex.getMessage(), ex);
        }
    }

    public static AttributeDictionary load(Path file) throws ConversionException {
        Objects.requireNonNull(file, "file");
        final String key = file.toAbsolutePath().normalize().toString();
        final AttributeDictionary cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        if (!Files.isRegularFile(file)) {
            throw new ConversionException("attribute table not found: " + file);
        }
        try {
            final AttributeDictionary dict = parse(key, new ObjectMapper().readTree(file.toFile()));
            CACHE.putIfAbsent(key, dict);
            return CACHE.get(key);
        } catch (IOException ex) {
            throw new ConversionException("attribute table " + file + " is not readable: " + ex.getMessage(), ex);
        }
    }

    static AttributeDictionary parse(String origin, JsonNode root) throws ConversionException {
        if (root == null || !root.isObject() || root.size() == 0) {
            throw new ConversionException("attribute table " + origin + " has no record types");
        }
        final Map<String, TypeEntry> types = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final JsonNode node = e.getValue();
            if (!node.isObject()) {
                throw new ConversionException("attribute table " + origin + ": entry " + e.getKey() + " is not an object");
            }
            String idAttribute = node.path("idAttribute").asText(null);
            if (idAttribute == null || idAttribute.isEmpty() || NO_ID_ATTRIBUTE.equals(idAttribute)) {
                idAttribute = null;
            }
            final Map<String, String> abbreviations = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> ab = node.path("abbreviations").fields();
            while (ab.hasNext()) {
                final Map.Entry<String, JsonNode> a = ab.next();
                abbreviations.put(a.getKey(), a.getValue().asText());
            }
            types.put(e.getKey(), new TypeEntry(idAttribute, abbreviations));
        }
        return new AttributeDictionary(origin, types);
    }

    public String origin() {
        return origin;
    }

    public TypeEntry entry(String recordType) {
        return types.get(recordType);
    }

    public boolean knows(String recordType) {
        return types.containsKey(recordType);
    }

    public Map<String, TypeEntry> types() {
        return types;
    }
}
