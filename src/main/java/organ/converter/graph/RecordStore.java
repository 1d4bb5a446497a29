package organ.converter.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;

/**
 * Every source record of one run, keyed by (type, id). Records of one type iterate by ascending id;
 * types iterate in load order.
 */
public final class RecordStore {

    private final Map<String, TreeMap<Integer, SourceRecord>> byType = new LinkedHashMap<>();

    public void clear() {
        byType.clear();
    }

    /**
     * Adds the record unless its key is already taken.
     *
     * @return false if a record with the same type and id exists
     */
    public boolean add(SourceRecord record) {
        Objects.requireNonNull(record, "record");
        final TreeMap<Integer, SourceRecord> records = byType.computeIfAbsent(record.type(), t -> new TreeMap<>());
        return records.putIfAbsent(record.id(), record) == null;
    }

    /**
     * Replaces the whole content with {@code loaded}, keeping its type order.
     */
    public void replaceAll(Map<String, ? extends Map<Integer, SourceRecord>> loaded) {
        byType.clear();
        for (var e : loaded.entrySet()) {
            byType.put(e.getKey(), new TreeMap<>(e.getValue()));
        }
    }

    public SourceRecord find(String type, int id) {
        final TreeMap<Integer, SourceRecord> records = byType.get(type);
        return records == null ? null : records.get(id);
    }

    public SourceRecord find(String type, Integer id) {
        return id == null ? null : find(type, id.intValue());
    }

    public SourceRecord root() {
        return find(SourceTypes.GENERAL, 0);
    }

    public boolean hasType(String type) {
        return byType.containsKey(type);
    }

    public Collection<SourceRecord> ofType(String type) {
        final TreeMap<Integer, SourceRecord> records = byType.get(type);
        return records == null ? Collections.emptyList() : Collections.unmodifiableCollection(records.values());
    }

    public List<String> types() {
        return new ArrayList<>(byType.keySet());
    }

    public int count(String type) {
        final TreeMap<Integer, SourceRecord> records = byType.get(type);
        return records == null ? 0 : records.size();
    }

    public int size() {
        int n = 0;
        for (TreeMap<Integer, SourceRecord> records : byType.values()) {
            n += records.size();
        }
        return n;
    }

    public List<SourceRecord> all() {
        final List<SourceRecord> out = new ArrayList<>(size());
        for (TreeMap<Integer, SourceRecord> records : byType.values()) {
            out.addAll(records.values());
        }
        return out;
    }
}
