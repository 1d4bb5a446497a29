package organ.converter.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import organ.converter.model.Ids;
import organ.converter.model.TargetRecord;

/**
 * Synthesized target records in creation order. Sequence numbers are dense per prefix and start at 1;
 * slot 0 is only used through {@link #createReserved(String)}.
 */
public final class TargetStore {

    private final Map<String, TargetRecord> records = new LinkedHashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    public void clear() {
        records.clear();
        counters.clear();
    }

    /**
     * Creates {@code <prefix><next>} with the next free sequence number of that prefix.
     */
    public TargetRecord create(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        final int next = counters.merge(prefix, 1, Integer::sum);
        return put(new TargetRecord(Ids.targetId(prefix, next)));
    }

    /**
     * Creates a record with a fixed name such as {@code Organ}, {@code Panel000} or {@code Manual000}.
     */
    public TargetRecord createReserved(String name) {
        if (records.containsKey(name)) {
            throw new IllegalStateException("target record already exists: " + name);
        }
        return put(new TargetRecord(name));
    }

    private TargetRecord put(TargetRecord record) {
        records.put(record.id(), record);
        return record;
    }

    public TargetRecord get(String id) {
        return id == null ? null : records.get(id);
    }

    public boolean contains(String id) {
        return records.containsKey(id);
    }

    public Collection<TargetRecord> all() {
        return Collections.unmodifiableCollection(records.values());
    }

    /**
     * Records whose id is {@code prefix} followed by exactly three digits, in creation order.
     */
    public List<TargetRecord> withPrefix(String prefix) {
        final List<TargetRecord> out = new ArrayList<>();
        for (TargetRecord r : records.values()) {
            if (Ids.targetNumber(r.id()) >= 0 && Ids.targetPrefix(r.id()).equals(prefix)) {
                out.add(r);
            }
        }
        return out;
    }

    public int count(String prefix) {
        return withPrefix(prefix).size();
    }

    public int size() {
        return records.size();
    }

    public void finishAll() {
        for (TargetRecord r : records.values()) {
            r.finish();
        }
    }
}
