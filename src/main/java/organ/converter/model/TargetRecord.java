package organ.converter.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One object of the target organ definition: an id and an ordered attribute map.
 * Attributes whose name starts with {@link #BOOKKEEPING_PREFIX} are internal and removed by {@link #finish()}.
 */
public final class TargetRecord {

    public static final String BOOKKEEPING_PREFIX = "_";

    private final String id;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public TargetRecord(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String id() {
        return id;
    }

    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public TargetRecord set(String name, String value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            attributes.remove(name);
        } else {
            attributes.put(name, value);
        }
        return this;
    }

    public TargetRecord set(String name, int value) {
        return set(name, Integer.toString(value));
    }

    public TargetRecord set(String name, boolean value) {
        return set(name, value ? "Y" : "N");
    }

    public String get(String name) {
        return attributes.get(name);
    }

    public int getInt(String name, int defaultValue) {
        final String v = attributes.get(name);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    /**
     * Increments the counter attribute {@code countName} and returns its new value.
     */
    public int increment(String countName) {
        final int next = getInt(countName, 0) + 1;
        set(countName, next);
        return next;
    }

    /**
     * Adds a numbered reference such as {@code Stop003=012}, bumping {@code countName}.
     */
    public int appendReference(String countName, String refPrefix, int referencedNumber) {
        final int slot = increment(countName);
        set(refPrefix + Ids.number3(slot), Ids.number3(referencedNumber));
        return slot;
    }

    public void finish() {
        final Iterator<String> it = attributes.keySet().iterator();
        while (it.hasNext()) {
            if (it.next().startsWith(BOOKKEEPING_PREFIX)) {
                it.remove();
            }
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
