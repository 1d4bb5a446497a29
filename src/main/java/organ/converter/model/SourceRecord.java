package organ.converter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One typed record of the source document.
 * <p>
 * Attributes are fixed at load time. Only the parent/child edges and the target id back-reference
 * change afterwards (linker and synthesizer).
 */
public final class SourceRecord {

    /**
     * Back-reference value for records that were examined and deliberately produce no target object.
     */
    public static final String NO_TARGET = "none";

    private final String type;
    private final int id;
    private final String key;
    private final Map<String, String> attributes;
    private final Set<SourceRecord> parents = new LinkedHashSet<>();
    private final Set<SourceRecord> children = new LinkedHashSet<>();
    private String targetId;

    public SourceRecord(String type, int id, Map<String, String> attributes) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = id;
        this.key = Ids.sourceKey(type, id);
        final Map<String, String> copy = new LinkedHashMap<>();
        for (var e : Objects.requireNonNull(attributes, "attributes").entrySet()) {
            if (e.getValue() != null && !e.getValue().isEmpty()) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        this.attributes = Collections.unmodifiableMap(copy);
    }

    public String type() {
        return type;
    }

    public int id() {
        return id;
    }

    public String key() {
        return key;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String attr(String name) {
        return attributes.get(name);
    }

    public boolean hasAttr(String name) {
        return attributes.containsKey(name);
    }

    public Set<SourceRecord> parents() {
        return Collections.unmodifiableSet(parents);
    }

    public Set<SourceRecord> children() {
        return Collections.unmodifiableSet(children);
    }

    public List<SourceRecord> parents(String ofType) {
        return filter(parents, ofType);
    }

    public List<SourceRecord> children(String ofType) {
        return filter(children, ofType);
    }

    public SourceRecord firstParent(String ofType) {
        for (SourceRecord r : parents) {
            if (r.type.equals(ofType)) {
                return r;
            }
        }
        return null;
    }

    public SourceRecord firstChild(String ofType) {
        for (SourceRecord r : children) {
            if (r.type.equals(ofType)) {
                return r;
            }
        }
        return null;
    }

    public String targetId() {
        return targetId;
    }

    public boolean hasTarget() {
        return targetId != null;
    }

    /**
     * Sets the synthesized target id unless one is already set.
     *
     * @return true if the id was recorded
     */
    public boolean assignTarget(String newTargetId) {
        Objects.requireNonNull(newTargetId, "newTargetId");
        if (targetId != null) {
            return false;
        }
        targetId = newTargetId;
        return true;
    }

    /**
     * Creates the edge pair parent -> child. Duplicates are suppressed.
     *
     * @return true if a new edge was created
     */
    public static boolean link(SourceRecord parent, SourceRecord child) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(child, "child");
        if (parent == child) {
            return false;
        }
        final boolean added = parent.children.add(child);
        child.parents.add(parent);
        return added;
    }

    private static List<SourceRecord> filter(Set<SourceRecord> records, String ofType) {
        final List<SourceRecord> out = new ArrayList<>();
        for (SourceRecord r : records) {
            if (r.type.equals(ofType)) {
                out.add(r);
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return key;
    }
}
