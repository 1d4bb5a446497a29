package organ.converter.check;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import organ.converter.model.ConversionLog;
import organ.converter.model.Ids;
import organ.converter.model.TargetRecord;

/**
 * Parent/child graph over finished target objects, built from their reference attributes.
 * <ul>
 * <li>{@code Organ} parents every manual, windchest group and panel</li>
 * <li>a panel parents its elements and images</li>
 * <li>{@code <Type>NNN=MMM} references {@code <Type>MMM}</li>
 * <li>a {@code WindchestGroup} or {@code PipeNNNWindchestGroup} attribute makes the windchest group a parent</li>
 * <li>panel element {@code Manual/Stop/Coupler/Switch/Enclosure} attributes reference that object</li>
 * </ul>
 * Unresolved references are logged as errors, objects nothing refers to as warnings.
 */
public final class OdfObjectGraph {

    public static final String ORGAN = "Organ";

    /**
     * Types that may appear in {@code <Type>NNN} references.
     */
    static final Set<String> REFERENCE_TYPES = Set.of(
            "Manual", "Stop", "Coupler", "Rank", "Switch", "Enclosure", "WindchestGroup",
            "Tremulant", "Divisional", "DivisionalCoupler", "General", "ReversiblePiston");

    static final Set<String> ELEMENT_REFERENCES = Set.of("Manual", "Stop", "Coupler", "Switch", "Enclosure");

    static final Set<String> ORGAN_CHILDREN = Set.of("Manual", "WindchestGroup", "Panel");

    private static final Pattern NUMBERED = Pattern.compile("([A-Za-z]+?)(\\d{3})");
    private static final Pattern PIPE_WINDCHEST = Pattern.compile("Pipe\\d{3}WindchestGroup");
    private static final Pattern PANEL_CHILD = Pattern.compile("(Panel\\d{3})(Element|Image)\\d{3}");

    /**
     * One object of the tree; an object reached a second time is listed without its children.
     */
    public record Node(String id, List<Node> children) {
    }

    private final Map<String, Set<String>> parents = new LinkedHashMap<>();
    private final Map<String, Set<String>> children = new LinkedHashMap<>();
    private final List<String> unresolved = new ArrayList<>();
    private final List<String> unused = new ArrayList<>();

    private OdfObjectGraph() {
    }

    public static OdfObjectGraph build(Collection<TargetRecord> records, ConversionLog log) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(log, "log");
        final OdfObjectGraph graph = new OdfObjectGraph();
        for (TargetRecord r : records) {
            graph.parents.put(r.id(), new LinkedHashSet<>());
            graph.children.put(r.id(), new LinkedHashSet<>());
        }

        // Step 1: structural parents
        for (TargetRecord r : records) {
            final String id = r.id();
            final Matcher panelChild = PANEL_CHILD.matcher(id);
            if (panelChild.matches()) {
                graph.link(panelChild.group(1), id, id, log);
            } else if (ORGAN_CHILDREN.contains(Ids.targetPrefix(id)) && Ids.targetNumber(id) >= 0) {
                graph.link(ORGAN, id, id, log);
            }
        }

        // Step 2: reference attributes
        for (TargetRecord r : records) {
            final boolean element = PANEL_CHILD.matcher(r.id()).matches() && r.id().contains("Element");
            for (var e : r.attributes().entrySet()) {
                graph.reference(r, e.getKey(), e.getValue(), element, log);
            }
        }

        // Step 3: objects nobody refers to
        for (var e : graph.parents.entrySet()) {
            if (e.getValue().isEmpty() && !ORGAN.equals(e.getKey())) {
                graph.unused.add(e.getKey());
                log.warn(e.getKey() + ": not used");
            }
        }
        return graph;
    }

    private void reference(TargetRecord from, String name, String value, boolean element, ConversionLog log) {
        final Integer number = Ids.parsePositiveInt(value);
        if ("WindchestGroup".equals(name) || PIPE_WINDCHEST.matcher(name).matches()) {
            link(targetOf("WindchestGroup", value), from.id(), from.id() + "." + name, log);
            return;
        }
        if (element && ELEMENT_REFERENCES.contains(name)) {
            link(from.id(), targetOf(name, value), from.id() + "." + name, log);
            return;
        }
        if ("DestinationManual".equals(name)) {
            final String target = targetOf("Manual", value);
            if (!children.containsKey(target)) {
                unresolved(from.id() + "." + name + " -> " + target, log);
            }
            return;
        }
        final Matcher m = NUMBERED.matcher(name);
        if (number != null && m.matches() && REFERENCE_TYPES.contains(m.group(1))) {
            link(from.id(), targetOf(m.group(1), value), from.id() + "." + name, log);
        }
    }

    private static String targetOf(String type, String value) {
        final Integer n = Ids.parsePositiveInt(value);
        if (n != null) {
            return Ids.targetId(type, n);
        }
        // Manual000 and Panel000
        return "000".equals(value == null ? null : value.trim()) ? Ids.targetId(type, 0) : type + "?" + value;
    }

    private void link(String parent, String child, String origin, ConversionLog log) {
        if (!children.containsKey(parent)) {
            unresolved(origin + " -> " + parent, log);
            return;
        }
        if (!parents.containsKey(child)) {
            unresolved(origin + " -> " + child, log);
            return;
        }
        if (parent.equals(child)) {
            return;
        }
        children.get(parent).add(child);
        parents.get(child).add(parent);
    }

    private void unresolved(String what, ConversionLog log) {
        unresolved.add(what);
        log.error("unresolved reference " + what);
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(parents.keySet());
    }

    public Set<String> parentsOf(String id) {
        return Collections.unmodifiableSet(parents.getOrDefault(id, Set.of()));
    }

    public Set<String> childrenOf(String id) {
        return Collections.unmodifiableSet(children.getOrDefault(id, Set.of()));
    }

    public List<String> unresolvedReferences() {
        return Collections.unmodifiableList(unresolved);
    }

    public List<String> unusedObjects() {
        return Collections.unmodifiableList(unused);
    }

    /**
     * The object tree rooted at {@code Organ}, followed by every unused object as its own root.
     */
    public List<Node> tree() {
        final List<Node> roots = new ArrayList<>();
        final Set<String> expanded = new HashSet<>();
        if (children.containsKey(ORGAN)) {
            roots.add(node(ORGAN, expanded));
        }
        for (String id : unused) {
            roots.add(node(id, expanded));
        }
        return roots;
    }

    private Node node(String id, Set<String> expanded) {
        if (!expanded.add(id)) {
            return new Node(id, List.of());
        }
        final List<Node> out = new ArrayList<>();
        for (String child : children.get(id)) {
            out.add(node(child, expanded));
        }
        return new Node(id, out);
    }
}
