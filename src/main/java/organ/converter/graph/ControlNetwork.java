package organ.converter.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import organ.converter.model.SourceRecord;

/**
 * Switches that act as one logical control, in discovery order, with their aggregate flags.
 */
public final class ControlNetwork {

    private final Set<SourceRecord> switches = new LinkedHashSet<>();
    private boolean defaultEngaged;
    private boolean clickable;
    private boolean inverting;

    /**
     * @return false if the switch was already part of the network
     */
    boolean visit(SourceRecord sw) {
        return switches.add(sw);
    }

    void markDefaultEngaged() {
        defaultEngaged = true;
    }

    void markClickable() {
        clickable = true;
    }

    void markInverting() {
        inverting = true;
    }

    public Set<SourceRecord> switches() {
        return Collections.unmodifiableSet(switches);
    }

    public List<SourceRecord> switchList() {
        return new ArrayList<>(switches);
    }

    public boolean isEmpty() {
        return switches.isEmpty();
    }

    public boolean contains(SourceRecord sw) {
        return switches.contains(sw);
    }

    public boolean defaultEngaged() {
        return defaultEngaged;
    }

    public boolean clickable() {
        return clickable;
    }

    public boolean inverting() {
        return inverting;
    }

    /**
     * First target id with the given prefix already assigned to a switch of the network, or null.
     */
    public String existingTarget(String prefix) {
        for (SourceRecord sw : switches) {
            final String id = sw.targetId();
            if (id != null && id.startsWith(prefix)) {
                return id;
            }
        }
        return null;
    }

    /**
     * Sets the back-reference of every switch that has none yet.
     */
    public void assignTarget(String targetId) {
        for (SourceRecord sw : switches) {
            sw.assignTarget(targetId);
        }
    }

    @Override
    public String toString() {
        return "ControlNetwork" + switches + (defaultEngaged ? " default-engaged" : "")
                + (clickable ? " clickable" : "") + (inverting ? " inverting" : "");
    }
}
