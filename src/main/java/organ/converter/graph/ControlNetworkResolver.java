package organ.converter.graph;

import static organ.converter.model.SourceAttributes.LINK_CONDITION_SWITCH;
import static organ.converter.model.SourceAttributes.LINK_DEST_SWITCH;
import static organ.converter.model.SourceAttributes.LINK_DISENGAGE_ACTION;
import static organ.converter.model.SourceAttributes.LINK_ENGAGE_ACTION;
import static organ.converter.model.SourceAttributes.LINK_SOURCE_IF_ENGAGED;
import static organ.converter.model.SourceAttributes.LINK_SOURCE_SWITCH;
import static organ.converter.model.SourceAttributes.SWITCH_CLICKABLE;
import static organ.converter.model.SourceAttributes.SWITCH_DEFAULT_ENGAGED;

import java.util.Objects;
import java.util.Optional;

import organ.converter.model.AttributeReader;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;

/**
 * Collects the switches joined to a seed by plain pass-through switch linkages.
 * <p>
 * A linkage is followed only when it has no condition switch, its engage and disengage actions are the
 * pass-through codes (or unset), and it joins the current switch to a different one in the traced
 * direction. Linkages that mirror the inverse of their source are followed and flag the network as
 * inverting.
 */
public final class ControlNetworkResolver {

    public static final int ENGAGE_PASS_THROUGH = 1;
    public static final int DISENGAGE_PASS_THROUGH = 2;

    private final AttributeReader attributes;

    public ControlNetworkResolver(AttributeReader attributes) {
        this.attributes = Objects.requireNonNull(attributes, "attributes");
    }

    /**
     * Adds the network reachable from {@code seed} to {@code out}. A null seed leaves {@code out} untouched.
     * A device seed starts from its controlling switch (upstream) or controlled switch (downstream).
     */
    public void resolve(SourceRecord seed, TraceDirection direction, ControlNetwork out) {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(out, "out");
        if (seed == null) {
            return;
        }
        final SourceRecord start = SourceTypes.SWITCH.equals(seed.type())
                ? seed
                : direction == TraceDirection.UPSTREAM
                        ? seed.firstParent(SourceTypes.SWITCH)
                        : seed.firstChild(SourceTypes.SWITCH);
        if (start != null) {
            visit(start, direction, out);
        }
    }

    /**
     * @return empty when the seed is absent, otherwise the (possibly empty) network
     */
    public Optional<ControlNetwork> resolve(SourceRecord seed, TraceDirection direction) {
        if (seed == null) {
            return Optional.empty();
        }
        final ControlNetwork network = new ControlNetwork();
        resolve(seed, direction, network);
        return Optional.of(network);
    }

    private void visit(SourceRecord sw, TraceDirection direction, ControlNetwork out) {
        if (!out.visit(sw)) {
            return;
        }
        if (attributes.flag(sw, SWITCH_DEFAULT_ENGAGED)) {
            out.markDefaultEngaged();
        }
        if (attributes.flag(sw, SWITCH_CLICKABLE)) {
            out.markClickable();
        }

        if (direction == TraceDirection.UPSTREAM) {
            for (SourceRecord linkage : sw.parents(SourceTypes.SWITCH_LINKAGE)) {
                if (!isPassThrough(linkage) || !Objects.equals(attributes.reference(linkage, LINK_DEST_SWITCH), sw.id())) {
                    continue;
                }
                final SourceRecord source = endpoint(linkage, LINK_SOURCE_SWITCH.name(), true);
                if (source != null && source != sw) {
                    follow(linkage, source, direction, out);
                }
            }
        } else {
            for (SourceRecord linkage : sw.children(SourceTypes.SWITCH_LINKAGE)) {
                if (!isPassThrough(linkage) || !Objects.equals(attributes.reference(linkage, LINK_SOURCE_SWITCH), sw.id())) {
                    continue;
                }
                final SourceRecord dest = endpoint(linkage, LINK_DEST_SWITCH.name(), false);
                if (dest != null && dest != sw) {
                    follow(linkage, dest, direction, out);
                }
            }
        }
    }

    private void follow(SourceRecord linkage, SourceRecord next, TraceDirection direction, ControlNetwork out) {
        if (!attributes.flag(linkage, LINK_SOURCE_IF_ENGAGED)) {
            out.markInverting();
        }
        visit(next, direction, out);
    }

    private boolean isPassThrough(SourceRecord linkage) {
        if (attributes.isSet(linkage, LINK_CONDITION_SWITCH)) {
            return false;
        }
        final Integer engage = attributes.integer(linkage, LINK_ENGAGE_ACTION);
        final Integer disengage = attributes.integer(linkage, LINK_DISENGAGE_ACTION);
        return (engage == null || engage == ENGAGE_PASS_THROUGH)
                && (disengage == null || disengage == DISENGAGE_PASS_THROUGH);
    }

    /**
     * The switch a linkage names in {@code attribute}, looked up among its linked neighbours.
     */
    private static SourceRecord endpoint(SourceRecord linkage, String attribute, boolean amongParents) {
        final Integer id = Ids.parsePositiveInt(linkage.attr(attribute));
        if (id == null) {
            return null;
        }
        for (SourceRecord sw : amongParents ? linkage.parents(SourceTypes.SWITCH) : linkage.children(SourceTypes.SWITCH)) {
            if (sw.id() == id) {
                return sw;
            }
        }
        return null;
    }
}
