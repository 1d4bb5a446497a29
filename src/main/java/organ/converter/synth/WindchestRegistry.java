package organ.converter.synth;

import static organ.converter.model.SourceAttributes.CONTROL_LINK_DEST;
import static organ.converter.model.SourceAttributes.CONTROL_LINK_SOURCE;
import static organ.converter.model.SourceAttributes.CONTROL_NAME;
import static organ.converter.model.SourceAttributes.ENCLOSURE_MIN_AMPLITUDE;
import static organ.converter.model.SourceAttributes.ENCLOSURE_NAME;
import static organ.converter.model.SourceAttributes.INSTANCE_LEFT;
import static organ.converter.model.SourceAttributes.INSTANCE_TOP;
import static organ.converter.model.SourceAttributes.WIND_COMPARTMENT_NAME;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * One target windchest group per distinct (wind supply, level control, enclosure) triple.
 * <p>
 * The triple is stored on the windchest as a bookkeeping attribute and looked up by scanning the existing
 * windchests, so the result does not depend on which pipe asks first. Enclosures are shared per control node.
 */
final class WindchestRegistry {

    static final String TRIPLE_ATTRIBUTE = "_WindTriple";
    static final String CONTROL_ATTRIBUTE = "_Control";

    /**
     * Node identities as source record keys; {@code null} for an absent slot.
     */
    record WindTriple(String wind, String level, String enclosure) {

        WindTriple {
            Objects.requireNonNull(wind, "wind");
        }

        String key() {
            return wind + "|" + (level == null ? "-" : level) + "|" + (enclosure == null ? "-" : enclosure);
        }
    }

    private final SynthesisContext ctx;

    WindchestRegistry(SynthesisContext ctx) {
        this.ctx = ctx;
    }

    /**
     * Windchest group feeding {@code pipe} when sounded through {@code layer} (which may be null).
     */
    TargetRecord windchestFor(SourceRecord pipe, SourceRecord layer) {
        final SourceRecord wind = windNode(pipe);
        final SourceRecord level = layer == null ? null : graphicalControl(layer.firstParent(SourceTypes.CONTINUOUS_CONTROL));
        final SourceRecord enclosure = enclosureControl(pipe);
        return windchestFor(wind, level, enclosure);
    }

    TargetRecord windchestFor(SourceRecord wind, SourceRecord level, SourceRecord enclosure) {
        final WindTriple triple = new WindTriple(wind.key(),
                level == null ? null : level.key(),
                enclosure == null ? null : enclosure.key());
        final TargetRecord existing = find(triple);
        if (existing != null) {
            return existing;
        }

        final TargetRecord chest = ctx.target.create("WindchestGroup");
        chest.set("Name", windchestName(wind, level, enclosure));
        chest.set("NumberOfEnclosures", 0);
        final Set<String> attached = new HashSet<>();
        for (SourceRecord control : new SourceRecord[] {enclosure, level}) {
            if (control != null) {
                final TargetRecord enc = enclosureFor(control);
                if (attached.add(enc.id())) {
                    chest.appendReference("NumberOfEnclosures", "Enclosure", Ids.targetNumber(enc.id()));
                }
            }
        }
        chest.set("NumberOfTremulants", 0);
        chest.set(TRIPLE_ATTRIBUTE, triple.key());
        return chest;
    }

    TargetRecord find(WindTriple triple) {
        for (TargetRecord chest : ctx.target.withPrefix("WindchestGroup")) {
            if (triple.key().equals(chest.get(TRIPLE_ATTRIBUTE))) {
                return chest;
            }
        }
        return null;
    }

    private SourceRecord windNode(SourceRecord pipe) {
        final SourceRecord compartment = pipe.firstParent(SourceTypes.WIND_COMPARTMENT);
        return compartment != null ? compartment : ctx.source.root();
    }

    private SourceRecord enclosureControl(SourceRecord pipe) {
        for (SourceRecord link : pipe.parents(SourceTypes.ENCLOSURE_PIPE)) {
            final SourceRecord enclosure = link.firstParent(SourceTypes.ENCLOSURE);
            if (enclosure != null) {
                final SourceRecord control = graphicalControl(enclosure.firstParent(SourceTypes.CONTINUOUS_CONTROL));
                if (control != null) {
                    return control;
                }
            }
        }
        return null;
    }

    /**
     * Walks upward through continuous control linkages to the first control shown on a display page.
     */
    SourceRecord graphicalControl(SourceRecord control) {
        final Set<SourceRecord> visited = new HashSet<>();
        SourceRecord current = control;
        while (current != null && visited.add(current)) {
            if (current.firstChild(SourceTypes.IMAGE_SET_INSTANCE) != null) {
                return current;
            }
            current = upstreamControl(current);
        }
        return null;
    }

    private SourceRecord upstreamControl(SourceRecord control) {
        for (SourceRecord linkage : control.parents(SourceTypes.CONTINUOUS_CONTROL_LINKAGE)) {
            if (!Objects.equals(ctx.attrs.reference(linkage, CONTROL_LINK_DEST), control.id())) {
                continue;
            }
            final Integer sourceId = ctx.attrs.reference(linkage, CONTROL_LINK_SOURCE);
            for (SourceRecord candidate : linkage.parents(SourceTypes.CONTINUOUS_CONTROL)) {
                if (Objects.equals(sourceId, candidate.id()) && candidate != control) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private TargetRecord enclosureFor(SourceRecord control) {
        for (TargetRecord enc : ctx.target.withPrefix("Enclosure")) {
            if (control.key().equals(enc.get(CONTROL_ATTRIBUTE))) {
                return enc;
            }
        }
        final TargetRecord enc = ctx.target.create("Enclosure");
        final SourceRecord shutter = control.firstChild(SourceTypes.ENCLOSURE);
        String name = ctx.attrs.text(control, CONTROL_NAME);
        if (name == null && shutter != null) {
            name = ctx.attrs.text(shutter, ENCLOSURE_NAME);
        }
        enc.set("Name", name != null ? name : control.key());
        enc.set("AmpMinimumLevel", shutter != null ? ctx.attrs.integer(shutter, ENCLOSURE_MIN_AMPLITUDE, 1) : 0);
        enc.set("MIDIInputNumber", 0);
        enc.set(CONTROL_ATTRIBUTE, control.key());
        control.assignTarget(enc.id());
        addPanelElement(enc, control);
        return enc;
    }

    private void addPanelElement(TargetRecord enc, SourceRecord control) {
        final SourceRecord instance = control.firstChild(SourceTypes.IMAGE_SET_INSTANCE);
        final SourceRecord page = control.firstParent(SourceTypes.DISPLAY_PAGE);
        if (instance == null || page == null) {
            enc.set("Displayed", false);
            return;
        }
        final TargetRecord element = ctx.addPanelElement(ctx.panelFor(page), "Enclosure");
        element.set("Enclosure", Ids.number3(Ids.targetNumber(enc.id())));
        element.set("PositionX", ctx.attrs.integer(instance, INSTANCE_LEFT, 0));
        element.set("PositionY", ctx.attrs.integer(instance, INSTANCE_TOP, 0));
        final SourceRecord imageSet = instance.firstChild(SourceTypes.IMAGE_SET);
        int count = 0;
        if (imageSet != null) {
            final int elements = imageSet.children(SourceTypes.IMAGE_SET_ELEMENT).size();
            String path;
            while (count < elements && (path = ctx.imagePath(imageSet, count + 1)) != null) {
                count++;
                element.set("Bitmap" + Ids.number3(count), path);
            }
        }
        if (count > 0) {
            element.set("BitmapCount", count);
        }
    }

    private String windchestName(SourceRecord wind, SourceRecord level, SourceRecord enclosure) {
        final StringBuilder sb = new StringBuilder();
        final String windName = SourceTypes.WIND_COMPARTMENT.equals(wind.type())
                ? ctx.attrs.text(wind, WIND_COMPARTMENT_NAME) : null;
        sb.append(windName != null ? windName : "Main");
        if (enclosure != null) {
            sb.append(" / ").append(nameOf(enclosure));
        }
        if (level != null) {
            sb.append(" / ").append(nameOf(level));
        }
        return sb.toString();
    }

    private String nameOf(SourceRecord control) {
        final String name = ctx.attrs.text(control, CONTROL_NAME);
        return name != null ? name : control.key();
    }
}
