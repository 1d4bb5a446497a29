package organ.converter.synth;

import static organ.converter.model.SourceAttributes.KEYBOARD_NAME;
import static organ.converter.model.SourceAttributes.KEY_ACTION_CONDITION_SWITCH;
import static organ.converter.model.SourceAttributes.KEY_ACTION_DEST_DIVISION;
import static organ.converter.model.SourceAttributes.KEY_ACTION_DEST_KEYBOARD;
import static organ.converter.model.SourceAttributes.KEY_ACTION_FIRST_NOTE;
import static organ.converter.model.SourceAttributes.KEY_ACTION_KEY_COUNT;
import static organ.converter.model.SourceAttributes.KEY_ACTION_NOTE_INCREMENT;
import static organ.converter.model.SourceAttributes.KEY_ACTION_TYPE;

import java.util.Objects;

import organ.converter.graph.ControlNetwork;
import organ.converter.graph.TraceDirection;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Key actions that play another manual become couplers of the manual they start from.
 * <p>
 * An action without condition switch is always on; a gated action follows the network of its condition switch
 * and is dropped when nobody can engage it.
 */
final class CouplerBuilder {

    static final int ACTION_NORMAL = 1;
    static final int ACTION_BASS = 2;
    static final int ACTION_MELODY = 3;

    private CouplerBuilder() {
    }

    static void build(SynthesisContext ctx) {
        for (SourceRecord action : ctx.source.ofType(SourceTypes.KEY_ACTION)) {
            if (action.hasTarget()) {
                continue;
            }
            ctx.progress.onProgress("coupler " + action.key());
            convert(ctx, action);
        }
    }

    private static void convert(SynthesisContext ctx, SourceRecord action) {
        final SourceRecord sourceKeyboard = action.firstParent(SourceTypes.KEYBOARD);
        final TargetRecord sourceManual = sourceKeyboard == null ? null : ctx.manualsByKeyboard.get(sourceKeyboard);
        if (sourceManual == null) {
            return;
        }
        final int increment = ctx.attrs.integer(action, KEY_ACTION_NOTE_INCREMENT, 0);
        final TargetRecord destManual = destinationManual(ctx, action, sourceKeyboard, increment);
        if (destManual == null) {
            return;
        }

        ControlNetwork network = null;
        if (ctx.attrs.isSet(action, KEY_ACTION_CONDITION_SWITCH)) {
            network = ctx.resolver.resolve(action, TraceDirection.UPSTREAM).orElseGet(ControlNetwork::new);
            if (network.isEmpty()) {
                action.assignTarget(SourceRecord.NO_TARGET);
                ctx.log.info(action.key() + ": condition switch not found, coupler dropped");
                return;
            }
        }

        final TargetRecord coupler = ctx.target.create("Coupler");
        action.assignTarget(coupler.id());
        coupler.set("Name", couplerName(ctx, sourceKeyboard, destManual, increment));
        coupler.set("UnisonOff", false);
        coupler.set("DestinationManual", Ids.number3(Ids.targetNumber(destManual.id())));
        coupler.set("DestinationKeyshift", increment);
        coupler.set("CoupleToSubsequentUnisonIntermanualCouplers", false);
        coupler.set("CoupleToSubsequentUpwardIntermanualCouplers", false);
        coupler.set("CoupleToSubsequentDownwardIntermanualCouplers", false);
        coupler.set("CoupleToSubsequentUpwardIntramanualCouplers", false);
        coupler.set("CoupleToSubsequentDownwardIntramanualCouplers", false);
        coupler.set("CouplerType", couplerType(ctx, action));
        final Integer first = ctx.attrs.integer(action, KEY_ACTION_FIRST_NOTE);
        final Integer count = ctx.attrs.integer(action, KEY_ACTION_KEY_COUNT);
        if (first != null) {
            coupler.set("FirstMIDINoteNumber", first);
        }
        if (count != null && count > 0) {
            coupler.set("NumberOfKeys", count);
        }
        coupler.set("Displayed", false);

        if (network == null) {
            coupler.set("DefaultToEngaged", true);
        } else {
            coupler.set("DefaultToEngaged", network.defaultEngaged());
            ctx.gate(coupler, network, coupler.get("Name"));
        }
        sourceManual.appendReference("NumberOfCouplers", "Coupler", Ids.targetNumber(coupler.id()));
    }

    /**
     * Manual played by the action, or null when the action is the keyboard's own key action or plays
     * nothing that was converted.
     */
    private static TargetRecord destinationManual(SynthesisContext ctx, SourceRecord action,
                                                  SourceRecord sourceKeyboard, int increment) {
        final Integer keyboardId = ctx.attrs.reference(action, KEY_ACTION_DEST_KEYBOARD);
        if (keyboardId != null) {
            for (SourceRecord dest : action.children(SourceTypes.KEYBOARD)) {
                if (dest.id() != keyboardId) {
                    continue;
                }
                if (dest == sourceKeyboard && increment == 0) {
                    return null;
                }
                return ctx.manualsByKeyboard.get(dest);
            }
            return null;
        }
        final Integer divisionId = ctx.attrs.reference(action, KEY_ACTION_DEST_DIVISION);
        if (divisionId == null) {
            return null;
        }
        for (SourceRecord division : action.children(SourceTypes.DIVISION)) {
            if (division.id() != divisionId) {
                continue;
            }
            final TargetRecord manual = ctx.manualsByDivision.get(division);
            final TargetRecord own = ctx.manualsByKeyboard.get(sourceKeyboard);
            if (manual == null) {
                ctx.log.info(action.key() + ": " + division.key() + " has no manual, key action skipped");
                return null;
            }
            if (Objects.equals(manual, own) && increment == 0) {
                return null;
            }
            return manual;
        }
        return null;
    }

    private static String couplerType(SynthesisContext ctx, SourceRecord action) {
        final int code = ctx.attrs.integer(action, KEY_ACTION_TYPE, ACTION_NORMAL);
        return switch (code) {
            case ACTION_BASS -> "Bass";
            case ACTION_MELODY -> "Melody";
            case ACTION_NORMAL -> "Normal";
            default -> {
                ctx.log.warn(action.key() + ": unsupported action type code " + code + ", normal coupler assumed");
                yield "Normal";
            }
        };
    }

    private static String couplerName(SynthesisContext ctx, SourceRecord sourceKeyboard, TargetRecord destManual,
                                      int increment) {
        final String from = ctx.attrs.text(sourceKeyboard, KEYBOARD_NAME);
        final StringBuilder sb = new StringBuilder();
        sb.append(destManual.get("Name")).append(" to ")
                .append(from != null ? from : sourceKeyboard.key());
        if (increment != 0) {
            sb.append(' ').append(increment > 0 ? "+" : "").append(increment);
        }
        return sb.toString();
    }
}
