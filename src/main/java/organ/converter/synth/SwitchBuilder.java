package organ.converter.synth;

import static organ.converter.model.SourceAttributes.FONT_NAME;
import static organ.converter.model.SourceAttributes.FONT_SIZE;
import static organ.converter.model.SourceAttributes.INSTANCE_LEFT;
import static organ.converter.model.SourceAttributes.INSTANCE_TOP;
import static organ.converter.model.SourceAttributes.SWITCH_CLICKABLE;
import static organ.converter.model.SourceAttributes.SWITCH_IMAGE_INDEX_DISENGAGED;
import static organ.converter.model.SourceAttributes.SWITCH_IMAGE_INDEX_ENGAGED;
import static organ.converter.model.SourceAttributes.SWITCH_NAME;
import static organ.converter.model.SourceAttributes.TEXT;

import organ.converter.graph.ControlNetwork;
import organ.converter.graph.TraceDirection;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Target switches: one per control network, shown on the panel of its clickable source switch.
 */
final class SwitchBuilder {

    private SwitchBuilder() {
    }

    static TargetRecord create(SynthesisContext ctx, ControlNetwork network, String fallbackName) {
        final SourceRecord shown = displayedSwitch(ctx, network);
        final TargetRecord sw = ctx.target.create("Switch");
        String name = shown != null ? ctx.attrs.text(shown, SWITCH_NAME) : null;
        if (name == null) {
            for (SourceRecord s : network.switches()) {
                name = ctx.attrs.text(s, SWITCH_NAME);
                if (name != null) {
                    break;
                }
            }
        }
        sw.set("Name", name != null ? name : fallbackName);
        sw.set("DefaultToEngaged", network.defaultEngaged());
        sw.set("Displayed", false);
        network.assignTarget(sw.id());

        if (shown != null) {
            addPanelElement(ctx, sw, shown);
        }
        return sw;
    }

    /**
     * Switches left on display pages after all devices were dispatched become plain target switches of the
     * last division seen.
     */
    static void convertRemaining(SynthesisContext ctx) {
        for (var e : ctx.panelsByPage.entrySet()) {
            for (SourceRecord sw : e.getKey().children(SourceTypes.SWITCH)) {
                if (sw.hasTarget()) {
                    continue;
                }
                ctx.progress.onProgress("switch " + sw.key());
                final ControlNetwork network = new ControlNetwork();
                ctx.resolver.resolve(sw, TraceDirection.UPSTREAM, network);
                final TargetRecord target = ctx.switchFor(network, sw.key());
                if (ctx.lastDivision != null) {
                    final TargetRecord manual = ctx.manualForDivision(ctx.lastDivision);
                    manual.appendReference("NumberOfSwitches", "Switch", Ids.targetNumber(target.id()));
                } else {
                    ctx.log.info(sw.key() + ": converted to " + target.id() + " without a manual");
                }
            }
        }
    }

    /**
     * The clickable switch of the network that has an image on a display page.
     */
    private static SourceRecord displayedSwitch(SynthesisContext ctx, ControlNetwork network) {
        SourceRecord withImage = null;
        for (SourceRecord s : network.switches()) {
            if (s.firstChild(SourceTypes.IMAGE_SET_INSTANCE) == null) {
                continue;
            }
            if (ctx.attrs.flag(s, SWITCH_CLICKABLE)) {
                return s;
            }
            if (withImage == null) {
                withImage = s;
            }
        }
        return withImage;
    }

    private static void addPanelElement(SynthesisContext ctx, TargetRecord sw, SourceRecord source) {
        final SourceRecord instance = source.firstChild(SourceTypes.IMAGE_SET_INSTANCE);
        final SourceRecord page = source.firstParent(SourceTypes.DISPLAY_PAGE);
        final TargetRecord panel = ctx.panelFor(page);
        if (panel == null) {
            return;
        }
        final TargetRecord element = ctx.addPanelElement(panel, "Switch");
        element.set("Switch", Ids.number3(Ids.targetNumber(sw.id())));
        element.set("PositionX", ctx.attrs.integer(instance, INSTANCE_LEFT, 0));
        element.set("PositionY", ctx.attrs.integer(instance, INSTANCE_TOP, 0));

        final SourceRecord imageSet = instance.firstChild(SourceTypes.IMAGE_SET);
        final String on = ctx.imagePath(imageSet, ctx.attrs.integer(source, SWITCH_IMAGE_INDEX_ENGAGED, 2));
        final String off = ctx.imagePath(imageSet, ctx.attrs.integer(source, SWITCH_IMAGE_INDEX_DISENGAGED, 1));
        if (on != null && off != null) {
            element.set("ImageOn", on);
            element.set("ImageOff", off);
            final String mask = ctx.maskPath(imageSet);
            if (mask != null) {
                element.set("MaskOn", mask);
                element.set("MaskOff", mask);
            }
        }
        final int width = ctx.imageWidth(imageSet, Geometry.DRAWSTOP_SIZE);
        final int height = ctx.imageHeight(imageSet, Geometry.DRAWSTOP_SIZE);
        element.set("Width", width);
        element.set("Height", height);
        element.set("MouseRectWidth", width);
        element.set("MouseRectHeight", height);

        final SourceRecord text = instance.firstChild(SourceTypes.TEXT_INSTANCE);
        if (text != null && ctx.attrs.isSet(text, TEXT)) {
            element.set("DispLabelText", ctx.attrs.text(text, TEXT));
            final SourceRecord style = text.firstChild(SourceTypes.TEXT_STYLE);
            if (style != null) {
                element.set("DispLabelFontSize", ctx.attrs.integer(style, FONT_SIZE, Geometry.DEFAULT_FONT_SIZE));
                final String font = ctx.attrs.text(style, FONT_NAME);
                if (font != null) {
                    element.set("DispLabelFontName", font);
                }
                element.set("DispLabelColour", PanelBuilder.colourOf(ctx, style));
            }
            element.set("TextBreakWidth", width);
        } else {
            element.set("DispLabelText", "");
        }
    }
}
