package organ.converter.synth;

import static organ.converter.model.SourceAttributes.COLOUR_BLUE;
import static organ.converter.model.SourceAttributes.COLOUR_GREEN;
import static organ.converter.model.SourceAttributes.COLOUR_RED;
import static organ.converter.model.SourceAttributes.CONSOLE_HEIGHT;
import static organ.converter.model.SourceAttributes.CONSOLE_WIDTH;
import static organ.converter.model.SourceAttributes.FONT_NAME;
import static organ.converter.model.SourceAttributes.FONT_SIZE;
import static organ.converter.model.SourceAttributes.INSTANCE_BOTTOM_IF_TILING;
import static organ.converter.model.SourceAttributes.INSTANCE_DEFAULT_INDEX;
import static organ.converter.model.SourceAttributes.INSTANCE_LAYER;
import static organ.converter.model.SourceAttributes.INSTANCE_LEFT;
import static organ.converter.model.SourceAttributes.INSTANCE_RIGHT_IF_TILING;
import static organ.converter.model.SourceAttributes.INSTANCE_TOP;
import static organ.converter.model.SourceAttributes.PAGE_NAME;
import static organ.converter.model.SourceAttributes.TEXT;
import static organ.converter.model.SourceAttributes.TEXT_BOX_HEIGHT;
import static organ.converter.model.SourceAttributes.TEXT_BOX_WIDTH;
import static organ.converter.model.SourceAttributes.TEXT_X;
import static organ.converter.model.SourceAttributes.TEXT_Y;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Display pages to panels: static images ordered by screen layer, then text labels.
 */
final class PanelBuilder {

    private PanelBuilder() {
    }

    static void build(SynthesisContext ctx) {
        final List<SourceRecord> pages = new ArrayList<>(ctx.source.ofType(SourceTypes.DISPLAY_PAGE));
        if (pages.isEmpty()) {
            final TargetRecord panel = ctx.target.createReserved("Panel000");
            initPanel(panel, "Console");
            setSize(ctx, panel, 0, 0);
            ctx.log.info("no display page, empty default panel created");
            return;
        }
        boolean first = true;
        for (SourceRecord page : pages) {
            ctx.progress.onProgress("panel " + page.key());
            final TargetRecord panel = first ? ctx.target.createReserved("Panel000") : ctx.target.create("Panel");
            first = false;
            final String name = ctx.attrs.text(page, PAGE_NAME);
            initPanel(panel, name != null ? name : "Page " + page.id());
            ctx.panelsByPage.put(page, panel);
            page.assignTarget(panel.id());

            int maxX = 0;
            int maxY = 0;
            for (SourceRecord instance : staticImages(ctx, page)) {
                final int[] extent = addImage(ctx, panel, instance);
                maxX = Math.max(maxX, extent[0]);
                maxY = Math.max(maxY, extent[1]);
            }
            for (SourceRecord text : page.children(SourceTypes.TEXT_INSTANCE)) {
                if (isDeviceLabel(text)) {
                    continue;
                }
                addLabel(ctx, panel, text);
            }
            setSize(ctx, panel, maxX, maxY);
        }
    }

    private static void initPanel(TargetRecord panel, String name) {
        panel.set("Name", name);
        panel.set("HasPedals", false);
        panel.set("NumberOfGUIElements", 0);
        panel.set("NumberOfImages", 0);
        for (var e : Geometry.PANEL_DISPLAY_DEFAULTS.entrySet()) {
            panel.set(e.getKey(), e.getValue());
        }
    }

    private static void setSize(SynthesisContext ctx, TargetRecord panel, int maxX, int maxY) {
        final SourceRecord root = ctx.source.root();
        final Integer width = ctx.attrs.integer(root, CONSOLE_WIDTH);
        final Integer height = ctx.attrs.integer(root, CONSOLE_HEIGHT);
        panel.set("DispScreenSizeHoriz", width != null ? width : maxX > 0 ? maxX : Geometry.DEFAULT_PANEL_WIDTH);
        panel.set("DispScreenSizeVert", height != null ? height : maxY > 0 ? maxY : Geometry.DEFAULT_PANEL_HEIGHT);
    }

    /**
     * Image instances of the page that belong to no device, by screen layer then id.
     */
    static List<SourceRecord> staticImages(SynthesisContext ctx, SourceRecord page) {
        final List<SourceRecord> out = new ArrayList<>();
        for (SourceRecord instance : page.children(SourceTypes.IMAGE_SET_INSTANCE)) {
            if (instance.firstParent(SourceTypes.SWITCH) == null
                    && instance.firstParent(SourceTypes.KEYBOARD_KEY) == null
                    && instance.firstParent(SourceTypes.CONTINUOUS_CONTROL) == null) {
                out.add(instance);
            }
        }
        out.sort(Comparator.comparingInt((SourceRecord r) -> ctx.attrs.integer(r, INSTANCE_LAYER, 0))
                .thenComparingInt(SourceRecord::id));
        return out;
    }

    /**
     * @return right and bottom edge of the image
     */
    private static int[] addImage(SynthesisContext ctx, TargetRecord panel, SourceRecord instance) {
        final SourceRecord imageSet = instance.firstChild(SourceTypes.IMAGE_SET);
        final String path = ctx.imagePath(imageSet, ctx.attrs.integer(instance, INSTANCE_DEFAULT_INDEX, 1));
        final int left = ctx.attrs.integer(instance, INSTANCE_LEFT, 0);
        final int top = ctx.attrs.integer(instance, INSTANCE_TOP, 0);
        int width = ctx.imageWidth(imageSet, 0);
        int height = ctx.imageHeight(imageSet, 0);
        if (path == null) {
            ctx.log.warn(instance.key() + ": no bitmap, image skipped");
            return new int[] {left + width, top + height};
        }
        final TargetRecord image = ctx.addPanelImage(panel);
        image.set("Image", path);
        final String mask = ctx.maskPath(imageSet);
        if (mask != null) {
            image.set("Mask", mask);
        }
        image.set("PositionX", left);
        image.set("PositionY", top);
        final Integer right = ctx.attrs.integer(instance, INSTANCE_RIGHT_IF_TILING);
        final Integer bottom = ctx.attrs.integer(instance, INSTANCE_BOTTOM_IF_TILING);
        if (right != null && right > left) {
            width = right - left;
            image.set("Width", width);
        }
        if (bottom != null && bottom > top) {
            height = bottom - top;
            image.set("Height", height);
        }
        return new int[] {left + width, top + height};
    }

    /**
     * Text attached to the image of a switch is rendered on that switch instead.
     */
    private static boolean isDeviceLabel(SourceRecord text) {
        for (SourceRecord instance : text.parents(SourceTypes.IMAGE_SET_INSTANCE)) {
            if (instance.firstParent(SourceTypes.SWITCH) != null) {
                return true;
            }
        }
        return false;
    }

    private static void addLabel(SynthesisContext ctx, TargetRecord panel, SourceRecord text) {
        final String value = ctx.attrs.text(text, TEXT);
        if (value == null) {
            return;
        }
        final SourceRecord style = text.firstChild(SourceTypes.TEXT_STYLE);
        final int fontSize = style != null ? ctx.attrs.integer(style, FONT_SIZE, Geometry.DEFAULT_FONT_SIZE)
                : Geometry.DEFAULT_FONT_SIZE;
        final TargetRecord label = ctx.addPanelElement(panel, "Label");
        label.set("Name", value);
        label.set("FreeXPlacement", true);
        label.set("FreeYPlacement", true);
        label.set("DispXpos", ctx.attrs.integer(text, TEXT_X, 0));
        label.set("DispYpos", ctx.attrs.integer(text, TEXT_Y, 0));
        label.set("DispLabelFontSize", fontSize);
        if (style != null) {
            final String font = ctx.attrs.text(style, FONT_NAME);
            if (font != null) {
                label.set("DispLabelFontName", font);
            }
            label.set("DispLabelColour", colourOf(ctx, style));
        }
        final Integer boxWidth = ctx.attrs.integer(text, TEXT_BOX_WIDTH);
        final Integer boxHeight = ctx.attrs.integer(text, TEXT_BOX_HEIGHT);
        label.set("Width", boxWidth != null ? boxWidth : Geometry.textWidth(value, fontSize));
        label.set("Height", boxHeight != null ? boxHeight : Geometry.textHeight(value, fontSize));
    }

    static String colourOf(SynthesisContext ctx, SourceRecord style) {
        return Geometry.colour(
                ctx.attrs.integer(style, COLOUR_RED, 0),
                ctx.attrs.integer(style, COLOUR_GREEN, 0),
                ctx.attrs.integer(style, COLOUR_BLUE, 0));
    }
}
