package organ.converter.synth;

import static organ.converter.model.SourceAttributes.INSTANCE_LEFT;
import static organ.converter.model.SourceAttributes.INSTANCE_TOP;
import static organ.converter.model.SourceAttributes.KEYBOARD_ASSIGNMENT_CODE;
import static organ.converter.model.SourceAttributes.KEYBOARD_FIRST_NOTE;
import static organ.converter.model.SourceAttributes.KEYBOARD_KEY_COUNT;
import static organ.converter.model.SourceAttributes.KEYBOARD_LEFT;
import static organ.converter.model.SourceAttributes.KEYBOARD_NAME;
import static organ.converter.model.SourceAttributes.KEYBOARD_TOP;
import static organ.converter.model.SourceAttributes.KEY_ACTION_CONDITION_SWITCH;
import static organ.converter.model.SourceAttributes.KEY_IMAGE_INDEX_DISENGAGED;
import static organ.converter.model.SourceAttributes.KEY_IMAGE_INDEX_ENGAGED;
import static organ.converter.model.SourceAttributes.KEY_NATURAL_SPACING;
import static organ.converter.model.SourceAttributes.KEY_NOTE;
import static organ.converter.model.SourceAttributes.KEY_SHAPE_A;
import static organ.converter.model.SourceAttributes.KEY_SHAPE_CF;
import static organ.converter.model.SourceAttributes.KEY_SHAPE_D;
import static organ.converter.model.SourceAttributes.KEY_SHAPE_EB;
import static organ.converter.model.SourceAttributes.KEY_SHAPE_G;
import static organ.converter.model.SourceAttributes.KEY_SHAPE_SHARP;
import static organ.converter.model.SourceAttributes.KEY_SHARP_OFFSET;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import organ.converter.model.AttrSpec;
import organ.converter.model.Ids;
import organ.converter.model.SourceRecord;
import organ.converter.model.SourceTypes;
import organ.converter.model.TargetRecord;

/**
 * Keyboards to manuals. The pedal keyboard takes the reserved {@code Manual000}.
 * <p>
 * Graphics, by priority: one image instance per key, a shared key image set, or none.
 */
final class ManualBuilder {

    static final int DEFAULT_KEY_COUNT = 61;
    static final int DEFAULT_FIRST_NOTE = 36;
    static final int PEDAL_ASSIGNMENT_CODE = 1;

    private ManualBuilder() {
    }

    static void build(SynthesisContext ctx) {
        final List<SourceRecord> keyboards = new ArrayList<>(ctx.source.ofType(SourceTypes.KEYBOARD));
        final SourceRecord pedal = findPedal(ctx, keyboards);

        int midiInput = 0;
        for (SourceRecord keyboard : keyboards) {
            ctx.progress.onProgress("manual " + keyboard.key());
            final TargetRecord manual = keyboard == pedal
                    ? ctx.target.createReserved("Manual000")
                    : ctx.target.create("Manual");
            keyboard.assignTarget(manual.id());
            ctx.manualsByKeyboard.put(keyboard, manual);

            final String name = ctx.attrs.text(keyboard, KEYBOARD_NAME);
            manual.set("Name", name != null ? name : "Keyboard " + keyboard.id());
            final int[] range = keyRange(ctx, keyboard);
            manual.set("NumberOfLogicalKeys", range[1]);
            manual.set("FirstAccessibleKeyLogicalKeyNumber", 1);
            manual.set("FirstAccessibleKeyMIDINoteNumber", range[0]);
            manual.set("NumberOfAccessibleKeys", range[1]);
            manual.set("MIDIInputNumber", ++midiInput);
            initCounters(manual);

            final SourceRecord division = primaryDivision(ctx, keyboard);
            if (division != null) {
                ctx.manualsByDivision.putIfAbsent(division, manual);
            }

            if (!perKeyGraphics(ctx, keyboard, manual, range[0]) && !keyImageSetGraphics(ctx, keyboard, manual)) {
                manual.set("Displayed", false);
            }

            for (SourceRecord key : keyboard.children(SourceTypes.KEYBOARD_KEY)) {
                for (SourceRecord sw : key.children(SourceTypes.SWITCH)) {
                    sw.assignTarget(manual.id());
                }
            }
        }
    }

    static void initCounters(TargetRecord manual) {
        manual.set("NumberOfStops", 0);
        manual.set("NumberOfCouplers", 0);
        manual.set("NumberOfDivisionals", 0);
        manual.set("NumberOfTremulants", 0);
        manual.set("NumberOfSwitches", 0);
    }

    static int firstNote(TargetRecord manual) {
        return manual.getInt("FirstAccessibleKeyMIDINoteNumber", DEFAULT_FIRST_NOTE);
    }

    static int keyCount(TargetRecord manual) {
        return manual.getInt("NumberOfAccessibleKeys", DEFAULT_KEY_COUNT);
    }

    private static SourceRecord findPedal(SynthesisContext ctx, List<SourceRecord> keyboards) {
        for (SourceRecord keyboard : keyboards) {
            if (ctx.attrs.integer(keyboard, KEYBOARD_ASSIGNMENT_CODE, 0) == PEDAL_ASSIGNMENT_CODE) {
                return keyboard;
            }
        }
        for (SourceRecord keyboard : keyboards) {
            final String name = ctx.attrs.text(keyboard, KEYBOARD_NAME);
            if (name != null && name.toLowerCase(Locale.ROOT).contains("pedal")) {
                return keyboard;
            }
        }
        return null;
    }

    /**
     * {first MIDI note, key count}
     */
    private static int[] keyRange(SynthesisContext ctx, SourceRecord keyboard) {
        final Integer count = ctx.attrs.integer(keyboard, KEYBOARD_KEY_COUNT);
        final Integer first = ctx.attrs.integer(keyboard, KEYBOARD_FIRST_NOTE);
        if (count != null && count > 0 && first != null) {
            return new int[] {first, count};
        }
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (SourceRecord key : keyboard.children(SourceTypes.KEYBOARD_KEY)) {
            final Integer note = ctx.attrs.integer(key, KEY_NOTE);
            if (note != null) {
                min = Math.min(min, note);
                max = Math.max(max, note);
            }
        }
        if (min <= max) {
            return new int[] {min, max - min + 1};
        }
        ctx.log.warn(keyboard.key() + ": no key range, " + DEFAULT_KEY_COUNT + " keys from MIDI note "
                + DEFAULT_FIRST_NOTE + " assumed");
        return new int[] {DEFAULT_FIRST_NOTE, DEFAULT_KEY_COUNT};
    }

    /**
     * The division hinted by the keyboard, else the division its first ungated key action plays.
     */
    static SourceRecord primaryDivision(SynthesisContext ctx, SourceRecord keyboard) {
        final SourceRecord hinted = keyboard.firstParent(SourceTypes.DIVISION);
        if (hinted != null) {
            return hinted;
        }
        for (SourceRecord action : keyboard.children(SourceTypes.KEY_ACTION)) {
            if (ctx.attrs.isSet(action, KEY_ACTION_CONDITION_SWITCH)) {
                continue;
            }
            final SourceRecord division = action.firstChild(SourceTypes.DIVISION);
            if (division != null) {
                return division;
            }
        }
        return null;
    }

    private static boolean perKeyGraphics(SynthesisContext ctx, SourceRecord keyboard, TargetRecord manual,
                                          int firstNote) {
        final List<SourceRecord> keys = new ArrayList<>();
        for (SourceRecord key : keyboard.children(SourceTypes.KEYBOARD_KEY)) {
            if (key.firstChild(SourceTypes.IMAGE_SET_INSTANCE) != null && ctx.attrs.integer(key, KEY_NOTE) != null) {
                keys.add(key);
            }
        }
        if (keys.isEmpty()) {
            return false;
        }
        keys.sort(Comparator.comparingInt((SourceRecord k) -> ctx.attrs.integer(k, KEY_NOTE)));

        int minLeft = Integer.MAX_VALUE;
        int minTop = Integer.MAX_VALUE;
        SourceRecord page = null;
        for (SourceRecord key : keys) {
            final SourceRecord instance = key.firstChild(SourceTypes.IMAGE_SET_INSTANCE);
            minLeft = Math.min(minLeft, ctx.attrs.integer(instance, INSTANCE_LEFT, 0));
            minTop = Math.min(minTop, ctx.attrs.integer(instance, INSTANCE_TOP, 0));
            if (page == null) {
                page = instance.firstParent(SourceTypes.DISPLAY_PAGE);
            }
        }

        for (int i = 0; i < keys.size(); i++) {
            final SourceRecord key = keys.get(i);
            final SourceRecord instance = key.firstChild(SourceTypes.IMAGE_SET_INSTANCE);
            final SourceRecord imageSet = instance.firstChild(SourceTypes.IMAGE_SET);
            final String prefix = "Key" + Ids.number3(ctx.attrs.integer(key, KEY_NOTE) - firstNote + 1);
            final String on = ctx.imagePath(imageSet, 2);
            final String off = ctx.imagePath(imageSet, 1);
            if (on != null) {
                manual.set(prefix + "ImageOn", on);
            }
            if (off != null) {
                manual.set(prefix + "ImageOff", off);
            }
            final int left = ctx.attrs.integer(instance, INSTANCE_LEFT, 0);
            final int width = i + 1 < keys.size()
                    ? ctx.attrs.integer(keys.get(i + 1).firstChild(SourceTypes.IMAGE_SET_INSTANCE), INSTANCE_LEFT, 0) - left
                    : ctx.imageWidth(imageSet, Geometry.KEY_BITMAP_WIDTH);
            manual.set(prefix + "Width", Math.max(0, width));
            manual.set(prefix + "YOffset", ctx.attrs.integer(instance, INSTANCE_TOP, 0) - minTop);
        }
        manual.set("Displayed", true);
        addManualElement(ctx, manual, keyboard, page, minLeft, minTop);
        return true;
    }

    private static boolean keyImageSetGraphics(SynthesisContext ctx, SourceRecord keyboard, TargetRecord manual) {
        final SourceRecord keyImages = keyboard.firstChild(SourceTypes.KEY_IMAGE_SET);
        if (keyImages == null) {
            return false;
        }
        final int engaged = ctx.attrs.integer(keyImages, KEY_IMAGE_INDEX_ENGAGED, 2);
        final int disengaged = ctx.attrs.integer(keyImages, KEY_IMAGE_INDEX_DISENGAGED, 1);
        final int spacing = ctx.attrs.integer(keyImages, KEY_NATURAL_SPACING, 0);
        final Integer sharpOffset = ctx.attrs.integer(keyImages, KEY_SHARP_OFFSET);

        boolean any = false;
        any |= keyShape(ctx, manual, keyImages, KEY_SHAPE_CF, engaged, disengaged, spacing, null, "C", "F");
        any |= keyShape(ctx, manual, keyImages, KEY_SHAPE_D, engaged, disengaged, spacing, null, "D");
        any |= keyShape(ctx, manual, keyImages, KEY_SHAPE_EB, engaged, disengaged, spacing, null, "E", "B");
        any |= keyShape(ctx, manual, keyImages, KEY_SHAPE_G, engaged, disengaged, spacing, null, "G");
        any |= keyShape(ctx, manual, keyImages, KEY_SHAPE_A, engaged, disengaged, spacing, null, "A");
        any |= keyShape(ctx, manual, keyImages, KEY_SHAPE_SHARP, engaged, disengaged, 0,
                sharpOffset == null ? null : sharpOffset - spacing, "Cis", "Dis", "Fis", "Gis", "Ais");
        if (!any) {
            ctx.log.warn(keyImages.key() + ": key image set without usable images");
            return false;
        }
        manual.set("Displayed", true);
        addManualElement(ctx, manual, keyboard, keyboard.firstParent(SourceTypes.DISPLAY_PAGE),
                ctx.attrs.integer(keyboard, KEYBOARD_LEFT, 0), ctx.attrs.integer(keyboard, KEYBOARD_TOP, 0));
        return true;
    }

    private static boolean keyShape(SynthesisContext ctx, TargetRecord manual, SourceRecord keyImages, AttrSpec shape,
                                    int engaged, int disengaged, int width, Integer offset, String... notes) {
        final SourceRecord imageSet = linkedImageSet(keyImages, ctx.attrs.reference(keyImages, shape));
        if (imageSet == null) {
            return false;
        }
        final String on = ctx.imagePath(imageSet, engaged);
        final String off = ctx.imagePath(imageSet, disengaged);
        if (on == null || off == null) {
            return false;
        }
        for (String note : notes) {
            manual.set("ImageOn_" + note, on);
            manual.set("ImageOff_" + note, off);
            if (width > 0) {
                manual.set("Width_" + note, width);
            } else if (offset != null) {
                manual.set("Width_" + note, 0);
            }
            if (offset != null) {
                manual.set("Offset_" + note, offset);
            }
        }
        return true;
    }

    private static SourceRecord linkedImageSet(SourceRecord keyImages, Integer id) {
        if (id == null) {
            return null;
        }
        for (SourceRecord imageSet : keyImages.children(SourceTypes.IMAGE_SET)) {
            if (imageSet.id() == id) {
                return imageSet;
            }
        }
        return null;
    }

    private static void addManualElement(SynthesisContext ctx, TargetRecord manual, SourceRecord keyboard,
                                         SourceRecord page, int left, int top) {
        final TargetRecord panel = ctx.panelFor(page != null ? page : keyboard.firstParent(SourceTypes.DISPLAY_PAGE));
        if (panel == null) {
            return;
        }
        final TargetRecord element = ctx.addPanelElement(panel, "Manual");
        element.set("Manual", Ids.number3(Ids.targetNumber(manual.id())));
        element.set("PositionX", left);
        element.set("PositionY", top);
    }
}
