package organ.converter.synth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback dimensions and text metrics used when the source does not supply a size.
 */
final class Geometry {

    private Geometry() {
    }

    static final int DEFAULT_PANEL_WIDTH = 1024;
    static final int DEFAULT_PANEL_HEIGHT = 768;

    /** Built-in drawstop bitmap. */
    static final int DRAWSTOP_SIZE = 62;

    static final int KEY_BITMAP_WIDTH = 100;

    static final int DEFAULT_FONT_SIZE = 10;
    static final String DEFAULT_FONT_NAME = "Arial";

    private static final double CHAR_WIDTH_RATIO = 0.6;
    private static final double LINE_HEIGHT_RATIO = 1.2;

    /**
     * Display metrics every panel of the new panel format carries.
     */
    static final Map<String, String> PANEL_DISPLAY_DEFAULTS;

    static {
        final Map<String, String> m = new LinkedHashMap<>();
        m.put("DispDrawstopBackgroundImageNum", "1");
        m.put("DispConsoleBackgroundImageNum", "1");
        m.put("DispKeyHorizBackgroundImageNum", "1");
        m.put("DispKeyVertBackgroundImageNum", "1");
        m.put("DispDrawstopInsetBackgroundImageNum", "1");
        m.put("DispControlLabelFont", DEFAULT_FONT_NAME);
        m.put("DispShortcutKeyLabelFont", DEFAULT_FONT_NAME);
        m.put("DispShortcutKeyLabelColour", "Yellow");
        m.put("DispGroupLabelFont", DEFAULT_FONT_NAME);
        m.put("DispDrawstopCols", "2");
        m.put("DispDrawstopRows", "1");
        m.put("DispDrawstopColsOffset", "N");
        m.put("DispDrawstopOuterColOffsetUp", "N");
        m.put("DispPairDrawstopCols", "N");
        m.put("DispExtraDrawstopRows", "0");
        m.put("DispExtraDrawstopCols", "0");
        m.put("DispButtonCols", "1");
        m.put("DispExtraButtonRows", "0");
        m.put("DispExtraPedalButtonRow", "N");
        m.put("DispExtraPedalButtonRowOffset", "N");
        m.put("DispExtraPedalButtonRowOffsetRight", "N");
        m.put("DispButtonsAboveManuals", "N");
        m.put("DispTrimAboveManuals", "N");
        m.put("DispTrimBelowManuals", "N");
        m.put("DispTrimAboveExtraRows", "N");
        m.put("DispExtraDrawstopRowsAboveExtraButtonRows", "N");
        PANEL_DISPLAY_DEFAULTS = Collections.unmodifiableMap(m);
    }

    static int textWidth(String text, int fontSize) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int longest = 0;
        for (String line : text.split("\n")) {
            longest = Math.max(longest, line.length());
        }
        return (int) Math.round(longest * fontSize * CHAR_WIDTH_RATIO);
    }

    static int textHeight(String text, int fontSize) {
        final int lines = text == null || text.isEmpty() ? 1 : text.split("\n").length;
        return (int) Math.round(lines * fontSize * LINE_HEIGHT_RATIO);
    }

    static String colour(int red, int green, int blue) {
        return String.format("#%02X%02X%02X", clamp(red), clamp(green), clamp(blue));
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }
}
