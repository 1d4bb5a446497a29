package organ.converter.model;

import java.util.Objects;

public final class Ids {

    private Ids() {
    }

    /**
     * Key of a source record: type name followed by the id zero-padded to six digits.
     * The root record (id 0) is keyed by its type name alone.
     */
    public static String sourceKey(String type, int id) {
        Objects.requireNonNull(type, "type");
        if (id <= 0) {
            return type;
        }
        return type + String.format("%06d", id);
    }

    /**
     * Target object name, e.g. {@code Stop007}.
     */
    public static String targetId(String prefix, int number) {
        Objects.requireNonNull(prefix, "prefix");
        return prefix + number3(number);
    }

    /**
     * Zero-padded three digit number as used in target attribute names and values.
     */
    public static String number3(int number) {
        return String.format("%03d", number);
    }

    /**
     * Numeric suffix of a target id ({@code Manual002} -> 2), or -1 if there is none.
     */
    public static int targetNumber(String targetId) {
        if (targetId == null || targetId.length() < 4) {
            return -1;
        }
        final String digits = targetId.substring(targetId.length() - 3);
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(digits);
    }

    /**
     * Prefix of a target id ({@code Manual002} -> {@code Manual}); ids without numeric suffix are returned as-is.
     */
    public static String targetPrefix(String targetId) {
        if (targetNumber(targetId) < 0) {
            return targetId;
        }
        return targetId.substring(0, targetId.length() - 3);
    }

    /**
     * Parses a positive integer reference, returning null for anything else.
     */
    public static Integer parsePositiveInt(String raw) {
        if (raw == null) {
            return null;
        }
        final String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            final int value = Integer.parseInt(trimmed);
            return value > 0 ? value : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Normalizes a path declared in a source document: backslashes become slashes, duplicate and leading
     * separators are removed.
     */
    public static String normalizePath(String declared) {
        if (declared == null) {
            return "";
        }
        String p = declared.trim().replace('\\', '/');
        while (p.contains("//")) {
            p = p.replace("//", "/");
        }
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p;
    }
}
