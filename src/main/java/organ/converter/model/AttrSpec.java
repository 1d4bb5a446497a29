package organ.converter.model;

import java.util.Objects;

/**
 * Declaration of one source attribute: owning record type, name, value kind, whether its absence is
 * reported, and the value used when it is absent or invalid.
 */
public record AttrSpec(
        String recordType,
        String name,
        Kind kind,
        boolean required,
        String defaultValue
) {

    public enum Kind {
        TEXT,
        INTEGER,
        DECIMAL,
        BOOLEAN,
        REFERENCE
    }

    public AttrSpec {
        Objects.requireNonNull(recordType, "recordType");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
    }

    public static AttrSpec text(String type, String name) {
        return new AttrSpec(type, name, Kind.TEXT, false, null);
    }

    public static AttrSpec text(String type, String name, String defaultValue) {
        return new AttrSpec(type, name, Kind.TEXT, false, defaultValue);
    }

    public static AttrSpec requiredText(String type, String name) {
        return new AttrSpec(type, name, Kind.TEXT, true, null);
    }

    public static AttrSpec integer(String type, String name) {
        return new AttrSpec(type, name, Kind.INTEGER, false, null);
    }

    public static AttrSpec integer(String type, String name, int defaultValue) {
        return new AttrSpec(type, name, Kind.INTEGER, false, Integer.toString(defaultValue));
    }

    public static AttrSpec requiredInteger(String type, String name) {
        return new AttrSpec(type, name, Kind.INTEGER, true, null);
    }

    public static AttrSpec decimal(String type, String name) {
        return new AttrSpec(type, name, Kind.DECIMAL, false, null);
    }

    public static AttrSpec flag(String type, String name, boolean defaultValue) {
        return new AttrSpec(type, name, Kind.BOOLEAN, false, defaultValue ? "Y" : "N");
    }

    public static AttrSpec reference(String type, String name) {
        return new AttrSpec(type, name, Kind.REFERENCE, false, null);
    }

    public String qualifiedName() {
        return recordType + "." + name;
    }
}
