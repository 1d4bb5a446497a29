package organ.converter.graph;

import java.util.Objects;

/**
 * An id attribute of {@code recordType} that references a record of {@code targetType}.
 *
 * @param mandatory a missing or unresolved reference is logged
 */
public record LinkageRule(
        String recordType,
        String attribute,
        String targetType,
        LinkDirection direction,
        boolean mandatory
) {

    public LinkageRule {
        Objects.requireNonNull(recordType, "recordType");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(targetType, "targetType");
        Objects.requireNonNull(direction, "direction");
    }

    public static LinkageRule parent(String recordType, String attribute, String targetType) {
        return new LinkageRule(recordType, attribute, targetType, LinkDirection.TO_PARENT, false);
    }

    public static LinkageRule child(String recordType, String attribute, String targetType) {
        return new LinkageRule(recordType, attribute, targetType, LinkDirection.TO_CHILD, false);
    }

    public LinkageRule required() {
        return new LinkageRule(recordType, attribute, targetType, direction, true);
    }

    /**
     * {@code Type.Attribute}, the form used by the exclusion list.
     */
    public String name() {
        return recordType + "." + attribute;
    }
}
