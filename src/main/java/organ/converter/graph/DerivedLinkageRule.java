package organ.converter.graph;

import java.util.Objects;

/**
 * Links a record to the {@code targetType} parents of a record it is already linked to.
 * <p>
 * Example: a switch joins the display page of its image instance. Applied after every
 * {@link LinkageRule}, since it reads edges those rules created.
 *
 * @param viaIsParent    the intermediate record is a parent (true) or a child (false) of the record
 * @param onlyIfUnlinked skip records that already have a {@code targetType} parent
 */
public record DerivedLinkageRule(
        String recordType,
        String viaType,
        boolean viaIsParent,
        String targetType,
        boolean onlyIfUnlinked
) {

    public DerivedLinkageRule {
        Objects.requireNonNull(recordType, "recordType");
        Objects.requireNonNull(viaType, "viaType");
        Objects.requireNonNull(targetType, "targetType");
    }

    public String name() {
        return recordType + "->" + viaType + "->" + targetType;
    }
}
