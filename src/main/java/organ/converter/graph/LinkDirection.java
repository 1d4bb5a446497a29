package organ.converter.graph;

/**
 * Role of the referenced record relative to the record holding the reference.
 */
public enum LinkDirection {
    /** The referenced record controls or contains the holder. */
    TO_PARENT,
    /** The referenced record is controlled or contained by the holder. */
    TO_CHILD
}
