package organ.converter.graph;

public enum TraceDirection {
    /** Toward the switches that drive the seed. */
    UPSTREAM,
    /** Toward the switches the seed drives. */
    DOWNSTREAM
}
