package io.github.eutro.restruct.graph;

/**
 * The kind of a {@link Node}.
 */
public enum NodeKind {
    /**
     * A plain block of code, with up to two successors.
     */
    CODE,
    /**
     * A dispatch on the state variable, with exactly two successors tagged true and false.
     */
    CHECK,
    /**
     * An opaque node standing for an already identified loop, wrapping its body region.
     */
    COLLAPSED,
    /**
     * A zero-weight node with no code, used to mediate joins.
     */
    ARTIFICIAL_DUMMY,
    BREAK,
    CONTINUE,
    /**
     * An assignment to the state variable.
     */
    SET,
}
