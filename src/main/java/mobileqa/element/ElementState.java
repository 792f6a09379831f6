package mobileqa.element;

/** Resolution state of an {@link Element}'s cached handle. */
public enum ElementState {
    /** No handle cached yet. */
    UNRESOLVED,
    /** A lookup is in flight. */
    RESOLVING,
    /** A handle is cached and believed valid. */
    RESOLVED,
    /** The cached handle failed or belongs to an older session; the next use looks it up again. */
    STALE
}
