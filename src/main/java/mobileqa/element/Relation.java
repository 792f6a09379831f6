package mobileqa.element;

/** How an element is positioned relative to the element it was derived from. */
public enum Relation {
    /** Looked up from the root of the screen. */
    PLAIN,
    /** A descendant of the base element. */
    CHILD,
    /** The base element's parent. */
    PARENT,
    /** A following sibling of the base element. */
    SIBLING,
    /** A descendant of the base element's ancestor {@code depth} levels up. */
    COUSIN,
    /** The n-th direct child of the base element. */
    NTH_CHILD,
    /** Every ancestor of the base element, outermost first. */
    ANCESTOR
}
