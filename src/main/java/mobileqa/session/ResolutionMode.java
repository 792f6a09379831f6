package mobileqa.session;

/** How relational elements (child, parent, sibling, cousin) are looked up. */
public enum ResolutionMode {
    /** The whole relation chain is folded into one XPath: one remote lookup per attempt. */
    COMPOSED,
    /** Each base element is resolved (and cached) first; the next hop searches inside it. */
    SCOPED
}
