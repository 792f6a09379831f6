package mobileqa.element;

import mobileqa.locator.InvalidLocatorException;

/**
 * Folds a relation onto a base XPath, producing one query for a whole chain
 * of relational lookups.
 *
 * <pre>
 * CHILD      base//step
 * PARENT     base/..
 * SIBLING    base/following-sibling::step
 * COUSIN     base/../..//step      (one /.. per level)
 * NTH_CHILD  base/*[n+1]
 * ANCESTOR   base/ancestor::*
 * </pre>
 *
 * A relative query of the form {@code (//step)[k]} keeps its instance
 * position, counted inside the base: {@code (base//step)[k]}.
 */
final class XPathComposer {

    private XPathComposer() {}

    static String compose(String base, Relation relation, String relative, int n) {
        return switch (relation) {
            case PLAIN     -> relative;
            case PARENT    -> base + "/..";
            case NTH_CHILD -> base + "/*[" + (n + 1) + "]";
            case ANCESTOR  -> base + "/ancestor::*";
            case CHILD, SIBLING, COUSIN -> attach(base, relation, relative.strip(), n);
        };
    }

    private static String attach(String base, Relation relation, String relative, int depth) {
        if (relative.startsWith("(")) {
            int close = closingParen(relative);
            return "(" + attach(base, relation, relative.substring(1, close).strip(), depth) + ")"
                    + relative.substring(close + 1);
        }
        if (!relative.startsWith("//")) {
            throw new InvalidLocatorException("Relative lookups need a path query starting with '//': " + relative);
        }
        String step = relative.substring(2);
        if (step.startsWith("child::")) {
            step = step.substring("child::".length());
        }
        return switch (relation) {
            case SIBLING -> base + "/following-sibling::" + step;
            case COUSIN  -> base + "/..".repeat(depth) + "//" + step;
            default      -> base + "//" + step;
        };
    }

    /** Index of the parenthesis closing the one at index 0, skipping string literals. */
    private static int closingParen(String s) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        throw new InvalidLocatorException("Unbalanced parentheses in path query: " + s);
    }
}
