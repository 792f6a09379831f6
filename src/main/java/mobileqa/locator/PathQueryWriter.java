package mobileqa.locator;

import mobileqa.locator.selector.Selector;
import mobileqa.locator.selector.SelectorNode;
import mobileqa.locator.selector.UiMethod;

/**
 * Writes a selector AST as an XPath over the UI hierarchy dump.
 *
 * <table>
 *   <caption>Call → XPath</caption>
 *   <tr><td>{@code text("a")}</td><td>{@code [@text="a"]}</td></tr>
 *   <tr><td>{@code textContains("a")}</td><td>{@code [contains(@text, "a")]}</td></tr>
 *   <tr><td>{@code textStartsWith("a")}</td><td>{@code [starts-with(@text, "a")]}</td></tr>
 *   <tr><td>{@code textMatches("a")}</td><td>{@code [matches(@text, "a")]}</td></tr>
 *   <tr><td>{@code checked(true)}</td><td>{@code [@checked="true"]}</td></tr>
 *   <tr><td>{@code index(n)}</td><td>{@code [position()=n+1]}</td></tr>
 *   <tr><td>{@code instance(n)}</td><td>{@code (path so far)[n+1]}</td></tr>
 *   <tr><td>{@code childSelector(S)}</td><td>{@code /*} + S</td></tr>
 *   <tr><td>{@code fromParent(S)}</td><td>{@code /../*} + S</td></tr>
 * </table>
 */
final class PathQueryWriter {

    private PathQueryWriter() {}

    static String write(Selector selector) {
        if (selector.isEmpty()) {
            throw new EmptyLocatorException("Selector has no method calls");
        }
        return writeStep(selector, "//");
    }

    /** Appends {@code *} and the predicates of {@code selector} to {@code prefix}. */
    private static String writeStep(Selector selector, String prefix) {
        String path = prefix + "*";
        for (SelectorNode node : selector.nodes()) {
            UiMethod method = node.method();
            Object arg = node.argument();
            switch (method.getMatchKind()) {
                case EQUALS      -> path += "[@" + method.getNodeAttribute() + "=" + literal(String.valueOf(arg)) + "]";
                case CONTAINS    -> path += function("contains", method, arg);
                case STARTS_WITH -> path += function("starts-with", method, arg);
                case MATCHES     -> path += function("matches", method, arg);
                case POSITION    -> path += "[position()=" + ((Integer) arg + 1) + "]";
                case INSTANCE    -> path = "(" + path + ")[" + ((Integer) arg + 1) + "]";
                case CHILD       -> path = writeStep(node.nested(), path + "/");
                case PARENT      -> path = writeStep(node.nested(), path + "/../");
            }
        }
        return path;
    }

    private static String function(String name, UiMethod method, Object arg) {
        return "[" + name + "(@" + method.getNodeAttribute() + ", " + literal(String.valueOf(arg)) + ")]";
    }

    /**
     * XPath 1.0 string literal. XPath has no escapes, so a value holding both
     * quote kinds is written as a {@code concat(...)} of quoted pieces.
     */
    static String literal(String value) {
        if (value.indexOf('"') < 0) {
            return '"' + value + '"';
        }
        if (value.indexOf('\'') < 0) {
            return "'" + value + "'";
        }
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("\"", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", '\"', ");
            sb.append('"').append(parts[i]).append('"');
        }
        return sb.append(')').toString();
    }
}
