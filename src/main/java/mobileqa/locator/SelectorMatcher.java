package mobileqa.locator;

import mobileqa.locator.selector.Selector;
import mobileqa.locator.selector.SelectorNode;
import mobileqa.locator.selector.UiMethod;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a selector AST against a UI hierarchy dump.
 *
 * <p>Calls are applied left to right, each narrowing (or, for the hierarchical
 * calls, moving) the current node set, which is always kept in document order.
 * {@code index(n)} keeps the n-th node among same-parent survivors;
 * {@code instance(n)} keeps the n-th node of the whole set, and positional
 * calls after it at the same step count over the whole set too. This is the
 * XPath reading of {@link PathQueryWriter}'s output, so a selector and its
 * path-query conversion select the same nodes.
 *
 * <p>{@code *Matches} calls use {@link Pattern} full-match semantics.
 */
final class SelectorMatcher {

    private final List<Element> all;
    private final Map<Node, Integer> order = new IdentityHashMap<>();

    SelectorMatcher(List<Element> documentOrder) {
        this.all = documentOrder;
        for (int i = 0; i < documentOrder.size(); i++) {
            order.put(documentOrder.get(i), i);
        }
    }

    List<Element> select(Selector selector) {
        return evaluate(selector, all).nodes;
    }

    private Step evaluate(Selector selector, List<Element> start) {
        List<Element> current = start;
        boolean global = false;
        for (SelectorNode node : selector.nodes()) {
            UiMethod method = node.method();
            switch (method.getMatchKind()) {
                case POSITION -> current = global
                        ? nth(current, (Integer) node.argument())
                        : nthAmongSiblings(current, (Integer) node.argument());
                case INSTANCE -> {
                    current = nth(current, (Integer) node.argument());
                    global = true;
                }
                case CHILD -> {
                    Step step = evaluate(node.nested(), children(current));
                    current = step.nodes;
                    global = step.global;
                }
                case PARENT -> {
                    Step step = evaluate(node.nested(), children(parents(current)));
                    current = step.nodes;
                    global = step.global;
                }
                default -> current = filter(current, method, node.argument());
            }
        }
        return new Step(current, global);
    }

    // ── Predicates ────────────────────────────────────────────────────────

    private static List<Element> filter(List<Element> in, UiMethod method, Object arg) {
        String attr = method.getNodeAttribute();
        String expected = String.valueOf(arg);
        Pattern pattern = method.getMatchKind() == UiMethod.MatchKind.MATCHES ? compile(expected) : null;
        List<Element> out = new ArrayList<>();
        for (Element e : in) {
            String actual = e.getAttribute(attr);
            boolean hit = switch (method.getMatchKind()) {
                case EQUALS      -> e.hasAttribute(attr) && actual.equals(expected);
                case CONTAINS    -> actual.contains(expected);
                case STARTS_WITH -> actual.startsWith(expected);
                case MATCHES     -> pattern.matcher(actual).matches();
                default -> throw new IllegalStateException("Not an attribute predicate: " + method);
            };
            if (hit) out.add(e);
        }
        return out;
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidLocatorException("Invalid regular expression '" + regex + "'", e);
        }
    }

    private static List<Element> nth(List<Element> in, int n) {
        return n < in.size() ? List.of(in.get(n)) : List.of();
    }

    private static List<Element> nthAmongSiblings(List<Element> in, int n) {
        Map<Node, Integer> seen = new IdentityHashMap<>();
        List<Element> out = new ArrayList<>();
        for (Element e : in) {
            int pos = seen.merge(e.getParentNode(), 1, Integer::sum) - 1;
            if (pos == n) out.add(e);
        }
        return out;
    }

    // ── Axes ──────────────────────────────────────────────────────────────

    private static List<Node> parents(List<Element> in) {
        Set<Node> out = new LinkedHashSet<>();
        for (Element e : in) {
            if (e.getParentNode() != null) out.add(e.getParentNode());
        }
        return new ArrayList<>(out);
    }

    private List<Element> children(List<? extends Node> in) {
        Set<Element> out = new LinkedHashSet<>();
        for (Node parent : in) {
            for (Node c = parent.getFirstChild(); c != null; c = c.getNextSibling()) {
                if (c instanceof Element child) out.add(child);
            }
        }
        List<Element> sorted = new ArrayList<>(out);
        sorted.sort(Comparator.comparingInt(order::get));
        return sorted;
    }

    private record Step(List<Element> nodes, boolean global) {}
}
