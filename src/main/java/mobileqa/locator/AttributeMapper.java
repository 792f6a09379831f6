package mobileqa.locator;

import mobileqa.locator.selector.ArgumentType;
import mobileqa.locator.selector.Selector;
import mobileqa.locator.selector.SelectorNode;
import mobileqa.locator.selector.SelectorParser;
import mobileqa.locator.selector.UiMethod;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps attribute-map locators to and from the selector AST.
 *
 * <p>Each key maps to exactly one {@link UiMethod} (see
 * {@link UiMethod#getAttributeKey()}), so a map with N entries always yields a
 * chain of N calls in the map's iteration order. Hierarchical keys
 * ({@code childSelector}, {@code fromParent}) take a nested map.
 */
final class AttributeMapper {

    /** Recognized key with no selector counterpart. */
    static final String SIBLING_KEY = "sibling";

    private AttributeMapper() {}

    // ── Map → AST ─────────────────────────────────────────────────────────

    static Selector toSelector(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            throw new EmptyLocatorException("Attribute locator has no attributes");
        }
        List<SelectorNode> nodes = new ArrayList<>(attributes.size());
        for (Map.Entry<String, ?> e : attributes.entrySet()) {
            String key = e.getKey();
            if (SIBLING_KEY.equals(key)) {
                throw new UnsupportedAxisException("following-sibling");
            }
            UiMethod method = UiMethod.fromAttributeKey(key)
                    .orElseThrow(() -> new UnsupportedAttributeException(key));
            nodes.add(SelectorNode.of(method, coerce(method, e.getValue())));
        }
        return new Selector(nodes);
    }

    private static Object coerce(UiMethod method, Object value) {
        String key = method.getAttributeKey();
        if (value == null) {
            throw new InvalidLocatorException("Attribute '" + key + "' has a null value");
        }
        ArgumentType type = method.getArgumentType();
        switch (type) {
            case STRING:
                if (value instanceof Map || value instanceof Selector) {
                    throw new InvalidLocatorException("Attribute '" + key + "' expects a string value");
                }
                return String.valueOf(value);
            case BOOLEAN:
                if (value instanceof Boolean) return value;
                String b = String.valueOf(value).trim();
                if (b.equalsIgnoreCase("true"))  return Boolean.TRUE;
                if (b.equalsIgnoreCase("false")) return Boolean.FALSE;
                throw new InvalidLocatorException("Attribute '" + key + "' expects true/false but got '" + value + "'");
            case INTEGER:
                return toIndex(key, value);
            case SELECTOR:
                if (value instanceof Selector s) return s;
                if (value instanceof Map<?, ?> m) return toSelector(castKeys(key, m));
                if (value instanceof CharSequence cs) return SelectorParser.parse(cs.toString());
                throw new InvalidLocatorException("Attribute '" + key + "' expects a nested attribute map");
            default:
                throw new IllegalStateException("Unhandled argument type " + type);
        }
    }

    private static Integer toIndex(String key, Object value) {
        long n;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            n = ((Number) value).longValue();
        } else {
            try {
                n = Long.parseLong(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                throw new InvalidLocatorException("Attribute '" + key + "' expects an integer but got '" + value + "'", e);
            }
        }
        if (n < 0 || n > Integer.MAX_VALUE) {
            throw new InvalidLocatorException("Attribute '" + key + "' must be a non-negative integer: " + value);
        }
        return (int) n;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> castKeys(String key, Map<?, ?> map) {
        for (Object k : map.keySet()) {
            if (!(k instanceof String)) {
                throw new InvalidLocatorException("Nested '" + key + "' map has a non-string key: " + k);
            }
        }
        return (Map<String, ?>) map;
    }

    // ── AST → Map ─────────────────────────────────────────────────────────

    static Map<String, Object> toAttributes(Selector selector) {
        if (selector.isEmpty()) {
            throw new EmptyLocatorException("Selector has no method calls");
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (SelectorNode node : selector.nodes()) {
            String key = node.method().getAttributeKey();
            if (out.containsKey(key)) {
                throw new InvalidLocatorException("Selector calls " + node.method().getMethodName()
                        + " more than once; an attribute map cannot hold both constraints");
            }
            Object arg = node.argument();
            out.put(key, arg instanceof Selector nested ? toAttributes(nested) : arg);
        }
        return out;
    }
}
