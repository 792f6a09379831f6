package mobileqa.locator;

import mobileqa.locator.selector.Selector;
import mobileqa.locator.selector.SelectorParser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An element query in exactly one of the three {@link LocatorShape}s.
 *
 * <p>Locators are immutable value objects. Construction only rejects empty
 * input; grammar errors surface when the locator is converted or parsed.
 * Use {@link LocatorConverter} to move between shapes.
 *
 * <pre>{@code
 * Locator a = Locator.attributes(Map.of("resource-id", "android:id/title"));
 * Locator b = Locator.xpath("//*[@text=\"Wi-Fi\"]");
 * Locator c = Locator.selector("new UiSelector().text(\"Wi-Fi\");");
 * Locator d = Locator.of("//android.widget.Button");   // shape detected
 * }</pre>
 */
public final class Locator {

    private final LocatorShape shape;
    private final Map<String, Object> attributes;
    private final String pathQuery;
    private final String selectorText;
    private final Selector selector;

    private Locator(LocatorShape shape, Map<String, Object> attributes, String pathQuery,
                    String selectorText, Selector selector) {
        this.shape = shape;
        this.attributes = attributes;
        this.pathQuery = pathQuery;
        this.selectorText = selectorText;
        this.selector = selector;
    }

    // ── Factories ─────────────────────────────────────────────────────────

    /**
     * @param attributes ordered attribute map; iteration order is kept
     * @throws EmptyLocatorException if the map is null or empty
     */
    public static Locator attributes(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            throw new EmptyLocatorException("Attribute locator has no attributes");
        }
        return new Locator(LocatorShape.ATTRIBUTES,
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), null, null, null);
    }

    /** @throws EmptyLocatorException if the path is null or blank */
    public static Locator xpath(String xpath) {
        if (xpath == null || xpath.isBlank()) {
            throw new EmptyLocatorException("Path query is blank");
        }
        return new Locator(LocatorShape.PATH_QUERY, null, xpath.strip(), null, null);
    }

    /** @throws EmptyLocatorException if the selector text is null or blank */
    public static Locator selector(String selectorText) {
        if (selectorText == null || selectorText.isBlank()) {
            throw new EmptyLocatorException("Selector string is blank");
        }
        return new Locator(LocatorShape.SELECTOR, null, null, selectorText.strip(), null);
    }

    /** @throws EmptyLocatorException if the selector has no calls */
    public static Locator selector(Selector selector) {
        if (selector == null || selector.isEmpty()) {
            throw new EmptyLocatorException("Selector has no method calls");
        }
        return new Locator(LocatorShape.SELECTOR, null, null, null, selector);
    }

    /**
     * Builds a locator from a string, detecting its shape: strings starting
     * with {@code /} or {@code (} are path queries, everything else is
     * treated as selector text.
     */
    public static Locator of(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyLocatorException("Locator string is blank");
        }
        String s = text.strip();
        if (s.startsWith("/") || s.startsWith("(")) {
            return xpath(s);
        }
        return selector(s);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public LocatorShape getShape() { return shape; }

    /** @throws IllegalStateException if this is not an attribute locator */
    public Map<String, Object> getAttributes() {
        requireShape(LocatorShape.ATTRIBUTES);
        return attributes;
    }

    /** @throws IllegalStateException if this is not a path-query locator */
    public String getPathQuery() {
        requireShape(LocatorShape.PATH_QUERY);
        return pathQuery;
    }

    /**
     * Returns the parsed selector, parsing the text form on demand.
     *
     * @throws IllegalStateException if this is not a selector locator
     */
    public Selector getSelector() {
        requireShape(LocatorShape.SELECTOR);
        return selector != null ? selector : SelectorParser.parse(selectorText);
    }

    /** Selector text as given by the caller, or the canonical form of a parsed selector. */
    public String getSelectorText() {
        requireShape(LocatorShape.SELECTOR);
        return selectorText != null ? selectorText : selector.toString();
    }

    /** Human-readable value used in logs and error messages. */
    public String describe() {
        return switch (shape) {
            case ATTRIBUTES -> attributes.toString();
            case PATH_QUERY -> pathQuery;
            case SELECTOR   -> getSelectorText();
        };
    }

    private void requireShape(LocatorShape expected) {
        if (shape != expected) {
            throw new IllegalStateException("Locator is " + shape + ", not " + expected);
        }
    }

    // ── Object ────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Locator other)) return false;
        return shape == other.shape && describe().equals(other.describe());
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, describe());
    }

    @Override
    public String toString() {
        return String.format("Locator{%s=%s}", shape, describe());
    }
}
