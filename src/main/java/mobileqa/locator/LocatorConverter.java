package mobileqa.locator;

import mobileqa.locator.selector.Selector;

/**
 * Converts locators between the three {@link LocatorShape}s.
 *
 * <p>Every conversion pivots through the selector AST: the source is read into
 * a {@link Selector}, and the target is written from it. Surface syntax is not
 * preserved; the set of matched nodes is. Conversions are stateless and safe
 * to call from any thread.
 */
public final class LocatorConverter {

    private LocatorConverter() {}

    /**
     * Returns {@code locator} expressed in {@code target}. A locator already in
     * the target shape is returned unchanged.
     *
     * @throws EmptyLocatorException         if the locator has no constraints
     * @throws UnsupportedAttributeException if an attribute or predicate has no counterpart
     * @throws UnsupportedAxisException      if a hierarchical axis has no counterpart
     * @throws InvalidLocatorException       if the locator is malformed
     */
    public static Locator convert(Locator locator, LocatorShape target) {
        if (locator.getShape() == target) {
            return locator;
        }
        Selector ast = toSelector(locator);
        return switch (target) {
            case ATTRIBUTES -> Locator.attributes(AttributeMapper.toAttributes(ast));
            case PATH_QUERY -> Locator.xpath(PathQueryWriter.write(ast));
            case SELECTOR   -> Locator.selector(ast);
        };
    }

    /** Reads any locator into the canonical selector AST. */
    public static Selector toSelector(Locator locator) {
        Selector ast = switch (locator.getShape()) {
            case ATTRIBUTES -> AttributeMapper.toSelector(locator.getAttributes());
            case PATH_QUERY -> PathQueryParser.parse(locator.getPathQuery());
            case SELECTOR   -> locator.getSelector();
        };
        if (ast.isEmpty()) {
            throw new EmptyLocatorException("Locator " + locator.describe() + " has no constraints");
        }
        return ast;
    }

    /**
     * XPath for the driver's {@code By.xpath} strategy. Path queries pass
     * through untouched, so XPath outside the convertible subset can still be
     * used for lookups.
     */
    public static String toXPath(Locator locator) {
        if (locator.getShape() == LocatorShape.PATH_QUERY) {
            return locator.getPathQuery();
        }
        return PathQueryWriter.write(toSelector(locator));
    }

    /** Canonical selector text for the driver's UiAutomator strategy. */
    public static String toSelectorText(Locator locator) {
        return toSelector(locator).toString();
    }
}
