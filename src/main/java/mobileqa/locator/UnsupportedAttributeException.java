package mobileqa.locator;

/**
 * Thrown when an attribute key or path-query predicate has no counterpart in
 * the selector vocabulary.
 */
public class UnsupportedAttributeException extends LocatorException {

    private final String attribute;

    public UnsupportedAttributeException(String attribute) {
        super("Unsupported locator attribute: '" + attribute + "'");
        this.attribute = attribute;
    }

    /** The offending key or predicate, as written by the caller. */
    public String getAttribute() { return attribute; }
}
