package mobileqa.locator;

/**
 * Thrown for locators that are structurally malformed: an unparsable path
 * query, an attribute value of the wrong type, or a selector that cannot be
 * flattened into an attribute map.
 */
public class InvalidLocatorException extends LocatorException {

    public InvalidLocatorException(String msg) {
        super(msg);
    }

    public InvalidLocatorException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
