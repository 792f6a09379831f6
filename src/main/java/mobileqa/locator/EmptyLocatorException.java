package mobileqa.locator;

/**
 * Thrown when a locator carries no constraint at all. An empty locator would
 * match every node, so it is rejected instead.
 */
public class EmptyLocatorException extends LocatorException {

    public EmptyLocatorException(String msg) {
        super(msg);
    }
}
