package mobileqa.element;

import mobileqa.MobileQAException;
import mobileqa.locator.Locator;
import org.openqa.selenium.NoSuchElementException;

/**
 * Thrown when an element could not be resolved, or could not be used, within
 * its attempt budget or deadline. The last transient driver failure is kept
 * as the cause and named in the message when it is not a plain lookup miss.
 */
public class ElementNotFoundException extends MobileQAException {

    private final transient Locator locator;
    private final long elapsedMs;
    private final int attempts;

    public ElementNotFoundException(Locator locator, long elapsedMs, int attempts, Throwable cause) {
        super(describe(locator, elapsedMs, attempts, cause), cause);
        this.locator = locator;
        this.elapsedMs = elapsedMs;
        this.attempts = attempts;
    }

    private static String describe(Locator locator, long elapsedMs, int attempts, Throwable cause) {
        String summary = String.format("%s (%d attempt(s) in %d ms)", locator.describe(), attempts, elapsedMs);
        if (cause == null || cause instanceof NoSuchElementException) {
            return "Element not found: " + summary;
        }
        return "Element not usable: " + summary + ", last failure " + cause.getClass().getSimpleName();
    }

    public Locator getLocator()  { return locator; }
    public long    getElapsedMs() { return elapsedMs; }
    public int     getAttempts()  { return attempts; }
}
