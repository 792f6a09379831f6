package mobileqa.element;

import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.remote.UnreachableBrowserException;

import java.util.List;
import java.util.Locale;

/**
 * What the retry loop should do about a failed remote call.
 */
public enum FailureKind {

    /** The element is not there yet, or its handle went stale: wait and try again. */
    TRANSIENT,

    /** The driver session is gone: reconnect once, then repeat the operation. */
    SESSION_LOST,

    /** Anything else: propagate immediately. */
    FATAL;

    /** Server messages that mean the session died even though the exception type does not say so. */
    private static final List<String> SESSION_LOST_MARKERS = List.of(
            "instrumentation process is not running",
            "session is either terminated or not started",
            "invalid session id");

    public static FailureKind classify(Throwable error) {
        // InvalidSelectorException extends NoSuchElementException and must not be retried
        if (error instanceof InvalidSelectorException) {
            return FATAL;
        }
        if (error instanceof NoSuchSessionException || error instanceof UnreachableBrowserException) {
            return SESSION_LOST;
        }
        if (error instanceof NoSuchElementException
                || error instanceof StaleElementReferenceException
                || error instanceof ElementNotInteractableException) {
            return TRANSIENT;
        }
        if (error instanceof WebDriverException && error.getMessage() != null) {
            String msg = error.getMessage().toLowerCase(Locale.ROOT);
            for (String marker : SESSION_LOST_MARKERS) {
                if (msg.contains(marker)) return SESSION_LOST;
            }
        }
        return FATAL;
    }
}
