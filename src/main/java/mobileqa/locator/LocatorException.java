package mobileqa.locator;

import mobileqa.MobileQAException;

/**
 * Base class for locator problems detected before any remote call is made.
 * These are caller bugs and are never retried.
 */
public class LocatorException extends MobileQAException {

    public LocatorException(String msg) {
        super(msg);
    }

    public LocatorException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
