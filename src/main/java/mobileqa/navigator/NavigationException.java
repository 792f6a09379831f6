package mobileqa.navigator;

import mobileqa.MobileQAException;

/** Base class for page-graph failures. Navigation errors are never recovered silently. */
public class NavigationException extends MobileQAException {

    public NavigationException(String msg) {
        super(msg);
    }

    public NavigationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
