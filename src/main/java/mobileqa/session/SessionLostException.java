package mobileqa.session;

import mobileqa.MobileQAException;

/**
 * Thrown when the driver session is gone and could not be brought back:
 * reconnecting failed, or the session was lost a second time within one
 * operation. Never retried.
 */
public class SessionLostException extends MobileQAException {

    public SessionLostException(String msg) {
        super(msg);
    }

    public SessionLostException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
