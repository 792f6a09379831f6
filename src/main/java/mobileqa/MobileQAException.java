package mobileqa;

/**
 * Root of every unchecked failure raised by MobileQA.
 */
public class MobileQAException extends RuntimeException {

    public MobileQAException(String msg) {
        super(msg);
    }

    public MobileQAException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
