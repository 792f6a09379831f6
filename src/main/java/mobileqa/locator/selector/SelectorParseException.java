package mobileqa.locator.selector;

import mobileqa.locator.LocatorException;

/**
 * Raised by {@link SelectorParser} when a well-lexed token stream does not
 * form a valid selector: unknown method, wrong arity or argument type,
 * unbalanced parentheses or trailing tokens.
 */
public class SelectorParseException extends LocatorException {

    private final int offset;

    public SelectorParseException(String msg, int offset) {
        super(msg + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() { return offset; }
}
