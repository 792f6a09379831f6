package mobileqa.locator.selector;

import mobileqa.locator.LocatorException;

/**
 * Raised by {@link SelectorLexer} for characters outside the grammar and for
 * string literals left open at end of input.
 */
public class SelectorLexException extends LocatorException {

    private final int offset;
    private final String characterClass;

    public SelectorLexException(String msg, int offset, String characterClass) {
        super(msg + " at offset " + offset + " (" + characterClass + ")");
        this.offset = offset;
        this.characterClass = characterClass;
    }

    public int getOffset() { return offset; }

    /** Coarse description of the offending input, e.g. {@code "symbol '#'"}. */
    public String getCharacterClass() { return characterClass; }
}
