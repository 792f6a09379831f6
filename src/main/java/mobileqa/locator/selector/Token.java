package mobileqa.locator.selector;

/**
 * One lexical unit of a selector string.
 *
 * @param type   lexical category
 * @param text   decoded text (string literals are unescaped, {@code null} for EOF)
 * @param offset zero-based position of the first character in the source
 */
public record Token(TokenType type, String text, int offset) {

    @Override
    public String toString() {
        return type + (text != null ? "('" + text + "')" : "") + "@" + offset;
    }
}
