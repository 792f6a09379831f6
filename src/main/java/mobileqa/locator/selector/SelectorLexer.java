package mobileqa.locator.selector;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a selector string into {@link Token}s, left to right.
 *
 * <p>String literals are double-quoted and understand the escapes
 * {@code \"}, {@code \\}, {@code \n} and {@code \t}; any other escaped
 * character is kept together with its backslash so regex arguments such as
 * {@code "\d+"} survive unchanged. Numbers are unsigned decimal integers.
 *
 * <p>Stateless between calls and safe to share across threads.
 */
public final class SelectorLexer {

    private SelectorLexer() {}

    /**
     * @return tokens terminated by a single {@link TokenType#EOF}
     * @throws SelectorLexException on an unknown character or an unterminated string
     */
    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int n = text.length();
        int i = 0;
        while (i < n) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            switch (ch) {
                case '.' -> { tokens.add(new Token(TokenType.DOT, ".", i)); i++; continue; }
                case '(' -> { tokens.add(new Token(TokenType.LPAREN, "(", i)); i++; continue; }
                case ')' -> { tokens.add(new Token(TokenType.RPAREN, ")", i)); i++; continue; }
                case ',' -> { tokens.add(new Token(TokenType.COMMA, ",", i)); i++; continue; }
                case ';' -> { tokens.add(new Token(TokenType.SEMI, ";", i)); i++; continue; }
                default -> { }
            }

            if (ch == '"') {
                i = readString(text, i, tokens);
            } else if (isDigit(ch)) {
                int start = i;
                while (i < n && isDigit(text.charAt(i))) i++;
                tokens.add(new Token(TokenType.NUMBER, text.substring(start, i), start));
            } else if (Character.isLetter(ch) || ch == '_') {
                int start = i;
                while (i < n && isIdentPart(text.charAt(i))) i++;
                tokens.add(keywordOrIdent(text.substring(start, i), start));
            } else {
                throw new SelectorLexException("Unexpected character '" + ch + "'", i, classify(ch));
            }
        }
        tokens.add(new Token(TokenType.EOF, null, n));
        return tokens;
    }

    /** Reads a string literal starting at the opening quote; returns the index after the closing quote. */
    private static int readString(String text, int start, List<Token> tokens) {
        int n = text.length();
        int i = start + 1;
        StringBuilder buf = new StringBuilder();
        while (true) {
            if (i >= n) {
                throw new SelectorLexException("Unterminated string literal", start, "quote");
            }
            char c = text.charAt(i++);
            if (c == '\\') {
                if (i >= n) {
                    throw new SelectorLexException("Unterminated string literal", start, "quote");
                }
                char next = text.charAt(i++);
                switch (next) {
                    case '"', '\\' -> buf.append(next);
                    case 'n' -> buf.append('\n');
                    case 't' -> buf.append('\t');
                    default -> buf.append('\\').append(next);
                }
                continue;
            }
            if (c == '"') {
                tokens.add(new Token(TokenType.STRING, buf.toString(), start));
                return i;
            }
            buf.append(c);
        }
    }

    private static Token keywordOrIdent(String ident, int start) {
        if (ident.equalsIgnoreCase("new"))   return new Token(TokenType.NEW, ident, start);
        if (ident.equals("UiSelector"))      return new Token(TokenType.UISELECTOR, ident, start);
        if (ident.equalsIgnoreCase("true"))  return new Token(TokenType.TRUE, ident, start);
        if (ident.equalsIgnoreCase("false")) return new Token(TokenType.FALSE, ident, start);
        return new Token(TokenType.IDENT, ident, start);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static String classify(char c) {
        if (Character.isISOControl(c)) return "control character";
        if (Character.isDigit(c))      return "non-ASCII digit '" + c + "'";
        if (c == '\'')                 return "single quote";
        return "symbol '" + c + "'";
    }
}
