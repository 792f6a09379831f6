package mobileqa.locator.selector;

/** Lexical categories of the selector grammar. */
public enum TokenType {
    IDENT,
    STRING,
    NUMBER,
    TRUE,
    FALSE,
    NEW,
    UISELECTOR,
    DOT,
    LPAREN,
    RPAREN,
    COMMA,
    SEMI,
    EOF
}
