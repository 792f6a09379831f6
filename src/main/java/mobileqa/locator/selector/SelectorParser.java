package mobileqa.locator.selector;

import mobileqa.locator.EmptyLocatorException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the selector grammar:
 *
 * <pre>
 * selector := "new" "UiSelector" "(" ")" call+ [ ";" ] EOF
 *           | [ "." ] invoke call* [ ";" ] EOF
 * call     := "." invoke
 * invoke   := IDENT "(" [ arg { "," arg } ] ")"
 * arg      := STRING | NUMBER | "true" | "false" | nested
 * nested   := "new" "UiSelector" "(" ")" call+
 * </pre>
 *
 * <p>Method names are checked against {@link UiMethod}; arity and argument
 * types are checked against the method's {@link ArgumentType}. Arguments are
 * kept in source order. One parser instance parses one string.
 */
public final class SelectorParser {

    private final List<Token> tokens;
    private int pos;

    private SelectorParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a selector string into its AST.
     *
     * @throws SelectorLexException   if the string cannot be tokenized
     * @throws SelectorParseException if the tokens do not form a selector
     * @throws EmptyLocatorException  if the string contains no method call
     */
    public static Selector parse(String text) {
        String source = text == null ? "" : text.strip();
        if (source.length() >= 2 && source.startsWith("'") && source.endsWith("'")) {
            source = source.substring(1, source.length() - 1);
        }
        if (source.isBlank()) {
            throw new EmptyLocatorException("Selector string is empty");
        }
        return new SelectorParser(SelectorLexer.tokenize(source)).parseRoot();
    }

    // ── Grammar rules ─────────────────────────────────────────────────────

    private Selector parseRoot() {
        List<SelectorNode> calls = new ArrayList<>();
        if (peek().type() == TokenType.NEW) {
            parseConstructor();
        } else if (peek().type() == TokenType.IDENT) {
            // bare chain such as text("OK").clickable(true)
            calls.add(parseInvocation());
        }
        while (peek().type() == TokenType.DOT) {
            calls.add(parseCall());
        }
        if (calls.isEmpty() && isEnd(peek())) {
            throw new EmptyLocatorException("Selector has no method calls");
        }
        if (peek().type() == TokenType.SEMI) {
            advance();
        }
        Token trailing = peek();
        if (trailing.type() == TokenType.RPAREN) {
            throw new SelectorParseException("Unbalanced parentheses: unexpected ')'", trailing.offset());
        }
        if (trailing.type() != TokenType.EOF) {
            throw new SelectorParseException("Unexpected trailing token " + trailing.type(), trailing.offset());
        }
        return new Selector(calls);
    }

    private void parseConstructor() {
        expect(TokenType.NEW);
        expect(TokenType.UISELECTOR);
        expect(TokenType.LPAREN);
        expect(TokenType.RPAREN);
    }

    private SelectorNode parseCall() {
        expect(TokenType.DOT);
        return parseInvocation();
    }

    private SelectorNode parseInvocation() {
        Token name = expect(TokenType.IDENT);
        UiMethod method = UiMethod.fromMethodName(name.text())
                .orElseThrow(() -> new SelectorParseException(
                        "Unknown selector method '" + name.text() + "'", name.offset()));
        expect(TokenType.LPAREN);

        List<Object> args = new ArrayList<>();
        List<Token> argTokens = new ArrayList<>();
        if (peek().type() != TokenType.RPAREN) {
            argTokens.add(peek());
            args.add(parseArgument());
            while (peek().type() == TokenType.COMMA) {
                advance();
                argTokens.add(peek());
                args.add(parseArgument());
            }
        }
        expect(TokenType.RPAREN);

        if (args.size() != 1) {
            throw new SelectorParseException(method.getMethodName() + " expects 1 argument but got "
                    + args.size(), name.offset());
        }
        Object arg = args.get(0);
        if (!method.getArgumentType().accepts(arg)) {
            throw new SelectorParseException(method.getMethodName() + " expects "
                    + method.getArgumentType() + " argument", argTokens.get(0).offset());
        }
        return new SelectorNode(method, args);
    }

    private Object parseArgument() {
        Token tok = peek();
        switch (tok.type()) {
            case STRING:
                advance();
                return tok.text();
            case NUMBER:
                advance();
                try {
                    return Integer.valueOf(tok.text());
                } catch (NumberFormatException e) {
                    throw new SelectorParseException("Integer literal out of range: " + tok.text(), tok.offset());
                }
            case TRUE:
                advance();
                return Boolean.TRUE;
            case FALSE:
                advance();
                return Boolean.FALSE;
            case NEW:
                return parseNested();
            default:
                throw new SelectorParseException("Unexpected token " + tok.type() + " in argument", tok.offset());
        }
    }

    private Selector parseNested() {
        Token start = peek();
        parseConstructor();
        List<SelectorNode> calls = new ArrayList<>();
        while (peek().type() == TokenType.DOT) {
            calls.add(parseCall());
        }
        if (calls.isEmpty()) {
            throw new SelectorParseException("Nested selector has no method calls", start.offset());
        }
        return new Selector(calls);
    }

    // ── Token helpers ─────────────────────────────────────────────────────

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token tok = tokens.get(pos);
        if (tok.type() != TokenType.EOF) pos++;
        return tok;
    }

    private Token expect(TokenType type) {
        Token tok = peek();
        if (tok.type() != type) {
            if (type == TokenType.RPAREN && tok.type() == TokenType.EOF) {
                throw new SelectorParseException("Unbalanced parentheses: missing ')'", tok.offset());
            }
            throw new SelectorParseException("Expected " + type + " but got " + tok.type(), tok.offset());
        }
        return advance();
    }

    private static boolean isEnd(Token tok) {
        return tok.type() == TokenType.EOF || tok.type() == TokenType.SEMI;
    }
}
