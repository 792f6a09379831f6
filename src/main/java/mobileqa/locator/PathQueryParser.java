package mobileqa.locator;

import mobileqa.locator.selector.Selector;
import mobileqa.locator.selector.SelectorNode;
import mobileqa.locator.selector.UiMethod;
import mobileqa.locator.selector.UiMethod.MatchKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the XPath subset that has a one-to-one selector equivalent and turns
 * it into a selector AST. This is the inverse of {@link PathQueryWriter}; it
 * additionally accepts name tests ({@code //android.widget.Button} means
 * {@code className}), single-quoted literals, {@code child::}, bare
 * {@code [N]} positions and {@code and}-joined predicates.
 *
 * <p>Anything else is rejected rather than approximated:
 * <ul>
 *   <li>axes other than child and the leading {@code //} →
 *       {@link UnsupportedAxisException}</li>
 *   <li>unknown attributes, functions and operators →
 *       {@link UnsupportedAttributeException}</li>
 *   <li>syntax errors → {@link InvalidLocatorException}</li>
 * </ul>
 */
final class PathQueryParser {

    private final String src;
    private int i;

    private PathQueryParser(String src) {
        this.src = src;
    }

    static Selector parse(String xpath) {
        if (xpath == null || xpath.isBlank()) {
            throw new EmptyLocatorException("Path query is blank");
        }
        return new PathQueryParser(xpath.strip()).parseRoot();
    }

    // ── Paths ─────────────────────────────────────────────────────────────

    private Selector parseRoot() {
        List<SelectorNode> chain = parseExpr();
        skipWs();
        if (i < src.length()) {
            throw invalid("Unexpected '" + src.charAt(i) + "'");
        }
        if (chain.isEmpty()) {
            throw new EmptyLocatorException("Path query '" + src + "' has no constraints");
        }
        return new Selector(chain);
    }

    private List<SelectorNode> parseExpr() {
        List<SelectorNode> chain = parsePrimary();
        parseTail(chain);
        return chain;
    }

    private List<SelectorNode> parsePrimary() {
        skipWs();
        if (peek('(')) {
            i++;
            List<SelectorNode> chain = parseExpr();
            skipWs();
            expect(')');
            skipWs();
            int n = parseGroupPosition();
            chain.add(SelectorNode.of(UiMethod.INSTANCE, n - 1));
            skipWs();
            while (peek('[')) {
                chain.addAll(parsePredicate());
                skipWs();
            }
            return chain;
        }
        if (startsWith("//")) {
            i += 2;
            return parseStep();
        }
        if (peek('/')) {
            throw new UnsupportedAxisException("root");
        }
        if (peek('.')) {
            throw new UnsupportedAxisException("self");
        }
        throw invalid("Path query must start with '//'");
    }

    /** Consumes {@code /step} or {@code /../step}; the rest of the path nests inside the new call. */
    private void parseTail(List<SelectorNode> chain) {
        skipWs();
        if (startsWith("//")) {
            throw new UnsupportedAxisException("descendant");
        }
        if (!peek('/')) {
            return;
        }
        i++;
        skipWs();
        UiMethod relation = UiMethod.CHILD_SELECTOR;
        if (startsWith("..")) {
            i += 2;
            skipWs();
            if (!peek('/') || startsWith("//")) {
                throw new UnsupportedAxisException("parent");
            }
            i++;
            relation = UiMethod.FROM_PARENT;
        }
        List<SelectorNode> nested = parseStep();
        parseTail(nested);
        if (nested.isEmpty()) {
            throw invalid("Step '*' without predicates has no selector equivalent");
        }
        chain.add(SelectorNode.of(relation, new Selector(nested)));
    }

    private List<SelectorNode> parseStep() {
        List<SelectorNode> chain = new ArrayList<>();
        skipWs();
        String nodeTest = readNodeTest();
        if (startsWith("::")) {
            i += 2;
            if (!nodeTest.equals("child")) {
                throw new UnsupportedAxisException(nodeTest);
            }
            nodeTest = readNodeTest();
        }
        if (!nodeTest.equals("*")) {
            if (peek('(')) {
                throw new UnsupportedAttributeException(nodeTest + "()");
            }
            chain.add(SelectorNode.of(UiMethod.CLASS_NAME, nodeTest));
        }
        skipWs();
        while (peek('[')) {
            chain.addAll(parsePredicate());
            skipWs();
        }
        return chain;
    }

    private String readNodeTest() {
        skipWs();
        if (peek('*')) {
            i++;
            return "*";
        }
        String name = readName();
        if (name.isEmpty()) {
            throw invalid("Expected a node test");
        }
        return name;
    }

    // ── Predicates ────────────────────────────────────────────────────────

    private List<SelectorNode> parsePredicate() {
        expect('[');
        List<SelectorNode> out = parseAnd();
        skipWs();
        expect(']');
        return out;
    }

    private List<SelectorNode> parseAnd() {
        List<SelectorNode> out = new ArrayList<>(parseAtom());
        while (true) {
            skipWs();
            if (startsWithWord("and")) {
                i += 3;
                out.addAll(parseAtom());
            } else if (startsWithWord("or")) {
                throw new UnsupportedAttributeException("or");
            } else {
                return out;
            }
        }
    }

    private List<SelectorNode> parseAtom() {
        skipWs();
        if (peek('(')) {
            i++;
            List<SelectorNode> inner = parseAnd();
            skipWs();
            expect(')');
            return inner;
        }
        if (peek('@')) {
            i++;
            String attr = readName();
            skipWs();
            if (startsWith("!=")) {
                throw new UnsupportedAttributeException("@" + attr + " !=");
            }
            if (!peek('=')) {
                throw new UnsupportedAttributeException("@" + attr + " presence test");
            }
            i++;
            String value = readLiteral();
            UiMethod method = UiMethod.forPredicate(attr, MatchKind.EQUALS)
                    .orElseThrow(() -> new UnsupportedAttributeException("@" + attr));
            return List.of(SelectorNode.of(method, typed(method, value)));
        }
        if (peekDigit()) {
            return List.of(SelectorNode.of(UiMethod.INDEX, readPosition() - 1));
        }

        String fn = readName();
        if (fn.isEmpty()) {
            throw invalid("Expected a predicate");
        }
        skipWs();
        if (!peek('(')) {
            throw new UnsupportedAttributeException(fn);
        }
        i++;
        skipWs();
        switch (fn) {
            case "position": {
                expect(')');
                skipWs();
                expect('=');
                return List.of(SelectorNode.of(UiMethod.INDEX, readPosition() - 1));
            }
            case "contains":
                return List.of(functionPredicate(fn, MatchKind.CONTAINS));
            case "starts-with":
                return List.of(functionPredicate(fn, MatchKind.STARTS_WITH));
            case "matches":
                return List.of(functionPredicate(fn, MatchKind.MATCHES));
            default:
                throw new UnsupportedAttributeException(fn + "()");
        }
    }

    private SelectorNode functionPredicate(String fn, MatchKind kind) {
        expect('@');
        String attr = readName();
        skipWs();
        expect(',');
        String value = readLiteral();
        skipWs();
        expect(')');
        UiMethod method = UiMethod.forPredicate(attr, kind)
                .orElseThrow(() -> new UnsupportedAttributeException(fn + "(@" + attr + ")"));
        return SelectorNode.of(method, value);
    }

    /** The positional filter that must follow a parenthesised path: {@code [N]} or {@code [position()=N]}. */
    private int parseGroupPosition() {
        expect('[');
        skipWs();
        int n;
        if (peekDigit()) {
            n = readPosition();
        } else if (startsWithWord("position")) {
            i += "position".length();
            skipWs();
            expect('(');
            skipWs();
            expect(')');
            skipWs();
            expect('=');
            n = readPosition();
        } else {
            throw invalid("A parenthesised path must be followed by a position");
        }
        skipWs();
        expect(']');
        return n;
    }

    private Object typed(UiMethod method, String value) {
        switch (method.getArgumentType()) {
            case BOOLEAN:
                if (value.equals("true"))  return Boolean.TRUE;
                if (value.equals("false")) return Boolean.FALSE;
                throw invalid("@" + method.getNodeAttribute() + " expects \"true\" or \"false\"");
            case STRING:
                return value;
            default:
                throw new UnsupportedAttributeException("@" + method.getNodeAttribute());
        }
    }

    // ── Lexical helpers ───────────────────────────────────────────────────

    private String readLiteral() {
        skipWs();
        if (startsWith("concat(")) {
            i += "concat(".length();
            StringBuilder sb = new StringBuilder();
            sb.append(readLiteral());
            skipWs();
            while (peek(',')) {
                i++;
                sb.append(readLiteral());
                skipWs();
            }
            expect(')');
            return sb.toString();
        }
        if (!peek('"') && !peek('\'')) {
            throw invalid("Expected a string literal");
        }
        char quote = src.charAt(i);
        int end = src.indexOf(quote, i + 1);
        if (end < 0) {
            throw invalid("Unterminated string literal");
        }
        String value = src.substring(i + 1, end);
        i = end + 1;
        return value;
    }

    private int readPosition() {
        skipWs();
        int start = i;
        while (peekDigit()) i++;
        if (start == i) {
            throw invalid("Expected a number");
        }
        int n;
        try {
            n = Integer.parseInt(src.substring(start, i));
        } catch (NumberFormatException e) {
            throw invalid("Position out of range");
        }
        if (n < 1) {
            throw invalid("XPath positions start at 1");
        }
        return n;
    }

    private String readName() {
        int start = i;
        if (i < src.length() && (Character.isLetter(src.charAt(i)) || src.charAt(i) == '_')) {
            i++;
            while (i < src.length()) {
                char c = src.charAt(i);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '$') {
                    i++;
                } else {
                    break;
                }
            }
        }
        return src.substring(start, i);
    }

    private void skipWs() {
        while (i < src.length() && Character.isWhitespace(src.charAt(i))) i++;
    }

    private boolean peek(char c) {
        return i < src.length() && src.charAt(i) == c;
    }

    private boolean peekDigit() {
        return i < src.length() && src.charAt(i) >= '0' && src.charAt(i) <= '9';
    }

    private boolean startsWith(String s) {
        return src.startsWith(s, i);
    }

    private boolean startsWithWord(String word) {
        if (!src.startsWith(word, i)) return false;
        int end = i + word.length();
        return end >= src.length() || !(Character.isLetterOrDigit(src.charAt(end)) || src.charAt(end) == '-');
    }

    private void expect(char c) {
        skipWs();
        if (!peek(c)) {
            throw invalid("Expected '" + c + "'");
        }
        i++;
    }

    private InvalidLocatorException invalid(String msg) {
        return new InvalidLocatorException(msg + " at offset " + i + " in path query: " + src);
    }
}
