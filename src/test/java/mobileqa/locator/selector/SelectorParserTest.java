package mobileqa.locator.selector;

import mobileqa.locator.EmptyLocatorException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SelectorParser} and the canonical form written by
 * {@link SelectorWriter}.
 */
public class SelectorParserTest {

    // ── Happy path ────────────────────────────────────────────────────────

    @Test(description = "A chain of calls parses into nodes in source order")
    public void testChainOrder() {
        Selector s = SelectorParser.parse(
                "new UiSelector().text(\"Wi-Fi\").className(\"android.widget.TextView\").index(0);");

        assertThat(s.size()).isEqualTo(3);
        assertThat(s.nodes()).extracting(SelectorNode::method)
                .containsExactly(UiMethod.TEXT, UiMethod.CLASS_NAME, UiMethod.INDEX);
        assertThat(s.nodes().get(0).argument()).isEqualTo("Wi-Fi");
        assertThat(s.nodes().get(2).argument()).isEqualTo(0);
    }

    @Test(description = "A bare chain may start without a leading dot")
    public void testBareLeadingCall() {
        Selector s = SelectorParser.parse("text(\"Wi-Fi\").className(\"android.widget.TextView\")");

        assertThat(s.nodes()).extracting(SelectorNode::method)
                .containsExactly(UiMethod.TEXT, UiMethod.CLASS_NAME);
        assertThat(s.nodes()).extracting(SelectorNode::argument)
                .containsExactly("Wi-Fi", "android.widget.TextView");
        assertThat(s).isEqualTo(SelectorParser.parse(
                "new UiSelector().text(\"Wi-Fi\").className(\"android.widget.TextView\");"));
    }

    @Test(description = "A bare leading call still has its method name checked")
    public void testBareLeadingUnknownMethod() {
        assertThatThrownBy(() -> SelectorParser.parse("colour(\"red\").text(\"a\")"))
                .isInstanceOf(SelectorParseException.class)
                .hasMessageContaining("Unknown selector method 'colour'")
                .satisfies(e -> assertThat(((SelectorParseException) e).getOffset()).isZero());
    }

    @Test(description = "Constructor prefix and trailing semicolon are both optional")
    public void testOptionalPrefixAndSemicolon() {
        Selector full = SelectorParser.parse("new UiSelector().text(\"OK\");");
        assertThat(SelectorParser.parse(".text(\"OK\")")).isEqualTo(full);
        assertThat(SelectorParser.parse("new UiSelector().text(\"OK\")")).isEqualTo(full);
    }

    @Test(description = "A selector wrapped in single quotes is unwrapped before parsing")
    public void testSingleQuotedWrapper() {
        assertThat(SelectorParser.parse("'new UiSelector().text(\"OK\");'"))
                .isEqualTo(Selector.of(SelectorNode.of(UiMethod.TEXT, "OK")));
    }

    @Test(description = "Boolean and integer arguments are typed")
    public void testTypedArguments() {
        Selector s = SelectorParser.parse(".checked(false).instance(3)");
        assertThat(s.nodes().get(0).argument()).isEqualTo(Boolean.FALSE);
        assertThat(s.nodes().get(1).argument()).isEqualTo(3);
    }

    @Test(description = "childSelector takes a nested selector")
    public void testNestedSelector() {
        Selector s = SelectorParser.parse(
                "new UiSelector().resourceId(\"list\").childSelector(new UiSelector().text(\"Row\").clickable(true))");

        SelectorNode child = s.nodes().get(1);
        assertThat(child.method()).isEqualTo(UiMethod.CHILD_SELECTOR);
        assertThat(child.nested().nodes()).extracting(SelectorNode::method)
                .containsExactly(UiMethod.TEXT, UiMethod.CLICKABLE);
    }

    @Test(description = "The same method may appear more than once")
    public void testRepeatedMethod() {
        Selector s = SelectorParser.parse(".textContains(\"a\").textContains(\"b\")");
        assertThat(s.size()).isEqualTo(2);
    }

    // ── Errors ────────────────────────────────────────────────────────────

    @Test(description = "Blank or call-less input is an empty locator")
    public void testEmpty() {
        assertThatThrownBy(() -> SelectorParser.parse("   ")).isInstanceOf(EmptyLocatorException.class);
        assertThatThrownBy(() -> SelectorParser.parse(null)).isInstanceOf(EmptyLocatorException.class);
        assertThatThrownBy(() -> SelectorParser.parse("new UiSelector();")).isInstanceOf(EmptyLocatorException.class);
    }

    @Test(description = "An unknown method name is rejected with its offset")
    public void testUnknownMethod() {
        assertThatThrownBy(() -> SelectorParser.parse("new UiSelector().colour(\"red\")"))
                .isInstanceOf(SelectorParseException.class)
                .hasMessageContaining("Unknown selector method 'colour'")
                .satisfies(e -> assertThat(((SelectorParseException) e).getOffset()).isEqualTo(17));
    }

    @DataProvider
    public Object[][] malformed() {
        return new Object[][] {
                {".text(1)",                     "expects STRING"},
                {".index(\"1\")",                "expects INTEGER"},
                {".checked(\"true\")",           "expects BOOLEAN"},
                {".text(\"a\", \"b\")",          "expects 1 argument but got 2"},
                {".text()",                      "expects 1 argument but got 0"},
                {".text(\"a\"",                  "missing ')'"},
                {".text(\"a\"))",                "unexpected ')'"},
                {".text(\"a\") .",               "Expected IDENT"},
                {".text(\"a\") text",            "trailing token IDENT"},
                {".index(99999999999)",          "out of range"},
                {".childSelector(new UiSelector())", "Nested selector has no method calls"},
        };
    }

    @Test(dataProvider = "malformed", description = "Malformed selectors raise SelectorParseException")
    public void testMalformed(String text, String message) {
        assertThatThrownBy(() -> SelectorParser.parse(text))
                .isInstanceOf(SelectorParseException.class)
                .hasMessageContaining(message);
    }

    @Test(description = "Lexical errors propagate as SelectorLexException")
    public void testLexErrorPropagates() {
        assertThatThrownBy(() -> SelectorParser.parse(".text(@)"))
                .isInstanceOf(SelectorLexException.class);
    }

    // ── Canonical form ────────────────────────────────────────────────────

    @Test(description = "The writer emits the canonical prefix, call chain and semicolon")
    public void testCanonicalForm() {
        Selector s = SelectorParser.parse(".text(\"Wi-Fi\") . className( \"android.widget.TextView\" )");
        assertThat(SelectorWriter.write(s))
                .isEqualTo("new UiSelector().text(\"Wi-Fi\").className(\"android.widget.TextView\");");
        assertThat(s.toString()).isEqualTo(SelectorWriter.write(s));
    }

    @Test(description = "Nested selectors are written without their own semicolon")
    public void testNestedCanonicalForm() {
        Selector s = Selector.of(
                SelectorNode.of(UiMethod.SCROLLABLE, true),
                SelectorNode.of(UiMethod.CHILD_SELECTOR, Selector.of(SelectorNode.of(UiMethod.INDEX, 1))));
        assertThat(s.toString()).isEqualTo(
                "new UiSelector().scrollable(true).childSelector(new UiSelector().index(1));");
    }

    @DataProvider
    public Object[][] roundTrip() {
        return new Object[][] {
                {"new UiSelector().text(\"Network & internet\");"},
                {"new UiSelector().description(\"say \\\"hi\\\"\").textMatches(\"\\\\d+ items\");"},
                {"new UiSelector().resourceId(\"android:id/title\").instance(1);"},
                {"new UiSelector().text(\"Wi-Fi\").fromParent(new UiSelector().resourceId(\"android:id/summary\"));"},
                {"new UiSelector().className(\"a\").childSelector(new UiSelector().index(0).childSelector(new UiSelector().checked(true)));"},
        };
    }

    @Test(dataProvider = "roundTrip", description = "Canonical text re-parses to an equal tree and is a fixed point")
    public void testRoundTrip(String canonical) {
        Selector parsed = SelectorParser.parse(canonical);
        assertThat(parsed.toString()).isEqualTo(canonical);
        assertThat(SelectorParser.parse(parsed.toString())).isEqualTo(parsed);
    }

    @Test(description = "Control characters and backslashes survive writing and re-parsing")
    public void testEscapeRoundTrip() {
        Selector s = Selector.of(SelectorNode.of(UiMethod.TEXT, "a\\b\n\"c\"\t"));
        assertThat(SelectorParser.parse(s.toString())).isEqualTo(s);
        assertThat(SelectorWriter.escape("a\"b")).isEqualTo("a\\\"b");
    }

    // ── AST helpers ───────────────────────────────────────────────────────

    @Test(description = "append returns a new selector and leaves the original untouched")
    public void testAppendIsImmutable() {
        Selector one = Selector.of(SelectorNode.of(UiMethod.TEXT, "a"));
        Selector two = one.append(SelectorNode.of(UiMethod.INDEX, 0));
        assertThat(one.size()).isEqualTo(1);
        assertThat(two.size()).isEqualTo(2);
    }

    @Test(description = "SelectorNode.of rejects an argument of the wrong type")
    public void testNodeTypeCheck() {
        assertThatThrownBy(() -> SelectorNode.of(UiMethod.CHECKED, "yes"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("checked expects BOOLEAN");
        assertThatThrownBy(() -> new SelectorNode(UiMethod.TEXT, List.of("a", "b")).argument())
                .isInstanceOf(IllegalStateException.class);
    }
}
