package mobileqa.element;

import mobileqa.locator.InvalidLocatorException;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link XPathComposer}.
 */
public class XPathComposerTest {

    private static final String BASE = "//*[@text=\"Wi-Fi\"]";

    @Test(description = "Each relation folds onto the base as documented")
    public void testRelations() {
        assertThat(XPathComposer.compose(BASE, Relation.PARENT, "", 0))
                .isEqualTo(BASE + "/..");
        assertThat(XPathComposer.compose(BASE, Relation.NTH_CHILD, "", 2))
                .isEqualTo(BASE + "/*[3]");
        assertThat(XPathComposer.compose(BASE, Relation.CHILD, "//*[@text=\"a\"]", 0))
                .isEqualTo(BASE + "//*[@text=\"a\"]");
        assertThat(XPathComposer.compose(BASE, Relation.SIBLING, "//*[@text=\"a\"]", 0))
                .isEqualTo(BASE + "/following-sibling::*[@text=\"a\"]");
        assertThat(XPathComposer.compose(BASE, Relation.COUSIN, "//*[@text=\"a\"]", 2))
                .isEqualTo(BASE + "/../..//*[@text=\"a\"]");
        assertThat(XPathComposer.compose(BASE, Relation.ANCESTOR, "", 0))
                .isEqualTo(BASE + "/ancestor::*");
    }

    @Test(description = "A grouped relative query keeps its position inside the base")
    public void testGroupedRelative() {
        assertThat(XPathComposer.compose(BASE, Relation.CHILD, "(//*[@text=\"(a)\"])[2]", 0))
                .isEqualTo("(" + BASE + "//*[@text=\"(a)\"])[2]");
    }

    @Test(description = "A child:: prefix on the relative step is dropped")
    public void testChildAxisPrefix() {
        assertThat(XPathComposer.compose(".", Relation.SIBLING, "//child::android.widget.Switch", 0))
                .isEqualTo("./following-sibling::android.widget.Switch");
    }

    @Test(description = "Relative queries must start with //")
    public void testBadRelative() {
        assertThatThrownBy(() -> XPathComposer.compose(BASE, Relation.CHILD, "/hierarchy", 0))
                .isInstanceOf(InvalidLocatorException.class);
        assertThatThrownBy(() -> XPathComposer.compose(BASE, Relation.CHILD, "(//*[@text=\"a\"]", 0))
                .isInstanceOf(InvalidLocatorException.class)
                .hasMessageContaining("Unbalanced");
    }
}
