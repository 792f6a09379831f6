package mobileqa.element;

import mobileqa.locator.Locator;
import mobileqa.session.DriverFactory;
import mobileqa.session.DriverSession;
import mobileqa.session.LocatorStrategy;
import mobileqa.session.ResolutionMode;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.RemoteWebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link Element}: lazy resolution, handle caching, relational
 * composition and recovery from stale handles and lost sessions.
 */
public class ElementTest {

    private static final String WIFI = "//*[@text=\"Wi-Fi\"]";
    private static final Locator SWITCH = Locator.attributes(Map.of("class", "android.widget.Switch"));

    @Mock
    private DriverFactory factory;

    @Mock(extraInterfaces = JavascriptExecutor.class)
    private WebDriver driver;

    @Mock
    private WebDriver secondDriver;

    @Mock
    private WebElement first;

    @Mock
    private WebElement second;

    @Mock
    private RemoteWebElement container;

    private AutoCloseable mocks;
    private FakeTime time;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        time = new FakeTime();
        when(factory.create()).thenReturn(driver, secondDriver);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private DriverSession session(ResolutionMode mode) {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(1), Duration.ofMillis(100), 5, 1.0,
                Duration.ofMillis(100));
        return new DriverSession(factory, LocatorStrategy.XPATH, mode, policy, time, time);
    }

    // ── Laziness and caching ──────────────────────────────────────────────

    @Test(description = "Building elements and relations makes no remote call")
    public void testLazy() {
        DriverSession s = session(ResolutionMode.COMPOSED);

        Element e = s.getElement(WIFI).getParent().getChild(2).getSibling(SWITCH).getCousin(SWITCH, 2);

        assertThat(e.getState()).isEqualTo(ElementState.UNRESOLVED);
        verifyNoInteractions(factory, driver);
    }

    @Test(description = "A resolved element is reused without another lookup")
    public void testHandleCached() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.getText()).thenReturn("Wi-Fi");
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThat(e.getText()).isEqualTo("Wi-Fi");
        assertThat(e.getText()).isEqualTo("Wi-Fi");
        e.tap();

        verify(driver, times(1)).findElement(any(By.class));
        verify(first).click();
        assertThat(e.getState()).isEqualTo(ElementState.RESOLVED);
    }

    @Test(description = "A stale handle is dropped and the element looked up again")
    public void testStaleReResolve() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first, second);
        when(first.getText()).thenThrow(new StaleElementReferenceException("stale"));
        when(second.getText()).thenReturn("Wi-Fi");
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThat(e.getText()).isEqualTo("Wi-Fi");

        verify(driver, times(2)).findElement(By.xpath(WIFI));
        assertThat(time.getSleeps()).containsExactly(Duration.ofMillis(100));
    }

    @Test(description = "An element that never appears fails with ElementNotFoundException")
    public void testNotFound() {
        when(driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("none"));
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThatThrownBy(e::getText)
                .isInstanceOf(ElementNotFoundException.class)
                .satisfies(ex -> assertThat(((ElementNotFoundException) ex).getAttempts()).isEqualTo(5));
        assertThat(e.getState()).isEqualTo(ElementState.UNRESOLVED);
    }

    @Test(description = "isPresent reports absence instead of throwing")
    public void testIsPresent() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(driver.findElement(By.xpath("//*[@text=\"Bluetooth\"]"))).thenThrow(new NoSuchElementException("none"));
        DriverSession s = session(ResolutionMode.COMPOSED);

        assertThat(s.getElement(WIFI).isPresent(Duration.ofMillis(500))).isTrue();
        assertThat(s.getElement(Map.of("text", "Bluetooth")).isPresent(Duration.ofMillis(500))).isFalse();
    }

    @Test(description = "Invalid selectors are not retried")
    public void testFatalNotRetried() {
        when(driver.findElement(any(By.class))).thenThrow(new InvalidSelectorException("bad"));
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThatThrownBy(e::tap).isInstanceOf(InvalidSelectorException.class);
        verify(driver, times(1)).findElement(any(By.class));
    }

    // ── Session changes ───────────────────────────────────────────────────

    @Test(description = "A reconnect invalidates cached handles")
    public void testGenerationInvalidates() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(secondDriver.findElement(By.xpath(WIFI))).thenReturn(second);
        when(second.getText()).thenReturn("Wi-Fi");
        DriverSession s = session(ResolutionMode.COMPOSED);
        Element e = s.getElement(WIFI);
        e.tap();

        s.reconnect();

        assertThat(e.getText()).isEqualTo("Wi-Fi");
        verify(first, never()).getText();
        verify(secondDriver).findElement(By.xpath(WIFI));
    }

    @Test(description = "A lost session is reconnected once and the operation repeated")
    public void testSessionLostMidOperation() {
        when(driver.findElement(By.xpath(WIFI))).thenThrow(new NoSuchSessionException("invalid session id"));
        when(secondDriver.findElement(By.xpath(WIFI))).thenReturn(second);
        DriverSession s = session(ResolutionMode.COMPOSED);

        s.getElement(WIFI).tap();

        verify(second).click();
        verify(driver).quit();
        assertThat(s.getGeneration()).isEqualTo(2);
    }

    // ── Relations ─────────────────────────────────────────────────────────

    @Test(description = "COMPOSED mode resolves a relation chain with one lookup")
    public void testComposedSibling() {
        String composed = WIFI + "/following-sibling::*[@class=\"android.widget.Switch\"]";
        when(driver.findElement(By.xpath(composed))).thenReturn(first);
        Element toggle = session(ResolutionMode.COMPOSED).getElement(WIFI).getSibling(SWITCH);

        assertThat(toggle.toXPath()).isEqualTo(composed);
        toggle.tap();

        verify(driver, times(1)).findElement(any(By.class));
        verify(first).click();
    }

    @Test(description = "Parent, child and cousin relations compose into one XPath")
    public void testComposedChain() {
        DriverSession s = session(ResolutionMode.COMPOSED);
        Element row = s.getElement(WIFI).getParent().getParent();

        assertThat(row.getChild(2).toXPath()).isEqualTo(WIFI + "/../../*[3]");
        assertThat(row.getElement(SWITCH).toXPath())
                .isEqualTo(WIFI + "/../..//*[@class=\"android.widget.Switch\"]");
        assertThat(s.getElement(WIFI).getCousin(SWITCH).toXPath())
                .isEqualTo(WIFI + "/..//*[@class=\"android.widget.Switch\"]");
        assertThat(row.getRelation()).isEqualTo(Relation.PARENT);
        assertThat(row.getLocator()).isNull();
    }

    @Test(description = "SCOPED mode resolves the base once and searches inside it")
    public void testScopedSibling() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.findElement(By.xpath("./following-sibling::*[@class=\"android.widget.Switch\"]"))).thenReturn(second);
        Element base = session(ResolutionMode.SCOPED).getElement(WIFI);
        Element toggle = base.getSibling(SWITCH);

        toggle.tap();
        toggle.tap();

        verify(driver, times(1)).findElement(any(By.class));
        verify(first, times(1)).findElement(any(By.class));
        verify(second, times(2)).click();
        assertThat(base.getState()).isEqualTo(ElementState.RESOLVED);
    }

    @Test(description = "Relation arguments are validated eagerly")
    public void testRelationArguments() {
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThatThrownBy(() -> e.getChild(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> e.getCousin(SWITCH, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    // ── Lists ─────────────────────────────────────────────────────────────

    @Test(description = "getElements binds each match to its position and pre-resolves it")
    public void testGetElements() {
        String titles = "//*[@resource-id=\"android:id/title\"]";
        when(driver.findElements(By.xpath(titles))).thenReturn(List.of(first, second));
        when(second.getText()).thenReturn("Wi-Fi");
        DriverSession s = session(ResolutionMode.COMPOSED);

        List<Element> found = s.getElements(Locator.attributes(Map.of("resource-id", "android:id/title")));

        assertThat(found).hasSize(2);
        assertThat(found).allSatisfy(e -> assertThat(e.getState()).isEqualTo(ElementState.RESOLVED));
        assertThat(found.get(1).getLocator()).isEqualTo(Locator.xpath("(" + titles + ")[2]"));
        assertThat(found.get(1).getText()).isEqualTo("Wi-Fi");
        verify(driver, never()).findElement(any(By.class));
    }

    @Test(description = "An empty match list is not an error")
    public void testGetElementsEmpty() {
        when(driver.findElements(any(By.class))).thenReturn(List.of());

        assertThat(session(ResolutionMode.COMPOSED).getElements(Locator.xpath(WIFI))).isEmpty();
    }

    @Test(description = "getElements under an element searches its composed XPath")
    public void testNestedGetElements() {
        when(driver.findElements(By.xpath(WIFI + "/..//*[@class=\"android.widget.Switch\"]")))
                .thenReturn(List.of(first));
        Element parent = session(ResolutionMode.COMPOSED).getElement(WIFI).getParent();

        assertThat(parent.getElements(SWITCH)).hasSize(1);
    }

    @Test(description = "getParents lists every ancestor through one ancestor-axis query")
    public void testGetParents() {
        when(driver.findElements(By.xpath(WIFI + "/ancestor::*"))).thenReturn(List.of(first, second));
        Element wifi = session(ResolutionMode.COMPOSED).getElement(WIFI);

        List<Element> parents = wifi.getParents();

        assertThat(parents).hasSize(2);
        assertThat(parents.get(0).getLocator()).isEqualTo(Locator.xpath("(" + WIFI + "/ancestor::*)[1]"));
        assertThat(parents).allSatisfy(e -> assertThat(e.getState()).isEqualTo(ElementState.RESOLVED));
    }

    @Test(description = "getSiblings and getCousins bind every match of the composed query")
    public void testPluralSiblingsAndCousins() {
        String siblings = WIFI + "/following-sibling::*[@class=\"android.widget.Switch\"]";
        String cousins = WIFI + "/../..//*[@class=\"android.widget.Switch\"]";
        when(driver.findElements(By.xpath(siblings))).thenReturn(List.of(first));
        when(driver.findElements(By.xpath(cousins))).thenReturn(List.of(first, second));
        when(second.getText()).thenReturn("ON");
        Element wifi = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThat(wifi.getSiblings(SWITCH)).hasSize(1);
        List<Element> found = wifi.getCousins(SWITCH, 2);
        assertThat(found).hasSize(2);
        assertThat(found.get(1).getLocator()).isEqualTo(Locator.xpath("(" + cousins + ")[2]"));
        assertThat(found.get(1).getText()).isEqualTo("ON");
        assertThatThrownBy(() -> wifi.getCousins(SWITCH, 0)).isInstanceOf(IllegalArgumentException.class);
        verify(driver, never()).findElement(any(By.class));
    }

    // ── Gestures ──────────────────────────────────────────────────────────

    private static Map<String, Object> params(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Test(description = "Swipes, long taps and double taps run as mobile gestures on the element id")
    public void testGestures() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(container);
        when(container.getId()).thenReturn("el-7");
        JavascriptExecutor js = (JavascriptExecutor) driver;
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        e.swipe(SwipeDirection.LEFT, 0.5).tap(Duration.ofMillis(800)).doubleTap();

        verify(js).executeScript("mobile: swipeGesture",
                params("elementId", "el-7", "direction", "left", "percent", 0.5));
        verify(js).executeScript("mobile: longClickGesture", params("elementId", "el-7", "duration", 800L));
        verify(js).executeScript("mobile: doubleClickGesture", params("elementId", "el-7"));
        verify(driver, times(1)).findElement(any(By.class));
    }

    @Test(description = "scroll reports whether more content remains")
    public void testScroll() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(container);
        when(container.getId()).thenReturn("el-7");
        JavascriptExecutor js = (JavascriptExecutor) driver;
        when(js.executeScript(eq("mobile: scrollGesture"), any())).thenReturn(true, false);
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThat(e.scroll(SwipeDirection.DOWN, 0.7)).isTrue();
        assertThat(e.scroll(SwipeDirection.DOWN, 0.7)).isFalse();
        assertThatThrownBy(() -> e.swipe(SwipeDirection.UP, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test(description = "scrollToElement sends the target as a selector and returns it lazily")
    public void testScrollToElement() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(container);
        when(container.getId()).thenReturn("el-7");
        JavascriptExecutor js = (JavascriptExecutor) driver;
        Locator target = Locator.attributes(Map.of("text", "Hotspot & tethering"));
        Element scroller = session(ResolutionMode.COMPOSED).getElement(WIFI);

        Element found = scroller.scrollToElement(target, 10);

        verify(js).executeScript("mobile: scroll", params("elementId", "el-7",
                "strategy", "-android uiautomator",
                "selector", "new UiSelector().text(\"Hotspot & tethering\");",
                "maxSwipes", 10));
        assertThat(found.getLocator()).isEqualTo(target);
        assertThat(found.getState()).isEqualTo(ElementState.UNRESOLVED);
    }

    @Test(description = "A stale handle during a gesture is re-resolved and the gesture repeated")
    public void testGestureStaleRetry() {
        RemoteWebElement fresh = mock(RemoteWebElement.class);
        when(driver.findElement(By.xpath(WIFI))).thenReturn(container, fresh);
        when(container.getId()).thenReturn("old");
        when(fresh.getId()).thenReturn("new");
        JavascriptExecutor js = (JavascriptExecutor) driver;
        when(js.executeScript(eq("mobile: doubleClickGesture"), any()))
                .thenThrow(new StaleElementReferenceException("stale"))
                .thenReturn(null);

        session(ResolutionMode.COMPOSED).getElement(WIFI).doubleTap();

        verify(js).executeScript("mobile: doubleClickGesture", params("elementId", "new"));
    }

    // ── Reads and waits ───────────────────────────────────────────────────

    @Test(description = "getAttributes keeps only the attributes the driver reports")
    public void testGetAttributes() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.getAttribute("text")).thenReturn("Wi-Fi");
        when(first.getAttribute("checked")).thenReturn("true");
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThat(e.getAttributes()).containsExactly(Map.entry("text", "Wi-Fi"), Map.entry("checked", "true"));
        assertThat(e.isChecked()).isTrue();
    }

    @Test(description = "waitVisible polls until the element is displayed")
    public void testWaitVisible() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.isDisplayed()).thenReturn(false, false, true);

        session(ResolutionMode.COMPOSED).getElement(WIFI).waitVisible(Duration.ofSeconds(1));

        verify(first, times(3)).isDisplayed();
    }

    @Test(description = "waitGone returns once the element can no longer be found")
    public void testWaitGone() {
        when(driver.findElement(By.xpath(WIFI)))
                .thenReturn(first)
                .thenThrow(new NoSuchElementException("gone"));
        when(first.isDisplayed()).thenReturn(true);

        session(ResolutionMode.COMPOSED).getElement(WIFI).waitGone(Duration.ofSeconds(1));

        verify(driver, times(2)).findElement(By.xpath(WIFI));
    }

    @Test(description = "waitGone times out while the element stays visible")
    public void testWaitGoneTimeout() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.isDisplayed()).thenReturn(true);
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThatThrownBy(() -> e.waitGone(Duration.ofMillis(500)))
                .isInstanceOf(TimeoutException.class)
                .hasMessageContaining("still visible");
    }

    @Test(description = "waitClickable polls until the element is displayed and enabled")
    public void testWaitClickable() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.isDisplayed()).thenReturn(true);
        when(first.isEnabled()).thenReturn(false, true);

        session(ResolutionMode.COMPOSED).getElement(WIFI).waitClickable(Duration.ofSeconds(1));

        verify(first, times(2)).isEnabled();
    }

    @Test(description = "waitClickable times out on an element that stays disabled")
    public void testWaitClickableTimeout() {
        when(driver.findElement(By.xpath(WIFI))).thenReturn(first);
        when(first.isDisplayed()).thenReturn(true);
        when(first.isEnabled()).thenReturn(false);
        Element e = session(ResolutionMode.COMPOSED).getElement(WIFI);

        assertThatThrownBy(() -> e.waitClickable(Duration.ofMillis(500)))
                .isInstanceOf(TimeoutException.class)
                .hasMessageContaining("is not clickable");
    }
}
