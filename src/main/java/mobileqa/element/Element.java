package mobileqa.element;

import mobileqa.MobileQAException;
import mobileqa.locator.Locator;
import mobileqa.locator.LocatorConverter;
import mobileqa.session.DriverSession;
import mobileqa.session.ResolutionMode;
import mobileqa.session.SessionLostException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.RemoteWebElement;
import org.openqa.selenium.support.ui.FluentWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A lazily resolved UI element.
 *
 * <p>Creating an element, or deriving one through {@link #getElement},
 * {@link #getParent}, {@link #getSibling}, {@link #getCousin} or
 * {@link #getChild}, never talks to the device. The first read or action
 * looks the element up through the owning {@link DriverSession} and caches
 * the handle; later calls reuse it until it goes stale or the session
 * reconnects. Every remote call runs under the session's
 * {@link RetryingExecutor}.
 *
 * <p>With {@link ResolutionMode#COMPOSED} a relational chain is folded into a
 * single XPath, so resolving it costs one lookup per attempt. With
 * {@link ResolutionMode#SCOPED} each base is resolved (and cached) first and
 * the next hop searches inside it.
 *
 * <p>Gestures run as {@code mobile:} scripts on the driver against the
 * resolved element's id.
 *
 * <p>Actions return {@code this} for chaining:
 * <pre>{@code
 * session.getElement(Map.of("text", "Wi-Fi"))
 *        .getSibling(Locator.attributes(Map.of("class", "android.widget.Switch")))
 *        .tap();
 * }</pre>
 *
 * <p>Not thread-safe.
 */
public class Element {

    private static final Logger log = LoggerFactory.getLogger(Element.class);

    /** Attributes read by {@link #getAttributes()}. */
    private static final List<String> NODE_ATTRIBUTES = List.of(
            "text", "resource-id", "class", "package", "content-desc",
            "checkable", "checked", "clickable", "enabled", "focusable", "focused",
            "long-clickable", "scrollable", "selected", "password", "displayed", "bounds");

    private static final double DEFAULT_SCROLL_PERCENT = 0.7;
    private static final String UI_AUTOMATOR_STRATEGY = "-android uiautomator";

    private final WeakReference<DriverSession> sessionRef;
    private final Locator locator;
    private final Relation relation;
    private final Element base;
    private final int position;

    private WebElement handle;
    private long handleGeneration;
    private ElementState state = ElementState.UNRESOLVED;

    public Element(DriverSession session, Locator locator) {
        this(session, locator, Relation.PLAIN, null, 0);
    }

    private Element(DriverSession session, Locator locator, Relation relation, Element base, int position) {
        this.sessionRef = new WeakReference<>(session);
        this.locator = locator;
        this.relation = relation;
        this.base = base;
        this.position = position;
    }

    /**
     * Every current match of {@code locator}, each bound to
     * {@code (xpath)[i]} and pre-resolved with the handle found.
     */
    public static List<Element> listOf(DriverSession session, Locator locator) {
        List<WebElement> found = session.newExecutor().execute(locator,
                () -> session.findAll(locator, session.getDriver()));
        return bindAll(session, LocatorConverter.toXPath(locator), found);
    }

    private static List<Element> bindAll(DriverSession session, String xpath, List<WebElement> found) {
        List<Element> out = new ArrayList<>(found.size());
        for (int i = 0; i < found.size(); i++) {
            Element e = new Element(session, Locator.xpath("(" + xpath + ")[" + (i + 1) + "]"));
            e.bind(found.get(i), session.getGeneration());
            out.add(e);
        }
        log.debug("{} matched {} element(s)", xpath, out.size());
        return Collections.unmodifiableList(out);
    }

    // ── Relations ─────────────────────────────────────────────────────────

    /** A descendant of this element matching {@code relative}. */
    public Element getElement(Locator relative) {
        return new Element(session(), relative, Relation.CHILD, this, 0);
    }

    public Element getElement(Map<String, ?> attributes) {
        return getElement(Locator.attributes(attributes));
    }

    /** Every descendant of this element matching {@code relative}. */
    public List<Element> getElements(Locator relative) {
        return related(Relation.CHILD, relative, 0);
    }

    public Element getParent() {
        return new Element(session(), null, Relation.PARENT, this, 0);
    }

    /** Every ancestor of this element, outermost first. */
    public List<Element> getParents() {
        return related(Relation.ANCESTOR, null, 0);
    }

    /** A following sibling of this element matching {@code relative}. */
    public Element getSibling(Locator relative) {
        return new Element(session(), relative, Relation.SIBLING, this, 0);
    }

    public List<Element> getSiblings(Locator relative) {
        return related(Relation.SIBLING, relative, 0);
    }

    /** Same as {@code getCousin(relative, 1)}. */
    public Element getCousin(Locator relative) {
        return getCousin(relative, 1);
    }

    /**
     * An element matching {@code relative} anywhere below this element's
     * ancestor {@code depth} levels up.
     */
    public Element getCousin(Locator relative, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("Cousin depth must be at least 1, got " + depth);
        }
        return new Element(session(), relative, Relation.COUSIN, this, depth);
    }

    public List<Element> getCousins(Locator relative) {
        return getCousins(relative, 1);
    }

    public List<Element> getCousins(Locator relative, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("Cousin depth must be at least 1, got " + depth);
        }
        return related(Relation.COUSIN, relative, depth);
    }

    /** The direct child at zero-based position {@code n}. */
    public Element getChild(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Child index must not be negative, got " + n);
        }
        return new Element(session(), null, Relation.NTH_CHILD, this, n);
    }

    /** All current matches of a relation, found with one composed XPath and bound by position. */
    private List<Element> related(Relation rel, Locator relative, int n) {
        DriverSession session = session();
        String relativeXPath = relative == null ? "" : LocatorConverter.toXPath(relative);
        Locator query = Locator.xpath(XPathComposer.compose(composedXPath(), rel, relativeXPath, n));
        List<WebElement> found = session.newExecutor().execute(query,
                () -> session.findAll(query, session.getDriver()));
        return bindAll(session, query.getPathQuery(), found);
    }

    // ── Reads ─────────────────────────────────────────────────────────────

    public String getText() {
        return withHandle(WebElement::getText);
    }

    public String getAttribute(String name) {
        return withHandle(h -> h.getAttribute(name));
    }

    public String getResourceId()  { return getAttribute("resource-id"); }
    public String getClassName()   { return getAttribute("class"); }
    public String getContentDesc() { return getAttribute("content-desc"); }

    /** The standard node attributes the driver reports for this element; absent ones are left out. */
    public Map<String, String> getAttributes() {
        return withHandle(h -> {
            Map<String, String> out = new LinkedHashMap<>();
            for (String name : NODE_ATTRIBUTES) {
                String value = h.getAttribute(name);
                if (value != null) out.put(name, value);
            }
            return out;
        });
    }

    public boolean isDisplayed() {
        return withHandle(WebElement::isDisplayed);
    }

    public boolean isEnabled() {
        return withHandle(WebElement::isEnabled);
    }

    public boolean isSelected() {
        return withHandle(WebElement::isSelected);
    }

    public boolean isChecked() {
        return "true".equals(getAttribute("checked"));
    }

    public Rectangle getRect() {
        return withHandle(WebElement::getRect);
    }

    /**
     * Whether the element can be found within {@code timeout}. Returns
     * {@code false} instead of throwing {@link ElementNotFoundException}.
     */
    public boolean isPresent(Duration timeout) {
        DriverSession session = session();
        try {
            session.newExecutor(session.getRetryPolicy().withTimeout(timeout))
                    .execute(effectiveLocator(), () -> resolve(session), this::markStale);
            return true;
        } catch (ElementNotFoundException e) {
            return false;
        }
    }

    // ── Actions ───────────────────────────────────────────────────────────

    public Element tap() {
        return act(WebElement::click);
    }

    public Element sendKeys(CharSequence... keys) {
        return act(h -> h.sendKeys(keys));
    }

    public Element clear() {
        return act(WebElement::clear);
    }

    /** Replaces the element's text. */
    public Element setValue(CharSequence text) {
        return act(h -> {
            h.clear();
            h.sendKeys(text);
        });
    }

    // ── Gestures ──────────────────────────────────────────────────────────

    /** Presses and holds the element for {@code holdFor}. */
    public Element tap(Duration holdFor) {
        gesture("mobile: longClickGesture", Map.of("duration", holdFor.toMillis()));
        return this;
    }

    public Element doubleTap() {
        gesture("mobile: doubleClickGesture", Map.of());
        return this;
    }

    /**
     * Swipes across the element.
     *
     * @param percent share of the element's size to travel, in {@code (0, 1]}
     */
    public Element swipe(SwipeDirection direction, double percent) {
        gesture("mobile: swipeGesture", Map.of("direction", direction.wireName(), "percent", checkPercent(percent)));
        return this;
    }

    /**
     * Scrolls the element's content once.
     *
     * @return whether the content can scroll further in that direction
     */
    public boolean scroll(SwipeDirection direction, double percent) {
        Object more = gesture("mobile: scrollGesture",
                Map.of("direction", direction.wireName(), "percent", checkPercent(percent)));
        return Boolean.TRUE.equals(more);
    }

    public Element scrollDown() {
        scroll(SwipeDirection.DOWN, DEFAULT_SCROLL_PERCENT);
        return this;
    }

    public Element scrollUp() {
        scroll(SwipeDirection.UP, DEFAULT_SCROLL_PERCENT);
        return this;
    }

    /**
     * Scrolls this container until {@code target} is on screen, then returns
     * it as a lazy element. The target must have a selector form.
     */
    public Element scrollToElement(Locator target, int maxSwipes) {
        if (maxSwipes < 1) {
            throw new IllegalArgumentException("maxSwipes must be at least 1, got " + maxSwipes);
        }
        String selector = LocatorConverter.toSelectorText(target);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("strategy", UI_AUTOMATOR_STRATEGY);
        params.put("selector", selector);
        params.put("maxSwipes", maxSwipes);
        gesture("mobile: scroll", params);
        return session().getElement(target);
    }

    private Object gesture(String script, Map<String, Object> params) {
        DriverSession session = session();
        return session.newExecutor().execute(effectiveLocator(), () -> {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("elementId", elementId(resolve(session)));
            args.putAll(params);
            log.debug("{} {}", script, args);
            return scriptRunner(session).executeScript(script, args);
        }, this::markStale);
    }

    private static String elementId(WebElement handle) {
        if (handle instanceof RemoteWebElement remote) {
            return remote.getId();
        }
        throw new MobileQAException("Gestures need a remote element, got " + handle.getClass().getName());
    }

    private static JavascriptExecutor scriptRunner(DriverSession session) {
        WebDriver driver = session.getDriver();
        if (driver instanceof JavascriptExecutor js) {
            return js;
        }
        throw new MobileQAException("Driver " + driver.getClass().getName() + " cannot run mobile gestures");
    }

    private static double checkPercent(double percent) {
        if (!(percent > 0 && percent <= 1)) {
            throw new IllegalArgumentException("Gesture percent must be in (0, 1], got " + percent);
        }
        return percent;
    }

    // ── Waits ─────────────────────────────────────────────────────────────

    /**
     * Waits until the element is found and displayed.
     *
     * @throws ElementNotFoundException if that does not happen within {@code timeout}
     */
    public Element waitVisible(Duration timeout) {
        DriverSession session = session();
        session.newExecutor(session.getRetryPolicy().withTimeout(timeout)).execute(effectiveLocator(), () -> {
            if (!resolve(session).isDisplayed()) {
                throw new NoSuchElementException("Element is present but not displayed");
            }
            return this;
        }, this::markStale);
        return this;
    }

    /**
     * Waits until the element is no longer found or no longer displayed.
     *
     * @throws TimeoutException if it is still visible after {@code timeout}
     */
    public Element waitGone(Duration timeout) {
        DriverSession session = session();
        new FluentWait<>(this, session.getClock(), session.getSleeper())
                .withTimeout(timeout)
                .pollingEvery(session.getRetryPolicy().initialDelay())
                .withMessage(() -> effectiveLocator().describe() + " is still visible")
                .until(e -> e.isGoneNow(session));
        return this;
    }

    /**
     * Waits until the element is displayed and enabled.
     *
     * @throws TimeoutException if that does not happen within {@code timeout}
     */
    public Element waitClickable(Duration timeout) {
        DriverSession session = session();
        new FluentWait<>(this, session.getClock(), session.getSleeper())
                .withTimeout(timeout)
                .pollingEvery(session.getRetryPolicy().initialDelay())
                .withMessage(() -> effectiveLocator().describe() + " is not clickable")
                .until(e -> e.isClickableNow(session));
        return this;
    }

    private boolean isClickableNow(DriverSession session) {
        try {
            return session.newExecutor(RetryPolicy.once()).execute(effectiveLocator(), () -> {
                WebElement h = resolve(session);
                return h.isDisplayed() && h.isEnabled();
            }, this::markStale);
        } catch (ElementNotFoundException e) {
            return false;
        }
    }

    private boolean isGoneNow(DriverSession session) {
        markStale();
        try {
            return !session.newExecutor(RetryPolicy.once())
                    .execute(effectiveLocator(), () -> resolve(session).isDisplayed());
        } catch (ElementNotFoundException e) {
            return true;
        }
    }

    // ── Resolution ────────────────────────────────────────────────────────

    public ElementState getState() { return state; }

    public Relation getRelation() { return relation; }

    /** The locator this element was created with; {@code null} for parent and nth-child elements. */
    public Locator getLocator() { return locator; }

    /** The single XPath that finds this element from the root of the screen. */
    public String toXPath() {
        return composedXPath();
    }

    private String composedXPath() {
        if (relation == Relation.PLAIN) {
            return LocatorConverter.toXPath(locator);
        }
        return XPathComposer.compose(base.composedXPath(), relation, relativeXPath(), position);
    }

    private String relativeXPath() {
        return locator == null ? "" : LocatorConverter.toXPath(locator);
    }

    private Locator effectiveLocator() {
        return relation == Relation.PLAIN ? locator : Locator.xpath(composedXPath());
    }

    private <T> T withHandle(Function<WebElement, T> read) {
        DriverSession session = session();
        return session.newExecutor().execute(effectiveLocator(),
                () -> read.apply(resolve(session)), this::markStale);
    }

    private Element act(Consumer<WebElement> action) {
        DriverSession session = session();
        session.newExecutor().execute(effectiveLocator(), () -> {
            action.accept(resolve(session));
            return this;
        }, this::markStale);
        return this;
    }

    /** The cached handle, or one fresh lookup. Package-private for scoped resolution. */
    WebElement resolve(DriverSession session) {
        if (state == ElementState.RESOLVED && handle != null && handleGeneration == session.getGeneration()) {
            return handle;
        }
        state = ElementState.RESOLVING;
        try {
            WebElement found = lookup(session);
            bind(found, session.getGeneration());
            log.debug("Resolved {}", this);
            return found;
        } catch (RuntimeException e) {
            state = handle == null ? ElementState.UNRESOLVED : ElementState.STALE;
            throw e;
        }
    }

    private WebElement lookup(DriverSession session) {
        if (relation == Relation.PLAIN) {
            return session.find(locator, session.getDriver());
        }
        if (session.getResolutionMode() == ResolutionMode.COMPOSED) {
            return session.find(Locator.xpath(composedXPath()), session.getDriver());
        }
        WebElement scope = base.resolve(session);
        String scoped = XPathComposer.compose(".", relation, relativeXPath(), position);
        return session.find(Locator.xpath(scoped), scope);
    }

    private void bind(WebElement found, long generation) {
        this.handle = found;
        this.handleGeneration = generation;
        this.state = ElementState.RESOLVED;
    }

    /** Drops trust in the cached handles of this element and its bases. */
    private void markStale() {
        if (handle != null) {
            state = ElementState.STALE;
        }
        if (base != null) {
            base.markStale();
        }
    }

    private DriverSession session() {
        DriverSession session = sessionRef.get();
        if (session == null) {
            throw new SessionLostException("The session owning this element no longer exists");
        }
        return session;
    }

    @Override
    public String toString() {
        if (relation == Relation.PLAIN) {
            return "Element{" + locator.describe() + ", " + state + "}";
        }
        String rel = locator == null ? relation.toString() : relation + " " + locator.describe();
        return "Element{" + rel + " of " + base + ", " + state + "}";
    }
}
