package mobileqa.session;

import mobileqa.element.Element;
import mobileqa.element.FailureKind;
import mobileqa.element.RetryPolicy;
import mobileqa.element.RetryingExecutor;
import mobileqa.locator.Locator;
import mobileqa.locator.LocatorConverter;
import mobileqa.locator.LocatorException;
import mobileqa.locator.LocatorShape;
import mobileqa.locator.PageSource;
import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.openqa.selenium.support.ui.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Owns the live driver connection and everything elements need to use it:
 * the locator strategy, the retry policy and the clock and sleeper the retry
 * loop runs on.
 *
 * <p>Each element holds a reference to its session; there is no global
 * driver. {@link #reconnect()} replaces the driver and bumps
 * {@link #getGeneration()}, which invalidates every handle cached under the
 * old driver.
 *
 * <pre>{@code
 * try (DriverSession session = DriverSession.create(new SessionConfig())) {
 *     session.getElement(Map.of("text", "Wi-Fi")).tap();
 * }
 * }</pre>
 */
public class DriverSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DriverSession.class);

    private final DriverFactory factory;
    private final LocatorStrategy strategy;
    private final ResolutionMode resolutionMode;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Sleeper sleeper;

    private volatile WebDriver driver;
    private volatile long generation;

    public DriverSession(DriverFactory factory, SessionConfig config) {
        this(factory, config, Clock.systemUTC(), Sleeper.SYSTEM_SLEEPER);
    }

    public DriverSession(DriverFactory factory, SessionConfig config, Clock clock, Sleeper sleeper) {
        this(factory, config.getLocatorStrategy(), config.getResolutionMode(),
                RetryPolicy.from(config), clock, sleeper);
    }

    public DriverSession(DriverFactory factory, LocatorStrategy strategy, ResolutionMode resolutionMode,
                         RetryPolicy retryPolicy, Clock clock, Sleeper sleeper) {
        this.factory = factory;
        this.strategy = strategy;
        this.resolutionMode = resolutionMode;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /** A session against the remote automation server named in {@code config}. */
    public static DriverSession create(SessionConfig config) {
        return new DriverSession(new RemoteDriverFactory(config), config);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Opens the driver if it is not open yet. */
    public synchronized void connect() {
        if (driver != null) return;
        driver = factory.create();
        generation++;
        log.info("Session connected (generation {})", generation);
    }

    /** Quits the driver. Quit failures are logged, not thrown. */
    public synchronized void disconnect() {
        if (driver == null) return;
        quitQuietly(driver);
        driver = null;
        log.info("Session disconnected");
    }

    /**
     * Replaces the driver with a fresh one.
     *
     * @throws SessionLostException if a new driver cannot be created
     */
    public synchronized void reconnect() {
        log.info("Reconnecting session (generation {})", generation);
        if (driver != null) {
            quitQuietly(driver);
            driver = null;
        }
        try {
            driver = factory.create();
        } catch (RuntimeException e) {
            throw new SessionLostException("Reconnect failed: " + e.getMessage(), e);
        }
        generation++;
        log.info("Session reconnected (generation {})", generation);
    }

    /**
     * Whether the server still answers for this session. A session-loss error
     * means no; any other answer, even an error, means yes.
     */
    public boolean isSessionValid() {
        WebDriver d = driver;
        if (d == null) return false;
        if (d instanceof RemoteWebDriver remote && remote.getSessionId() == null) return false;
        try {
            d.getWindowHandle();
            return true;
        } catch (WebDriverException e) {
            return FailureKind.classify(e) != FailureKind.SESSION_LOST;
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    private static void quitQuietly(WebDriver d) {
        try {
            d.quit();
        } catch (WebDriverException e) {
            log.warn("Failed to quit driver: {}", e.getMessage());
        }
    }

    // ── Lookups ───────────────────────────────────────────────────────────

    /** The live driver, connecting first if needed. */
    public WebDriver getDriver() {
        WebDriver d = driver;
        if (d == null) {
            connect();
            d = driver;
        }
        return d;
    }

    /** One remote lookup of {@code locator} inside {@code scope}. */
    public WebElement find(Locator locator, SearchContext scope) {
        By by = toBy(locator);
        log.debug("findElement {}", by);
        return scope.findElement(by);
    }

    /** One remote lookup of every match of {@code locator} inside {@code scope}. */
    public List<WebElement> findAll(Locator locator, SearchContext scope) {
        By by = toBy(locator);
        log.debug("findElements {}", by);
        return scope.findElements(by);
    }

    /**
     * Translates a locator for the configured strategy. Under the UiAutomator
     * strategy, path queries that have no selector form (sibling axes, scoped
     * {@code .//} paths) are sent as XPath.
     */
    public By toBy(Locator locator) {
        if (strategy == LocatorStrategy.XPATH) {
            return By.xpath(LocatorConverter.toXPath(locator));
        }
        if (locator.getShape() == LocatorShape.PATH_QUERY) {
            try {
                return new UiAutomatorBy(LocatorConverter.toSelectorText(locator));
            } catch (LocatorException e) {
                log.debug("Sending {} as XPath: {}", locator.getPathQuery(), e.getMessage());
                return By.xpath(locator.getPathQuery());
            }
        }
        return new UiAutomatorBy(LocatorConverter.toSelectorText(locator));
    }

    /** The raw hierarchy dump of the current screen. */
    public String getPageSource() {
        return getDriver().getPageSource();
    }

    /** The current screen parsed for offline matching. */
    public PageSource snapshot() {
        return PageSource.parse(getPageSource());
    }

    // ── Elements ──────────────────────────────────────────────────────────

    /** A lazy element; no remote call is made until it is used. */
    public Element getElement(Locator locator) {
        return new Element(this, locator);
    }

    public Element getElement(Map<String, ?> attributes) {
        return getElement(Locator.attributes(attributes));
    }

    /** @param locator XPath (starting with {@code /} or {@code (}) or selector text */
    public Element getElement(String locator) {
        return getElement(Locator.of(locator));
    }

    /**
     * Every current match of {@code locator}, each bound to its position so
     * that it can be re-resolved later. May be empty.
     */
    public List<Element> getElements(Locator locator) {
        return Element.listOf(this, locator);
    }

    // ── Retry support ─────────────────────────────────────────────────────

    public RetryingExecutor newExecutor() {
        return newExecutor(retryPolicy);
    }

    public RetryingExecutor newExecutor(RetryPolicy policy) {
        return new RetryingExecutor(this, policy, clock, sleeper);
    }

    /** Bumped by every connect and reconnect. */
    public long getGeneration() { return generation; }

    public LocatorStrategy getLocatorStrategy() { return strategy; }
    public ResolutionMode  getResolutionMode()  { return resolutionMode; }
    public RetryPolicy     getRetryPolicy()     { return retryPolicy; }
    public Clock           getClock()           { return clock; }
    public Sleeper         getSleeper()         { return sleeper; }
}
