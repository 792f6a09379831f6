package mobileqa.session;

import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.openqa.selenium.remote.RemoteWebElement;

import java.util.List;
import java.util.Objects;

/**
 * Locates elements with the Android {@code -android uiautomator} strategy,
 * whose value is selector text such as
 * {@code new UiSelector().text("Wi-Fi");}. Remote drivers send the strategy
 * name and value to the server as they are.
 */
public final class UiAutomatorBy extends By implements By.Remotable {

    public static final String USING = "-android uiautomator";

    private final String selector;

    public UiAutomatorBy(String selector) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
    }

    public String getSelector() { return selector; }

    @Override
    public Parameters getRemoteParameters() {
        return new Parameters(USING, selector);
    }

    @Override
    public List<WebElement> findElements(SearchContext context) {
        if (context instanceof RemoteWebDriver || context instanceof RemoteWebElement) {
            return context.findElements(this);
        }
        throw new WebDriverException("Strategy '" + USING + "' needs a remote session, got "
                + context.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UiAutomatorBy other && selector.equals(other.selector);
    }

    @Override
    public int hashCode() {
        return selector.hashCode();
    }

    @Override
    public String toString() {
        return "By.androidUIAutomator: " + selector;
    }
}
