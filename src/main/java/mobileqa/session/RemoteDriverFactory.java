package mobileqa.session;

import org.openqa.selenium.MutableCapabilities;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.Map;
import java.util.Set;

/**
 * Opens a {@link RemoteWebDriver} against the automation server configured in
 * {@link SessionConfig}. Capability names that are neither W3C standard nor
 * already vendor-prefixed get the {@code appium:} prefix the server expects.
 */
public class RemoteDriverFactory implements DriverFactory {

    private static final Logger log = LoggerFactory.getLogger(RemoteDriverFactory.class);

    private static final Set<String> W3C_CAPABILITIES = Set.of(
            "browserName", "browserVersion", "platformName", "acceptInsecureCerts",
            "pageLoadStrategy", "proxy", "setWindowRect", "timeouts",
            "unhandledPromptBehavior", "strictFileInteractability", "webSocketUrl");

    private final URL serverUrl;
    private final Map<String, Object> capabilities;

    public RemoteDriverFactory(SessionConfig config) {
        this(config.getServerUrl(), config.getCapabilities());
    }

    public RemoteDriverFactory(String serverUrl, Map<String, Object> capabilities) {
        try {
            this.serverUrl = URI.create(serverUrl).toURL();
        } catch (IllegalArgumentException | MalformedURLException e) {
            throw new IllegalArgumentException("Invalid automation server URL: " + serverUrl, e);
        }
        this.capabilities = Map.copyOf(capabilities);
    }

    @Override
    public WebDriver create() {
        MutableCapabilities caps = toCapabilities(capabilities);
        log.info("Opening session on {} with {}", serverUrl, caps.asMap().keySet());
        try {
            return new RemoteWebDriver(serverUrl, caps);
        } catch (WebDriverException e) {
            log.error("Session creation on {} failed: {}", serverUrl, e.getMessage());
            throw e;
        }
    }

    static MutableCapabilities toCapabilities(Map<String, Object> raw) {
        MutableCapabilities caps = new MutableCapabilities();
        raw.forEach((name, value) -> caps.setCapability(
                name.contains(":") || W3C_CAPABILITIES.contains(name) ? name : "appium:" + name, value));
        return caps;
    }
}
