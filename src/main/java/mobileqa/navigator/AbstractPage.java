package mobileqa.navigator;

import mobileqa.element.Element;
import mobileqa.locator.Locator;
import mobileqa.session.DriverSession;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for page objects bound to a {@link DriverSession}.
 *
 * <p>Subclasses declare an anchor element that only this page shows, and
 * their edges in the constructor:
 * <pre>{@code
 * public class SettingsPage extends AbstractPage {
 *     public SettingsPage(DriverSession session) {
 *         super(session);
 *         edge("WifiPage", () -> element(Map.of("text", "Wi-Fi")).tap());
 *     }
 *     protected Element anchor() {
 *         return element(Map.of("text", "Settings", "class", "android.widget.TextView"));
 *     }
 * }
 * }</pre>
 */
public abstract class AbstractPage implements PageNode {

    /** How long {@link #isCurrentPage()} looks for the anchor. */
    protected static final Duration DEFAULT_IDENTITY_TIMEOUT = Duration.ofSeconds(2);

    protected final DriverSession session;
    private final Map<String, Transition> edges = new LinkedHashMap<>();

    protected AbstractPage(DriverSession session) {
        this.session = session;
    }

    /** The element that identifies this page. */
    protected abstract Element anchor();

    /** Defaults to the simple class name. */
    @Override
    public String getName() {
        return getClass().getSimpleName();
    }

    @Override
    public boolean isCurrentPage() {
        return anchor().isPresent(DEFAULT_IDENTITY_TIMEOUT);
    }

    @Override
    public Map<String, Transition> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    protected void edge(String target, Transition transition) {
        edges.put(target, transition);
    }

    protected Element element(Locator locator) {
        return session.getElement(locator);
    }

    protected Element element(Map<String, ?> attributes) {
        return session.getElement(attributes);
    }

    protected Element element(String locator) {
        return session.getElement(locator);
    }

    @Override
    public String toString() {
        return getName();
    }
}
