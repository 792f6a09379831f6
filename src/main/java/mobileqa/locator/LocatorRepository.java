package mobileqa.locator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named locators kept in a JSON file so page objects can refer to elements by
 * logical name instead of embedding locator strings.
 *
 * <pre>{@code
 * {
 *   "locators": {
 *     "wifiRow":  { "attributes": { "text": "Wi-Fi" } },
 *     "backIcon": { "xpath": "//*[@content-desc=\"Navigate up\"]" },
 *     "toggle":   { "selector": "new UiSelector().resourceId(\"android:id/switch_widget\");" }
 *   }
 * }
 * }</pre>
 *
 * Entry order is preserved.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocatorRepository {

    private static final Logger log = LoggerFactory.getLogger(LocatorRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @JsonProperty("description")
    private String description;

    @JsonProperty("locators")
    private Map<String, LocatorEntry> locators = new LinkedHashMap<>();

    // ── Factory ───────────────────────────────────────────────────────────

    public static LocatorRepository empty() {
        return new LocatorRepository();
    }

    /**
     * Loads a repository from a JSON file.
     * @throws IOException if the file cannot be read or is malformed
     */
    public static LocatorRepository load(Path path) throws IOException {
        LocatorRepository repo = MAPPER.readValue(path.toFile(), LocatorRepository.class);
        log.info("Loaded {} locator(s) from {}", repo.size(), path);
        return repo;
    }

    /** Loads a repository from a classpath or other stream. */
    public static LocatorRepository load(InputStream in) throws IOException {
        return MAPPER.readValue(in, LocatorRepository.class);
    }

    // ── Persistence ───────────────────────────────────────────────────────

    /** Serialises this repository to a JSON file (pretty-printed). */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), this);
        log.debug("Saved {} locator(s) to {}", size(), path);
    }

    // ── Lookup ────────────────────────────────────────────────────────────

    /**
     * Returns the named locator.
     * @throws IllegalArgumentException if the name is not found
     */
    public Locator get(String name) {
        LocatorEntry entry = locators.get(name);
        if (entry == null) {
            throw new IllegalArgumentException(
                    "Unknown locator: '" + name + "'. Known: " + locators.keySet());
        }
        return entry.toLocator();
    }

    /** Adds or replaces a named locator. */
    public void put(String name, Locator locator) {
        locators.put(name, LocatorEntry.of(locator));
    }

    public boolean contains(String name) {
        return locators.containsKey(name);
    }

    public boolean remove(String name) {
        return locators.remove(name) != null;
    }

    public Set<String> names() {
        return locators.keySet();
    }

    public int size() {
        return locators.size();
    }

    // ── Getters / Setters ─────────────────────────────────────────────────

    public String                    getDescription()    { return description; }
    public void                      setDescription(String d) { this.description = d; }
    public Map<String, LocatorEntry> getLocators()       { return locators; }
    public void                      setLocators(Map<String, LocatorEntry> l) { this.locators = l; }
}
