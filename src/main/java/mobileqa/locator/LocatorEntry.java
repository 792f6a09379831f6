package mobileqa.locator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One named entry of a {@link LocatorRepository}. Exactly one of
 * {@code xpath}, {@code selector} or {@code attributes} is set.
 *
 * <pre>{@code
 * { "description": "Wi-Fi row", "attributes": { "text": "Wi-Fi", "class": "android.widget.TextView" } }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocatorEntry {

    @JsonProperty("description")
    private String description;

    @JsonProperty("xpath")
    private String xpath;

    @JsonProperty("selector")
    private String selector;

    @JsonProperty("attributes")
    private Map<String, Object> attributes;

    public LocatorEntry() {}

    /** Captures {@code locator} in whichever shape it currently has. */
    public static LocatorEntry of(Locator locator) {
        LocatorEntry entry = new LocatorEntry();
        switch (locator.getShape()) {
            case ATTRIBUTES -> entry.attributes = new LinkedHashMap<>(locator.getAttributes());
            case PATH_QUERY -> entry.xpath = locator.getPathQuery();
            case SELECTOR   -> entry.selector = locator.getSelectorText();
        }
        return entry;
    }

    /**
     * @throws InvalidLocatorException if zero or several shapes are set
     */
    @JsonIgnore
    public Locator toLocator() {
        int set = (xpath != null ? 1 : 0) + (selector != null ? 1 : 0) + (attributes != null ? 1 : 0);
        if (set != 1) {
            throw new InvalidLocatorException("Locator entry must set exactly one of xpath, selector, attributes; found " + set);
        }
        if (xpath != null)    return Locator.xpath(xpath);
        if (selector != null) return Locator.selector(selector);
        return Locator.attributes(attributes);
    }

    public String              getDescription()                  { return description; }
    public void                setDescription(String d)          { this.description = d; }
    public String              getXpath()                        { return xpath; }
    public void                setXpath(String xpath)            { this.xpath = xpath; }
    public String              getSelector()                     { return selector; }
    public void                setSelector(String selector)      { this.selector = selector; }
    public Map<String, Object> getAttributes()                   { return attributes; }
    public void                setAttributes(Map<String, Object> a) { this.attributes = a; }
}
