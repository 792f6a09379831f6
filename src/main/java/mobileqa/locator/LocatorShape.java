package mobileqa.locator;

/** The three interchangeable ways of writing a locator. */
public enum LocatorShape {
    /** Ordered attribute map, e.g. {@code {"text": "Wi-Fi", "class": "android.widget.TextView"}}. */
    ATTRIBUTES,
    /** XPath over the UI hierarchy dump. */
    PATH_QUERY,
    /** UiSelector chain, e.g. {@code new UiSelector().text("Wi-Fi")}. */
    SELECTOR
}
