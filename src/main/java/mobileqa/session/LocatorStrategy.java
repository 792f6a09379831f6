package mobileqa.session;

/** How locators are sent to the driver. */
public enum LocatorStrategy {
    /** Every locator is converted to XPath and sent with {@code By.xpath}. */
    XPATH,
    /** Every locator is converted to selector text and sent with {@link UiAutomatorBy}. */
    UIAUTOMATOR
}
