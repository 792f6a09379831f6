package mobileqa.session;

import org.openqa.selenium.WebDriver;

/**
 * Opens a new driver session. Called once by {@link DriverSession#connect()}
 * and again for every reconnect.
 */
@FunctionalInterface
public interface DriverFactory {

    /**
     * @return a live driver
     * @throws org.openqa.selenium.WebDriverException if the server refuses or cannot be reached
     */
    WebDriver create();
}
