package com.tenderwatch.monitor.collect;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Renders the listing in a headless Chrome session. The PPRA page builds its tender table with
 * JavaScript, so the served HTML alone has no rows; the city is chosen through the page's own
 * filter before the rendered DOM is handed to Jsoup.
 */
public class SeleniumTenderPageClient implements TenderPageClient {
    private static final Logger log = LoggerFactory.getLogger(SeleniumTenderPageClient.class);
    private static final By TABLE = By.cssSelector("table");
    private static final By TABLE_ROWS = By.cssSelector("table tr");
    private static final By SEARCH_BUTTON = By.xpath("//button[contains(normalize-space(.), 'Search')]");
    private static final List<String> CITY_FILTER_XPATHS = List.of(
        "//select[contains(translate(@name, 'CITY', 'city'), 'city') or contains(translate(@id, 'CITY', 'city'), 'city')]",
        "//*[normalize-space(text())='City']/following::*[normalize-space(text())='Select'][1]",
        "//*[contains(@class, 'city')]//*[contains(text(), 'Select')]"
    );

    private final WebDriverFactory driverFactory;

    public SeleniumTenderPageClient(boolean headless) {
        this((userAgent, pageLoadTimeout) -> chrome(headless, userAgent, pageLoadTimeout));
    }

    SeleniumTenderPageClient(WebDriverFactory driverFactory) {
        this.driverFactory = driverFactory;
    }

    @Override
    public Document fetchListingPage(String url, String scope, String userAgent, int timeoutMs) throws IOException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        WebDriver driver;
        try {
            driver = driverFactory.create(userAgent, Duration.ofMillis(timeoutMs));
        } catch (WebDriverException e) {
            throw new IOException("browser could not be started: " + e.getMessage(), e);
        }
        try {
            driver.get(url);
            waitUntilRendered(driver, deadline);
            if (scope != null && !scope.isBlank()) {
                selectCity(driver, scope.trim(), deadline);
            }
            return Jsoup.parse(driver.getPageSource(), url);
        } catch (TimeoutException e) {
            throw new IOException("listing table did not render within " + timeoutMs + "ms", e);
        } catch (WebDriverException e) {
            throw new IOException("browser failed on " + url + ": " + e.getMessage(), e);
        } finally {
            quit(driver);
        }
    }

    private void waitUntilRendered(WebDriver driver, long deadline) {
        WebDriverWait wait = new WebDriverWait(driver, remaining(deadline));
        wait.until(d -> "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
        wait.until(ExpectedConditions.presenceOfElementLocated(TABLE_ROWS));
    }

    private void selectCity(WebDriver driver, String city, long deadline) {
        try {
            WebElement filter = findCityFilter(driver);
            if ("select".equalsIgnoreCase(filter.getTagName())) {
                new Select(filter).selectByVisibleText(city);
            } else {
                click(driver, filter);
                List<String> optionXpaths = cityOptionXpaths(city);
                WebElement option = new WebDriverWait(driver, remaining(deadline))
                    .until(d -> firstDisplayed(d, optionXpaths));
                click(driver, option);
            }
            WebElement search = new WebDriverWait(driver, remaining(deadline))
                .until(ExpectedConditions.elementToBeClickable(SEARCH_BUTTON));
            click(driver, search);
            String needle = city.toLowerCase(Locale.ROOT);
            new WebDriverWait(driver, remaining(deadline)).until(d -> {
                String text = d.findElement(TABLE).getText().toLowerCase(Locale.ROOT);
                return text.contains(needle) || text.contains("no record");
            });
        } catch (NoSuchElementException | TimeoutException e) {
            log.warn("City filter '{}' could not be applied on the listing page ({}); rows are filtered by text only",
                city, e.getMessage());
        }
    }

    private static WebElement findCityFilter(WebDriver driver) {
        WebElement filter = firstDisplayed(driver, CITY_FILTER_XPATHS);
        if (filter == null) {
            throw new NoSuchElementException("city filter not found");
        }
        return filter;
    }

    private static WebElement firstDisplayed(WebDriver driver, List<String> xpaths) {
        for (String xpath : xpaths) {
            for (WebElement element : driver.findElements(By.xpath(xpath))) {
                if (element.isDisplayed()) {
                    return element;
                }
            }
        }
        return null;
    }

    static List<String> cityOptionXpaths(String city) {
        String literal = xpathLiteral(city);
        return List.of(
            "//*[@role='option' or @role='menuitem' or self::li][normalize-space(.)=" + literal + "]",
            "//*[normalize-space(text())=" + literal + "]",
            "//*[@role='option' or @role='menuitem' or self::li][contains(., " + literal + ")]"
        );
    }

    static String xpathLiteral(String value) {
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }
        return "concat('" + value.replace("'", "', \"'\", '") + "')";
    }

    private static void click(WebDriver driver, WebElement element) {
        ((JavascriptExecutor) driver).executeScript("arguments[0].scrollIntoView(true);", element);
        element.click();
    }

    private static Duration remaining(long deadline) {
        return Duration.ofMillis(Math.max(1L, deadline - System.currentTimeMillis()));
    }

    private static void quit(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("Browser session did not close cleanly: {}", e.getMessage());
        }
    }

    private static WebDriver chrome(boolean headless, String userAgent, Duration pageLoadTimeout) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments("--no-sandbox", "--disable-dev-shm-usage", "--disable-gpu", "--disable-extensions");
        options.addArguments("--user-agent=" + userAgent);
        options.setPageLoadTimeout(pageLoadTimeout);
        return new ChromeDriver(options);
    }

    @FunctionalInterface
    interface WebDriverFactory {
        WebDriver create(String userAgent, Duration pageLoadTimeout);
    }
}
