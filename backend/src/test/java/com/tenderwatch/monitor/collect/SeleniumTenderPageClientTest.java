package com.tenderwatch.monitor.collect;

import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.SessionNotCreatedException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

class SeleniumTenderPageClientTest {
    private static final String URL = "https://ppra.gov.pk/#/tenders/activetenders";
    private static final String RENDERED = "<html><body><table>"
        + "<tr><th>Sr No</th><th>Tender No</th></tr>"
        + "<tr><td>1</td><td>TS-1</td><td>Road works<br>Civil Works<br>Lahore</td>"
        + "<td><a href=\"/docs/TS-1.pdf\">pdf</a></td><td>01-10-2026</td><td>25-10-2026</td></tr>"
        + "</table></body></html>";

    private WebDriver driver;
    private WebElement table;

    @BeforeEach
    void setUp() {
        driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        table = mock(WebElement.class);
        when(((JavascriptExecutor) driver).executeScript("return document.readyState")).thenReturn("complete");
        when(driver.getPageSource()).thenReturn(RENDERED);
    }

    @Test
    void returnsRenderedDomAndClosesBrowser() throws IOException {
        when(driver.findElement(any(By.class))).thenReturn(table);
        SeleniumTenderPageClient client = new SeleniumTenderPageClient((userAgent, timeout) -> driver);

        Document document = client.fetchListingPage(URL, null, "tender-monitor/0.1", 2000);

        verify(driver).get(URL);
        assertThat(document.select("table tr")).hasSize(2);
        assertThat(document.selectFirst("a[href]").absUrl("href")).isEqualTo("https://ppra.gov.pk/docs/TS-1.pdf");
        verify(driver, never()).findElements(any(By.class));
        verify(driver).quit();
    }

    @Test
    void cityIsChosenInPageFilterBeforeReading() throws IOException {
        WebElement filter = displayed();
        WebElement option = displayed();
        WebElement search = displayed();
        when(filter.getTagName()).thenReturn("div");
        when(table.getText()).thenReturn("1 TS-1 Road works Lahore");
        when(driver.findElements(any(By.class))).thenAnswer(invocation -> {
            String locator = invocation.getArgument(0).toString();
            return locator.contains("Lahore") ? List.of(option) : List.of(filter);
        });
        when(driver.findElement(any(By.class))).thenAnswer(invocation -> {
            String locator = invocation.getArgument(0).toString();
            return locator.contains("Search") ? search : table;
        });
        SeleniumTenderPageClient client = new SeleniumTenderPageClient((userAgent, timeout) -> driver);

        Document document = client.fetchListingPage(URL, "Lahore", "tender-monitor/0.1", 2000);

        InOrder clicks = inOrder(filter, option, search);
        clicks.verify(filter).click();
        clicks.verify(option).click();
        clicks.verify(search).click();
        assertThat(document.select("table tr")).hasSize(2);
        verify(driver).quit();
    }

    @Test
    void tableThatNeverRendersFailsAndClosesBrowser() {
        when(driver.findElement(any(By.class))).thenThrow(new NoSuchElementException("table tr"));
        SeleniumTenderPageClient client = new SeleniumTenderPageClient((userAgent, timeout) -> driver);

        assertThatThrownBy(() -> client.fetchListingPage(URL, null, "tender-monitor/0.1", 1000))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("did not render");
        verify(driver).quit();
    }

    @Test
    void browserThatCannotStartIsAnIoFailure() {
        SeleniumTenderPageClient client = new SeleniumTenderPageClient((userAgent, timeout) -> {
            throw new SessionNotCreatedException("chrome not found");
        });

        assertThatThrownBy(() -> client.fetchListingPage(URL, null, "tender-monitor/0.1", 1000))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("chrome not found");
    }

    @Test
    void cityLiteralsSurviveQuotes() {
        assertThat(SeleniumTenderPageClient.xpathLiteral("Lahore")).isEqualTo("'Lahore'");
        assertThat(SeleniumTenderPageClient.xpathLiteral("D'Kot")).isEqualTo("\"D'Kot\"");
        assertThat(SeleniumTenderPageClient.xpathLiteral("a'b\"c")).isEqualTo("concat('a', \"'\", 'b\"c')");
        assertThat(SeleniumTenderPageClient.cityOptionXpaths("Lahore")).allMatch(xpath -> xpath.contains("'Lahore'"));
    }

    private static WebElement displayed() {
        WebElement element = mock(WebElement.class);
        when(element.isDisplayed()).thenReturn(true);
        when(element.isEnabled()).thenReturn(true);
        return element;
    }
}
