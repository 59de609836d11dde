package com.ekslens.leadmaster.lead.collector;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;

@Component
public class SeleniumBrowserSessionFactory implements BrowserSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSessionFactory.class);
    private static final int SCROLL_PASSES = 3;
    private static final long SCROLL_PAUSE_MS = 1500;

    private final LeadMasterProperties properties;

    public SeleniumBrowserSessionFactory(LeadMasterProperties properties) {
        this.properties = properties;
    }

    @Override
    public BrowserSession open() {
        LeadMasterProperties.LinkedIn config = properties.getLinkedin();
        WebDriver driver = newDriver(config);
        Duration pageTimeout = Duration.ofSeconds(config.getPageLoadTimeoutSeconds());
        driver.manage().timeouts().pageLoadTimeout(pageTimeout);
        driver.manage().timeouts().scriptTimeout(pageTimeout);
        return new SeleniumBrowserSession(driver, pageTimeout);
    }

    private WebDriver newDriver(LeadMasterProperties.LinkedIn config) {
        ChromeOptions options = new ChromeOptions();
        options.addArguments(
            "--headless=new",
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-blink-features=AutomationControlled",
            "--disable-extensions",
            "--window-size=1920,1080",
            "--user-agent=" + properties.getUserAgent()
        );
        String remoteUrl = config.getRemoteDriverUrl();
        if (remoteUrl != null && !remoteUrl.isBlank()) {
            try {
                log.info("Using remote WebDriver at {}", remoteUrl);
                return new RemoteWebDriver(new URL(remoteUrl.trim()), options);
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Invalid remote WebDriver URL " + remoteUrl, e);
            }
        }
        return new ChromeDriver(options);
    }

    static final class SeleniumBrowserSession implements BrowserSession {
        private final WebDriver driver;
        private final Duration timeout;

        SeleniumBrowserSession(WebDriver driver, Duration timeout) {
            this.driver = driver;
            this.timeout = timeout;
        }

        @Override
        public boolean login(String loginUrl, String username, String password) {
            try {
                driver.get(loginUrl);
                WebDriverWait wait = new WebDriverWait(driver, timeout);
                WebElement usernameField = wait.until(ExpectedConditions.presenceOfElementLocated(By.id("username")));
                usernameField.sendKeys(username);
                driver.findElement(By.id("password")).sendKeys(password);
                driver.findElement(By.xpath("//button[@type='submit']")).click();
                return wait.until(d -> isLoggedIn(d.getCurrentUrl()));
            } catch (WebDriverException e) {
                log.warn("Browser login at {} failed: {}", loginUrl, e.getMessage());
                return false;
            }
        }

        @Override
        public String loadPage(String url) {
            driver.get(url);
            JavascriptExecutor js = (JavascriptExecutor) driver;
            for (int i = 0; i < SCROLL_PASSES; i++) {
                js.executeScript("window.scrollTo(0, document.body.scrollHeight);");
                try {
                    Thread.sleep(SCROLL_PAUSE_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            return driver.getPageSource();
        }

        @Override
        public void close() {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.debug("WebDriver quit failed", e);
            }
        }

        private static boolean isLoggedIn(String currentUrl) {
            if (currentUrl == null) {
                return false;
            }
            return currentUrl.contains("/feed") || currentUrl.contains("/mynetwork") || currentUrl.contains("/in/");
        }
    }
}
