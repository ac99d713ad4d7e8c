package com.sarkari.jobfeed.scrape.fetch;

import com.sarkari.jobfeed.scrape.model.ProxyEndpoint;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@Component
public class ChromeDriverFactory implements WebDriverFactory {
    private static final Logger log = LoggerFactory.getLogger(ChromeDriverFactory.class);

    /**
     * Starts a Chrome session, remote when a grid URL is configured, local otherwise. A local session
     * needs a chromedriver that Selenium Manager can resolve or the {@code webdriver.chrome.driver}
     * system property.
     */
    @Override
    public WebDriver newInstance(BrowserLaunchOptions options) {
        ChromeOptions chrome = new ChromeOptions();
        if (options.headless()) {
            chrome.addArguments("--headless=new");
        }
        chrome.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=" + options.windowWidth() + "," + options.windowHeight()
        );
        if (options.userAgent() != null) {
            chrome.addArguments("--user-agent=" + options.userAgent());
        }
        ProxyEndpoint proxy = options.proxy();
        if (proxy != null) {
            String scheme = proxy.type().name().toLowerCase(Locale.ROOT);
            chrome.addArguments("--proxy-server=" + scheme + "://" + proxy.hostPort());
            if (proxy.hasCredentials()) {
                log.warn("Chrome ignores proxy credentials passed on the command line, proxy {} may reject requests", proxy.hostPort());
            }
        }
        if (options.blockResources()) {
            Map<String, Object> prefs = new HashMap<>();
            prefs.put("profile.managed_default_content_settings.images", 2);
            prefs.put("profile.managed_default_content_settings.fonts", 2);
            prefs.put("profile.managed_default_content_settings.media_stream", 2);
            chrome.setExperimentalOption("prefs", prefs);
            chrome.addArguments("--blink-settings=imagesEnabled=false", "--mute-audio");
        }

        WebDriver driver;
        if (options.remoteUrl() != null) {
            try {
                driver = new RemoteWebDriver(URI.create(options.remoteUrl()).toURL(), chrome);
            } catch (MalformedURLException | IllegalArgumentException e) {
                throw new IllegalStateException("Invalid Selenium grid URL " + options.remoteUrl(), e);
            }
        } else {
            driver = new ChromeDriver(chrome);
        }
        driver.manage().timeouts().pageLoadTimeout(options.pageLoadTimeout());
        return driver;
    }
}
