package com.sarkari.jobfeed.scrape.fetch;

import org.openqa.selenium.WebDriver;

public interface WebDriverFactory {

    WebDriver newInstance(BrowserLaunchOptions options);
}
