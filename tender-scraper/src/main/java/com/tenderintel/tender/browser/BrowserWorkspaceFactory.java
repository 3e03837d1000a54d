package com.tenderintel.tender.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.session.PortalException;
import com.tenderintel.tender.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Launches Chromium and restores the saved session state when there is one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrowserWorkspaceFactory {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    private final TenderScraperProperties properties;
    private final SessionStore sessionStore;

    public BrowserWorkspace open(boolean headless) {
        log.info("Launching browser (headless={})", headless);
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));

            Browser.NewContextOptions options = new Browser.NewContextOptions()
                    .setViewportSize(1366, 768)
                    .setUserAgent(USER_AGENT);
            if (sessionStore.exists()) {
                log.info("Restoring browser state from {}", sessionStore.path());
                options.setStorageStatePath(sessionStore.path());
            }

            BrowserContext context = browser.newContext(options);
            context.setDefaultTimeout(properties.getBrowser().getNavigationTimeout().toMillis());
            Page page = context.newPage();
            return new PlaywrightWorkspace(playwright, browser, context, page, properties);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new PortalException("Could not launch browser: " + e.getMessage(), e);
        }
    }
}
