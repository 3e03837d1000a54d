package com.tenderintel.tender.browser;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitUntilState;
import com.tenderintel.tender.enrich.BrowserLostException;

import java.time.Duration;
import java.util.Locale;

/** Small helpers shared by the page adapters. */
final class PageSupport {

    static final String AUTH_MARKER = "Authenticate Yourself";

    private PageSupport() {
    }

    static void navigate(Page page, String url, Duration timeout) {
        page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout(timeout.toMillis()));
    }

    static void settle(Page page, Duration delay) {
        page.waitForTimeout(delay.toMillis());
    }

    static boolean showsLoginForm(Page page) {
        return page.getByText(AUTH_MARKER).count() > 0;
    }

    /** Playwright reports a dead page or browser as "Target closed" / "... has been closed". */
    static boolean isBrowserLost(PlaywrightException e) {
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        return message.contains("closed") || message.contains("target");
    }

    static RuntimeException lostOr(PlaywrightException e, RuntimeException otherwise) {
        return isBrowserLost(e) ? new BrowserLostException(e.getMessage(), e) : otherwise;
    }
}
