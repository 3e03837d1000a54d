package com.tenderintel.tender.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.enrich.DetailPortal;
import com.tenderintel.tender.harvest.ListingSource;
import com.tenderintel.tender.session.LoginPortal;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class PlaywrightWorkspace implements BrowserWorkspace {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final LoginPortal loginPortal;
    private final ListingSource listingSource;
    private final DetailPortal detailPortal;

    PlaywrightWorkspace(Playwright playwright, Browser browser, BrowserContext context, Page page,
                        TenderScraperProperties properties) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.loginPortal = new PlaywrightLoginPortal(page, context, properties);
        this.listingSource = new PlaywrightListingSource(page, properties);
        this.detailPortal = new PlaywrightDetailPortal(page, context, properties);
    }

    @Override
    public LoginPortal loginPortal() {
        return loginPortal;
    }

    @Override
    public ListingSource listingSource() {
        return listingSource;
    }

    @Override
    public DetailPortal detailPortal() {
        return detailPortal;
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException e) {
            log.warn("Browser did not close cleanly: {}", e.getMessage());
        } finally {
            playwright.close();
        }
        log.info("Browser closed");
    }
}
