package com.tenderintel.tender.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.enrich.DetailPageException;
import com.tenderintel.tender.enrich.DetailPortal;
import com.tenderintel.tender.enrich.DetailView;
import com.tenderintel.tender.model.TenderRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens detail pages the way the portal's own {@code postRequestNewWindow} does: a POST in a
 * new tab. A plain GET only returns the anonymous view without the documents section.
 */
@Slf4j
class PlaywrightDetailPortal implements DetailPortal {

    private static final String POST_IN_NEW_TAB = """
            url => {
                const form = document.createElement('form');
                form.method = 'post';
                form.action = url;
                form.target = '_blank';
                document.body.appendChild(form);
                form.submit();
                form.remove();
            }
            """;

    private final Page listingPage;
    private final BrowserContext context;
    private final TenderScraperProperties properties;

    PlaywrightDetailPortal(Page listingPage, BrowserContext context, TenderScraperProperties properties) {
        this.listingPage = listingPage;
        this.context = context;
        this.properties = properties;
    }

    @Override
    public DetailView open(TenderRecord record) {
        Page detail;
        try {
            detail = context.waitForPage(new BrowserContext.WaitForPageOptions().setTimeout(15000),
                    () -> listingPage.evaluate(POST_IN_NEW_TAB, record.getDetailUrl()));
        } catch (PlaywrightException e) {
            throw PageSupport.lostOr(e, new DetailPageException(
                    "Detail page for " + record.getTenderNo() + " did not open: " + e.getMessage(), e));
        }

        try {
            detail.waitForLoadState(LoadState.NETWORKIDLE, new Page.WaitForLoadStateOptions().setTimeout(15000));
        } catch (TimeoutError e) {
            log.debug("    networkidle wait timed out for {}, proceeding", record.getTenderNo());
        } catch (PlaywrightException e) {
            closeQuietly(detail);
            throw PageSupport.lostOr(e, new DetailPageException(e.getMessage(), e));
        }
        detail.waitForTimeout(2000);
        return new PlaywrightDetailView(detail, listingPage, context, properties);
    }

    private void closeQuietly(Page page) {
        try {
            page.close();
        } catch (PlaywrightException e) {
            log.debug("Could not close detail tab: {}", e.getMessage());
        }
    }
}
