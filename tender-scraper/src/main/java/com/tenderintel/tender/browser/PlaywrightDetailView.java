package com.tenderintel.tender.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.enrich.DetailView;
import com.tenderintel.tender.enrich.LabelResolver;
import com.tenderintel.tender.model.AttachedDocument;
import com.tenderintel.tender.util.LinkResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * A detail tab. The primary document button is {@code onclick="downloadtenderDoc();"} on an
 * {@code href="#"} link, so its URL is read from the script source or from the tab it opens.
 */
@Slf4j
class PlaywrightDetailView implements DetailView {

    private static final String SCRIPT_DOCUMENT_URL = """
            () => {
                for (const script of document.querySelectorAll('script')) {
                    const text = script.textContent || '';
                    if (!text.includes('downloadtenderDoc')) continue;
                    let m = text.match(/downloadtenderDoc[^}]*window\\.open\\(['"]([^'"]+)['"]/s);
                    if (m) return m[1];
                    m = text.match(/downloadtenderDoc[^}]*\\.action\\s*=\\s*['"]([^'"]+)['"]/s);
                    if (m) return m[1];
                    m = text.match(/downloadtenderDoc[^}]*(?:href|location)\\s*=\\s*['"]([^'"]+)['"]/s);
                    if (m) return m[1];
                }
                return null;
            }
            """;

    private static final String FORM_ACTION_URL = """
            () => {
                for (const form of document.querySelectorAll('form')) {
                    if (form.action && form.action.includes('pdfdocs')) return form.action;
                }
                return null;
            }
            """;

    private final Page page;
    private final Page listingPage;
    private final BrowserContext context;
    private final TenderScraperProperties properties;

    PlaywrightDetailView(Page page, Page listingPage, BrowserContext context, TenderScraperProperties properties) {
        this.page = page;
        this.listingPage = listingPage;
        this.context = context;
        this.properties = properties;
    }

    @Override
    public boolean isAuthenticationRedirect() {
        return guarded(() -> PageSupport.showsLoginForm(page));
    }

    @Override
    public boolean looksLoaded() {
        String url = page.url();
        return url.contains("nitPublish") || url.contains("rfq");
    }

    @Override
    public LabelResolver labels() {
        return new PlaywrightLabelResolver(page);
    }

    @Override
    public List<AttachedDocument> attachedDocuments() {
        return guarded(this::readAttachmentTable);
    }

    @Override
    public Optional<String> primaryDocumentFromScript() {
        return guarded(() -> {
            Object url = page.evaluate(SCRIPT_DOCUMENT_URL);
            if (url instanceof String s && !s.isBlank()) {
                log.info("    Tender doc URL from JS source: {}", s);
                return Optional.of(s);
            }
            return Optional.empty();
        });
    }

    @Override
    public Optional<String> primaryDocumentFromNavigation() {
        return guarded(() -> {
            Locator button = page.locator(".styled-button-8").first();
            if (button.count() == 0) {
                button = page.getByText("Download Tender Doc").first();
            }
            if (button.count() == 0) {
                return Optional.empty();
            }

            Locator target = button;
            try {
                Page tab = context.waitForPage(new BrowserContext.WaitForPageOptions().setTimeout(10000), target::click);
                tab.waitForLoadState(LoadState.LOAD, new Page.WaitForLoadStateOptions().setTimeout(10000));
                String url = tab.url();
                tab.close();
                if (url != null && !url.equals("about:blank") && !url.equals("#")) {
                    log.info("    Tender doc URL from new tab: {}", url);
                    return Optional.of(url);
                }
            } catch (PlaywrightException e) {
                if (PageSupport.isBrowserLost(e)) throw e;
                log.debug("    New tab capture failed: {}", e.getMessage());
            }

            Object action = page.evaluate(FORM_ACTION_URL);
            if (action instanceof String s && !s.isBlank()) {
                log.info("    Tender doc URL from form action: {}", s);
                return Optional.of(s);
            }
            return Optional.empty();
        });
    }

    @Override
    public void close() {
        if (page == listingPage) {
            return;
        }
        try {
            page.close();
            listingPage.bringToFront();
        } catch (PlaywrightException e) {
            log.debug("Could not close detail tab: {}", e.getMessage());
        }
    }

    private List<AttachedDocument> readAttachmentTable() {
        List<AttachedDocument> documents = new ArrayList<>();
        Locator table = page.locator("#attach_docs");
        if (table.count() == 0) {
            log.debug("    No #attach_docs table found on page");
            return documents;
        }

        String baseUrl = properties.getPortal().getBaseUrl();
        Set<String> seen = new LinkedHashSet<>();
        Locator rows = table.locator("tr");
        int rowCount = rows.count();

        // row 0 is the header
        for (int i = 1; i < rowCount; i++) {
            Locator cells = rows.nth(i).locator("td");
            int cellCount = cells.count();
            if (cellCount < 2) continue;

            Locator link = cells.nth(1).locator("a").first();
            if (link.count() == 0) continue;

            String fileName = link.innerText().trim();
            Optional<String> url = LinkResolver.documentTarget(
                    link.getAttribute("onclick"), link.getAttribute("href"), baseUrl);
            if (url.isEmpty()) {
                log.debug("    Row {}: could not extract URL for '{}'", i, fileName);
                continue;
            }
            if (!seen.add(url.get())) continue;

            String description = cellCount >= 3 ? cells.nth(2).innerText().trim() : "";
            documents.add(AttachedDocument.builder()
                    .fileName(fileName)
                    .fileUrl(url.get())
                    .description(description)
                    .build());
            log.info("    + attached doc: {} -> {}", fileName, url.get());
        }
        return documents;
    }

    private <T> T guarded(Supplier<T> action) {
        try {
            return action.get();
        } catch (PlaywrightException e) {
            throw PageSupport.lostOr(e, e);
        }
    }
}
