package com.tenderintel.tender.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.AriaRole;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.harvest.ListingRow;
import com.tenderintel.tender.harvest.ListingSource;
import com.tenderintel.tender.session.PortalException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * The public tender search page. The data table is nested inside a wrapper table that also
 * holds the search form, so the smallest table containing the expected headers is used.
 */
@Slf4j
class PlaywrightListingSource implements ListingSource {

    private static final String TAB_ALL_ACTIVE = "All Active Tenders";
    private static final String DETAIL_ICON = "img[title=\"View Tender Details\"]";
    private static final int COL_ACTIONS = 7;

    private final Page page;
    private final TenderScraperProperties properties;

    PlaywrightListingSource(Page page, TenderScraperProperties properties) {
        this.page = page;
        this.properties = properties;
    }

    @Override
    public void open() {
        try {
            String url = page.url().toLowerCase(Locale.ROOT);
            if (url.contains("search")) {
                log.info("Already on the Search Tender page, skipping navigation");
            } else {
                PageSupport.navigate(page, properties.getPortal().getSearchUrl(),
                        properties.getBrowser().getNavigationTimeout());
                PageSupport.settle(page, properties.getBrowser().getSettleDelay());
            }
            selectAllActiveTab();
            Locator count = page.getByText("Tender search results");
            if (count.count() > 0) {
                log.info("Results count: {}", count.first().innerText().trim());
            }
        } catch (PlaywrightException e) {
            throw new PortalException("Could not open tender listing: " + e.getMessage(), e);
        }
    }

    @Override
    public List<ListingRow> currentRows() {
        Locator table;
        try {
            table = listingTable();
        } catch (PlaywrightException e) {
            log.error("Failed to locate listing table: {}", e.getMessage());
            return List.of();
        }
        if (table == null) {
            log.warn("Could not find the tender listing table");
            return List.of();
        }

        Locator rows = table.locator("tr");
        int rowCount = rows.count();
        log.debug("Found {} rows in table", rowCount);

        List<ListingRow> result = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            try {
                Locator cells = rows.nth(i).locator("td");
                List<String> texts = cells.allInnerTexts();
                if (texts.size() < 7) {
                    continue;
                }
                result.add(toRow(cells, texts));
            } catch (PlaywrightException e) {
                log.warn("Failed to parse row {}: {}", i, e.getMessage());
            }
        }
        return result;
    }

    @Override
    public boolean nextPage() {
        try {
            for (String text : List.of("Next", "»", ">")) {
                Locator next = page.getByRole(AriaRole.LINK, new Page.GetByRoleOptions().setName(text));
                if (next.count() > 0) {
                    Locator link = next.first();
                    String classes = link.getAttribute("class");
                    if (classes != null && classes.toLowerCase(Locale.ROOT).contains("disabled")) {
                        return false;
                    }
                    link.click();
                    PageSupport.settle(page, properties.getBrowser().getSettleDelay());
                    return true;
                }
            }
            Locator button = page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName("Next"));
            if (button.count() > 0) {
                button.first().click();
                PageSupport.settle(page, properties.getBrowser().getSettleDelay());
                return true;
            }
        } catch (PlaywrightException e) {
            log.warn("Pagination click failed: {}", e.getMessage());
        }
        return false;
    }

    private ListingRow toRow(Locator cells, List<String> texts) {
        List<String> trimmed = texts.stream().map(String::trim).toList();
        if (texts.size() <= COL_ACTIONS) {
            return new ListingRow(trimmed, false, null, null);
        }
        Locator icon = cells.nth(COL_ACTIONS).locator(DETAIL_ICON);
        if (icon.count() == 0) {
            return new ListingRow(trimmed, false, null, null);
        }
        Locator link = icon.locator("xpath=ancestor::a[1]");
        if (link.count() == 0) {
            return new ListingRow(trimmed, false, null, null);
        }
        return new ListingRow(trimmed, true, link.getAttribute("onclick"), link.getAttribute("href"));
    }

    private Locator listingTable() {
        Locator tables = page.locator("table");
        int count = tables.count();
        Locator best = null;
        int bestLength = Integer.MAX_VALUE;
        for (int i = 0; i < count; i++) {
            Locator table = tables.nth(i);
            String text = table.innerText();
            if (text.contains("Tender No") && text.contains("Deptt") && text.length() < bestLength) {
                bestLength = text.length();
                best = table;
            }
        }
        return best;
    }

    private void selectAllActiveTab() {
        log.info("Selecting '{}' tab...", TAB_ALL_ACTIVE);
        List<Supplier<Locator>> strategies = List.of(
                () -> page.getByText(TAB_ALL_ACTIVE, new Page.GetByTextOptions().setExact(true)),
                () -> page.getByRole(AriaRole.LINK, new Page.GetByRoleOptions().setName(TAB_ALL_ACTIVE)),
                () -> page.getByRole(AriaRole.BUTTON, new Page.GetByRoleOptions().setName(TAB_ALL_ACTIVE)),
                () -> page.getByText("All Active"));

        boolean clicked = false;
        for (Supplier<Locator> strategy : strategies) {
            try {
                Locator tab = strategy.get();
                if (tab.count() > 0) {
                    tab.first().click();
                    clicked = true;
                    break;
                }
            } catch (PlaywrightException e) {
                log.debug("Tab strategy failed: {}", e.getMessage());
            }
        }
        if (!clicked) {
            log.warn("Could not find '{}' tab, proceeding with current view", TAB_ALL_ACTIVE);
        }

        page.waitForTimeout(5000);
        if (page.getByText("No Results Found").count() > 0) {
            log.warn("'No Results Found' displayed, tab may not have loaded correctly");
        }
    }
}
