package com.tenderintel.tender.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.tenderintel.tender.enrich.LabelResolver;

import java.util.ArrayList;
import java.util.List;

class PlaywrightLabelResolver implements LabelResolver {

    private final Page page;

    PlaywrightLabelResolver(Page page) {
        this.page = page;
    }

    @Override
    public List<String> candidatesFor(String label) {
        Locator match = page.getByText(label, new Page.GetByTextOptions().setExact(true));
        if (match.count() == 0) {
            match = page.getByText(label);
            if (match.count() == 0) {
                return List.of();
            }
        }
        Locator element = match.first();

        List<String> candidates = new ArrayList<>();
        Locator row = element.locator("xpath=ancestor::tr[1]");
        if (row.count() > 0) {
            Locator cells = row.locator("td");
            if (cells.count() >= 2) {
                candidates.add(cells.nth(1).innerText());
            }
        }
        Locator sibling = element.locator("xpath=following-sibling::*[1]");
        if (sibling.count() > 0) {
            candidates.add(sibling.innerText());
        }
        return candidates;
    }
}
