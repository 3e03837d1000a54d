package com.tenderintel.tender.harvest;

import java.util.List;

/**
 * Raw text of one listing table row plus the attributes of its "View Tender Details" control.
 *
 * @param cells                trimmed inner text of every cell, in column order
 * @param detailControlPresent whether the actions column carries the detail control at all
 * @param detailOnclick        onclick of the control's link, may be null
 * @param detailHref           href of the control's link, may be null
 */
public record ListingRow(List<String> cells, boolean detailControlPresent,
                         String detailOnclick, String detailHref) {

    public String cell(int index) {
        if (index >= cells.size()) return "";
        String text = cells.get(index);
        return text == null ? "" : text.trim();
    }

    public int cellCount() {
        return cells.size();
    }
}
