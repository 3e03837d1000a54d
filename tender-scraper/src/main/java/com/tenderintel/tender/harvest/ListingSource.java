package com.tenderintel.tender.harvest;

import java.util.List;

/** The paginated public tender listing, one page visible at a time. */
public interface ListingSource {

    /** Navigate to the listing and select the "All Active Tenders" view. */
    void open();

    /** Rows of the data table on the current page; empty when the table cannot be found. */
    List<ListingRow> currentRows();

    /** Advance to the next page. False when there is none. */
    boolean nextPage();
}
