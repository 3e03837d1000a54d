package com.tenderintel.tender.enrich;

import com.tenderintel.tender.model.TenderRecord;

public interface DetailPortal {

    /**
     * Open the authenticated detail view using the record's navigation hint.
     *
     * @throws DetailPageException   the page could not be opened; may be retried
     * @throws BrowserLostException  the browser went away
     */
    DetailView open(TenderRecord record);
}
