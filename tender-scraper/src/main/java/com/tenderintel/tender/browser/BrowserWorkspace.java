package com.tenderintel.tender.browser;

import com.tenderintel.tender.enrich.DetailPortal;
import com.tenderintel.tender.harvest.ListingSource;
import com.tenderintel.tender.session.LoginPortal;

/**
 * One browser session for one run. All three views share the same page and cookies,
 * so a login performed through {@link #loginPortal()} authenticates the other two.
 */
public interface BrowserWorkspace extends AutoCloseable {

    LoginPortal loginPortal();

    ListingSource listingSource();

    DetailPortal detailPortal();

    @Override
    void close();
}
