package com.tenderintel.tender.enrich;

import com.tenderintel.tender.model.AttachedDocument;

import java.util.List;
import java.util.Optional;

/** An opened, authenticated detail page of one tender. Closing it never closes the listing. */
public interface DetailView extends AutoCloseable {

    /** The portal answered with its login form instead of the detail page. */
    boolean isAuthenticationRedirect();

    /** The page reached the expected detail URL. */
    boolean looksLoaded();

    LabelResolver labels();

    /** Rows of the attachment table with resolved absolute URLs, de-duplicated by URL. */
    List<AttachedDocument> attachedDocuments();

    /** Primary document URL read from the literal in the download script, if present. */
    Optional<String> primaryDocumentFromScript();

    /** Primary document URL captured from the navigation the download control triggers. */
    Optional<String> primaryDocumentFromNavigation();

    @Override
    void close();
}
