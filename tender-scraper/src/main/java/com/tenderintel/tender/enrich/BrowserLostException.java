package com.tenderintel.tender.enrich;

/** The browser or the listing page is gone; nothing further can be enriched this run. */
public class BrowserLostException extends RuntimeException {

    public BrowserLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
