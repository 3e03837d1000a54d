package com.tenderintel.tender.enrich;

/** A detail page did not open or load. Retryable. */
public class DetailPageException extends RuntimeException {

    public DetailPageException(String message) {
        super(message);
    }

    public DetailPageException(String message, Throwable cause) {
        super(message, cause);
    }
}
