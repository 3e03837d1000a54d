package com.tenderintel.tender.service;

/** A run could not complete; the snapshot was left untouched. */
public class RunFailedException extends RuntimeException {

    public RunFailedException(String message) {
        super(message);
    }

    public RunFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
