package com.tenderintel.tender.session;

/** A page step could not be completed (element missing, navigation timeout, ...). */
public class PortalException extends RuntimeException {

    public PortalException(String message) {
        super(message);
    }

    public PortalException(String message, Throwable cause) {
        super(message, cause);
    }
}
