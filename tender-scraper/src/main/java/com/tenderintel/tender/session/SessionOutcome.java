package com.tenderintel.tender.session;

import lombok.Value;

/**
 * Result of {@link SessionManager#ensureValidSession}. FAILED is run-fatal.
 */
@Value
public class SessionOutcome {

    public enum Status {
        REUSED,
        RENEWED,
        FAILED
    }

    Status status;
    String reason;

    public boolean isValid() {
        return status != Status.FAILED;
    }

    public static SessionOutcome reused() {
        return new SessionOutcome(Status.REUSED, null);
    }

    public static SessionOutcome renewed() {
        return new SessionOutcome(Status.RENEWED, null);
    }

    public static SessionOutcome failed(String reason) {
        return new SessionOutcome(Status.FAILED, reason);
    }
}
