package com.tenderintel.tender.otp;

import java.time.Instant;

/**
 * A delivered one-time code and when it arrived. The portal reuses the same code
 * for a day, so arrival time, not value, decides whether a ticket answers a request.
 */
public record OtpTicket(String code, Instant receivedAt) {

    public boolean arrivedAfter(Instant instant) {
        return receivedAt.isAfter(instant);
    }
}
