package com.tenderintel.tender.session;

import lombok.Value;

@Value
public class LoginOutcome {

    boolean success;
    int attempts;
    String reason;

    public static LoginOutcome succeeded(int attempts) {
        return new LoginOutcome(true, attempts, null);
    }

    public static LoginOutcome failed(int attempts, String reason) {
        return new LoginOutcome(false, attempts, reason);
    }
}
