package com.tenderintel.tender.otp;

import java.util.Optional;

/**
 * Last-resort OTP source: ask the person at the console.
 */
public interface ManualOtpPrompt {

    Optional<String> prompt();
}
