package com.tenderintel.tender.session;

import java.nio.file.Path;

/**
 * Browser-facing steps of the portal's "Authenticate Yourself" flow.
 * Implementations throw {@link PortalException} when a step cannot be performed.
 */
public interface LoginPortal {

    /** Load a protected page and report whether the current session is still logged in. */
    boolean verifySession();

    void openLoginPage();

    void fillCredential(String mobile);

    /**
     * Screenshot of the verification-code image.
     *
     * @param refresh ask the portal for a new image first (retries)
     */
    byte[] captureChallenge(boolean refresh);

    void fillChallengeAnswer(String answer);

    /**
     * Click "Get OTP".
     *
     * @return false if the portal rejected the verification code
     */
    boolean requestOtp();

    void submitOtp(String otp);

    /** After {@link #submitOtp}: true if the login form is gone. */
    boolean isAuthenticated();

    void saveSession(Path sessionFile);
}
