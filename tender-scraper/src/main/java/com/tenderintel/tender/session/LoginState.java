package com.tenderintel.tender.session;

/**
 * States of one login run. RETRY loops back to NAV_LOGIN while attempts remain;
 * SUCCESS and FAILED are terminal.
 */
public enum LoginState {
    NAV_LOGIN,
    FILL_CREDENTIAL,
    SOLVE_CHALLENGE,
    REQUEST_OTP,
    AWAIT_OTP,
    SUBMIT_OTP,
    VERIFY,
    SUCCESS,
    RETRY,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
