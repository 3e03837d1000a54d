package com.tenderintel.tender.model;

/**
 * Whether a human is at the console. Only INTERACTIVE runs may fall back to typing an OTP.
 */
public enum RunMode {
    UNATTENDED,
    INTERACTIVE
}
