package com.tenderintel.tender.util;

/**
 * Pause between requests to the portal. Injected so tests can run without sleeping.
 */
@FunctionalInterface
public interface Pacer {

    void pause();
}
