package com.tenderintel.tender.util;

import com.tenderintel.tender.config.TenderScraperProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Sleeps a random duration between the configured min and max delay so page
 * requests never arrive at a perfectly regular interval.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RandomDelayPacer implements Pacer {

    private final TenderScraperProperties properties;

    @Override
    public void pause() {
        long min = properties.getScraping().getMinDelay().toMillis();
        long max = properties.getScraping().getMaxDelay().toMillis();
        long delay = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
        log.debug("Waiting {}ms before next page...", delay);
        sleepMs(delay);
    }

    private void sleepMs(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
