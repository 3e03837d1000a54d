package com.tenderintel.tender.scheduler;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.RunMode;
import com.tenderintel.tender.service.TenderScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup scraping.
 *
 * Default schedule: 06:00, 13:00 and 19:00 India time.
 * Override with the CRON env var or tender-scraper.scheduling.cron property.
 *
 * The startup run waits for ApplicationReadyEvent so the OTP webhook is already listening.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeScheduler {

    private final TenderScrapeService scrapeService;
    private final ScrapeCommandRunner commandRunner;
    private final TenderScraperProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (commandRunner.isOneShot()) {
            return;
        }
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running scrape now");
            runSafely();
        } else {
            log.info("Scraper ready. Next scheduled run: {} ({})",
                    properties.getScheduling().getCron(), properties.getScheduling().getZone());
        }
    }

    @Scheduled(cron = "${tender-scraper.scheduling.cron:0 0 6,13,19 * * *}",
            zone = "${tender-scraper.scheduling.zone:Asia/Kolkata}")
    public void scheduledScrape() {
        log.info("Scheduled scrape triggered");
        runSafely();
    }

    private void runSafely() {
        try {
            scrapeService.runOnce(RunMode.UNATTENDED);
        } catch (Exception e) {
            log.error("Scheduled scrape failed: {}", e.getMessage());
        }
    }
}
