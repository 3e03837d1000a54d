package com.tenderintel.tender.scheduler;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.RunMode;
import com.tenderintel.tender.service.RunFailedException;
import com.tenderintel.tender.service.TenderScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line surface.
 *
 *   --run-now     one scrape, exit 0 on success and 1 on failure
 *   --test-login  headed login only, console OTP entry allowed
 *
 * Without either flag the application keeps running for the scheduler and the webhook.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String RUN_NOW = "run-now";
    static final String TEST_LOGIN = "test-login";

    private final TenderScrapeService scrapeService;
    private final TenderScraperProperties properties;

    private volatile boolean oneShot;
    private volatile int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(TEST_LOGIN)) {
            oneShot = true;
            exitCode = scrapeService.testLogin().isSuccess() ? 0 : 1;
        } else if (args.containsOption(RUN_NOW)) {
            oneShot = true;
            // a headed run has someone watching who can type the OTP
            RunMode mode = properties.getBrowser().isHeadless() ? RunMode.UNATTENDED : RunMode.INTERACTIVE;
            try {
                scrapeService.runOnce(mode);
                exitCode = 0;
            } catch (RunFailedException | IllegalStateException e) {
                log.error("Run failed: {}", e.getMessage());
                exitCode = 1;
            }
        }
    }

    public boolean isOneShot() {
        return oneShot;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
