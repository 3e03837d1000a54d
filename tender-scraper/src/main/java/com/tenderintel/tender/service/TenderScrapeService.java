package com.tenderintel.tender.service;

import com.tenderintel.tender.browser.BrowserWorkspace;
import com.tenderintel.tender.browser.BrowserWorkspaceFactory;
import com.tenderintel.tender.change.ChangeDetector;
import com.tenderintel.tender.change.MergeMode;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.enrich.DetailEnricher;
import com.tenderintel.tender.enrich.EnrichmentResult;
import com.tenderintel.tender.harvest.ListingHarvester;
import com.tenderintel.tender.model.ChangeReport;
import com.tenderintel.tender.model.ChangeSummary;
import com.tenderintel.tender.model.RunMode;
import com.tenderintel.tender.model.ScrapeRun;
import com.tenderintel.tender.model.TenderRecord;
import com.tenderintel.tender.output.OutputRouter;
import com.tenderintel.tender.session.LoginFlow;
import com.tenderintel.tender.session.LoginOutcome;
import com.tenderintel.tender.session.SessionManager;
import com.tenderintel.tender.session.SessionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one scrape cycle: session, listing, detail enrichment, change detection,
 * reports, snapshot commit.
 *
 * Only one run at a time. A failed session is run-fatal; a failed enrichment stage is not,
 * the run continues with the listing data. The snapshot is committed only after the
 * change report has been written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TenderScrapeService {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BrowserWorkspaceFactory workspaceFactory;
    private final SessionManager sessionManager;
    private final LoginFlow loginFlow;
    private final ListingHarvester harvester;
    private final DetailEnricher enricher;
    private final ChangeDetector changeDetector;
    private final OutputRouter outputRouter;
    private final HealthNotifier healthNotifier;
    private final TenderScraperProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ScrapeRun> lastRun = new AtomicReference<>();

    public boolean isRunning() {
        return running.get();
    }

    public Optional<ScrapeRun> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    /**
     * Execute one full cycle.
     *
     * @throws IllegalStateException when another run is in progress
     * @throws RunFailedException    when the run could not complete
     */
    public ScrapeRun runOnce(RunMode mode) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A scrape run is already in progress");
        }

        LocalDateTime started = LocalDateTime.now(clock);
        String stamp = started.format(STAMP);
        ScrapeRun run = ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(started)
                .status("RUNNING")
                .build();
        lastRun.set(run);

        log.info("==========================================");
        log.info("SCRAPE RUN STARTED at {} ({} mode)", started, mode);
        log.info("==========================================");

        ChangeReport report = null;
        try {
            report = execute(run, mode, stamp);
            return run;
        } catch (RuntimeException e) {
            log.error("Scrape run failed: {}", e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            healthNotifier.failure("Scrape run FAILED: " + e.getMessage());
            throw e instanceof RunFailedException failed ? failed : new RunFailedException(e.getMessage(), e);
        } finally {
            run.setCompletedAt(LocalDateTime.now(clock));
            outputRouter.writeScrapeRun(run, report, stamp);
            running.set(false);
        }
    }

    /** Headed login only, with console OTP entry allowed. Used by --test-login. */
    public LoginOutcome testLogin() {
        log.info("=== TEST LOGIN MODE (headed) ===");
        try (BrowserWorkspace workspace = workspaceFactory.open(false)) {
            LoginOutcome outcome = loginFlow.login(workspace.loginPortal(), RunMode.INTERACTIVE);
            if (outcome.isSuccess()) {
                log.info("Login test PASSED, session saved");
            } else {
                log.error("Login test FAILED: {}", outcome.getReason());
            }
            return outcome;
        }
    }

    private ChangeReport execute(ScrapeRun run, RunMode mode, String stamp) {
        try (BrowserWorkspace workspace = workspaceFactory.open(properties.getBrowser().isHeadless())) {

            log.info("Step 1: Ensuring valid session...");
            SessionOutcome session = sessionManager.ensureValidSession(workspace.loginPortal(), mode);
            if (!session.isValid()) {
                throw new RunFailedException("No valid portal session: " + session.getReason());
            }
            log.info("Session {}", session.getStatus());

            log.info("Step 2: Scraping tenders...");
            List<TenderRecord> records = harvester.harvestAll(workspace.listingSource());
            run.setRecordsFound(records.size());
            if (records.isEmpty()) {
                log.warn("No tenders scraped, skipping enrichment, export and memory update");
                run.setStatus("SKIPPED");
                return null;
            }

            records = enrich(records, workspace, run);

            log.info("Step 3: Detecting changes...");
            ChangeReport report = changeDetector.detect(records);
            run.setSummary(report.getSummary());
            outputRouter.writeReport(report, stamp);

            log.info("Step 4: Updating memory...");
            MergeMode mergeMode = properties.getStorage().isCleanOverwrite() ? MergeMode.OVERWRITE : MergeMode.MERGE;
            changeDetector.commit(records, mergeMode);

            run.setStatus("SUCCESS");
            complete(run, report.getSummary());
            return report;
        }
    }

    private List<TenderRecord> enrich(List<TenderRecord> records, BrowserWorkspace workspace, ScrapeRun run) {
        try {
            EnrichmentResult result = enricher.enrich(records, workspace.detailPortal());
            run.setRecordsEnriched(result.getEnriched());
            run.setEnrichmentOutcome(result.getOutcome().name());
            log.info("Phase 2 complete: {} of {} tenders enriched ({})",
                    result.getEnriched(), records.size(), result.getOutcome());
            return result.getRecords();
        } catch (RuntimeException e) {
            log.error("Phase 2 failed entirely: {}, continuing with listing data only", e.getMessage(), e);
            run.setEnrichmentOutcome("ABORTED");
            records.forEach(TenderRecord::markEnrichmentMissing);
            return records;
        }
    }

    private void complete(ScrapeRun run, ChangeSummary summary) {
        long elapsed = Duration.between(run.getStartedAt(), LocalDateTime.now(clock)).toSeconds();
        log.info("==========================================");
        log.info("SCRAPE RUN COMPLETE in {}s", elapsed);
        log.info("  Total: {} | New: {} | Updated: {} | Status Changed: {} | Unchanged: {}",
                summary.getTotalScraped(), summary.getNewCount(), summary.getUpdatedCount(),
                summary.getStatusChangedCount(), summary.getUnchangedCount());
        log.info("==========================================");

        healthNotifier.success(String.format("Scrape completed in %ds: %d tenders (%d new, %d updated, %d status changed)",
                elapsed, summary.getTotalScraped(), summary.getNewCount(), summary.getUpdatedCount(),
                summary.getStatusChangedCount()));
    }
}
