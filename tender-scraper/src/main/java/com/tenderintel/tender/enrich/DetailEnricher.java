package com.tenderintel.tender.enrich;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.AttachedDocument;
import com.tenderintel.tender.model.TenderRecord;
import com.tenderintel.tender.util.BoundedRetry;
import com.tenderintel.tender.util.Pacer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Phase 2: opens each record's authenticated detail view and fills in detail scalars,
 * attachments and the primary document URL.
 *
 * Never discards input records. Per-record failures are retried with backoff and then
 * counted by a consecutive-failure breaker; once it opens, the remaining records are left
 * unenriched. A login redirect or a lost browser stops the stage with partial results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetailEnricher {

    private final DetailFieldExtractor fieldExtractor;
    private final PrimaryDocumentResolver documentResolver;
    private final Pacer pacer;
    private final TenderScraperProperties properties;

    private enum PageResult { ENRICHED, SESSION_EXPIRED }

    public EnrichmentResult enrich(List<TenderRecord> records, DetailPortal portal) {
        TenderScraperProperties.Scraping scraping = properties.getScraping();
        CircuitBreaker breaker = consecutiveFailureBreaker(scraping.getMaxConsecutiveFailures());
        Retry retry = BoundedRetry.of("detail-page", scraping.getMaxRetries(), scraping.getRetryBaseDelay(),
                e -> !(e instanceof BrowserLostException));

        Set<TenderRecord> enriched = Collections.newSetFromMap(new IdentityHashMap<>());
        int failed = 0;
        EnrichmentResult.Outcome outcome = EnrichmentResult.Outcome.COMPLETED;
        int total = records.size();

        log.info("Phase 2: Enriching {} tenders from detail pages...", total);

        for (int i = 0; i < total; i++) {
            TenderRecord record = records.get(i);
            String tenderNo = record.getTenderNo();
            log.info("  Detail {}/{}: {}", i + 1, total, tenderNo);

            if (record.getDetailUrl() == null || record.getDetailUrl().isBlank()) {
                log.warn("CLICK_FAILED: no detail navigation hint for tender {}", tenderNo);
                failed++;
                if (recordFailure(breaker, new DetailPageException("missing navigation hint"))) {
                    outcome = EnrichmentResult.Outcome.CIRCUIT_OPEN;
                    break;
                }
                continue;
            }

            try {
                PageResult result = retry.executeSupplier(() -> enrichOne(record, portal));
                if (result == PageResult.SESSION_EXPIRED) {
                    log.warn("Session expired during detail scraping, returning partial results");
                    outcome = EnrichmentResult.Outcome.SESSION_EXPIRED;
                    break;
                }
                enriched.add(record);
                breaker.onSuccess(0, TimeUnit.NANOSECONDS);
            } catch (BrowserLostException e) {
                log.error("Browser/page crashed: {}, aborting Phase 2", e.getMessage());
                outcome = EnrichmentResult.Outcome.BROWSER_LOST;
                break;
            } catch (RuntimeException e) {
                log.warn("    Detail failed for {} after {} attempt(s): {}",
                        tenderNo, scraping.getMaxRetries(), e.getMessage());
                failed++;
                if (recordFailure(breaker, e)) {
                    outcome = EnrichmentResult.Outcome.CIRCUIT_OPEN;
                    break;
                }
            }

            if (i < total - 1) {
                pacer.pause();
            }
        }

        for (TenderRecord record : records) {
            if (!enriched.contains(record)) {
                record.markEnrichmentMissing();
            }
        }

        log.info("Detail scraping: {} enriched, {} failed out of {} ({})", enriched.size(), failed, total, outcome);
        return new EnrichmentResult(records, outcome, enriched.size(), failed);
    }

    private PageResult enrichOne(TenderRecord record, DetailPortal portal) {
        try (DetailView view = portal.open(record)) {
            if (view.isAuthenticationRedirect()) {
                return PageResult.SESSION_EXPIRED;
            }

            Map<String, String> detail = fieldExtractor.extract(view.labels(), record.getTenderTitle());
            List<AttachedDocument> documents = attachments(view, record.getTenderNo());
            Optional<String> primary = documentResolver.resolve(view);

            detail.forEach(record::applyDetail);
            record.setTenderDocDownloadUrl(primary.orElse(null));
            record.setAttachedDocuments(documents);

            log.info("    Collected tender_doc={}, {} attached doc(s) for {}",
                    primary.isPresent() ? "YES" : "NO", documents.size(), record.getTenderNo());
            if (view.looksLoaded() && primary.isEmpty() && documents.isEmpty()) {
                log.warn("    EMPTY_DOCS: {} page loaded OK but tender_doc=null and attached_documents=[], "
                        + "needs manual check", record.getTenderNo());
            }
            return PageResult.ENRICHED;
        }
    }

    private List<AttachedDocument> attachments(DetailView view, String tenderNo) {
        try {
            return new ArrayList<>(view.attachedDocuments());
        } catch (BrowserLostException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("    Could not extract attached documents for {}: {}", tenderNo, e.getMessage());
            return new ArrayList<>();
        }
    }

    /** @return true once the breaker has opened */
    private boolean recordFailure(CircuitBreaker breaker, Throwable cause) {
        breaker.onError(0, TimeUnit.NANOSECONDS, cause);
        if (breaker.getState() == CircuitBreaker.State.OPEN) {
            log.error("{} consecutive failures, aborting Phase 2",
                    properties.getScraping().getMaxConsecutiveFailures());
            return true;
        }
        return false;
    }

    /** Opens after {@code limit} failures in a row; any success resets the streak. */
    static CircuitBreaker consecutiveFailureBreaker(int limit) {
        int window = Math.max(1, limit);
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(window)
                .minimumNumberOfCalls(window)
                .failureRateThreshold(100f)
                .build();
        return CircuitBreaker.of("detail-enrichment", config);
    }
}
