package com.tenderintel.tender.enrich;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.AttachedDocument;
import com.tenderintel.tender.model.TenderRecord;
import com.tenderintel.tender.testutil.TestDataFactory;
import com.tenderintel.tender.util.Pacer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.tenderintel.tender.testutil.TestDataFactory.createDocument;
import static com.tenderintel.tender.testutil.TestDataFactory.tenders;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DetailEnricherTest {

    @Mock
    private Pacer pacer;

    private TenderScraperProperties properties;
    private DetailEnricher enricher;
    private ScriptedPortal portal;

    @BeforeEach
    void setUp() {
        properties = TestDataFactory.fastProperties();
        enricher = new DetailEnricher(new DetailFieldExtractor(), new PrimaryDocumentResolver(properties),
                pacer, properties);
        portal = new ScriptedPortal();
    }

    /** Answers with a loaded page unless a tender has queued behaviours. */
    private static final class ScriptedPortal implements DetailPortal {

        private final Map<String, Deque<Supplier<DetailView>>> scripts = new HashMap<>();
        private final Map<String, Integer> opens = new HashMap<>();
        private final List<FakeDetailView> served = new ArrayList<>();

        @SafeVarargs
        final void script(String tenderNo, Supplier<DetailView>... behaviours) {
            scripts.put(tenderNo, new ArrayDeque<>(List.of(behaviours)));
        }

        int opens(String tenderNo) {
            return opens.getOrDefault(tenderNo, 0);
        }

        FakeDetailView page(String tenderNo) {
            FakeDetailView view = new FakeDetailView()
                    .label("Estimated Value", "10,00,000")
                    .label("Tender Type", "Open");
            view.scriptUrl = "/ireps/upload/pdfdocs/" + tenderNo + ".pdf";
            view.documents = new ArrayList<>(List.of(createDocument(tenderNo + "-annex")));
            served.add(view);
            return view;
        }

        @Override
        public DetailView open(TenderRecord record) {
            String tenderNo = record.getTenderNo();
            opens.merge(tenderNo, 1, Integer::sum);
            Deque<Supplier<DetailView>> queue = scripts.get(tenderNo);
            if (queue != null && !queue.isEmpty()) {
                return queue.poll().get();
            }
            return page(tenderNo);
        }
    }

    private static Supplier<DetailView> failing(String message) {
        return () -> {
            throw new DetailPageException(message);
        };
    }

    private static Supplier<DetailView> redirect() {
        return () -> {
            FakeDetailView view = new FakeDetailView();
            view.redirect = true;
            return view;
        };
    }

    private static void alwaysFail(ScriptedPortal portal, String tenderNo) {
        portal.script(tenderNo, failing("Timeout"), failing("Timeout"), failing("Timeout"));
    }

    @Test
    void enrich_allPagesLoad_recordsEnrichedAndPagesClosed() {
        List<TenderRecord> records = tenders("T-1", "T-2", "T-3");

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentResult.Outcome.COMPLETED);
        assertThat(result.getEnriched()).isEqualTo(3);
        assertThat(result.getFailed()).isZero();
        TenderRecord first = result.getRecords().get(0);
        assertThat(first.getEstimatedValue()).isEqualTo("10,00,000");
        assertThat(first.getTenderType()).isEqualTo("Open");
        assertThat(first.getTenderDocDownloadUrl()).isEqualTo("https://www.ireps.gov.in/ireps/upload/pdfdocs/T-1.pdf");
        assertThat(first.getAttachedDocuments()).extracting(AttachedDocument::getFileName).containsExactly("T-1-annex.pdf");
        assertThat(portal.served).allMatch(view -> view.closed);
        verify(pacer, times(2)).pause();
    }

    @Test
    void enrich_consecutiveFailures_breakerOpensAndRestAreMarkedEmpty() {
        List<TenderRecord> records = tenders("T-1", "T-2", "T-3", "T-4", "T-5");
        records.forEach(r -> r.setAttachedDocuments(new ArrayList<>(List.of(createDocument("stale")))));
        alwaysFail(portal, "T-1");
        alwaysFail(portal, "T-2");
        alwaysFail(portal, "T-3");

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentResult.Outcome.CIRCUIT_OPEN);
        assertThat(result.getRecords()).hasSize(5);
        assertThat(result.getFailed()).isEqualTo(3);
        assertThat(portal.opens("T-1")).isEqualTo(3);
        assertThat(portal.opens("T-4")).isZero();
        assertThat(result.getRecords()).allSatisfy(record -> {
            assertThat(record.getAttachedDocuments()).isEmpty();
            assertThat(record.getTenderDocDownloadUrl()).isNull();
        });
    }

    @Test
    void enrich_sporadicFailures_neverTripBreaker() {
        List<TenderRecord> records = tenders("T-1", "T-2", "T-3", "T-4", "T-5");
        alwaysFail(portal, "T-1");
        alwaysFail(portal, "T-2");
        alwaysFail(portal, "T-4");
        alwaysFail(portal, "T-5");

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentResult.Outcome.COMPLETED);
        assertThat(result.getEnriched()).isEqualTo(1);
        assertThat(result.getFailed()).isEqualTo(4);
        assertThat(records.get(2).getTenderDocDownloadUrl()).isNotNull();
    }

    @Test
    void enrich_transientFailure_recoveredByRetry() {
        List<TenderRecord> records = tenders("T-1");
        portal.script("T-1", failing("net::ERR_ABORTED"), failing("net::ERR_ABORTED"));

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getEnriched()).isEqualTo(1);
        assertThat(portal.opens("T-1")).isEqualTo(3);
        verify(pacer, never()).pause();
    }

    @Test
    void enrich_loginRedirect_stopsWithPartialResults() {
        List<TenderRecord> records = tenders("T-1", "T-2", "T-3");
        portal.script("T-2", redirect());

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentResult.Outcome.SESSION_EXPIRED);
        assertThat(result.getEnriched()).isEqualTo(1);
        assertThat(portal.opens("T-2")).isEqualTo(1);
        assertThat(portal.opens("T-3")).isZero();
        assertThat(records.get(0).getTenderDocDownloadUrl()).isNotNull();
        assertThat(records.get(2).getAttachedDocuments()).isEmpty();
    }

    @Test
    void enrich_browserLost_notRetriedAndStopsStage() {
        List<TenderRecord> records = tenders("T-1", "T-2");
        portal.script("T-1", () -> {
            throw new BrowserLostException("Target page, context or browser has been closed", null);
        });

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentResult.Outcome.BROWSER_LOST);
        assertThat(portal.opens("T-1")).isEqualTo(1);
        assertThat(portal.opens("T-2")).isZero();
        assertThat(result.getRecords()).hasSize(2);
    }

    @Test
    void enrich_missingNavigationHint_countedAsFailureWithoutOpening() {
        List<TenderRecord> records = tenders("T-1", "T-2");
        records.get(0).setDetailUrl("");

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentResult.Outcome.COMPLETED);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getEnriched()).isEqualTo(1);
        assertThat(portal.opens("T-1")).isZero();
        assertThat(records.get(0).getAttachedDocuments()).isEmpty();
    }

    @Test
    void enrich_pageWithoutDocuments_stillCountsAsEnriched() {
        List<TenderRecord> records = tenders("T-1");
        portal.script("T-1", FakeDetailView::new);

        EnrichmentResult result = enricher.enrich(records, portal);

        assertThat(result.getEnriched()).isEqualTo(1);
        assertThat(records.get(0).getTenderDocDownloadUrl()).isNull();
        assertThat(records.get(0).getAttachedDocuments()).isEmpty();
    }

    @Test
    void consecutiveFailureBreaker_successResetsStreak() {
        CircuitBreaker breaker = DetailEnricher.consecutiveFailureBreaker(2);
        RuntimeException failure = new DetailPageException("x");

        breaker.onError(0, TimeUnit.NANOSECONDS, failure);
        breaker.onSuccess(0, TimeUnit.NANOSECONDS);
        breaker.onError(0, TimeUnit.NANOSECONDS, failure);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        breaker.onError(0, TimeUnit.NANOSECONDS, failure);
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }
}
