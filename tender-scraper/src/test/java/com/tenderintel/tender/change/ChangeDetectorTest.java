package com.tenderintel.tender.change;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.model.AttachedDocument;
import com.tenderintel.tender.model.ChangeReport;
import com.tenderintel.tender.model.ChangeType;
import com.tenderintel.tender.model.ClassifiedTender;
import com.tenderintel.tender.model.TenderRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.tenderintel.tender.testutil.TestDataFactory.createDocument;
import static com.tenderintel.tender.testutil.TestDataFactory.createTender;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeDetectorTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T06:00:00Z"), ZoneOffset.UTC);

    private SnapshotStore store;

    @BeforeEach
    void setUp() {
        store = new SnapshotStore(dir.resolve("tenders_memory.json"), mapper);
    }

    private ChangeDetector newDetector() {
        return new ChangeDetector(store, mapper, clock);
    }

    private ChangeDetector detectorWith(TenderRecord... previous) {
        ChangeDetector seeding = newDetector();
        seeding.commit(List.of(previous), MergeMode.OVERWRITE);
        return newDetector();
    }

    @Test
    void detect_unknownTender_classifiedAsNew() {
        ChangeReport report = newDetector().detect(List.of(createTender("T-1", "Active")));

        assertThat(report.getCreated()).extracting(ClassifiedTender::getTenderNo).containsExactly("T-1");
        assertThat(report.getCreated().get(0).getChangeType()).isEqualTo(ChangeType.NEW);
        assertThat(report.getCreated().get(0).getChanges()).isEmpty();
        assertThat(report.getSummary().getNewCount()).isEqualTo(1);
    }

    @Test
    void detect_identicalTender_classifiedAsUnchanged() {
        ChangeDetector detector = detectorWith(createTender("T-1", "Active"));

        ChangeReport report = detector.detect(List.of(createTender("T-1", "Active")));

        assertThat(report.getUnchanged()).hasSize(1);
        assertThat(report.getUnchanged().get(0).getChanges()).isEmpty();
    }

    @Test
    void detect_statusDiffers_statusChangedWinsOverOtherFields() {
        ChangeDetector detector = detectorWith(createTender("T-1", "Active"));
        TenderRecord scraped = createTender("T-1", "Closed");
        scraped.setDueDays("0");

        ChangeReport report = detector.detect(List.of(scraped));

        assertThat(report.getStatusChanged()).hasSize(1);
        assertThat(report.getUpdated()).isEmpty();
        ClassifiedTender classified = report.getStatusChanged().get(0);
        assertThat(classified.getOldStatus()).isEqualTo("Active");
        assertThat(classified.getNewStatus()).isEqualTo("Closed");
        assertThat(classified.getChanges()).containsOnlyKeys("status", "due_days");
    }

    @Test
    void detect_otherFieldDiffers_classifiedAsUpdated() {
        ChangeDetector detector = detectorWith(createTender("T-1", "Active"));
        TenderRecord scraped = createTender("T-1", "Active");
        scraped.setEstimatedValue("12,50,000");

        ChangeReport report = detector.detect(List.of(scraped));

        assertThat(report.getUpdated()).hasSize(1);
        assertThat(report.getUpdated().get(0).getChanges().get("estimated_value").newValue())
                .isEqualTo("12,50,000");
        assertThat(report.getUpdated().get(0).getChanges().get("estimated_value").oldValue()).isEmpty();
    }

    @Test
    void detect_nullVersusEmptyAndSurroundingWhitespace_treatedAsEqual() {
        TenderRecord previous = createTender("T-1", "Active");
        previous.setCorrigendum(null);
        ChangeDetector detector = detectorWith(previous);

        TenderRecord scraped = createTender("T-1", " Active ");
        scraped.setCorrigendum("");
        scraped.setAttachedDocuments(new ArrayList<>());

        ChangeReport report = detector.detect(List.of(scraped));

        assertThat(report.getUnchanged()).hasSize(1);
    }

    @Test
    void detect_detailUrlAndLastSeenIgnored() {
        ChangeDetector detector = detectorWith(createTender("T-1", "Active"));
        TenderRecord scraped = createTender("T-1", "Active");
        scraped.setDetailUrl("https://www.ireps.gov.in/other");
        scraped.setLastSeen("2030-01-01T00:00");

        assertThat(detector.detect(List.of(scraped)).getUnchanged()).hasSize(1);
    }

    @Test
    void detect_blankTenderNumber_skippedButCountedInTotal() {
        ChangeReport report = newDetector().detect(List.of(createTender("  ", "Active"), createTender("T-2", "Active")));

        assertThat(report.all()).extracting(ClassifiedTender::getTenderNo).containsExactly("T-2");
        assertThat(report.getSummary().getTotalScraped()).isEqualTo(2);
    }

    @Test
    void detectThenCommit_statusChangeAndNewTender_reloadedSnapshotSeesBothAsUnchanged() {
        ChangeDetector first = detectorWith(titled(createTender("T-1", "Active"), "X"));
        List<TenderRecord> scraped = List.of(
                titled(createTender("T-1", "Closed"), "X"),
                titled(createTender("T-2", "Active"), "Y"));

        ChangeReport report = first.detect(scraped);
        first.commit(scraped);

        assertThat(report.getSummary().getNewCount()).isEqualTo(1);
        assertThat(report.getSummary().getStatusChangedCount()).isEqualTo(1);
        assertThat(report.getSummary().getUpdatedCount()).isZero();
        assertThat(report.getSummary().getUnchangedCount()).isZero();
        assertThat(report.getSummary().getTotalScraped()).isEqualTo(2);
        assertThat(report.getCreated()).extracting(ClassifiedTender::getTenderNo).containsExactly("T-2");
        ClassifiedTender closed = report.getStatusChanged().get(0);
        assertThat(closed.getTenderNo()).isEqualTo("T-1");
        assertThat(closed.getChanges()).containsOnlyKeys("status");
        assertThat(closed.getChanges().get("status").oldValue()).isEqualTo("Active");
        assertThat(closed.getChanges().get("status").newValue()).isEqualTo("Closed");

        ChangeReport second = newDetector().detect(List.of(
                titled(createTender("T-1", "Closed"), "X"),
                titled(createTender("T-2", "Active"), "Y")));
        assertThat(second.getUnchanged()).hasSize(2);
    }

    @Test
    void commit_saveFails_inMemorySnapshotUnchanged() throws Exception {
        Path blocker = Files.createFile(dir.resolve("blocker"));
        ChangeDetector detector = new ChangeDetector(
                new SnapshotStore(blocker.resolve("tenders_memory.json"), mapper), mapper, clock);

        assertThatThrownBy(() -> detector.commit(List.of(createTender("T-9", "Active"))))
                .isInstanceOf(RuntimeException.class);

        assertThat(detector.snapshot()).isEmpty();
        ChangeReport retry = detector.detect(List.of(createTender("T-9", "Active")));
        assertThat(retry.getSummary().getNewCount()).isEqualTo(1);
        assertThat(retry.getSummary().getUnchangedCount()).isZero();
    }

    @Test
    void commit_merge_unionsAttachmentsByFileUrl() {
        TenderRecord previous = createTender("T-1", "Active");
        previous.setAttachedDocuments(new ArrayList<>(List.of(createDocument("a"), createDocument("b"))));
        ChangeDetector detector = detectorWith(previous);

        TenderRecord scraped = createTender("T-1", "Active");
        scraped.setAttachedDocuments(new ArrayList<>(List.of(createDocument("b"), createDocument("c"))));
        detector.commit(List.of(scraped), MergeMode.MERGE);

        assertThat(detector.snapshot().get("T-1").getAttachedDocuments())
                .extracting(AttachedDocument::getFileName)
                .containsExactly("a.pdf", "b.pdf", "c.pdf");
    }

    @Test
    void commit_mergeTwice_isIdempotent() {
        TenderRecord scraped = createTender("T-1", "Active");
        scraped.setAttachedDocuments(new ArrayList<>(List.of(createDocument("a"))));
        ChangeDetector detector = newDetector();

        detector.commit(List.of(scraped));
        detector.commit(List.of(scraped));

        assertThat(detector.snapshot().get("T-1").getAttachedDocuments()).hasSize(1);
    }

    @Test
    void commit_merge_preservesPrimaryDocumentWhenNewScrapeHasNone() {
        TenderRecord previous = createTender("T-1", "Active");
        previous.setTenderDocDownloadUrl("https://www.ireps.gov.in/doc.pdf");
        previous.setAttachedDocuments(new ArrayList<>(List.of(createDocument("a"))));
        ChangeDetector detector = detectorWith(previous);

        TenderRecord scraped = createTender("T-1", "Active");
        scraped.markEnrichmentMissing();
        detector.commit(List.of(scraped));

        TenderRecord stored = detector.snapshot().get("T-1");
        assertThat(stored.getTenderDocDownloadUrl()).isEqualTo("https://www.ireps.gov.in/doc.pdf");
        assertThat(stored.getAttachedDocuments()).extracting(AttachedDocument::getFileName).containsExactly("a.pdf");
    }

    @Test
    void commit_overwrite_replacesRecordEntirely() {
        TenderRecord previous = createTender("T-1", "Active");
        previous.setTenderDocDownloadUrl("https://www.ireps.gov.in/doc.pdf");
        previous.setAttachedDocuments(new ArrayList<>(List.of(createDocument("a"))));
        ChangeDetector detector = detectorWith(previous);

        TenderRecord scraped = createTender("T-1", "Active");
        detector.commit(List.of(scraped), MergeMode.OVERWRITE);

        TenderRecord stored = detector.snapshot().get("T-1");
        assertThat(stored.getTenderDocDownloadUrl()).isNull();
        assertThat(stored.getAttachedDocuments()).isEmpty();
    }

    @Test
    void commit_writesLastSeenAndDropsDetailUrl() throws Exception {
        newDetector().commit(List.of(createTender("T-1", "Active")));

        String json = Files.readString(store.path());
        assertThat(json).contains("\"_last_seen\" : \"2026-03-01T06:00\"");
        assertThat(json).doesNotContain("detail_url");

        Map<String, TenderRecord> reloaded = store.load();
        assertThat(reloaded.get("T-1").getDetailUrl()).isNull();
        assertThat(reloaded.get("T-1").getLastSeen()).isEqualTo("2026-03-01T06:00");
    }

    @Test
    void commit_doesNotMutateCallerRecord() {
        TenderRecord scraped = createTender("T-1", "Active");

        newDetector().commit(List.of(scraped));

        assertThat(scraped.getDetailUrl()).isNotNull();
        assertThat(scraped.getLastSeen()).isNull();
    }

    private static TenderRecord titled(TenderRecord record, String title) {
        record.setTenderTitle(title);
        return record;
    }
}
