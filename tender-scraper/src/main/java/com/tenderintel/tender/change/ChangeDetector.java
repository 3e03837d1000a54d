package com.tenderintel.tender.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.model.AttachedDocument;
import com.tenderintel.tender.model.ChangeReport;
import com.tenderintel.tender.model.ChangeSummary;
import com.tenderintel.tender.model.ChangeType;
import com.tenderintel.tender.model.ClassifiedTender;
import com.tenderintel.tender.model.FieldChange;
import com.tenderintel.tender.model.TenderRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies scraped tenders against the snapshot from previous runs and folds them back in.
 *
 * NEW            tender number not in the snapshot
 * STATUS_CHANGED status differs (wins over any other difference)
 * UPDATED        any other field differs
 * UNCHANGED      identical after normalisation
 *
 * The snapshot is read once when the bean is created and only written by {@link #commit}.
 * Call commit after the run's reports are out, never before.
 */
@Service
@Slf4j
public class ChangeDetector {

    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private static final String STATUS = "status";
    private static final String DETAIL_URL = "detail_url";

    private final SnapshotStore store;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, TenderRecord> memory;

    public ChangeDetector(SnapshotStore store, ObjectMapper mapper, Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
        this.memory = store.load();
    }

    public ChangeReport detect(List<TenderRecord> records) {
        List<ClassifiedTender> created = new ArrayList<>();
        List<ClassifiedTender> updated = new ArrayList<>();
        List<ClassifiedTender> statusChanged = new ArrayList<>();
        List<ClassifiedTender> unchanged = new ArrayList<>();

        for (TenderRecord record : records) {
            String tenderNo = identity(record);
            if (tenderNo.isEmpty()) {
                continue;
            }

            TenderRecord previous = memory.get(tenderNo);
            if (previous == null) {
                created.add(classified(record, ChangeType.NEW, Collections.emptyMap()));
                log.debug("NEW: {}", tenderNo);
                continue;
            }

            Map<String, FieldChange> changes = diff(previous, record);
            if (changes.isEmpty()) {
                unchanged.add(classified(record, ChangeType.UNCHANGED, changes));
            } else if (changes.containsKey(STATUS)) {
                statusChanged.add(classified(record, ChangeType.STATUS_CHANGED, changes));
                FieldChange status = changes.get(STATUS);
                log.info("STATUS_CHANGED: {} '{}' -> '{}'", tenderNo, status.oldValue(), status.newValue());
                changes.forEach((field, change) -> {
                    if (!STATUS.equals(field)) {
                        log.info("  Also changed {}: '{}' -> '{}'", field, change.oldValue(), change.newValue());
                    }
                });
            } else {
                updated.add(classified(record, ChangeType.UPDATED, changes));
                changes.forEach((field, change) -> log.info("UPDATED {} {}: '{}' -> '{}'",
                        tenderNo, field, change.oldValue(), change.newValue()));
            }
        }

        ChangeSummary summary = ChangeSummary.builder()
                .totalScraped(records.size())
                .newCount(created.size())
                .updatedCount(updated.size())
                .statusChangedCount(statusChanged.size())
                .unchangedCount(unchanged.size())
                .timestamp(LocalDateTime.now(clock).toString())
                .build();

        log.info("Change detection: {} new, {} updated, {} status_changed, {} unchanged (total {})",
                created.size(), updated.size(), statusChanged.size(), unchanged.size(), records.size());

        return ChangeReport.builder()
                .created(created)
                .updated(updated)
                .statusChanged(statusChanged)
                .unchanged(unchanged)
                .summary(summary)
                .build();
    }

    public void commit(List<TenderRecord> records) {
        commit(records, MergeMode.MERGE);
    }

    /**
     * Store the latest version of every record and persist the snapshot.
     * In {@link MergeMode#MERGE} attachments captured by earlier runs are never lost, and an
     * empty primary document keeps the previous one.
     */
    public void commit(List<TenderRecord> records, MergeMode mode) {
        String now = LocalDateTime.now(clock).toString();
        // memory only moves once the file is written
        Map<String, TenderRecord> next = new LinkedHashMap<>(memory);

        for (TenderRecord record : records) {
            String tenderNo = identity(record);
            if (tenderNo.isEmpty()) {
                continue;
            }

            TenderRecord clean = record.toBuilder()
                    .tenderNo(tenderNo)
                    .detailUrl(null)
                    .lastSeen(now)
                    .attachedDocuments(copy(record.getAttachedDocuments()))
                    .build();

            TenderRecord existing = next.get(tenderNo);
            if (existing != null && mode == MergeMode.MERGE) {
                merge(existing, clean);
            }
            next.put(tenderNo, clean);
        }

        store.save(next);
        memory.clear();
        memory.putAll(next);
    }

    /** Read-only view of the in-memory snapshot. */
    public Map<String, TenderRecord> snapshot() {
        return Collections.unmodifiableMap(memory);
    }

    private void merge(TenderRecord existing, TenderRecord clean) {
        String tenderNo = clean.getTenderNo();
        if (isBlank(clean.getTenderDocDownloadUrl()) && !isBlank(existing.getTenderDocDownloadUrl())) {
            clean.setTenderDocDownloadUrl(existing.getTenderDocDownloadUrl());
            log.debug("Preserving existing tender_doc_download_url for {}", tenderNo);
        }

        List<AttachedDocument> oldDocs = existing.getAttachedDocuments() == null
                ? List.of() : existing.getAttachedDocuments();
        if (oldDocs.isEmpty()) {
            return;
        }

        List<AttachedDocument> merged = new ArrayList<>(oldDocs);
        Set<String> seen = new LinkedHashSet<>();
        for (AttachedDocument doc : oldDocs) {
            if (!isBlank(doc.getFileUrl())) seen.add(doc.getFileUrl());
        }
        for (AttachedDocument doc : clean.getAttachedDocuments()) {
            if (!isBlank(doc.getFileUrl()) && seen.add(doc.getFileUrl())) {
                merged.add(doc);
            }
        }
        if (clean.getAttachedDocuments().isEmpty()) {
            log.debug("Preserving {} existing attached_documents for {} (new scrape returned none)",
                    oldDocs.size(), tenderNo);
        }
        clean.setAttachedDocuments(merged);
    }

    private Map<String, FieldChange> diff(TenderRecord previous, TenderRecord current) {
        Map<String, Object> oldFields = fields(previous);
        Map<String, Object> newFields = fields(current);

        Set<String> keys = new LinkedHashSet<>(newFields.keySet());
        keys.addAll(oldFields.keySet());

        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (String key : keys) {
            if (key.startsWith("_") || DETAIL_URL.equals(key)) {
                continue;
            }
            String oldValue = normalise(oldFields.get(key));
            String newValue = normalise(newFields.get(key));
            if (!oldValue.equals(newValue)) {
                changes.put(key, new FieldChange(oldValue, newValue));
            }
        }
        return changes;
    }

    private Map<String, Object> fields(TenderRecord record) {
        return mapper.convertValue(record, FIELDS_TYPE);
    }

    /** Absent, null, empty string and empty list all compare equal. */
    private String normalise(Object value) {
        if (value == null) return "";
        if (value instanceof Collection<?> c && c.isEmpty()) return "";
        if (value instanceof Map<?, ?> m && m.isEmpty()) return "";
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
            try {
                return mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return value.toString();
            }
        }
        return value.toString().trim();
    }

    private ClassifiedTender classified(TenderRecord record, ChangeType type, Map<String, FieldChange> changes) {
        return ClassifiedTender.builder()
                .tender(record)
                .changeType(type)
                .changes(changes)
                .build();
    }

    private static String identity(TenderRecord record) {
        return record.getTenderNo() == null ? "" : record.getTenderNo().trim();
    }

    private static List<AttachedDocument> copy(List<AttachedDocument> docs) {
        return docs == null ? new ArrayList<>() : new ArrayList<>(docs);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
