package com.tenderintel.tender.enrich;

import com.tenderintel.tender.model.DetailFields;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Label-based extraction of the detail scalars with plausibility checks.
 * Values picked up from dropdown dumps, scripts or header cells are rejected, never stored.
 */
@Component
@Slf4j
public class DetailFieldExtractor {

    static final int MAX_TABS = 3;
    static final int MAX_VALUE_LENGTH = 500;

    private static final Set<String> HEADER_TEXTS = Set.of("File Name", "file name", "Description", "Sl. No");

    /**
     * @param title listing title of the record, used to reject a tender type scraped from the wrong cell
     * @return field key to value, only for fields that produced a plausible value
     */
    public Map<String, String> extract(LabelResolver labels, String title) {
        Map<String, String> detail = new LinkedHashMap<>();

        DetailFields.LABELS.forEach((field, label) -> {
            try {
                for (String candidate : labels.candidatesFor(label)) {
                    String value = candidate == null ? "" : candidate.trim();
                    if (value.isEmpty() || value.equals(label) || isJunk(value)) {
                        continue;
                    }
                    if (accepts(field, value, title)) {
                        detail.put(field, value);
                    }
                    // only the first usable candidate is considered
                    break;
                }
            } catch (BrowserLostException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("Could not extract '{}' (label: '{}'): {}", field, label, e.getMessage());
            }
        });
        return detail;
    }

    /** Dropdown dumps, script fragments and oversized text. */
    static boolean isJunk(String value) {
        if (value == null || value.isEmpty()) return false;
        long tabs = value.chars().filter(c -> c == '\t').count();
        return tabs > MAX_TABS
                || value.contains("createOptorDpdw()")
                || value.contains("document.getElementById")
                || value.length() > MAX_VALUE_LENGTH;
    }

    private boolean accepts(String field, String value, String title) {
        switch (field) {
            case DetailFields.CLOSING_DATE -> {
                if (!value.contains("/")) {
                    log.debug("Rejected closing_date value (not a date): '{}'", value);
                    return false;
                }
            }
            case DetailFields.DESCRIPTION -> {
                if (HEADER_TEXTS.contains(value)) {
                    log.debug("Rejected description value (header text): '{}'", value);
                    return false;
                }
            }
            case DetailFields.TENDER_TYPE -> {
                if (title != null && !title.isEmpty() && value.equals(title)) {
                    log.debug("Rejected tender_type (same as tender_title): '{}'", value);
                    return false;
                }
            }
            default -> {
            }
        }
        return true;
    }
}
