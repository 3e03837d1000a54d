package com.tenderintel.tender.harvest;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.TenderRecord;
import com.tenderintel.tender.util.LinkResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a listing row into a {@link TenderRecord}, or decides it is not a record at all.
 *
 * The listing table shares its page with a search form and header rows whose cells look
 * like data, so identity and status are validated before anything else is read.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ListingRowParser {

    static final int COL_DEPTT = 0;
    static final int COL_TENDER_NO = 1;
    static final int COL_TENDER_TITLE = 2;
    static final int COL_STATUS = 3;
    static final int COL_WORK_AREA = 4;
    static final int COL_DUE_DATE = 5;
    static final int COL_DUE_DAYS = 6;
    static final int MIN_CELLS = 7;
    static final int MAX_IDENTITY_LENGTH = 50;

    private static final Set<String> JUNK_IDENTITIES = Set.of(
            "Tender No", "tender no", "Search Tender", "Organization",
            "Select Date", "Tender Closing Date", "Tender Uploading Date",
            "Deptt./Rly. Unit", "Actions");

    private static final Set<String> VALID_STATUSES = Set.of(
            "published", "active", "closed", "cancelled", "expired");

    private final TenderScraperProperties properties;

    public Optional<TenderRecord> parse(ListingRow row) {
        if (row.cellCount() < MIN_CELLS) {
            return Optional.empty();
        }

        String tenderNo = row.cell(COL_TENDER_NO);
        if (tenderNo.isEmpty()
                || tenderNo.length() > MAX_IDENTITY_LENGTH
                || tenderNo.contains("\n")
                || JUNK_IDENTITIES.contains(tenderNo)) {
            return Optional.empty();
        }

        // blank status is tolerated, an unknown one means header or form text
        String status = row.cell(COL_STATUS);
        if (!status.isEmpty() && !VALID_STATUSES.contains(status.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }

        return Optional.of(TenderRecord.builder()
                .tenderNo(tenderNo)
                .depttRlyUnit(row.cell(COL_DEPTT))
                .tenderTitle(row.cell(COL_TENDER_TITLE))
                .status(status)
                .workArea(row.cell(COL_WORK_AREA))
                .dueDateTime(row.cell(COL_DUE_DATE))
                .dueDays(row.cell(COL_DUE_DAYS))
                .detailUrl(detailHint(row, tenderNo))
                .build());
    }

    /** Case-insensitive match of the work area against the configured category. */
    public boolean inCategory(TenderRecord record) {
        String workArea = record.getWorkArea() == null ? "" : record.getWorkArea().trim();
        return workArea.equalsIgnoreCase(properties.getScraping().getCategory());
    }

    private String detailHint(ListingRow row, String tenderNo) {
        if (!row.detailControlPresent()) {
            log.warn("CLICK_FAILED: 'View Tender Details' control NOT FOUND in Actions column for tender: {}",
                    tenderNo);
            return "";
        }
        String hint = LinkResolver.detailTarget(row.detailOnclick(), row.detailHref(),
                        properties.getPortal().getBaseUrl())
                .orElse("");
        log.debug("View Details control onclick={} -> detail_url={}", row.detailOnclick(), hint);
        return hint;
    }
}
