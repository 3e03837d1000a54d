package com.tenderintel.tender.harvest;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.TenderRecord;
import com.tenderintel.tender.util.Pacer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase 1: walks every page of the public listing and collects the records of the
 * configured category. Needs no authentication.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ListingHarvester {

    private final ListingRowParser parser;
    private final Pacer pacer;
    private final TenderScraperProperties properties;

    public List<TenderRecord> harvestAll(ListingSource source) {
        log.info("Phase 1: Navigating to tender listing page...");
        source.open();

        int cap = properties.getScraping().getDevRecordCap();
        List<TenderRecord> all = new ArrayList<>();
        int page = 1;

        while (true) {
            log.info("Scraping listing page {}...", page);
            List<TenderRecord> onPage = extract(source.currentRows());
            log.info("  Found {} {} tenders on page {}", onPage.size(),
                    properties.getScraping().getCategory(), page);
            all.addAll(onPage);

            if (cap > 0 && all.size() >= cap) {
                log.info("DEV LIMIT reached: {} tenders, stopping listing scrape", cap);
                return new ArrayList<>(all.subList(0, cap));
            }

            if (!source.nextPage()) {
                log.info("No more pages, listing scrape complete");
                break;
            }
            page++;
            pacer.pause();
        }

        log.info("Phase 1 complete: {} tenders from listing", all.size());
        return all;
    }

    private List<TenderRecord> extract(List<ListingRow> rows) {
        List<TenderRecord> records = new ArrayList<>();
        for (ListingRow row : rows) {
            parser.parse(row).ifPresent(record -> {
                if (parser.inCategory(record)) {
                    records.add(record);
                } else {
                    log.debug("Skipping tender {}, Work Area is '{}'", record.getTenderNo(), record.getWorkArea());
                }
            });
        }
        return records;
    }
}
