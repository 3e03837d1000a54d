package com.tenderintel.tender.output;

import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.config.TenderScraperProperties.Output.OutputMode;
import com.tenderintel.tender.model.ChangeReport;
import com.tenderintel.tender.model.ScrapeRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes run output to the configured sink(s).
 * Supports CSV, JSON, BOTH or NONE.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final CsvReportWriter csvWriter;
    private final JsonReportWriter jsonWriter;
    private final TenderScraperProperties properties;

    /** Change CSV. Failures propagate: a run without its report must not commit the snapshot. */
    public void writeReport(ChangeReport report, String stamp) {
        OutputMode mode = properties.getOutput().getMode();
        if (mode == OutputMode.CSV || mode == OutputMode.BOTH) {
            csvWriter.write(report, stamp);
        }
    }

    /** JSON run summary, written for every run including failed ones. Never throws. */
    public void writeScrapeRun(ScrapeRun run, ChangeReport report, String stamp) {
        OutputMode mode = properties.getOutput().getMode();
        if (mode != OutputMode.JSON && mode != OutputMode.BOTH) {
            return;
        }
        try {
            jsonWriter.write(run, report, stamp);
        } catch (Exception e) {
            log.warn("Failed to write scrape run metadata: {}", e.getMessage());
        }
    }
}
