package com.tenderintel.tender.output;

import com.opencsv.CSVWriter;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.ChangeReport;
import com.tenderintel.tender.model.ClassifiedTender;
import com.tenderintel.tender.model.TenderRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes one row per classified tender.
 *
 * Output path pattern: {outputDir}/changes_{timestamp}.csv
 * e.g. data/reports/changes_20260301_060000.csv
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvReportWriter {

    static final String[] HEADERS = {
            "tender_no", "change_type", "status",
            "tender_title", "deptt_rly_unit", "due_date_time",
            "old_status", "new_status", "changed_fields"
    };

    private final TenderScraperProperties properties;

    public Path write(ChangeReport report, String stamp) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(String.format("changes_%s.csv", stamp));

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            writer.writeNext(HEADERS);
            for (ClassifiedTender tender : report.all()) {
                writer.writeNext(toRow(tender));
            }
            log.info("Written {} classified tenders to CSV: {}", report.all().size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(ClassifiedTender classified) {
        TenderRecord t = classified.getTender();
        return new String[]{
                str(t.getTenderNo()),
                classified.getChangeType().name(),
                str(t.getStatus()),
                str(t.getTenderTitle()),
                str(t.getDepttRlyUnit()),
                str(t.getDueDateTime()),
                str(classified.getOldStatus()),
                str(classified.getNewStatus()),
                String.join(";", classified.getChanges().keySet())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
