package com.tenderintel.tender.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderintel.tender.config.TenderScraperProperties;
import com.tenderintel.tender.model.ChangeReport;
import com.tenderintel.tender.model.ScrapeRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/** Run record plus the full change report, pretty-printed to {outputDir}/run_{timestamp}.json. */
@Component
@Slf4j
@RequiredArgsConstructor
public class JsonReportWriter {

    private final ObjectMapper objectMapper;
    private final TenderScraperProperties properties;

    public Path write(ScrapeRun run, ChangeReport report, String stamp) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        Path outputPath = outputDir.resolve(String.format("run_%s.json", stamp));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("run", run);
        if (report != null) {
            document.put("changes", report);
        }

        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), document);
        } catch (IOException e) {
            log.error("Failed to write run summary {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("JSON write failed", e);
        }
        log.info("Written run summary to {}", outputPath);
        return outputPath;
    }
}
