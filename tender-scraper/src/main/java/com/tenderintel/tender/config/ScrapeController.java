package com.tenderintel.tender.config;

import com.tenderintel.tender.model.RunMode;
import com.tenderintel.tender.service.TenderScrapeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final TenderScrapeService scrapeService;

    @PostMapping("/scrape/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        if (scrapeService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "rejected", "detail", "a scrape run is already in progress"));
        }
        new Thread(this::runManual, "manual-scrape").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "tender-scraper");
        body.put("running", scrapeService.isRunning());
        body.put("last_run", scrapeService.lastRun().orElse(null));
        return ResponseEntity.ok(body);
    }

    private void runManual() {
        try {
            scrapeService.runOnce(RunMode.UNATTENDED);
        } catch (Exception e) {
            log.error("Manual scrape failed: {}", e.getMessage());
        }
    }
}
