package com.tenderintel.tender.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each pipeline run for observability.
 * Written alongside the change report and exposed on /scrape/status.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScrapeRun {

    private String runId;               // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;              // RUNNING | SUCCESS | FAILED | SKIPPED
    private int recordsFound;
    private int recordsEnriched;
    private String enrichmentOutcome;   // null until phase 2 ran
    private ChangeSummary summary;      // null unless detection ran
    private String errorMessage;        // null on success
}
