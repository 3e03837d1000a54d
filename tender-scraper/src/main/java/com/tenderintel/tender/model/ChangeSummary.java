package com.tenderintel.tender.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/** Machine-readable counts for one detection pass, used for health reporting. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChangeSummary {

    int totalScraped;
    int newCount;
    int updatedCount;
    int statusChangedCount;
    int unchangedCount;
    String timestamp;
}
