package com.tenderintel.tender.enrich;

import com.tenderintel.tender.model.TenderRecord;
import lombok.Value;

import java.util.List;

/** Every input record, enriched or marked empty, plus why the stage stopped. */
@Value
public class EnrichmentResult {

    public enum Outcome {
        COMPLETED,
        /** Portal redirected to login mid-run; partial results. */
        SESSION_EXPIRED,
        /** Consecutive-failure limit reached. */
        CIRCUIT_OPEN,
        BROWSER_LOST
    }

    List<TenderRecord> records;
    Outcome outcome;
    int enriched;
    int failed;
}
