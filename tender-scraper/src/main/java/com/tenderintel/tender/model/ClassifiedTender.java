package com.tenderintel.tender.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A record with its classification for this run.
 * {@code changes} is empty for NEW and UNCHANGED; for STATUS_CHANGED it always contains "status".
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClassifiedTender {

    TenderRecord tender;
    ChangeType changeType;
    Map<String, FieldChange> changes;

    public String getTenderNo() {
        return tender.getTenderNo();
    }

    public String getOldStatus() {
        FieldChange status = changes.get("status");
        return status == null ? null : status.oldValue();
    }

    public String getNewStatus() {
        FieldChange status = changes.get("status");
        return status == null ? null : status.newValue();
    }
}
