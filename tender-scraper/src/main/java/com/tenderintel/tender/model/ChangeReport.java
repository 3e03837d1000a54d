package com.tenderintel.tender.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/** Input of one detection pass partitioned into the four classification buckets. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ChangeReport {

    @JsonProperty("new")
    List<ClassifiedTender> created;
    List<ClassifiedTender> updated;
    List<ClassifiedTender> statusChanged;
    List<ClassifiedTender> unchanged;
    ChangeSummary summary;

    /** Every classified record, NEW first, in the order the buckets were filled. */
    public List<ClassifiedTender> all() {
        List<ClassifiedTender> all = new ArrayList<>(created);
        all.addAll(statusChanged);
        all.addAll(updated);
        all.addAll(unchanged);
        return all;
    }
}
