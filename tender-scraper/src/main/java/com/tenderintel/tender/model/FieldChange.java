package com.tenderintel.tender.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Old and new value of one field, both trimmed. */
public record FieldChange(@JsonProperty("old") String oldValue, @JsonProperty("new") String newValue) {
}
