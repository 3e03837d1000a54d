package com.tenderintel.tender.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One tender as harvested from the listing and enriched from its detail page.
 *
 * Field naming notes:
 *  - tender_no is the identity; it is issued by the portal and never rewritten here
 *  - listing fields come from phase 1, detail fields and documents from phase 2
 *  - detail_url only lives for the duration of a run and is never serialised
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class TenderRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    private String tenderNo;

    // ── Listing (phase 1) ───────────────────────────────────────────────────
    /** Issuing department / railway unit. */
    private String depttRlyUnit;
    private String tenderTitle;
    /** Published, Active, Closed, Cancelled or Expired. */
    private String status;
    /** Classification column; only one category is harvested. */
    private String workArea;
    private String dueDateTime;
    private String dueDays;

    // ── Detail page (phase 2) ───────────────────────────────────────────────
    private String tenderType;
    private String dateOfIssue;
    private String estimatedValue;
    private String emdAmount;
    private String documentCost;
    private String contactOfficer;
    private String corrigendum;
    private String description;
    private String closingDate;

    // ── Documents (phase 2) ─────────────────────────────────────────────────
    private String tenderDocDownloadUrl;

    @Builder.Default
    private List<AttachedDocument> attachedDocuments = new ArrayList<>();

    // ── Run-only / bookkeeping ──────────────────────────────────────────────
    /** Navigation hint for the authenticated detail view. */
    @JsonIgnore
    private String detailUrl;

    @JsonProperty("_last_seen")
    private String lastSeen;

    /**
     * Sets a detail-page field by its snake_case key.
     *
     * @return false when the key is not a detail field
     */
    public boolean applyDetail(String field, String value) {
        switch (field) {
            case DetailFields.TENDER_TYPE -> tenderType = value;
            case DetailFields.DATE_OF_ISSUE -> dateOfIssue = value;
            case DetailFields.ESTIMATED_VALUE -> estimatedValue = value;
            case DetailFields.EMD_AMOUNT -> emdAmount = value;
            case DetailFields.DOCUMENT_COST -> documentCost = value;
            case DetailFields.CONTACT_OFFICER -> contactOfficer = value;
            case DetailFields.CORRIGENDUM -> corrigendum = value;
            case DetailFields.DESCRIPTION -> description = value;
            case DetailFields.CLOSING_DATE -> closingDate = value;
            default -> {
                return false;
            }
        }
        return true;
    }

    /** Phase 2 did not reach this record: no primary document and no attachments. */
    public void markEnrichmentMissing() {
        tenderDocDownloadUrl = null;
        attachedDocuments = new ArrayList<>();
    }
}
