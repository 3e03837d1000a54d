package com.tenderintel.tender.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Detail-page fields and the label text that precedes each value on the page.
 * If the portal renames a label, update it here.
 */
public final class DetailFields {

    public static final String TENDER_TYPE = "tender_type";
    public static final String DATE_OF_ISSUE = "date_of_issue";
    public static final String ESTIMATED_VALUE = "estimated_value";
    public static final String EMD_AMOUNT = "emd_amount";
    public static final String DOCUMENT_COST = "document_cost";
    public static final String CONTACT_OFFICER = "contact_officer";
    public static final String CORRIGENDUM = "corrigendum";
    public static final String DESCRIPTION = "description";
    public static final String CLOSING_DATE = "closing_date";

    public static final Map<String, String> LABELS;

    static {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(TENDER_TYPE, "Tender Type");
        labels.put(DATE_OF_ISSUE, "Date of Issue");
        labels.put(ESTIMATED_VALUE, "Estimated Value");
        labels.put(EMD_AMOUNT, "EMD Amount");
        labels.put(DOCUMENT_COST, "Document Cost");
        labels.put(CONTACT_OFFICER, "Contact Officer");
        labels.put(CORRIGENDUM, "Corrigendum");
        labels.put(DESCRIPTION, "Description");
        labels.put(CLOSING_DATE, "Closing Date");
        LABELS = Collections.unmodifiableMap(labels);
    }

    private DetailFields() {
    }
}
