package com.tenderintel.tender.model;

public enum ChangeType {
    NEW,
    UPDATED,
    STATUS_CHANGED,
    UNCHANGED
}
