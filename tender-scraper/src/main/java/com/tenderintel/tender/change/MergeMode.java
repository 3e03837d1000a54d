package com.tenderintel.tender.change;

/** How commit treats attachments already in the snapshot. */
public enum MergeMode {
    /** Union by file URL; previously seen attachments and primary document are kept. */
    MERGE,
    /** Replace each entry with exactly what this run scraped. */
    OVERWRITE
}
