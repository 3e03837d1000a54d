package com.tenderintel.tender.enrich;

import java.util.List;

/**
 * Finds the value displayed next to a label on a detail page.
 */
public interface LabelResolver {

    /**
     * Candidate values for {@code label}, best first: the second cell of the label's
     * table row, then the label's next sibling element. Empty when the label is absent.
     */
    List<String> candidatesFor(String label);
}
