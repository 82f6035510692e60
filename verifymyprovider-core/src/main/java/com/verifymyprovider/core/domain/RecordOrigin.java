package com.verifymyprovider.core.domain;

/**
 * Where the current contents of a provider or practice location record came from.
 * Anything other than {@link #NPPES} means a human or an enrichment pass has
 * improved the record, so bulk imports must not silently overwrite protected fields.
 */
public enum RecordOrigin {
    NPPES,             // Raw registry import (default)
    ENRICHMENT,        // Enriched from a secondary source (e.g. practice websites)
    USER_VERIFICATION; // Confirmed by crowdsourced verification

    public boolean isImprovedOverImport() {
        return this != NPPES;
    }
}
