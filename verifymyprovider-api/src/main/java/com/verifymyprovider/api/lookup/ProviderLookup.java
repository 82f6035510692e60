package com.verifymyprovider.api.lookup;

import java.util.Optional;

/**
 * Read access to the provider directory.
 */
public interface ProviderLookup {

    boolean exists(String npi);

    /**
     * Free-text specialty used to choose a freshness threshold, if the provider has one.
     */
    Optional<String> specialtyOf(String npi);
}
