package com.verifymyprovider.api.lookup;

/**
 * Read access to the insurance plan catalogue.
 */
public interface PlanLookup {

    boolean exists(String planId);
}
