package com.verifymyprovider.core.domain;

/**
 * Origin of an acceptance fact or verification, ordered roughly by how much it is trusted.
 * The weight attached to each constant lives with the confidence scorer.
 */
public enum SourceAuthority {
    CMS_NPPES,
    CMS_PLAN_FINDER,
    CMS_DATA,
    CARRIER_API,
    CARRIER_DATA,
    PROVIDER_PORTAL,
    USER_UPLOAD,
    PHONE_CALL,
    CROWDSOURCE,
    AUTOMATED
}
