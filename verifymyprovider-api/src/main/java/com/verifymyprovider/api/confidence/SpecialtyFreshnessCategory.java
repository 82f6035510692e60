package com.verifymyprovider.api.confidence;

import java.util.List;
import java.util.Locale;

/**
 * Specialty groups with different network-turnover rates. Mental health networks
 * churn fastest, hospital-based staff slowest.
 */
public enum SpecialtyFreshnessCategory {
    MENTAL_HEALTH(List.of("psychiatr", "psycholog", "mental health", "behavioral health", "counselor", "therapist")),
    PRIMARY_CARE(List.of("family medicine", "family practice", "internal medicine", "general practice", "primary care")),
    HOSPITAL_BASED(List.of("hospital", "radiology", "anesthesiology", "pathology", "emergency medicine")),
    SPECIALIST(List.of()),
    OTHER(List.of());

    private final List<String> keywords;

    SpecialtyFreshnessCategory(List<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * Classifies free-text specialty. Any unmatched non-blank text is a specialist; blank is OTHER.
     */
    public static SpecialtyFreshnessCategory classify(String specialty) {
        if (specialty == null || specialty.isBlank()) {
            return OTHER;
        }
        String normalized = specialty.toLowerCase(Locale.ROOT);
        for (SpecialtyFreshnessCategory category : List.of(MENTAL_HEALTH, PRIMARY_CARE, HOSPITAL_BASED)) {
            if (category.matches(normalized)) {
                return category;
            }
        }
        return SPECIALIST;
    }

    private boolean matches(String normalized) {
        return keywords.stream().anyMatch(normalized::contains);
    }
}
