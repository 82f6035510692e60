package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Whether a provider accepts an insurance plan, optionally at one practice location,
 * together with how much that fact is currently trusted.
 *
 * The verification counter is only changed through the repository's atomic increment;
 * this entity never load-modify-saves it.
 */
@Entity
@Table(name = "provider_plan_acceptance", indexes = {
    @Index(name = "idx_ppa_provider_plan", columnList = "provider_npi, plan_id"),
    @Index(name = "idx_ppa_expires_at", columnList = "expires_at"),
    @Index(name = "idx_ppa_confidence", columnList = "confidence_score")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_ppa_provider_plan_location", columnNames = {"provider_npi", "plan_id", "location_id"})
})
public class ProviderPlanAcceptance implements Expirable {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "provider_npi", length = 10, nullable = false, updatable = false)
    private String providerNpi;

    @NotNull
    @Column(name = "plan_id", length = 50, nullable = false, updatable = false)
    private String planId;

    @Column(name = "location_id", updatable = false)
    private UUID locationId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "acceptance_status", nullable = false, length = 20)
    private AcceptanceStatus acceptanceStatus;

    @Min(0)
    @Max(100)
    @Column(name = "confidence_score", nullable = false)
    private int confidenceScore;

    @Embedded
    private ConfidenceFactors confidenceFactors;

    @Min(0)
    @Column(name = "verification_count", nullable = false)
    private int verificationCount;

    @Column(name = "last_verified_at")
    private Instant lastVerifiedAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_source", length = 30)
    private SourceAuthority dataSource;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ProviderPlanAcceptance() {}

    /**
     * Creates the record for the first crowdsourced verification of a provider/plan pair.
     */
    public static ProviderPlanAcceptance fromFirstVerification(
            String providerNpi, String planId, UUID locationId,
            AcceptanceStatus status, SourceAuthority dataSource, Instant now) {
        ProviderPlanAcceptance acceptance = create(providerNpi, planId, locationId, status, dataSource, now);
        acceptance.verificationCount = 1;
        acceptance.lastVerifiedAt = now;
        return acceptance;
    }

    /**
     * Creates a record seeded by a bulk import. No one has verified it yet.
     */
    public static ProviderPlanAcceptance fromImport(
            String providerNpi, String planId, UUID locationId,
            AcceptanceStatus status, SourceAuthority dataSource, Instant now) {
        return create(providerNpi, planId, locationId, status, dataSource, now);
    }

    private static ProviderPlanAcceptance create(
            String providerNpi, String planId, UUID locationId,
            AcceptanceStatus status, SourceAuthority dataSource, Instant now) {
        if (providerNpi == null || providerNpi.isBlank()) {
            throw new IllegalArgumentException("Provider NPI cannot be blank");
        }
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("Plan ID cannot be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("Acceptance status cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        ProviderPlanAcceptance acceptance = new ProviderPlanAcceptance();
        acceptance.providerNpi = providerNpi;
        acceptance.planId = planId;
        acceptance.locationId = locationId;
        acceptance.acceptanceStatus = status;
        acceptance.dataSource = dataSource;
        acceptance.confidenceScore = 0;
        acceptance.confidenceFactors = ConfidenceFactors.none();
        acceptance.verificationCount = 0;
        acceptance.createdAt = now;
        acceptance.updatedAt = now;
        return acceptance;
    }

    /**
     * Stores a freshly computed score and its breakdown.
     */
    public void applyScore(int score, ConfidenceFactors factors, Instant now) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("Confidence score must be between 0 and 100: " + score);
        }
        if (factors == null) {
            throw new IllegalArgumentException("Confidence factors cannot be null");
        }
        this.confidenceScore = score;
        this.confidenceFactors = factors;
        this.updatedAt = now;
    }

    public void changeStatus(AcceptanceStatus status, Instant now) {
        if (status == null) {
            throw new IllegalArgumentException("Acceptance status cannot be null");
        }
        this.acceptanceStatus = status;
        this.updatedAt = now;
    }

    /**
     * Moves the expiration forward. Reverifying a fact resets its TTL clock.
     */
    public void renewExpiration(Instant expiresAt) {
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiration cannot be null");
        }
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("Expiration cannot precede creation: " + expiresAt);
        }
        this.expiresAt = expiresAt;
    }

    /**
     * Timestamp a legacy row's TTL is measured from.
     */
    public Instant expirationBase() {
        return lastVerifiedAt != null ? lastVerifiedAt : createdAt;
    }

    public boolean isLocationSpecific() {
        return locationId != null;
    }

    public enum AcceptanceStatus {
        ACCEPTED,
        NOT_ACCEPTED,
        PENDING,   // Verified at least once, no consensus yet
        UNKNOWN    // Seeded without any evidence either way
    }

    // Getters
    public UUID getId() { return id; }
    public String getProviderNpi() { return providerNpi; }
    public String getPlanId() { return planId; }
    public Optional<UUID> getLocationId() { return Optional.ofNullable(locationId); }
    public AcceptanceStatus getAcceptanceStatus() { return acceptanceStatus; }
    public int getConfidenceScore() { return confidenceScore; }
    public ConfidenceFactors getConfidenceFactors() { return confidenceFactors; }
    public int getVerificationCount() { return verificationCount; }
    public Optional<Instant> getLastVerifiedAt() { return Optional.ofNullable(lastVerifiedAt); }
    @Override
    public Optional<Instant> getExpiresAt() { return Optional.ofNullable(expiresAt); }
    public SourceAuthority getDataSource() { return dataSource; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
