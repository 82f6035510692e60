package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Audit record of one crowdsourced submission.
 *
 * Rows are append-only apart from the vote tallies (changed through atomic
 * repository updates) and their expiration. The link to the acceptance record is
 * nulled, not cascaded, when the acceptance is purged so the audit trail survives.
 * Source IP, user agent and submitter exist for abuse detection only.
 */
@Entity
@Table(name = "verification_logs", indexes = {
    @Index(name = "idx_vl_provider_plan", columnList = "provider_npi, plan_id"),
    @Index(name = "idx_vl_source_ip", columnList = "source_ip"),
    @Index(name = "idx_vl_submitted_by", columnList = "submitted_by"),
    @Index(name = "idx_vl_created_at", columnList = "created_at"),
    @Index(name = "idx_vl_expires_at", columnList = "expires_at")
})
public class VerificationLog implements Expirable {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "provider_npi", length = 10, nullable = false, updatable = false)
    private String providerNpi;

    @NotNull
    @Column(name = "plan_id", length = 50, nullable = false, updatable = false)
    private String planId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "acceptance_id")
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private ProviderPlanAcceptance acceptance;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "verification_type", nullable = false, length = 30, updatable = false)
    private VerificationType verificationType;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "verification_source", nullable = false, length = 30, updatable = false)
    private SourceAuthority verificationSource;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "previous_value")
    private Map<String, Object> previousValue;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_value", nullable = false)
    private Map<String, Object> newValue;

    @Column(name = "source_ip", length = 50, updatable = false)
    private String sourceIp;

    @Column(name = "user_agent", length = 500, updatable = false)
    private String userAgent;

    @Column(name = "submitted_by", length = 200, updatable = false)
    private String submittedBy;

    @Column(name = "upvotes", nullable = false)
    private int upvotes;

    @Column(name = "downvotes", nullable = false)
    private int downvotes;

    @Column(name = "is_approved")
    private Boolean approved;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "evidence_url", length = 500)
    private String evidenceUrl;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    protected VerificationLog() {}

    public static VerificationLog create(
            String providerNpi,
            String planId,
            VerificationType verificationType,
            SourceAuthority verificationSource,
            Submitter submitter,
            Map<String, Object> previousValue,
            Map<String, Object> newValue,
            Instant createdAt,
            Instant expiresAt) {
        if (providerNpi == null || providerNpi.isBlank()) {
            throw new IllegalArgumentException("Provider NPI cannot be blank");
        }
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("Plan ID cannot be blank");
        }
        if (verificationType == null || verificationSource == null) {
            throw new IllegalArgumentException("Verification type and source are required");
        }
        if (newValue == null) {
            throw new IllegalArgumentException("New value cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        if (expiresAt != null && expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("Expiration cannot precede creation: " + expiresAt);
        }
        VerificationLog log = new VerificationLog();
        log.providerNpi = providerNpi;
        log.planId = planId;
        log.verificationType = verificationType;
        log.verificationSource = verificationSource;
        log.previousValue = previousValue != null ? new HashMap<>(previousValue) : null;
        log.newValue = new HashMap<>(newValue);
        if (submitter != null) {
            log.sourceIp = submitter.sourceIp();
            log.userAgent = submitter.userAgent();
            log.submittedBy = submitter.submittedBy();
        }
        log.upvotes = 0;
        log.downvotes = 0;
        log.approved = null;
        log.createdAt = createdAt;
        log.expiresAt = expiresAt;
        return log;
    }

    public void linkAcceptance(ProviderPlanAcceptance acceptance) {
        this.acceptance = acceptance;
    }

    public void attachEvidence(String notes, String evidenceUrl) {
        this.notes = notes;
        this.evidenceUrl = evidenceUrl;
    }

    /**
     * Sets the expiration of a legacy row that predates TTLs.
     */
    public void backfillExpiration(Instant expiresAt) {
        if (this.expiresAt != null) {
            throw new IllegalStateException("Verification " + id + " already has an expiration");
        }
        if (expiresAt == null || expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("Expiration must not precede creation: " + expiresAt);
        }
        this.expiresAt = expiresAt;
    }

    public int totalVotes() {
        return upvotes + downvotes;
    }

    /**
     * Identity signals captured with a submission.
     */
    public record Submitter(String sourceIp, String userAgent, String submittedBy) {}

    public enum VerificationType {
        PLAN_ACCEPTANCE,
        PROVIDER_INFO,
        CONTACT_INFO,
        STATUS_CHANGE,
        NEW_PLAN
    }

    // Getters
    public UUID getId() { return id; }
    public String getProviderNpi() { return providerNpi; }
    public String getPlanId() { return planId; }
    public Optional<ProviderPlanAcceptance> getAcceptance() { return Optional.ofNullable(acceptance); }
    public VerificationType getVerificationType() { return verificationType; }
    public SourceAuthority getVerificationSource() { return verificationSource; }
    public Map<String, Object> getPreviousValue() { return previousValue; }
    public Map<String, Object> getNewValue() { return newValue; }
    public String getSourceIp() { return sourceIp; }
    public String getUserAgent() { return userAgent; }
    public String getSubmittedBy() { return submittedBy; }
    public int getUpvotes() { return upvotes; }
    public int getDownvotes() { return downvotes; }
    public Boolean getApproved() { return approved; }
    public String getNotes() { return notes; }
    public String getEvidenceUrl() { return evidenceUrl; }
    public Instant getCreatedAt() { return createdAt; }
    @Override
    public Optional<Instant> getExpiresAt() { return Optional.ofNullable(expiresAt); }
}
