package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.UUID;

/**
 * One identity's vote on one verification. The (verification, source IP) pair is
 * unique in the schema; the constraint violation is the authoritative duplicate signal.
 * Direction changes go through {@code VoteLogRepository.flipDirection} so that two
 * concurrent flips cannot both succeed.
 */
@Entity
@Table(name = "vote_logs", uniqueConstraints = {
    @UniqueConstraint(name = "uq_vote_logs_verification_ip", columnNames = {"verification_id", "source_ip"})
}, indexes = {
    @Index(name = "idx_vote_logs_source_ip", columnList = "source_ip")
})
public class VoteLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "verification_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private VerificationLog verification;

    @NotNull
    @Column(name = "source_ip", length = 50, nullable = false, updatable = false)
    private String sourceIp;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 10)
    private VoteDirection direction;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "changed_at")
    private Instant changedAt;

    protected VoteLog() {}

    public static VoteLog create(VerificationLog verification, String sourceIp, VoteDirection direction, Instant now) {
        if (verification == null) {
            throw new IllegalArgumentException("Verification cannot be null");
        }
        if (sourceIp == null || sourceIp.isBlank()) {
            throw new IllegalArgumentException("Source IP cannot be blank");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Vote direction cannot be null");
        }
        VoteLog vote = new VoteLog();
        vote.verification = verification;
        vote.sourceIp = sourceIp;
        vote.direction = direction;
        vote.createdAt = now;
        return vote;
    }

    public enum VoteDirection {
        UP,
        DOWN;

        public VoteDirection opposite() {
            return this == UP ? DOWN : UP;
        }
    }

    // Getters
    public UUID getId() { return id; }
    public VerificationLog getVerification() { return verification; }
    public String getSourceIp() { return sourceIp; }
    public VoteDirection getDirection() { return direction; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getChangedAt() { return changedAt; }
}
