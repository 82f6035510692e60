package com.verifymyprovider.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Thresholds that govern verification trust, bound once at startup.
 *
 * @param ttl                          lifetime of a verification or acceptance after its last refresh
 * @param sybilWindow                  period in which one identity may submit once per provider/plan pair
 * @param minVerificationsForConsensus verifications needed before a level above MEDIUM or a consensus status
 * @param minConfidenceForStatusChange score a record needs before consensus may set its status
 * @param cleanupBatchSize             default rows deleted per cleanup round
 * @param decayBatchSize               default records rescored per decay page
 */
@ConfigurationProperties(prefix = "verifymyprovider.verification")
public record VerificationPolicy(
        @DefaultValue("180d") Duration ttl,
        @DefaultValue("30d") Duration sybilWindow,
        @DefaultValue("3") int minVerificationsForConsensus,
        @DefaultValue("60") int minConfidenceForStatusChange,
        @DefaultValue("1000") int cleanupBatchSize,
        @DefaultValue("100") int decayBatchSize) {

    public static final Duration DEFAULT_TTL = Duration.ofDays(180);

    public VerificationPolicy {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (sybilWindow == null || sybilWindow.isNegative()) {
            throw new IllegalArgumentException("Sybil window cannot be negative: " + sybilWindow);
        }
        if (minVerificationsForConsensus < 1) {
            throw new IllegalArgumentException("Consensus needs at least one verification");
        }
        if (minConfidenceForStatusChange < 0 || minConfidenceForStatusChange > 100) {
            throw new IllegalArgumentException("Status-change confidence must be between 0 and 100");
        }
        if (cleanupBatchSize < 1 || decayBatchSize < 1) {
            throw new IllegalArgumentException("Batch sizes must be positive");
        }
    }

    public static VerificationPolicy defaults() {
        return new VerificationPolicy(DEFAULT_TTL, Duration.ofDays(30), 3, 60, 1000, 100);
    }
}
