package com.verifymyprovider.api.confidence;

import com.verifymyprovider.api.config.VerificationPolicy;
import com.verifymyprovider.core.domain.ConfidenceFactors;
import com.verifymyprovider.core.domain.SourceAuthority;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Scores how much a provider/plan acceptance fact can be trusted right now.
 *
 * Four factors are summed into a 0-100 score:
 * <ul>
 *   <li>data source authority (0-25)</li>
 *   <li>recency, decaying against a specialty-specific freshness threshold (0-30)</li>
 *   <li>verification count, plateauing at the consensus minimum (0-25)</li>
 *   <li>community agreement from votes (0-20)</li>
 * </ul>
 * Deterministic for a given {@code now}; holds no mutable state.
 */
@Component
public class ConfidenceScorer {

    static final int UNKNOWN_SOURCE_SCORE = 10;
    static final int NEUTRAL_AGREEMENT_SCORE = 10;

    private static final double RE_VERIFY_FRACTION = 0.8;

    private final VerificationPolicy policy;
    private final Map<SourceAuthority, Integer> sourceWeights;
    private final Map<SpecialtyFreshnessCategory, Integer> freshnessThresholdDays;

    @Autowired
    public ConfidenceScorer(VerificationPolicy policy) {
        this(policy, defaultSourceWeights(), defaultFreshnessThresholds());
    }

    ConfidenceScorer(VerificationPolicy policy,
                     Map<SourceAuthority, Integer> sourceWeights,
                     Map<SpecialtyFreshnessCategory, Integer> freshnessThresholdDays) {
        if (policy == null) {
            throw new IllegalArgumentException("Verification policy cannot be null");
        }
        this.policy = policy;
        this.sourceWeights = validateSourceWeights(sourceWeights);
        this.freshnessThresholdDays = validateThresholds(freshnessThresholdDays);
    }

    static Map<SourceAuthority, Integer> defaultSourceWeights() {
        Map<SourceAuthority, Integer> weights = new EnumMap<>(SourceAuthority.class);
        weights.put(SourceAuthority.CMS_NPPES, 25);
        weights.put(SourceAuthority.CMS_PLAN_FINDER, 25);
        weights.put(SourceAuthority.CMS_DATA, 25);
        weights.put(SourceAuthority.CARRIER_API, 20);
        weights.put(SourceAuthority.CARRIER_DATA, 20);
        weights.put(SourceAuthority.PROVIDER_PORTAL, 20);
        weights.put(SourceAuthority.USER_UPLOAD, 15);
        weights.put(SourceAuthority.PHONE_CALL, 15);
        weights.put(SourceAuthority.CROWDSOURCE, 15);
        weights.put(SourceAuthority.AUTOMATED, 10);
        return weights;
    }

    static Map<SpecialtyFreshnessCategory, Integer> defaultFreshnessThresholds() {
        Map<SpecialtyFreshnessCategory, Integer> thresholds = new EnumMap<>(SpecialtyFreshnessCategory.class);
        thresholds.put(SpecialtyFreshnessCategory.MENTAL_HEALTH, 30);
        thresholds.put(SpecialtyFreshnessCategory.PRIMARY_CARE, 60);
        thresholds.put(SpecialtyFreshnessCategory.SPECIALIST, 60);
        thresholds.put(SpecialtyFreshnessCategory.HOSPITAL_BASED, 90);
        thresholds.put(SpecialtyFreshnessCategory.OTHER, 60);
        return thresholds;
    }

    private static Map<SourceAuthority, Integer> validateSourceWeights(Map<SourceAuthority, Integer> weights) {
        if (weights == null) {
            throw new IllegalArgumentException("Source weights cannot be null");
        }
        EnumMap<SourceAuthority, Integer> copy = new EnumMap<>(SourceAuthority.class);
        for (SourceAuthority source : SourceAuthority.values()) {
            Integer weight = weights.get(source);
            if (weight == null) {
                throw new IllegalArgumentException("No weight configured for source " + source);
            }
            if (weight < 0 || weight > ConfidenceFactors.MAX_DATA_SOURCE) {
                throw new IllegalArgumentException("Weight for " + source + " must be between 0 and "
                        + ConfidenceFactors.MAX_DATA_SOURCE + ": " + weight);
            }
            copy.put(source, weight);
        }
        return copy;
    }

    private static Map<SpecialtyFreshnessCategory, Integer> validateThresholds(
            Map<SpecialtyFreshnessCategory, Integer> thresholds) {
        if (thresholds == null) {
            throw new IllegalArgumentException("Freshness thresholds cannot be null");
        }
        EnumMap<SpecialtyFreshnessCategory, Integer> copy = new EnumMap<>(SpecialtyFreshnessCategory.class);
        for (SpecialtyFreshnessCategory category : SpecialtyFreshnessCategory.values()) {
            Integer days = thresholds.get(category);
            if (days == null || days < 1) {
                throw new IllegalArgumentException("Freshness threshold for " + category + " must be positive: " + days);
            }
            copy.put(category, days);
        }
        return copy;
    }

    // ==================== Scoring ====================

    /**
     * Computes the score, level and factor breakdown.
     *
     * @throws IllegalArgumentException if counts or tallies are negative
     */
    public ConfidenceResult score(ScoringInput input, Instant now) {
        if (input == null || now == null) {
            throw new IllegalArgumentException("Scoring input and time are required");
        }
        if (input.verificationCount() < 0) {
            throw new IllegalArgumentException("Verification count cannot be negative: " + input.verificationCount());
        }
        if (input.upvotes() < 0 || input.downvotes() < 0) {
            throw new IllegalArgumentException("Vote tallies cannot be negative: "
                    + input.upvotes() + "/" + input.downvotes());
        }

        SpecialtyFreshnessCategory category = SpecialtyFreshnessCategory.classify(input.specialty());
        int thresholdDays = freshnessThresholdDays.get(category);
        Long daysSince = daysSince(input.lastVerifiedAt(), now);

        ConfidenceFactors factors = ConfidenceFactors.of(
                dataSourceScore(input.dataSource()),
                recencyScore(daysSince, thresholdDays),
                verificationScore(input.verificationCount()),
                agreementScore(input.upvotes(), input.downvotes()));

        int score = Math.max(0, Math.min(100, factors.total()));
        ConfidenceLevel level = levelFor(score, input.verificationCount());
        boolean capped = level != ConfidenceLevel.fromScore(score);

        ScoreMetadata metadata = metadata(category, thresholdDays, daysSince, input.verificationCount(), capped);
        return new ConfidenceResult(score, level, factors, describe(level, input.verificationCount(), capped), metadata);
    }

    /**
     * Categorical level for a stored score, held at MEDIUM until consensus is reached.
     */
    public ConfidenceLevel levelFor(int score, int verificationCount) {
        ConfidenceLevel level = ConfidenceLevel.fromScore(score);
        if (isImmature(verificationCount) && level.isAbove(ConfidenceLevel.MEDIUM)) {
            return ConfidenceLevel.MEDIUM;
        }
        return level;
    }

    int dataSourceScore(SourceAuthority source) {
        return source == null ? UNKNOWN_SOURCE_SCORE : sourceWeights.get(source);
    }

    /**
     * Full marks while fresh, stepping down to zero at twice the threshold.
     */
    int recencyScore(Long daysSince, int thresholdDays) {
        if (daysSince == null) {
            return 0;
        }
        double threshold = thresholdDays;
        if (daysSince <= Math.min(30.0, threshold * 0.5)) return 30;
        if (daysSince <= threshold) return 20;
        if (daysSince <= threshold * 1.5) return 10;
        if (daysSince < threshold * 2) return 5;
        return 0;
    }

    int verificationScore(int verificationCount) {
        if (verificationCount <= 0) return 0;
        if (verificationCount >= policy.minVerificationsForConsensus()) return ConfidenceFactors.MAX_VERIFICATION;
        if (verificationCount == 1) return 10;
        return 15;
    }

    int agreementScore(int upvotes, int downvotes) {
        int total = upvotes + downvotes;
        if (total == 0) {
            return NEUTRAL_AGREEMENT_SCORE;
        }
        double ratio = (double) upvotes / total;
        if (ratio >= 1.0) return 20;
        if (ratio >= 0.8) return 15;
        if (ratio >= 0.6) return 10;
        if (ratio >= 0.4) return 5;
        return 0;
    }

    public int freshnessThresholdDays(SpecialtyFreshnessCategory category) {
        return freshnessThresholdDays.get(category);
    }

    private boolean isImmature(int verificationCount) {
        return verificationCount > 0 && verificationCount < policy.minVerificationsForConsensus();
    }

    private static Long daysSince(Instant lastVerifiedAt, Instant now) {
        if (lastVerifiedAt == null) {
            return null;
        }
        long days = Duration.between(lastVerifiedAt, now).toDays();
        return Math.max(0L, days);
    }

    // ==================== Explanation ====================

    private ScoreMetadata metadata(SpecialtyFreshnessCategory category, int thresholdDays, Long daysSince,
                                   int verificationCount, boolean capped) {
        boolean stale = daysSince == null || daysSince > thresholdDays;
        int daysUntilStale = daysSince == null ? 0 : (int) Math.max(0, thresholdDays - daysSince);
        boolean recommendReVerification = daysSince == null || daysSince > thresholdDays * RE_VERIFY_FRACTION;

        StringBuilder explanation = new StringBuilder();
        if (daysSince == null) {
            explanation.append("Never verified. ");
        } else {
            explanation.append("Last verified ").append(daysSince).append(" days ago; ")
                    .append(category.name().toLowerCase(Locale.ROOT).replace('_', ' '))
                    .append(" data is considered fresh for ").append(thresholdDays).append(" days. ");
        }
        if (verificationCount < policy.minVerificationsForConsensus()) {
            int needed = policy.minVerificationsForConsensus() - verificationCount;
            explanation.append(needed).append(needed == 1 ? " more verification" : " more verifications")
                    .append(" needed for consensus.");
        } else {
            explanation.append("Consensus reached with ").append(verificationCount).append(" verifications.");
        }
        if (capped) {
            explanation.append(" Level held at MEDIUM until consensus.");
        }

        return new ScoreMetadata(category, thresholdDays, daysSince, stale, daysUntilStale,
                recommendReVerification, explanation.toString().trim());
    }

    private String describe(ConfidenceLevel level, int verificationCount, boolean capped) {
        if (capped) {
            return "High score from " + verificationCount + " verification"
                    + (verificationCount == 1 ? "" : "s") + "; needs independent confirmation";
        }
        return level.getDescription();
    }

    // ==================== DTOs ====================

    /**
     * Inputs to a score. {@code lastVerifiedAt}, {@code dataSource} and {@code specialty} may be null.
     */
    public record ScoringInput(
            SourceAuthority dataSource,
            Instant lastVerifiedAt,
            int verificationCount,
            int upvotes,
            int downvotes,
            String specialty) {}

    public record ConfidenceResult(
            int score,
            ConfidenceLevel level,
            ConfidenceFactors factors,
            String description,
            ScoreMetadata metadata) {}

    /**
     * @param daysSinceVerification null when never verified
     */
    public record ScoreMetadata(
            SpecialtyFreshnessCategory category,
            int freshnessThresholdDays,
            Long daysSinceVerification,
            boolean stale,
            int daysUntilStale,
            boolean recommendReVerification,
            String explanation) {}
}
