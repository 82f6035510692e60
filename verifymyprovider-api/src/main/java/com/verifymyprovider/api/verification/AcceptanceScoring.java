package com.verifymyprovider.api.verification;

import com.verifymyprovider.api.confidence.ConfidenceScorer;
import com.verifymyprovider.api.confidence.ConfidenceScorer.ConfidenceResult;
import com.verifymyprovider.api.confidence.ConfidenceScorer.ScoringInput;
import com.verifymyprovider.api.lookup.ProviderLookup;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance.AcceptanceStatus;
import com.verifymyprovider.core.domain.VerificationLog;
import com.verifymyprovider.core.domain.VerificationLog.VerificationType;
import com.verifymyprovider.core.repository.VerificationLogRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Feeds live evidence for an acceptance record into the scorer.
 * Expired verifications never contribute.
 *
 * Evidence is pooled per provider/plan pair: verifications carry no location, so a
 * location-specific record and the NPI-level record of the same pair are scored
 * against the same submissions and votes.
 */
@Component
public class AcceptanceScoring {

    static final String STATUS_KEY = "acceptanceStatus";

    private final ConfidenceScorer scorer;
    private final ProviderLookup providerLookup;
    private final VerificationLogRepository verificationLogRepository;

    public AcceptanceScoring(ConfidenceScorer scorer,
                             ProviderLookup providerLookup,
                             VerificationLogRepository verificationLogRepository) {
        this.scorer = scorer;
        this.providerLookup = providerLookup;
        this.verificationLogRepository = verificationLogRepository;
    }

    /**
     * Tallies submissions and votes of the unexpired acceptance verifications for a pair,
     * across all of its locations.
     */
    public Evidence liveEvidence(String npi, String planId, Instant now) {
        List<VerificationLog> live = verificationLogRepository.findLiveForPair(
                npi, planId, VerificationType.PLAN_ACCEPTANCE, now);
        int accepted = 0;
        int notAccepted = 0;
        int upvotes = 0;
        int downvotes = 0;
        for (VerificationLog verification : live) {
            Object status = verification.getNewValue().get(STATUS_KEY);
            if (AcceptanceStatus.ACCEPTED.name().equals(status)) {
                accepted++;
            } else if (AcceptanceStatus.NOT_ACCEPTED.name().equals(status)) {
                notAccepted++;
            }
            upvotes += verification.getUpvotes();
            downvotes += verification.getDownvotes();
        }
        return new Evidence(accepted, notAccepted, upvotes, downvotes);
    }

    /**
     * Scores the record against the given evidence without modifying it.
     */
    public ConfidenceResult evaluate(ProviderPlanAcceptance acceptance, Evidence evidence, Instant now) {
        String specialty = providerLookup.specialtyOf(acceptance.getProviderNpi()).orElse(null);
        return scorer.score(new ScoringInput(
                acceptance.getDataSource(),
                acceptance.getLastVerifiedAt().orElse(null),
                acceptance.getVerificationCount(),
                evidence.upvotes(),
                evidence.downvotes(),
                specialty), now);
    }

    /**
     * Scores the record and stores the result on it.
     */
    public ConfidenceResult rescore(ProviderPlanAcceptance acceptance, Evidence evidence, Instant now) {
        ConfidenceResult result = evaluate(acceptance, evidence, now);
        acceptance.applyScore(result.score(), result.factors(), now);
        return result;
    }

    public ConfidenceResult rescore(ProviderPlanAcceptance acceptance, Instant now) {
        return rescore(acceptance, liveEvidence(acceptance.getProviderNpi(), acceptance.getPlanId(), now), now);
    }

    /**
     * Live submission directions and summed vote tallies.
     */
    public record Evidence(int acceptedSubmissions, int notAcceptedSubmissions, int upvotes, int downvotes) {

        public int submissions() {
            return acceptedSubmissions + notAcceptedSubmissions;
        }
    }
}
