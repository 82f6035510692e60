package com.verifymyprovider.api.lifecycle;

import com.verifymyprovider.api.config.VerificationPolicy;
import com.verifymyprovider.api.confidence.ConfidenceScorer.ConfidenceResult;
import com.verifymyprovider.api.verification.AcceptanceScoring;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import com.verifymyprovider.core.repository.ProviderPlanAcceptanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Rescores every verified acceptance record so recency decay shows up in stored
 * scores even when nobody touches the record.
 *
 * Pages are committed one at a time. A record that fails to score is logged and
 * counted; the run carries on with the rest.
 */
@Service
public class ConfidenceDecayService {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceDecayService.class);

    private static final Sort BY_ID = Sort.by("id");

    private final AcceptanceScoring scoring;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final TransactionTemplate transactionTemplate;
    private final VerificationPolicy policy;
    private final Clock clock;

    public ConfidenceDecayService(
            AcceptanceScoring scoring,
            ProviderPlanAcceptanceRepository acceptanceRepository,
            TransactionTemplate transactionTemplate,
            VerificationPolicy policy,
            Clock clock) {
        this.scoring = scoring;
        this.acceptanceRepository = acceptanceRepository;
        this.transactionTemplate = transactionTemplate;
        this.policy = policy;
        this.clock = clock;
    }

    public DecayRecalculationStats recalculateAll(boolean dryRun) {
        return recalculateAll(dryRun, null, policy.decayBatchSize());
    }

    /**
     * @param dryRun    compute and count changes without writing them
     * @param limit     maximum records to process, null for all
     * @param batchSize records per page and transaction
     */
    public DecayRecalculationStats recalculateAll(boolean dryRun, Integer limit, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        long startedNanos = System.nanoTime();
        Instant now = clock.instant();

        long eligible = acceptanceRepository.countByVerificationCountGreaterThanEqual(1);
        long target = limit == null ? eligible : Math.min(limit, eligible);
        log.info("Confidence decay {}: {} records to rescore", dryRun ? "dry run" : "run", target);

        int processed = 0;
        int updated = 0;
        int unchanged = 0;
        int errors = 0;
        int page = 0;

        while (processed < target) {
            int remaining = (int) Math.min(batchSize, target - processed);
            int pageNumber = page;
            PageOutcome outcome = transactionTemplate.execute(status -> rescorePage(
                    acceptanceRepository.findByVerificationCountGreaterThanEqual(
                            1, PageRequest.of(pageNumber, batchSize, BY_ID)),
                    remaining, dryRun, now));
            if (outcome == null || outcome.processed() == 0) {
                break;
            }
            processed += outcome.processed();
            updated += outcome.updated();
            unchanged += outcome.unchanged();
            errors += outcome.errors();
            page++;
        }

        long durationMs = (System.nanoTime() - startedNanos) / 1_000_000;
        log.info("Confidence decay finished: processed={}, updated={}, unchanged={}, errors={}, {}ms",
                processed, updated, unchanged, errors, durationMs);
        return new DecayRecalculationStats(dryRun, processed, updated, unchanged, errors, durationMs);
    }

    private PageOutcome rescorePage(List<ProviderPlanAcceptance> batch, int remaining, boolean dryRun, Instant now) {
        int processed = 0;
        int updated = 0;
        int unchanged = 0;
        int errors = 0;
        for (ProviderPlanAcceptance acceptance : batch) {
            if (processed >= remaining) {
                break;
            }
            processed++;
            try {
                AcceptanceScoring.Evidence evidence = scoring.liveEvidence(
                        acceptance.getProviderNpi(), acceptance.getPlanId(), now);
                ConfidenceResult result = scoring.evaluate(acceptance, evidence, now);
                if (result.score() == acceptance.getConfidenceScore()
                        && result.factors().equals(acceptance.getConfidenceFactors())) {
                    unchanged++;
                    continue;
                }
                if (!dryRun) {
                    acceptance.applyScore(result.score(), result.factors(), now);
                }
                updated++;
            } catch (IllegalArgumentException | IllegalStateException e) {
                errors++;
                log.warn("Could not rescore acceptance {}: {}", acceptance.getId(), e.getMessage());
            }
        }
        return new PageOutcome(processed, updated, unchanged, errors);
    }

    private record PageOutcome(int processed, int updated, int unchanged, int errors) {}

    public record DecayRecalculationStats(
            boolean dryRun,
            int processed,
            int updated,
            int unchanged,
            int errors,
            long durationMs) {}
}
