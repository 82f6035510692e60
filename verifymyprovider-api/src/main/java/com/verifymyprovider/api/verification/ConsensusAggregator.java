package com.verifymyprovider.api.verification;

import com.verifymyprovider.api.confidence.ConfidenceLevel;
import com.verifymyprovider.api.confidence.ConfidenceScorer;
import com.verifymyprovider.api.confidence.ConfidenceScorer.ConfidenceResult;
import com.verifymyprovider.api.config.VerificationPolicy;
import com.verifymyprovider.api.error.DuplicateSubmissionException;
import com.verifymyprovider.api.error.NotFoundException;
import com.verifymyprovider.api.error.ValidationException;
import com.verifymyprovider.api.lifecycle.TtlLifecycleManager;
import com.verifymyprovider.api.lookup.PlanLookup;
import com.verifymyprovider.api.lookup.ProviderLookup;
import com.verifymyprovider.api.verification.AcceptanceScoring.Evidence;
import com.verifymyprovider.api.verification.VerificationSubmissionGuard.VoteDecision;
import com.verifymyprovider.core.domain.ConfidenceFactors;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance.AcceptanceStatus;
import com.verifymyprovider.core.domain.SourceAuthority;
import com.verifymyprovider.core.domain.VerificationLog;
import com.verifymyprovider.core.domain.VerificationLog.Submitter;
import com.verifymyprovider.core.domain.VerificationLog.VerificationType;
import com.verifymyprovider.core.domain.VoteLog;
import com.verifymyprovider.core.domain.VoteLog.VoteDirection;
import com.verifymyprovider.core.repository.PracticeLocationRepository;
import com.verifymyprovider.core.repository.ProviderPlanAcceptanceRepository;
import com.verifymyprovider.core.repository.ProviderRepository;
import com.verifymyprovider.core.repository.VerificationLogRepository;
import com.verifymyprovider.core.repository.VoteLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns crowdsourced submissions and votes into acceptance records and confidence scores.
 *
 * Submissions and votes each run in one transaction. A submission holds the provider
 * row lock and a vote holds the verification row lock, so concurrent requests on the
 * same record serialize in the database. Counters move through atomic repository
 * updates; the vote unique key is the final word on duplicates.
 * Identity fields (IP, user agent, submitter) never leave this service.
 */
@Service
public class ConsensusAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusAggregator.class);

    private static final int DEFAULT_RECENT_LIMIT = 20;
    private static final int MAX_RECENT_LIMIT = 100;
    private static final int MAX_PAIR_VERIFICATIONS = 50;
    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final ProviderLookup providerLookup;
    private final PlanLookup planLookup;
    private final VerificationSubmissionGuard guard;
    private final AcceptanceScoring scoring;
    private final ConfidenceScorer scorer;
    private final TtlLifecycleManager ttl;
    private final VerificationPolicy policy;
    private final Clock clock;
    private final VerificationLogRepository verificationLogRepository;
    private final VoteLogRepository voteLogRepository;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final ProviderRepository providerRepository;
    private final PracticeLocationRepository locationRepository;

    public ConsensusAggregator(
            ProviderLookup providerLookup,
            PlanLookup planLookup,
            VerificationSubmissionGuard guard,
            AcceptanceScoring scoring,
            ConfidenceScorer scorer,
            TtlLifecycleManager ttl,
            VerificationPolicy policy,
            Clock clock,
            VerificationLogRepository verificationLogRepository,
            VoteLogRepository voteLogRepository,
            ProviderPlanAcceptanceRepository acceptanceRepository,
            ProviderRepository providerRepository,
            PracticeLocationRepository locationRepository) {
        this.providerLookup = providerLookup;
        this.planLookup = planLookup;
        this.guard = guard;
        this.scoring = scoring;
        this.scorer = scorer;
        this.ttl = ttl;
        this.policy = policy;
        this.clock = clock;
        this.verificationLogRepository = verificationLogRepository;
        this.voteLogRepository = voteLogRepository;
        this.acceptanceRepository = acceptanceRepository;
        this.providerRepository = providerRepository;
        this.locationRepository = locationRepository;
    }

    // ==================== Submit ====================

    /**
     * Records a verification of whether a provider accepts a plan.
     *
     * @throws ValidationException          if the command lacks a provider, plan or source IP
     * @throws NotFoundException            if the provider, plan or a new record's location is unknown
     * @throws DuplicateSubmissionException if the identity already verified this pair recently
     */
    @Transactional
    public SubmissionResult submit(SubmitVerificationCommand command) {
        validate(command);
        String npi = command.npi();
        String planId = command.planId();

        if (!providerLookup.exists(npi)) {
            throw new NotFoundException("Provider not found: " + npi);
        }
        if (!planLookup.exists(planId)) {
            throw new NotFoundException("Plan not found: " + planId);
        }

        providerRepository.findByNpiForUpdate(npi)
                .orElseThrow(() -> new NotFoundException("Provider not found: " + npi));

        Instant now = clock.instant();
        guard.checkSubmission(npi, planId, command.sourceIp(), command.submittedBy(), now);

        AcceptanceStatus submitted = command.acceptsInsurance()
                ? AcceptanceStatus.ACCEPTED
                : AcceptanceStatus.NOT_ACCEPTED;

        Optional<ProviderPlanAcceptance> existing = findAcceptance(npi, planId, command.locationId());
        Map<String, Object> previousValue = existing.map(this::snapshot).orElse(null);

        ProviderPlanAcceptance acceptance;
        if (existing.isPresent()) {
            UUID acceptanceId = existing.get().getId();
            acceptanceRepository.incrementVerificationCount(acceptanceId, now);
            acceptance = acceptanceRepository.findById(acceptanceId)
                    .orElseThrow(() -> new IllegalStateException("Acceptance vanished mid-transaction: " + acceptanceId));
        } else {
            UUID locationId = command.locationId();
            if (locationId != null && !locationRepository.existsByIdAndNpi(locationId, npi)) {
                throw new NotFoundException("Practice location " + locationId + " not found for provider " + npi);
            }
            acceptance = acceptanceRepository.saveAndFlush(ProviderPlanAcceptance.fromFirstVerification(
                    npi, planId, command.locationId(), submitted, SourceAuthority.CROWDSOURCE, now));
        }

        Map<String, Object> newValue = new LinkedHashMap<>();
        newValue.put(AcceptanceScoring.STATUS_KEY, submitted.name());
        if (command.acceptsNewPatients() != null) {
            newValue.put("acceptsNewPatients", command.acceptsNewPatients());
        }

        VerificationLog verification = VerificationLog.create(
                npi, planId,
                VerificationType.PLAN_ACCEPTANCE,
                SourceAuthority.CROWDSOURCE,
                new Submitter(command.sourceIp(), command.userAgent(), command.submittedBy()),
                previousValue, newValue,
                now, ttl.getExpirationDate(now));
        verification.attachEvidence(command.notes(), command.evidenceUrl());
        verification.linkAcceptance(acceptance);
        verification = verificationLogRepository.saveAndFlush(verification);

        Evidence evidence = scoring.liveEvidence(npi, planId, now);
        ConfidenceResult result = scoring.rescore(acceptance, evidence, now);
        acceptance.changeStatus(resolveStatus(submitted, acceptance.getVerificationCount(), result, evidence), now);
        acceptance.renewExpiration(ttl.getExpirationDate(now));

        log.info("Verification {} recorded for {}/{}: status={}, score={}, count={}",
                verification.getId(), npi, planId, acceptance.getAcceptanceStatus(),
                result.score(), acceptance.getVerificationCount());

        return new SubmissionResult(VerificationView.from(verification), AcceptanceView.from(acceptance, result.level()));
    }

    private static void validate(SubmitVerificationCommand command) {
        if (command == null) {
            throw new ValidationException("Submission cannot be null");
        }
        if (command.npi() == null || command.npi().isBlank()) {
            throw new ValidationException("Provider NPI is required");
        }
        if (command.planId() == null || command.planId().isBlank()) {
            throw new ValidationException("Plan ID is required");
        }
        if (command.sourceIp() == null || command.sourceIp().isBlank()) {
            throw new ValidationException("Source IP is required to submit a verification");
        }
    }

    /**
     * Location-specific record first, then the NPI-level one.
     */
    private Optional<ProviderPlanAcceptance> findAcceptance(String npi, String planId, UUID locationId) {
        if (locationId != null) {
            Optional<ProviderPlanAcceptance> atLocation =
                    acceptanceRepository.findByProviderNpiAndPlanIdAndLocationId(npi, planId, locationId);
            if (atLocation.isPresent()) {
                return atLocation;
            }
        }
        return acceptanceRepository.findByProviderNpiAndPlanIdAndLocationIdIsNull(npi, planId);
    }

    private Map<String, Object> snapshot(ProviderPlanAcceptance acceptance) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(AcceptanceScoring.STATUS_KEY, acceptance.getAcceptanceStatus().name());
        snapshot.put("confidenceScore", acceptance.getConfidenceScore());
        return snapshot;
    }

    /**
     * The latest submission sets the status unless an established consensus disagrees:
     * enough verifications, a high enough score, and a majority over twice the minority.
     */
    AcceptanceStatus resolveStatus(AcceptanceStatus submitted, int verificationCount,
                                   ConfidenceResult result, Evidence evidence) {
        if (verificationCount >= policy.minVerificationsForConsensus()
                && result.score() >= policy.minConfidenceForStatusChange()) {
            if (evidence.acceptedSubmissions() > 2 * evidence.notAcceptedSubmissions()) {
                return AcceptanceStatus.ACCEPTED;
            }
            if (evidence.notAcceptedSubmissions() > 2 * evidence.acceptedSubmissions()) {
                return AcceptanceStatus.NOT_ACCEPTED;
            }
        }
        return submitted;
    }

    // ==================== Vote ====================

    /**
     * Records or flips a vote on a verification and rescores the linked acceptance.
     *
     * @throws ValidationException          if the source IP or direction is missing
     * @throws NotFoundException            if the verification does not exist
     * @throws DuplicateSubmissionException if the IP already voted the same way, or flipped concurrently
     */
    @Transactional
    public VoteResult vote(UUID verificationId, VoteDirection direction, String sourceIp) {
        if (sourceIp == null || sourceIp.isBlank()) {
            throw new ValidationException("Source IP is required to vote");
        }
        if (direction == null) {
            throw new ValidationException("Vote direction is required");
        }
        if (verificationId == null) {
            throw new ValidationException("Verification ID is required");
        }
        VerificationLog verification = verificationLogRepository.findByIdForUpdate(verificationId)
                .orElseThrow(() -> new NotFoundException("Verification not found: " + verificationId));

        Instant now = clock.instant();
        VoteDecision decision = guard.checkVote(verificationId, sourceIp, direction);

        if (decision.isChange()) {
            int flipped = voteLogRepository.flipDirection(
                    decision.existing().getId(), direction.opposite(), direction, now);
            if (flipped == 0) {
                throw new DuplicateSubmissionException("Already voted " + direction + " on verification " + verificationId);
            }
            verificationLogRepository.adjustVoteTallies(verificationId,
                    direction == VoteDirection.UP ? 1 : -1,
                    direction == VoteDirection.DOWN ? 1 : -1);
        } else {
            try {
                voteLogRepository.saveAndFlush(VoteLog.create(verification, sourceIp, direction, now));
            } catch (DataIntegrityViolationException e) {
                throw new DuplicateSubmissionException("Already voted on verification " + verificationId, e);
            }
            verificationLogRepository.adjustVoteTallies(verificationId,
                    direction == VoteDirection.UP ? 1 : 0,
                    direction == VoteDirection.DOWN ? 1 : 0);
        }

        VerificationLog updated = verificationLogRepository.findById(verificationId)
                .orElseThrow(() -> new IllegalStateException("Verification vanished mid-transaction: " + verificationId));
        Integer acceptanceScore = updated.getAcceptance()
                .map(acceptance -> scoring.rescore(acceptance, now).score())
                .orElse(null);

        log.info("Vote {} on verification {} ({}), tallies {}/{}",
                direction, verificationId, decision.isChange() ? "changed" : "new",
                updated.getUpvotes(), updated.getDownvotes());

        return new VoteResult(VerificationView.from(updated), decision.isChange(), acceptanceScore);
    }

    // ==================== Read side ====================

    @Transactional(readOnly = true)
    public VerificationStats getStats() {
        Instant now = clock.instant();
        Map<VerificationType, Long> byType = new EnumMap<>(VerificationType.class);
        for (VerificationType type : VerificationType.values()) {
            byType.put(type, verificationLogRepository.countByVerificationType(type));
        }
        return new VerificationStats(
                verificationLogRepository.count(),
                verificationLogRepository.countByApproved(Boolean.TRUE),
                verificationLogRepository.countByApprovedIsNull(),
                byType,
                verificationLogRepository.countByCreatedAtGreaterThanEqual(now.minus(RECENT_WINDOW)));
    }

    /**
     * Newest verifications first, expired ones hidden unless asked for.
     */
    @Transactional(readOnly = true)
    public List<VerificationView> getRecentVerifications(RecentVerificationsQuery query) {
        RecentVerificationsQuery effective = query != null ? query : RecentVerificationsQuery.latest();
        int limit = effective.limit() == null
                ? DEFAULT_RECENT_LIMIT
                : Math.max(1, Math.min(MAX_RECENT_LIMIT, effective.limit()));

        List<Specification<VerificationLog>> filters = new ArrayList<>();
        if (effective.npi() != null) {
            filters.add((root, q, cb) -> cb.equal(root.get("providerNpi"), effective.npi()));
        }
        if (effective.planId() != null) {
            filters.add((root, q, cb) -> cb.equal(root.get("planId"), effective.planId()));
        }
        if (!effective.includeExpired()) {
            filters.add(TtlLifecycleManager.notExpiredAt(clock.instant()));
        }

        return verificationLogRepository.findAll(Specification.allOf(filters), PageRequest.of(0, limit, NEWEST_FIRST))
                .map(VerificationView::from)
                .getContent();
    }

    /**
     * Acceptance record and verification history for one provider/plan pair.
     * Empty when either side is unknown.
     */
    @Transactional(readOnly = true)
    public Optional<PairVerifications> getVerificationsForPair(String npi, String planId, boolean includeExpired) {
        if (!providerLookup.exists(npi) || !planLookup.exists(planId)) {
            return Optional.empty();
        }
        Instant now = clock.instant();

        Optional<ProviderPlanAcceptance> acceptance =
                acceptanceRepository.findByProviderNpiAndPlanIdAndLocationIdIsNull(npi, planId);
        boolean acceptanceExpired = acceptance.map(a -> a.isExpiredAt(now)).orElse(false);

        List<Specification<VerificationLog>> filters = new ArrayList<>();
        filters.add((root, q, cb) -> cb.equal(root.get("providerNpi"), npi));
        filters.add((root, q, cb) -> cb.equal(root.get("planId"), planId));
        if (!includeExpired) {
            filters.add(TtlLifecycleManager.notExpiredAt(now));
        }
        List<VerificationLog> verifications = verificationLogRepository.findAll(
                Specification.allOf(filters), PageRequest.of(0, MAX_PAIR_VERIFICATIONS, NEWEST_FIRST)).getContent();

        long upvotes = verifications.stream().mapToLong(VerificationLog::getUpvotes).sum();
        long downvotes = verifications.stream().mapToLong(VerificationLog::getDownvotes).sum();

        AcceptanceView acceptanceView = acceptance
                .filter(a -> includeExpired || !a.isExpiredAt(now))
                .map(a -> AcceptanceView.from(a, scorer.levelFor(a.getConfidenceScore(), a.getVerificationCount())))
                .orElse(null);

        return Optional.of(new PairVerifications(
                acceptanceView,
                acceptanceExpired,
                verifications.stream().map(VerificationView::from).toList(),
                new PairSummary(verifications.size(), upvotes, downvotes)));
    }

    // ==================== DTOs ====================

    /**
     * A crowdsourced verification. Identity signals are used for abuse checks only.
     */
    public record SubmitVerificationCommand(
            String npi,
            String planId,
            boolean acceptsInsurance,
            String sourceIp,
            String userAgent,
            String submittedBy,
            UUID locationId,
            Boolean acceptsNewPatients,
            String notes,
            String evidenceUrl) {

        public static SubmitVerificationCommand of(String npi, String planId, boolean acceptsInsurance, String sourceIp) {
            return new SubmitVerificationCommand(npi, planId, acceptsInsurance, sourceIp,
                    null, null, null, null, null, null);
        }

        public SubmitVerificationCommand withSubmitter(String submittedBy) {
            return new SubmitVerificationCommand(npi, planId, acceptsInsurance, sourceIp,
                    userAgent, submittedBy, locationId, acceptsNewPatients, notes, evidenceUrl);
        }

        public SubmitVerificationCommand atLocation(UUID locationId) {
            return new SubmitVerificationCommand(npi, planId, acceptsInsurance, sourceIp,
                    userAgent, submittedBy, locationId, acceptsNewPatients, notes, evidenceUrl);
        }
    }

    public record SubmissionResult(VerificationView verification, AcceptanceView acceptance) {}

    /**
     * @param acceptanceScore rescored confidence of the linked acceptance, null when unlinked
     */
    public record VoteResult(VerificationView verification, boolean voteChanged, Integer acceptanceScore) {}

    public record RecentVerificationsQuery(Integer limit, String npi, String planId, boolean includeExpired) {

        public static RecentVerificationsQuery latest() {
            return new RecentVerificationsQuery(null, null, null, false);
        }
    }

    public record VerificationStats(
            long total,
            long approved,
            long pending,
            Map<VerificationType, Long> byType,
            long recentCount) {}

    public record PairSummary(long totalVerifications, long totalUpvotes, long totalDownvotes) {}

    /**
     * @param acceptance null when there is no record, or it expired and expired data was not requested
     */
    public record PairVerifications(
            AcceptanceView acceptance,
            boolean acceptanceExpired,
            List<VerificationView> verifications,
            PairSummary summary) {}

    /**
     * Verification as shown to callers: no source IP, user agent or submitter.
     */
    public record VerificationView(
            UUID id,
            String providerNpi,
            String planId,
            UUID acceptanceId,
            VerificationType verificationType,
            SourceAuthority verificationSource,
            Map<String, Object> previousValue,
            Map<String, Object> newValue,
            int upvotes,
            int downvotes,
            Boolean approved,
            String notes,
            String evidenceUrl,
            Instant createdAt,
            Instant expiresAt) {

        static VerificationView from(VerificationLog verification) {
            return new VerificationView(
                    verification.getId(),
                    verification.getProviderNpi(),
                    verification.getPlanId(),
                    verification.getAcceptance().map(ProviderPlanAcceptance::getId).orElse(null),
                    verification.getVerificationType(),
                    verification.getVerificationSource(),
                    verification.getPreviousValue(),
                    verification.getNewValue(),
                    verification.getUpvotes(),
                    verification.getDownvotes(),
                    verification.getApproved(),
                    verification.getNotes(),
                    verification.getEvidenceUrl(),
                    verification.getCreatedAt(),
                    verification.getExpiresAt().orElse(null));
        }
    }

    public record AcceptanceView(
            UUID id,
            String providerNpi,
            String planId,
            UUID locationId,
            AcceptanceStatus acceptanceStatus,
            int confidenceScore,
            ConfidenceLevel confidenceLevel,
            ConfidenceFactors confidenceFactors,
            int verificationCount,
            Instant lastVerifiedAt,
            Instant expiresAt) {

        static AcceptanceView from(ProviderPlanAcceptance acceptance, ConfidenceLevel level) {
            return new AcceptanceView(
                    acceptance.getId(),
                    acceptance.getProviderNpi(),
                    acceptance.getPlanId(),
                    acceptance.getLocationId().orElse(null),
                    acceptance.getAcceptanceStatus(),
                    acceptance.getConfidenceScore(),
                    level,
                    acceptance.getConfidenceFactors(),
                    acceptance.getVerificationCount(),
                    acceptance.getLastVerifiedAt().orElse(null),
                    acceptance.getExpiresAt().orElse(null));
        }
    }
}
