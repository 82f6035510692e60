package com.verifymyprovider.api.verification;

import com.verifymyprovider.api.confidence.ConfidenceLevel;
import com.verifymyprovider.api.confidence.ConfidenceScorer.ConfidenceResult;
import com.verifymyprovider.api.error.DuplicateSubmissionException;
import com.verifymyprovider.api.error.NotFoundException;
import com.verifymyprovider.api.error.ValidationException;
import com.verifymyprovider.api.support.MutableClock;
import com.verifymyprovider.api.support.TestClockConfiguration;
import com.verifymyprovider.api.support.TrustCoreFixtures;
import com.verifymyprovider.api.verification.ConsensusAggregator.AcceptanceView;
import com.verifymyprovider.api.verification.ConsensusAggregator.PairVerifications;
import com.verifymyprovider.api.verification.ConsensusAggregator.RecentVerificationsQuery;
import com.verifymyprovider.api.verification.ConsensusAggregator.SubmissionResult;
import com.verifymyprovider.api.verification.ConsensusAggregator.SubmitVerificationCommand;
import com.verifymyprovider.api.verification.ConsensusAggregator.VerificationStats;
import com.verifymyprovider.api.verification.ConsensusAggregator.VerificationView;
import com.verifymyprovider.api.verification.ConsensusAggregator.VoteResult;
import com.verifymyprovider.core.domain.PracticeLocation;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance.AcceptanceStatus;
import com.verifymyprovider.core.domain.SourceAuthority;
import com.verifymyprovider.core.domain.VerificationLog;
import com.verifymyprovider.core.domain.VerificationLog.VerificationType;
import com.verifymyprovider.core.domain.VoteLog.VoteDirection;
import com.verifymyprovider.core.repository.PracticeLocationRepository;
import com.verifymyprovider.core.repository.ProviderPlanAcceptanceRepository;
import com.verifymyprovider.core.repository.VerificationLogRepository;
import com.verifymyprovider.core.repository.VoteLogRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Submission, voting and read-side behaviour of the consensus aggregator against H2.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestClockConfiguration.class, TrustCoreFixtures.class})
class ConsensusAggregatorTest {

    private static final String NPI = "1234567893";
    private static final String PLAN = "BCBS-PPO-01";

    @Autowired
    private ConsensusAggregator aggregator;

    @Autowired
    private TrustCoreFixtures fixtures;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ProviderPlanAcceptanceRepository acceptanceRepository;

    @Autowired
    private VerificationLogRepository verificationLogRepository;

    @Autowired
    private VoteLogRepository voteLogRepository;

    @Autowired
    private PracticeLocationRepository locationRepository;

    @Autowired
    private AcceptanceScoring scoring;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfiguration.START);
        fixtures.wipe();
        fixtures.provider(NPI, "Family Medicine");
        fixtures.plan(PLAN);
    }

    // ==================== Submit ====================

    @Test
    void firstSubmission_createsAcceptanceWithSingleVerification() {
        SubmissionResult result = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));

        AcceptanceView acceptance = result.acceptance();
        assertEquals(AcceptanceStatus.ACCEPTED, acceptance.acceptanceStatus());
        assertEquals(1, acceptance.verificationCount());
        // crowdsource 15 + fresh 30 + one verification 10 + no votes 10
        assertEquals(65, acceptance.confidenceScore());
        assertEquals(ConfidenceLevel.MEDIUM, acceptance.confidenceLevel());
        assertEquals(TestClockConfiguration.START, acceptance.lastVerifiedAt());
        assertEquals(TestClockConfiguration.START.plus(Duration.ofDays(180)), acceptance.expiresAt());

        VerificationView verification = result.verification();
        assertEquals(VerificationType.PLAN_ACCEPTANCE, verification.verificationType());
        assertEquals("ACCEPTED", verification.newValue().get("acceptanceStatus"));
        assertNull(verification.previousValue());
        assertEquals(acceptance.id(), verification.acceptanceId());
        assertEquals(TestClockConfiguration.START.plus(Duration.ofDays(180)), verification.expiresAt());
    }

    @Test
    void notAcceptedSubmission_setsStatusBeforeConsensus() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));
        SubmissionResult second = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, false, "10.0.0.2"));

        assertEquals(AcceptanceStatus.NOT_ACCEPTED, second.acceptance().acceptanceStatus());
        assertEquals(2, second.acceptance().verificationCount());
        assertEquals("ACCEPTED", second.verification().previousValue().get("acceptanceStatus"));
        assertEquals(1, acceptanceRepository.count());
    }

    @Test
    void establishedConsensus_isNotFlippedBySingleDissent() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.2"));
        SubmissionResult third = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.3"));
        // 15 + 30 + 25 + 10
        assertEquals(80, third.acceptance().confidenceScore());
        assertEquals(ConfidenceLevel.HIGH, third.acceptance().confidenceLevel());

        SubmissionResult dissent = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, false, "10.0.0.4"));

        assertEquals(AcceptanceStatus.ACCEPTED, dissent.acceptance().acceptanceStatus());
        assertEquals(4, dissent.acceptance().verificationCount());
    }

    @Test
    void verificationCount_matchesNumberOfSubmissions() {
        for (int i = 1; i <= 5; i++) {
            aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, i % 2 == 0, "10.0.1." + i));
        }

        ProviderPlanAcceptance stored = acceptanceRepository
                .findByProviderNpiAndPlanIdAndLocationIdIsNull(NPI, PLAN).orElseThrow();
        assertEquals(5, stored.getVerificationCount());
        assertEquals(5, verificationLogRepository.count());
        assertTrue(stored.getConfidenceScore() >= 0 && stored.getConfidenceScore() <= 100);
    }

    @Test
    void repeatSubmissionFromSameIp_isRejected() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));

        assertThrows(DuplicateSubmissionException.class,
                () -> aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, false, "10.0.0.1")));
        assertEquals(1, verificationLogRepository.count());
        assertEquals(1, acceptanceRepository.findByProviderNpiAndPlanIdAndLocationIdIsNull(NPI, PLAN)
                .orElseThrow().getVerificationCount());
    }

    @Test
    void repeatSubmissionFromSameSubmitter_isRejectedAcrossIps() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1").withSubmitter("pat@example.org"));

        assertThrows(DuplicateSubmissionException.class, () -> aggregator.submit(
                SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.9").withSubmitter("pat@example.org")));
    }

    @Test
    void sameIp_mayResubmitAfterSybilWindow() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));
        clock.advance(Duration.ofDays(31));

        SubmissionResult again = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));

        assertEquals(2, again.acceptance().verificationCount());
    }

    @Test
    void sameIp_mayVerifyADifferentPlan() {
        fixtures.plan("AETNA-HMO-02");
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));

        assertDoesNotThrow(() -> aggregator.submit(SubmitVerificationCommand.of(NPI, "AETNA-HMO-02", true, "10.0.0.1")));
    }

    @Test
    void unknownProviderOrPlan_isNotFound() {
        assertThrows(NotFoundException.class,
                () -> aggregator.submit(SubmitVerificationCommand.of("9999999999", PLAN, true, "10.0.0.1")));
        assertThrows(NotFoundException.class,
                () -> aggregator.submit(SubmitVerificationCommand.of(NPI, "NO-SUCH-PLAN", true, "10.0.0.1")));
        assertEquals(0, verificationLogRepository.count());
    }

    @Test
    void missingSourceIp_isRejected() {
        assertThrows(ValidationException.class,
                () -> aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, " ")));
        assertThrows(ValidationException.class,
                () -> aggregator.submit(SubmitVerificationCommand.of(NPI, "", true, "10.0.0.1")));
    }

    @Test
    void submissionAtUnknownLocation_fallsBackToNpiLevelRecord() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));

        SubmissionResult atLocation = aggregator.submit(
                SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.2").atLocation(UUID.randomUUID()));

        assertEquals(2, atLocation.acceptance().verificationCount());
        assertNull(atLocation.acceptance().locationId());
    }

    @Test
    void firstSubmissionAtKnownLocation_createsLocationRecord() {
        PracticeLocation location = locationRepository.save(
                PracticeLocation.create(NPI, "Av. Sol 120", "Cusco", "CU", "08000"));

        SubmissionResult result = aggregator.submit(
                SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1").atLocation(location.getId()));

        assertEquals(location.getId(), result.acceptance().locationId());
        assertTrue(acceptanceRepository.findByProviderNpiAndPlanIdAndLocationIdIsNull(NPI, PLAN).isEmpty());
    }

    @Test
    void firstSubmissionAtUnknownLocation_isNotFound() {
        assertThrows(NotFoundException.class, () -> aggregator.submit(
                SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1").atLocation(UUID.randomUUID())));
        assertEquals(0, acceptanceRepository.count());
        assertEquals(0, verificationLogRepository.count());
    }

    @Test
    void locationRecord_isScoredOnEvidencePooledAcrossThePair() {
        PracticeLocation location = locationRepository.save(
                PracticeLocation.create(NPI, "Av. Sol 120", "Cusco", "CU", "08000"));
        UUID verificationId = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"))
                .verification().id();
        aggregator.vote(verificationId, VoteDirection.DOWN, "10.0.9.1");
        aggregator.vote(verificationId, VoteDirection.DOWN, "10.0.9.2");
        ProviderPlanAcceptance atLocation = acceptanceRepository.saveAndFlush(
                ProviderPlanAcceptance.fromFirstVerification(NPI, PLAN, location.getId(),
                        AcceptanceStatus.ACCEPTED, SourceAuthority.CROWDSOURCE, clock.instant()));

        ConfidenceResult result = scoring.evaluate(
                atLocation, scoring.liveEvidence(NPI, PLAN, clock.instant()), clock.instant());

        // votes cast on the NPI-level verification count here too: agreement 0
        assertEquals(55, result.score());
    }

    @Test
    void storedVerification_keepsIdentityButViewsDoNot() throws Exception {
        SubmissionResult result = aggregator.submit(new SubmitVerificationCommand(
                NPI, PLAN, true, "10.0.0.1", "Mozilla/5.0", "pat@example.org",
                null, Boolean.TRUE, "Called the front desk", null));

        VerificationLog stored = verificationLogRepository.findById(result.verification().id()).orElseThrow();
        assertEquals("10.0.0.1", stored.getSourceIp());
        assertEquals("pat@example.org", stored.getSubmittedBy());
        assertEquals(Boolean.TRUE, result.verification().newValue().get("acceptsNewPatients"));
        assertEquals("Called the front desk", result.verification().notes());

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));
        JsonNode view = json.get("verification");
        assertEquals(result.verification().id().toString(), view.get("id").asText());
        assertFalse(view.has("sourceIp"));
        assertFalse(view.has("userAgent"));
        assertFalse(view.has("submittedBy"));
        assertFalse(json.toString().contains("10.0.0.1"));
        assertFalse(json.toString().contains("pat@example.org"));
        assertFalse(json.toString().contains("Mozilla"));
    }

    // ==================== Vote ====================

    @Test
    void upvote_raisesTallyAndAcceptanceScore() {
        SubmissionResult submitted = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));

        VoteResult vote = aggregator.vote(submitted.verification().id(), VoteDirection.UP, "10.0.9.1");

        assertFalse(vote.voteChanged());
        assertEquals(1, vote.verification().upvotes());
        assertEquals(0, vote.verification().downvotes());
        // agreement moves from neutral 10 to 20
        assertEquals(75, vote.acceptanceScore());
        assertEquals(75, acceptanceRepository.findByProviderNpiAndPlanIdAndLocationIdIsNull(NPI, PLAN)
                .orElseThrow().getConfidenceScore());
    }

    @Test
    void sameVoteTwice_isRejected() {
        UUID verificationId = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"))
                .verification().id();
        aggregator.vote(verificationId, VoteDirection.UP, "10.0.9.1");

        assertThrows(DuplicateSubmissionException.class,
                () -> aggregator.vote(verificationId, VoteDirection.UP, "10.0.9.1"));

        VerificationLog stored = verificationLogRepository.findById(verificationId).orElseThrow();
        assertEquals(1, stored.getUpvotes());
        assertEquals(1, voteLogRepository.countByVerification(verificationId));
    }

    @Test
    void changedVote_movesOneTallyToTheOther() {
        UUID verificationId = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"))
                .verification().id();
        aggregator.vote(verificationId, VoteDirection.UP, "10.0.9.1");

        VoteResult changed = aggregator.vote(verificationId, VoteDirection.DOWN, "10.0.9.1");

        assertTrue(changed.voteChanged());
        assertEquals(0, changed.verification().upvotes());
        assertEquals(1, changed.verification().downvotes());
        // all votes against: agreement 0
        assertEquals(55, changed.acceptanceScore());
        assertEquals(1, voteLogRepository.countByVerification(verificationId));
        ProviderPlanAcceptance stored = acceptanceRepository
                .findByProviderNpiAndPlanIdAndLocationIdIsNull(NPI, PLAN).orElseThrow();
        assertEquals(1, stored.getVerificationCount());
    }

    @Test
    void votesFromDistinctIps_accumulate() {
        UUID verificationId = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"))
                .verification().id();
        aggregator.vote(verificationId, VoteDirection.UP, "10.0.9.1");
        aggregator.vote(verificationId, VoteDirection.UP, "10.0.9.2");
        VoteResult last = aggregator.vote(verificationId, VoteDirection.DOWN, "10.0.9.3");

        assertEquals(2, last.verification().upvotes());
        assertEquals(1, last.verification().downvotes());
        assertEquals(3, voteLogRepository.countByVerification(verificationId));
    }

    @Test
    void voteWithoutIp_orOnUnknownVerification_isRejected() {
        UUID verificationId = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"))
                .verification().id();

        assertThrows(ValidationException.class, () -> aggregator.vote(verificationId, VoteDirection.UP, ""));
        assertThrows(ValidationException.class, () -> aggregator.vote(verificationId, null, "10.0.9.1"));
        assertThrows(NotFoundException.class, () -> aggregator.vote(UUID.randomUUID(), VoteDirection.UP, "10.0.9.1"));
    }

    // ==================== Read side ====================

    @Test
    void stats_countPendingAndRecentVerifications() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, false, "10.0.0.2"));

        VerificationStats stats = aggregator.getStats();

        assertEquals(2, stats.total());
        assertEquals(0, stats.approved());
        assertEquals(2, stats.pending());
        assertEquals(2L, stats.byType().get(VerificationType.PLAN_ACCEPTANCE));
        assertEquals(0L, stats.byType().get(VerificationType.PROVIDER_INFO));
        assertEquals(2, stats.recentCount());

        clock.advance(Duration.ofDays(2));
        assertEquals(0, aggregator.getStats().recentCount());
    }

    @Test
    void recentVerifications_hideExpiredUnlessAsked() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.2"));

        assertEquals(2, aggregator.getRecentVerifications(RecentVerificationsQuery.latest()).size());
        assertEquals(1, aggregator.getRecentVerifications(new RecentVerificationsQuery(1, null, null, false)).size());

        clock.advance(Duration.ofDays(181));

        assertTrue(aggregator.getRecentVerifications(RecentVerificationsQuery.latest()).isEmpty());
        assertEquals(2, aggregator.getRecentVerifications(new RecentVerificationsQuery(null, NPI, PLAN, true)).size());
    }

    @Test
    void recentVerifications_areNewestFirst() {
        aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"));
        clock.advance(Duration.ofHours(1));
        SubmissionResult newer = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, false, "10.0.0.2"));

        List<VerificationView> recent = aggregator.getRecentVerifications(RecentVerificationsQuery.latest());

        assertEquals(newer.verification().id(), recent.get(0).id());
    }

    @Test
    void pairVerifications_summariseVotesAndHideExpiredAcceptance() {
        UUID verificationId = aggregator.submit(SubmitVerificationCommand.of(NPI, PLAN, true, "10.0.0.1"))
                .verification().id();
        aggregator.vote(verificationId, VoteDirection.UP, "10.0.9.1");
        aggregator.vote(verificationId, VoteDirection.DOWN, "10.0.9.2");

        PairVerifications live = aggregator.getVerificationsForPair(NPI, PLAN, false).orElseThrow();
        assertNotNull(live.acceptance());
        assertFalse(live.acceptanceExpired());
        assertEquals(1, live.summary().totalVerifications());
        assertEquals(1, live.summary().totalUpvotes());
        assertEquals(1, live.summary().totalDownvotes());

        clock.advance(Duration.ofDays(200));

        PairVerifications expired = aggregator.getVerificationsForPair(NPI, PLAN, false).orElseThrow();
        assertNull(expired.acceptance());
        assertTrue(expired.acceptanceExpired());
        assertTrue(expired.verifications().isEmpty());

        PairVerifications history = aggregator.getVerificationsForPair(NPI, PLAN, true).orElseThrow();
        assertNotNull(history.acceptance());
        assertEquals(1, history.verifications().size());
    }

    @Test
    void pairVerifications_areEmptyForUnknownPair() {
        Optional<PairVerifications> unknown = aggregator.getVerificationsForPair("9999999999", PLAN, true);

        assertTrue(unknown.isEmpty());
    }
}
