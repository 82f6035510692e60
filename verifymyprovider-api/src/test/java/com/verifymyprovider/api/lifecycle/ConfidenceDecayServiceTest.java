package com.verifymyprovider.api.lifecycle;

import com.verifymyprovider.api.lifecycle.ConfidenceDecayService.DecayRecalculationStats;
import com.verifymyprovider.api.support.MutableClock;
import com.verifymyprovider.api.support.TestClockConfiguration;
import com.verifymyprovider.api.support.TrustCoreFixtures;
import com.verifymyprovider.api.verification.ConsensusAggregator;
import com.verifymyprovider.api.verification.ConsensusAggregator.SubmitVerificationCommand;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance.AcceptanceStatus;
import com.verifymyprovider.core.domain.SourceAuthority;
import com.verifymyprovider.core.repository.ProviderPlanAcceptanceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Pageable;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Batch rescoring picks up recency decay on records nobody has touched.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestClockConfiguration.class, TrustCoreFixtures.class})
class ConfidenceDecayServiceTest {

    private static final String NPI = "1234567893";
    private static final List<String> PLANS = List.of("P-1", "P-2", "P-3");

    @Autowired
    private ConfidenceDecayService decayService;

    @Autowired
    private ConsensusAggregator aggregator;

    @Autowired
    private TrustCoreFixtures fixtures;

    @Autowired
    private MutableClock clock;

    @Autowired
    private ProviderPlanAcceptanceRepository acceptanceRepository;

    @BeforeEach
    void setUp() {
        clock.setInstant(TestClockConfiguration.START);
        fixtures.wipe();
        fixtures.provider(NPI, "Family Medicine");
        for (String plan : PLANS) {
            fixtures.plan(plan);
            aggregator.submit(SubmitVerificationCommand.of(NPI, plan, true, "10.0.0.1"));
        }
        fixtures.plan("P-IMPORTED");
        acceptanceRepository.save(ProviderPlanAcceptance.fromImport(
                NPI, "P-IMPORTED", null, AcceptanceStatus.ACCEPTED, SourceAuthority.CMS_DATA,
                TestClockConfiguration.START));
    }

    @Test
    void freshScores_areLeftUnchanged() {
        DecayRecalculationStats stats = decayService.recalculateAll(false);

        assertEquals(3, stats.processed());
        assertEquals(0, stats.updated());
        assertEquals(3, stats.unchanged());
        assertEquals(0, stats.errors());
    }

    @Test
    void dryRun_countsDecayWithoutWriting() {
        clock.advance(Duration.ofDays(70));

        DecayRecalculationStats stats = decayService.recalculateAll(true);

        assertTrue(stats.dryRun());
        assertEquals(3, stats.updated());
        acceptanceRepository.findByVerificationCountGreaterThanEqual(1, Pageable.unpaged())
                .forEach(acceptance -> assertEquals(65, acceptance.getConfidenceScore()));
    }

    @Test
    void decay_lowersStoredScoresPastFreshnessThreshold() {
        clock.advance(Duration.ofDays(70));

        DecayRecalculationStats stats = decayService.recalculateAll(false);

        assertEquals(3, stats.processed());
        assertEquals(3, stats.updated());
        for (ProviderPlanAcceptance acceptance : acceptanceRepository.findAll()) {
            if (acceptance.getVerificationCount() == 0) {
                assertEquals(0, acceptance.getConfidenceScore());
                continue;
            }
            // crowdsource 15 + past threshold 10 + one verification 10 + no votes 10
            assertEquals(45, acceptance.getConfidenceScore());
            assertEquals(10, acceptance.getConfidenceFactors().getRecencyScore());
        }

        DecayRecalculationStats rerun = decayService.recalculateAll(false);
        assertEquals(0, rerun.updated());
        assertEquals(3, rerun.unchanged());
    }

    @Test
    void limit_capsProcessedRecordsAcrossPages() {
        clock.advance(Duration.ofDays(70));

        DecayRecalculationStats stats = decayService.recalculateAll(false, 2, 1);

        assertEquals(2, stats.processed());
        assertEquals(2, stats.updated());
        assertEquals(1, acceptanceRepository.findAll().stream()
                .filter(a -> a.getConfidenceScore() == 65)
                .count());
    }

    @Test
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> decayService.recalculateAll(false, null, 0));
        assertThrows(IllegalArgumentException.class, () -> decayService.recalculateAll(false, 0, 10));
    }
}
