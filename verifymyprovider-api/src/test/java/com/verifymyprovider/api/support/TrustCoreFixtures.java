package com.verifymyprovider.api.support;

import com.verifymyprovider.core.domain.InsurancePlan;
import com.verifymyprovider.core.domain.InsurancePlan.PlanType;
import com.verifymyprovider.core.domain.Provider;
import com.verifymyprovider.core.repository.ImportConflictRepository;
import com.verifymyprovider.core.repository.InsurancePlanRepository;
import com.verifymyprovider.core.repository.PracticeLocationRepository;
import com.verifymyprovider.core.repository.ProviderPlanAcceptanceRepository;
import com.verifymyprovider.core.repository.ProviderRepository;
import com.verifymyprovider.core.repository.VerificationLogRepository;
import com.verifymyprovider.core.repository.VoteLogRepository;
import org.springframework.boot.test.context.TestComponent;

/**
 * Seeds and wipes the trust-core tables between Spring tests.
 */
@TestComponent
public class TrustCoreFixtures {

    private final ProviderRepository providerRepository;
    private final InsurancePlanRepository planRepository;
    private final PracticeLocationRepository locationRepository;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final VerificationLogRepository verificationLogRepository;
    private final VoteLogRepository voteLogRepository;
    private final ImportConflictRepository conflictRepository;

    public TrustCoreFixtures(ProviderRepository providerRepository,
                             InsurancePlanRepository planRepository,
                             PracticeLocationRepository locationRepository,
                             ProviderPlanAcceptanceRepository acceptanceRepository,
                             VerificationLogRepository verificationLogRepository,
                             VoteLogRepository voteLogRepository,
                             ImportConflictRepository conflictRepository) {
        this.providerRepository = providerRepository;
        this.planRepository = planRepository;
        this.locationRepository = locationRepository;
        this.acceptanceRepository = acceptanceRepository;
        this.verificationLogRepository = verificationLogRepository;
        this.voteLogRepository = voteLogRepository;
        this.conflictRepository = conflictRepository;
    }

    public void wipe() {
        voteLogRepository.deleteAllInBatch();
        verificationLogRepository.deleteAllInBatch();
        acceptanceRepository.deleteAllInBatch();
        conflictRepository.deleteAllInBatch();
        locationRepository.deleteAllInBatch();
        providerRepository.deleteAllInBatch();
        planRepository.deleteAllInBatch();
    }

    public Provider provider(String npi, String specialty) {
        return providerRepository.save(Provider.createIndividual(npi, "Ana", "Quispe", specialty));
    }

    public InsurancePlan plan(String planId) {
        return planRepository.save(InsurancePlan.create(planId, "Plan " + planId, "Andes Health", PlanType.PPO));
    }
}
