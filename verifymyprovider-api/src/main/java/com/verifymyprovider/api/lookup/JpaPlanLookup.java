package com.verifymyprovider.api.lookup;

import com.verifymyprovider.core.repository.InsurancePlanRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional(readOnly = true)
public class JpaPlanLookup implements PlanLookup {

    private final InsurancePlanRepository planRepository;

    public JpaPlanLookup(InsurancePlanRepository planRepository) {
        this.planRepository = planRepository;
    }

    @Override
    public boolean exists(String planId) {
        return planId != null && planRepository.existsById(planId);
    }
}
