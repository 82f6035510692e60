package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.InsurancePlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InsurancePlanRepository extends JpaRepository<InsurancePlan, String> {

    List<InsurancePlan> findByIssuerName(String issuerName);
}
