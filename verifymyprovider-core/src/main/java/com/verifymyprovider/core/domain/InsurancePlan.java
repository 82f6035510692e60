package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

@Entity
@Table(name = "insurance_plans", indexes = {
    @Index(name = "idx_insurance_plans_issuer", columnList = "issuer_name")
})
public class InsurancePlan {

    @Id
    @Column(name = "plan_id", length = 50, nullable = false, updatable = false)
    private String planId;

    @NotNull
    @Column(name = "plan_name", nullable = false, length = 200)
    private String planName;

    @Column(name = "issuer_name", length = 200)
    private String issuerName;

    @Enumerated(EnumType.STRING)
    @Column(name = "plan_type", length = 20)
    private PlanType planType;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected InsurancePlan() {}

    public static InsurancePlan create(String planId, String planName, String issuerName, PlanType planType) {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("Plan ID cannot be blank");
        }
        if (planName == null || planName.isBlank()) {
            throw new IllegalArgumentException("Plan name cannot be blank");
        }
        InsurancePlan plan = new InsurancePlan();
        plan.planId = planId;
        plan.planName = planName;
        plan.issuerName = issuerName;
        plan.planType = planType;
        plan.createdAt = Instant.now();
        return plan;
    }

    public enum PlanType {
        HMO, PPO, EPO, POS, HDHP, MEDICARE, MEDICAID, OTHER
    }

    // Getters
    public String getPlanId() { return planId; }
    public String getPlanName() { return planName; }
    public String getIssuerName() { return issuerName; }
    public PlanType getPlanType() { return planType; }
    public Instant getCreatedAt() { return createdAt; }
}
