package com.verifymyprovider.api.jobs;

import com.verifymyprovider.api.config.MaintenanceJobProperties;
import com.verifymyprovider.api.lifecycle.ConfidenceDecayService;
import com.verifymyprovider.api.lifecycle.ConfidenceDecayService.DecayRecalculationStats;
import com.verifymyprovider.api.lifecycle.TtlLifecycleManager;
import com.verifymyprovider.api.lifecycle.TtlLifecycleManager.CleanupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Off-request maintenance: purge expired evidence daily, rescore weekly.
 * Disabled with {@code verifymyprovider.jobs.enabled=false}.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "verifymyprovider.jobs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class VerificationMaintenanceJobs {

    private static final Logger log = LoggerFactory.getLogger(VerificationMaintenanceJobs.class);

    private final TtlLifecycleManager ttlLifecycleManager;
    private final ConfidenceDecayService decayService;
    private final MaintenanceJobProperties properties;

    public VerificationMaintenanceJobs(TtlLifecycleManager ttlLifecycleManager,
                                       ConfidenceDecayService decayService,
                                       MaintenanceJobProperties properties) {
        this.ttlLifecycleManager = ttlLifecycleManager;
        this.decayService = decayService;
        this.properties = properties;
    }

    @Scheduled(cron = "${verifymyprovider.jobs.cleanup-cron:0 0 3 * * *}")
    public void purgeExpiredEvidence() {
        CleanupResult result = ttlLifecycleManager.cleanupExpired(properties.isCleanupDryRun());
        log.info("Scheduled cleanup: {} verifications and {} acceptances deleted (dryRun={})",
                result.deletedVerificationLogs(), result.deletedPlanAcceptances(), result.dryRun());
    }

    @Scheduled(cron = "${verifymyprovider.jobs.decay-cron:0 30 4 * * SUN}")
    public void rescoreForDecay() {
        DecayRecalculationStats stats = decayService.recalculateAll(false);
        if (stats.errors() > 0) {
            log.warn("Scheduled decay finished with {} errors out of {} records", stats.errors(), stats.processed());
        }
    }
}
