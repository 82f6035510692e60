package com.verifymyprovider.api.lifecycle;

import com.verifymyprovider.api.config.VerificationPolicy;
import com.verifymyprovider.core.domain.Expirable;
import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import com.verifymyprovider.core.domain.VerificationLog;
import com.verifymyprovider.core.repository.ProviderPlanAcceptanceRepository;
import com.verifymyprovider.core.repository.VerificationLogRepository;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

/**
 * Time-to-live handling for verification evidence.
 *
 * Verifications and acceptance records expire six months after their last refresh.
 * Rows without an expiration predate TTLs and are treated as valid forever until
 * {@link #backfillExpirations(boolean)} assigns them one.
 */
@Service
public class TtlLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(TtlLifecycleManager.class);

    static final String VERIFICATION_LOGS = "verification_logs";
    static final String PLAN_ACCEPTANCES = "provider_plan_acceptance";

    private static final int BACKFILL_PAGE_SIZE = 500;
    private static final Duration WEEK = Duration.ofDays(7);
    private static final Duration MONTH = Duration.ofDays(30);

    private final VerificationPolicy policy;
    private final Clock clock;
    private final VerificationLogRepository verificationLogRepository;
    private final ProviderPlanAcceptanceRepository acceptanceRepository;
    private final TransactionTemplate transactionTemplate;
    private final EntityManager entityManager;

    public TtlLifecycleManager(
            VerificationPolicy policy,
            Clock clock,
            VerificationLogRepository verificationLogRepository,
            ProviderPlanAcceptanceRepository acceptanceRepository,
            TransactionTemplate transactionTemplate,
            EntityManager entityManager) {
        this.policy = policy;
        this.clock = clock;
        this.verificationLogRepository = verificationLogRepository;
        this.acceptanceRepository = acceptanceRepository;
        this.transactionTemplate = transactionTemplate;
        this.entityManager = entityManager;
    }

    // ==================== Expiration ====================

    public Instant getExpirationDate(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("Reference time cannot be null");
        }
        return now.plus(policy.ttl());
    }

    public Instant getExpirationDate() {
        return getExpirationDate(clock.instant());
    }

    /**
     * Query predicate keeping rows whose expiration is unset or still in the future.
     */
    public <T extends Expirable> Specification<T> notExpiredFilter() {
        return notExpiredAt(clock.instant());
    }

    public static <T extends Expirable> Specification<T> notExpiredAt(Instant now) {
        return (root, query, cb) -> cb.or(
                cb.isNull(root.get(Expirable.EXPIRES_AT)),
                cb.greaterThan(root.<Instant>get(Expirable.EXPIRES_AT), now));
    }

    /**
     * In-memory counterpart of {@link #notExpiredAt(Instant)}.
     */
    public static boolean isNotExpired(Expirable evidence, Instant now) {
        return !evidence.isExpiredAt(now);
    }

    // ==================== Cleanup ====================

    public CleanupResult cleanupExpired(boolean dryRun) {
        return cleanupExpired(dryRun, policy.cleanupBatchSize());
    }

    /**
     * Deletes expired verifications, then expired acceptance records, in bounded rounds.
     * Each round commits on its own, so an interrupted run resumes from the remaining rows.
     */
    public CleanupResult cleanupExpired(boolean dryRun, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        Instant now = clock.instant();
        long expiredLogs = verificationLogRepository.countExpired(now);
        long expiredAcceptances = acceptanceRepository.countExpired(now);

        if (dryRun) {
            log.info("Cleanup dry run: {} expired verifications, {} expired acceptances",
                    expiredLogs, expiredAcceptances);
            return new CleanupResult(true, expiredLogs, expiredAcceptances, 0, 0);
        }

        long deletedLogs = deleteInRounds(VERIFICATION_LOGS, expiredLogs, batchSize,
                page -> verificationLogRepository.findExpiredIds(now, page),
                verificationLogRepository::deleteAllByIdIn);
        long deletedAcceptances = deleteInRounds(PLAN_ACCEPTANCES, expiredAcceptances, batchSize,
                page -> acceptanceRepository.findExpiredIds(now, page),
                acceptanceRepository::deleteAllByIdIn);

        log.info("Cleanup complete: deleted {}/{} verifications, {}/{} acceptances",
                deletedLogs, expiredLogs, deletedAcceptances, expiredAcceptances);
        return new CleanupResult(false, expiredLogs, expiredAcceptances, deletedLogs, deletedAcceptances);
    }

    private long deleteInRounds(String table, long expiredCount, int batchSize,
                                Function<Pageable, List<UUID>> expiredIds,
                                Function<Collection<UUID>, Integer> deleter) {
        long deleted = 0;
        while (deleted < expiredCount) {
            Integer round = transactionTemplate.execute(status -> {
                List<UUID> ids = expiredIds.apply(PageRequest.of(0, batchSize));
                return ids.isEmpty() ? 0 : deleter.apply(ids);
            });
            int removed = round == null ? 0 : round;
            deleted += removed;
            log.debug("Deleted {} expired rows from {} ({} so far)", removed, table, deleted);
            if (removed < batchSize) {
                break;
            }
        }
        return deleted;
    }

    // ==================== Stats ====================

    @Transactional(readOnly = true)
    public ExpirationStats getExpirationStats() {
        Instant now = clock.instant();
        Instant weekOut = now.plus(WEEK);
        Instant monthOut = now.plus(MONTH);

        TableExpirationStats logs = new TableExpirationStats(
                VERIFICATION_LOGS,
                verificationLogRepository.count(),
                verificationLogRepository.countByExpiresAtIsNotNull(),
                verificationLogRepository.countExpired(now),
                verificationLogRepository.countByExpiresAtGreaterThanAndExpiresAtLessThanEqual(now, weekOut),
                verificationLogRepository.countByExpiresAtGreaterThanAndExpiresAtLessThanEqual(weekOut, monthOut));
        TableExpirationStats acceptances = new TableExpirationStats(
                PLAN_ACCEPTANCES,
                acceptanceRepository.count(),
                acceptanceRepository.countByExpiresAtIsNotNull(),
                acceptanceRepository.countExpired(now),
                acceptanceRepository.countByExpiresAtGreaterThanAndExpiresAtLessThanEqual(now, weekOut),
                acceptanceRepository.countByExpiresAtGreaterThanAndExpiresAtLessThanEqual(weekOut, monthOut));

        return new ExpirationStats(now, logs, acceptances);
    }

    // ==================== Backfill ====================

    /**
     * Assigns expirations to legacy rows: acceptances from their last verification
     * (or creation), verifications from their creation. Without {@code apply} only
     * reports how many rows would change.
     */
    @Transactional
    public BackfillReport backfillExpirations(boolean apply) {
        long acceptancesBefore = acceptanceRepository.countByExpiresAtIsNull();
        long logsBefore = verificationLogRepository.countByExpiresAtIsNull();

        if (!apply) {
            log.info("Backfill preview: {} acceptances and {} verifications lack an expiration",
                    acceptancesBefore, logsBefore);
            return new BackfillReport(false,
                    new TableBackfill(PLAN_ACCEPTANCES, acceptancesBefore, 0, acceptancesBefore),
                    new TableBackfill(VERIFICATION_LOGS, logsBefore, 0, logsBefore));
        }

        long acceptancesUpdated = 0;
        List<ProviderPlanAcceptance> acceptances;
        while (!(acceptances = acceptanceRepository.findByExpiresAtIsNullOrderByCreatedAt(
                PageRequest.of(0, BACKFILL_PAGE_SIZE))).isEmpty()) {
            for (ProviderPlanAcceptance acceptance : acceptances) {
                acceptance.renewExpiration(backfilledExpiration(acceptance));
            }
            acceptancesUpdated += acceptances.size();
            flushAndClear();
        }

        long logsUpdated = 0;
        List<VerificationLog> logs;
        while (!(logs = verificationLogRepository.findByExpiresAtIsNullOrderByCreatedAt(
                PageRequest.of(0, BACKFILL_PAGE_SIZE))).isEmpty()) {
            for (VerificationLog verification : logs) {
                verification.backfillExpiration(getExpirationDate(verification.getCreatedAt()));
            }
            logsUpdated += logs.size();
            flushAndClear();
        }

        long acceptancesAfter = acceptanceRepository.countByExpiresAtIsNull();
        long logsAfter = verificationLogRepository.countByExpiresAtIsNull();
        log.info("Backfill applied: {} acceptances, {} verifications", acceptancesUpdated, logsUpdated);

        return new BackfillReport(true,
                new TableBackfill(PLAN_ACCEPTANCES, acceptancesBefore, acceptancesUpdated, acceptancesAfter),
                new TableBackfill(VERIFICATION_LOGS, logsBefore, logsUpdated, logsAfter));
    }

    private Instant backfilledExpiration(ProviderPlanAcceptance acceptance) {
        Instant expiresAt = getExpirationDate(acceptance.expirationBase());
        // Never earlier than creation
        if (expiresAt.isBefore(acceptance.getCreatedAt())) {
            return getExpirationDate(acceptance.getCreatedAt());
        }
        return expiresAt;
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }

    // ==================== DTOs ====================

    public record CleanupResult(
            boolean dryRun,
            long expiredVerificationLogs,
            long expiredPlanAcceptances,
            long deletedVerificationLogs,
            long deletedPlanAcceptances) {}

    /**
     * Expiring buckets are disjoint: (now, now+7d] and (now+7d, now+30d].
     */
    public record TableExpirationStats(
            String table,
            long total,
            long withTtl,
            long expired,
            long expiringWithin7Days,
            long expiringWithin30Days) {

        public long withoutTtl() {
            return total - withTtl;
        }
    }

    public record ExpirationStats(
            Instant measuredAt,
            TableExpirationStats verificationLogs,
            TableExpirationStats planAcceptances) {}

    public record TableBackfill(String table, long missingBefore, long updated, long missingAfter) {}

    public record BackfillReport(boolean applied, TableBackfill planAcceptances, TableBackfill verificationLogs) {}
}
