package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.VerificationLog;
import com.verifymyprovider.core.domain.VerificationLog.VerificationType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for crowdsourced verification records.
 */
@Repository
public interface VerificationLogRepository extends JpaRepository<VerificationLog, UUID>,
        JpaSpecificationExecutor<VerificationLog> {

    // ==================== Sybil checks ====================

    /**
     * Whether the IP already has a live submission for the pair since the given instant.
     */
    @Query("SELECT COUNT(v) > 0 FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND v.sourceIp = :sourceIp AND v.createdAt >= :since " +
           "AND (v.expiresAt IS NULL OR v.expiresAt > :now)")
    boolean existsRecentBySourceIp(@Param("npi") String npi, @Param("planId") String planId,
                                   @Param("sourceIp") String sourceIp, @Param("since") Instant since,
                                   @Param("now") Instant now);

    /**
     * Whether the submitter already has a live submission for the pair since the given instant.
     */
    @Query("SELECT COUNT(v) > 0 FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND v.submittedBy = :submittedBy AND v.createdAt >= :since " +
           "AND (v.expiresAt IS NULL OR v.expiresAt > :now)")
    boolean existsRecentBySubmittedBy(@Param("npi") String npi, @Param("planId") String planId,
                                      @Param("submittedBy") String submittedBy, @Param("since") Instant since,
                                      @Param("now") Instant now);

    /**
     * Load a verification and hold its row lock until the transaction ends.
     * Votes on one verification queue up behind each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VerificationLog v WHERE v.id = :id")
    Optional<VerificationLog> findByIdForUpdate(@Param("id") UUID id);

    // ==================== Consensus evidence ====================

    /**
     * Unexpired verifications of one type behind a provider/plan pair.
     */
    @Query("SELECT v FROM VerificationLog v WHERE v.providerNpi = :npi AND v.planId = :planId " +
           "AND v.verificationType = :type AND (v.expiresAt IS NULL OR v.expiresAt > :now)")
    List<VerificationLog> findLiveForPair(@Param("npi") String npi, @Param("planId") String planId,
                                          @Param("type") VerificationType type, @Param("now") Instant now);

    /**
     * Atomically shift vote tallies. Deltas are +1, 0 or -1.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VerificationLog v SET v.upvotes = v.upvotes + :upDelta, " +
           "v.downvotes = v.downvotes + :downDelta WHERE v.id = :id")
    int adjustVoteTallies(@Param("id") UUID id, @Param("upDelta") int upDelta, @Param("downDelta") int downDelta);

    // ==================== Stats ====================

    long countByApproved(Boolean approved);

    long countByApprovedIsNull();

    long countByVerificationType(VerificationType verificationType);

    long countByCreatedAtGreaterThanEqual(Instant since);

    // ==================== TTL ====================

    @Query("SELECT COUNT(v) FROM VerificationLog v WHERE v.expiresAt IS NOT NULL AND v.expiresAt <= :now")
    long countExpired(@Param("now") Instant now);

    @Query("SELECT v.id FROM VerificationLog v WHERE v.expiresAt IS NOT NULL AND v.expiresAt <= :now " +
           "ORDER BY v.expiresAt")
    List<UUID> findExpiredIds(@Param("now") Instant now, Pageable pageable);

    /**
     * Bulk delete by id. Votes go with their verification through the ON DELETE CASCADE key.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM VerificationLog v WHERE v.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<UUID> ids);

    long countByExpiresAtIsNotNull();

    long countByExpiresAtIsNull();

    long countByExpiresAtGreaterThanAndExpiresAtLessThanEqual(Instant from, Instant to);

    List<VerificationLog> findByExpiresAtIsNullOrderByCreatedAt(Pageable pageable);
}
