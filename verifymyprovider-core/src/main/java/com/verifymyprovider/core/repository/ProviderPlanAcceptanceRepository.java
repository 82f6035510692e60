package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.ProviderPlanAcceptance;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
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
 * Repository for provider/plan acceptance facts.
 * "Expired" throughout means expiresAt is set and not after the reference instant.
 */
@Repository
public interface ProviderPlanAcceptanceRepository extends JpaRepository<ProviderPlanAcceptance, UUID> {

    /**
     * Find the acceptance recorded for one practice location.
     */
    Optional<ProviderPlanAcceptance> findByProviderNpiAndPlanIdAndLocationId(
            String providerNpi, String planId, UUID locationId);

    /**
     * Find the NPI-level acceptance (no location).
     */
    Optional<ProviderPlanAcceptance> findByProviderNpiAndPlanIdAndLocationIdIsNull(String providerNpi, String planId);

    /**
     * Atomically count one more verification. Clears the persistence context so callers reload.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ProviderPlanAcceptance a SET a.verificationCount = a.verificationCount + 1, " +
           "a.lastVerifiedAt = :now, a.updatedAt = :now WHERE a.id = :id")
    int incrementVerificationCount(@Param("id") UUID id, @Param("now") Instant now);

    /**
     * Acceptances with at least the given number of verifications, for batch rescoring.
     */
    List<ProviderPlanAcceptance> findByVerificationCountGreaterThanEqual(int minCount, Pageable pageable);

    long countByVerificationCountGreaterThanEqual(int minCount);

    // ==================== TTL ====================

    @Query("SELECT COUNT(a) FROM ProviderPlanAcceptance a WHERE a.expiresAt IS NOT NULL AND a.expiresAt <= :now")
    long countExpired(@Param("now") Instant now);

    @Query("SELECT a.id FROM ProviderPlanAcceptance a WHERE a.expiresAt IS NOT NULL AND a.expiresAt <= :now " +
           "ORDER BY a.expiresAt")
    List<UUID> findExpiredIds(@Param("now") Instant now, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProviderPlanAcceptance a WHERE a.id IN :ids")
    int deleteAllByIdIn(@Param("ids") Collection<UUID> ids);

    long countByExpiresAtIsNotNull();

    long countByExpiresAtIsNull();

    /**
     * Count rows expiring in the half-open window (from, to].
     */
    long countByExpiresAtGreaterThanAndExpiresAtLessThanEqual(Instant from, Instant to);

    /**
     * Legacy rows with no expiration, oldest first.
     */
    List<ProviderPlanAcceptance> findByExpiresAtIsNullOrderByCreatedAt(Pageable pageable);
}
