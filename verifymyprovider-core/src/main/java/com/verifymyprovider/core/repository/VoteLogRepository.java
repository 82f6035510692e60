package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.VoteLog;
import com.verifymyprovider.core.domain.VoteLog.VoteDirection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VoteLogRepository extends JpaRepository<VoteLog, UUID> {

    /**
     * Find the vote an identity cast on a verification.
     */
    @Query("SELECT v FROM VoteLog v WHERE v.verification.id = :verificationId AND v.sourceIp = :sourceIp")
    Optional<VoteLog> findByVerificationAndSourceIp(@Param("verificationId") UUID verificationId,
                                                    @Param("sourceIp") String sourceIp);

    /**
     * Flip a vote only if it still points the given way. Returns 0 when another
     * transaction flipped it first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE VoteLog v SET v.direction = :to, v.changedAt = :now WHERE v.id = :id AND v.direction = :from")
    int flipDirection(@Param("id") UUID id, @Param("from") VoteDirection from,
                      @Param("to") VoteDirection to, @Param("now") Instant now);

    @Query("SELECT COUNT(v) FROM VoteLog v WHERE v.verification.id = :verificationId")
    long countByVerification(@Param("verificationId") UUID verificationId);
}
