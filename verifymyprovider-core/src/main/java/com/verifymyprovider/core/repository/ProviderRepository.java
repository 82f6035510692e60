package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.Provider;
import com.verifymyprovider.core.domain.RecordOrigin;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProviderRepository extends JpaRepository<Provider, String> {

    /**
     * Specialty text used to pick a freshness threshold. Falls back to the taxonomy description.
     */
    @Query("SELECT COALESCE(p.primarySpecialty, p.taxonomyDescription) FROM Provider p WHERE p.npi = :npi")
    Optional<String> findSpecialtyText(@Param("npi") String npi);

    /**
     * Load a provider with a row lock held until the transaction ends. Submissions for the
     * same provider take it first so only one of them can create a missing acceptance record.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Provider p WHERE p.npi = :npi")
    Optional<Provider> findByNpiForUpdate(@Param("npi") String npi);

    /**
     * Count providers whose data is no longer raw import data.
     */
    long countByRecordOriginNot(RecordOrigin origin);
}
