package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.PracticeLocation;
import com.verifymyprovider.core.domain.RecordOrigin;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PracticeLocationRepository extends JpaRepository<PracticeLocation, UUID> {

    List<PracticeLocation> findByNpi(String npi);

    boolean existsByIdAndNpi(UUID id, String npi);

    /**
     * Count locations carrying enrichment or verification data.
     */
    long countByRecordOriginNot(RecordOrigin origin);
}
