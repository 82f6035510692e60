package com.verifymyprovider.core.repository;

import com.verifymyprovider.core.domain.ImportConflict;
import com.verifymyprovider.core.domain.ImportConflict.Resolution;
import com.verifymyprovider.core.domain.ImportConflict.TargetTable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ImportConflictRepository extends JpaRepository<ImportConflict, UUID> {

    /**
     * Whether this exact incoming value was already queued for the field, in any status.
     */
    boolean existsByTargetTableAndTargetRecordIdAndFieldNameAndIncomingValueHash(
            TargetTable targetTable, String targetRecordId, String fieldName, String incomingValueHash);

    Page<ImportConflict> findByStatus(Resolution status, Pageable pageable);

    List<ImportConflict> findByTargetTableAndTargetRecordId(TargetTable targetTable, String targetRecordId);

    long countByStatus(Resolution status);
}
