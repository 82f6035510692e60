package com.verifymyprovider.api.importer;

import com.verifymyprovider.api.importer.ImportConflictResolver.ImportBatchReport;
import com.verifymyprovider.api.importer.ImportConflictResolver.ImportFieldWrite;
import com.verifymyprovider.api.importer.ImportConflictResolver.ImportOutcome;
import com.verifymyprovider.core.domain.ImportConflict;
import com.verifymyprovider.core.domain.ImportConflict.TargetTable;
import com.verifymyprovider.core.domain.Provider;
import com.verifymyprovider.core.domain.RecordOrigin;
import com.verifymyprovider.core.repository.ImportConflictRepository;
import com.verifymyprovider.core.repository.PracticeLocationRepository;
import com.verifymyprovider.core.repository.ProviderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * A conflict row inserted by a concurrent import between the existence check and our insert.
 */
class ImportConflictConcurrentInsertTest {

    private static final String NPI = "1000000012";

    private ImportConflictRepository conflicts;
    private PlatformTransactionManager transactionManager;
    private ImportConflictResolver resolver;

    @BeforeEach
    void setUp() {
        Provider enriched = Provider.createIndividual(NPI, "Luis", "Huaman", "Psychiatry");
        enriched.writeField("phone", "555-0200");
        enriched.markImproved(RecordOrigin.ENRICHMENT);

        ProviderRepository providers = mock(ProviderRepository.class);
        when(providers.findById(NPI)).thenReturn(Optional.of(enriched));

        conflicts = mock(ImportConflictRepository.class);
        when(conflicts.existsByTargetTableAndTargetRecordIdAndFieldNameAndIncomingValueHash(
                eq(TargetTable.PROVIDERS), eq(NPI), anyString(), anyString())).thenReturn(false);
        when(conflicts.saveAndFlush(any(ImportConflict.class)))
                .thenThrow(new DataIntegrityViolationException("uq_import_conflicts_field_value"));

        transactionManager = mock(PlatformTransactionManager.class);
        resolver = new ImportConflictResolver(
                providers,
                mock(PracticeLocationRepository.class),
                conflicts,
                new TransactionTemplate(transactionManager),
                Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC),
                ImportConflictResolver.defaultProtectedFields());
    }

    @Test
    void singleWrite_losingTheInsertRace_isAlreadyRecorded() {
        ImportOutcome outcome = resolver.apply(
                new ImportFieldWrite(TargetTable.PROVIDERS, NPI, "phone", "555-0999", "nppes-2025-03"));

        assertThat(outcome).isEqualTo(ImportOutcome.CONFLICT_ALREADY_RECORDED);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void batchWrite_losingTheInsertRace_isCountedNotRejected() {
        ImportBatchReport report = resolver.applyBatch(List.of(
                new ImportFieldWrite(TargetTable.PROVIDERS, NPI, "phone", "555-0999", "nppes-2025-03"),
                new ImportFieldWrite(TargetTable.PROVIDERS, NPI, "fax", "555-0300", "nppes-2025-03")));

        assertThat(report.count(ImportOutcome.CONFLICT_ALREADY_RECORDED)).isEqualTo(1);
        assertThat(report.count(ImportOutcome.APPLIED)).isEqualTo(1);
        assertThat(report.rejected()).isZero();
    }
}
