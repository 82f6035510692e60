package com.verifymyprovider.api.importer;

import com.verifymyprovider.api.error.ConflictAlreadyResolvedException;
import com.verifymyprovider.api.error.NotFoundException;
import com.verifymyprovider.api.error.ValidationException;
import com.verifymyprovider.core.domain.ImportConflict;
import com.verifymyprovider.core.domain.ImportConflict.Resolution;
import com.verifymyprovider.core.domain.ImportConflict.TargetTable;
import com.verifymyprovider.core.domain.ImportableRecord;
import com.verifymyprovider.core.domain.PracticeLocation;
import com.verifymyprovider.core.domain.Provider;
import com.verifymyprovider.core.domain.RecordOrigin;
import com.verifymyprovider.core.repository.ImportConflictRepository;
import com.verifymyprovider.core.repository.PracticeLocationRepository;
import com.verifymyprovider.core.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Guards enriched and user-verified data against bulk imports.
 *
 * A write to a protected field of a record that is no longer raw import data is
 * diverted into the conflict queue when it would change a non-empty value.
 * Everything else is applied. The same incoming value is queued at most once per
 * field, whatever happened to the earlier conflict.
 */
@Service
public class ImportConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ImportConflictResolver.class);

    private final ProviderRepository providerRepository;
    private final PracticeLocationRepository locationRepository;
    private final ImportConflictRepository conflictRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Map<TargetTable, Set<String>> protectedFields;

    @Autowired
    public ImportConflictResolver(
            ProviderRepository providerRepository,
            PracticeLocationRepository locationRepository,
            ImportConflictRepository conflictRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this(providerRepository, locationRepository, conflictRepository, transactionTemplate, clock,
                defaultProtectedFields());
    }

    ImportConflictResolver(
            ProviderRepository providerRepository,
            PracticeLocationRepository locationRepository,
            ImportConflictRepository conflictRepository,
            TransactionTemplate transactionTemplate,
            Clock clock,
            Map<TargetTable, Set<String>> protectedFields) {
        this.providerRepository = providerRepository;
        this.locationRepository = locationRepository;
        this.conflictRepository = conflictRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.protectedFields = validateProtectedFields(protectedFields);
    }

    static Map<TargetTable, Set<String>> defaultProtectedFields() {
        Map<TargetTable, Set<String>> fields = new EnumMap<>(TargetTable.class);
        fields.put(TargetTable.PROVIDERS, Set.of("profileUrl", "phone", "fax", "primarySpecialty"));
        fields.put(TargetTable.PRACTICE_LOCATIONS, Set.of("addressLine2", "zipCode", "phone", "fax"));
        return fields;
    }

    private static Map<TargetTable, Set<String>> validateProtectedFields(Map<TargetTable, Set<String>> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Protected fields cannot be null");
        }
        Map<TargetTable, Set<String>> copy = new EnumMap<>(TargetTable.class);
        for (TargetTable table : TargetTable.values()) {
            Set<String> protectedSet = fields.get(table);
            if (protectedSet == null) {
                throw new IllegalArgumentException("No protected fields configured for " + table);
            }
            for (String field : protectedSet) {
                if (!importableFields(table).contains(field)) {
                    throw new IllegalArgumentException("Protected field " + field + " is not importable on " + table);
                }
            }
            copy.put(table, Set.copyOf(protectedSet));
        }
        return copy;
    }

    private static Set<String> importableFields(TargetTable table) {
        return switch (table) {
            case PROVIDERS -> Provider.IMPORTABLE_FIELDS;
            case PRACTICE_LOCATIONS -> PracticeLocation.IMPORTABLE_FIELDS;
        };
    }

    public boolean isProtected(TargetTable table, String fieldName) {
        return protectedFields.get(table).contains(fieldName);
    }

    // ==================== Apply ====================

    /**
     * Applies one field write from an import run, or queues it as a conflict.
     * Runs in its own transaction, or joins the caller's.
     *
     * @throws ValidationException if the write names an unknown table, record ID format or field
     */
    public ImportOutcome apply(ImportFieldWrite write) {
        return applyInTransaction(write);
    }

    /**
     * Applies each write in its own transaction and tallies the outcomes.
     * Invalid writes are counted as rejected; they do not stop the batch.
     */
    public ImportBatchReport applyBatch(List<ImportFieldWrite> writes) {
        Map<ImportOutcome, Integer> outcomes = new EnumMap<>(ImportOutcome.class);
        for (ImportOutcome outcome : ImportOutcome.values()) {
            outcomes.put(outcome, 0);
        }
        int rejected = 0;

        for (ImportFieldWrite write : writes) {
            ImportOutcome outcome;
            try {
                outcome = applyInTransaction(write);
            } catch (ValidationException e) {
                rejected++;
                log.warn("Rejected import write {}: {}", write, e.getMessage());
                continue;
            }
            outcomes.merge(outcome, 1, Integer::sum);
        }

        ImportBatchReport report = new ImportBatchReport(outcomes, rejected);
        log.info("Import batch applied: {}", report);
        return report;
    }

    /**
     * A unique-key violation leaves the transaction unusable, so it is translated after rollback.
     */
    private ImportOutcome applyInTransaction(ImportFieldWrite write) {
        try {
            return transactionTemplate.execute(status -> applyWrite(write));
        } catch (DataIntegrityViolationException e) {
            // A concurrent run queued the same value first
            log.debug("Conflict for {} already queued concurrently", write, e);
            return ImportOutcome.CONFLICT_ALREADY_RECORDED;
        }
    }

    private ImportOutcome applyWrite(ImportFieldWrite write) {
        validate(write);
        Optional<ImportableRecord> target = loadTarget(write.table(), write.targetRecordId());
        if (target.isEmpty()) {
            log.debug("Import target {} {} does not exist", write.table(), write.targetRecordId());
            return ImportOutcome.TARGET_MISSING;
        }

        ImportableRecord record = target.get();
        String currentValue = record.readField(write.fieldName());
        if (Objects.equals(currentValue, write.incomingValue())) {
            return ImportOutcome.UNCHANGED;
        }

        if (record.getRecordOrigin().isImprovedOverImport()
                && isProtected(write.table(), write.fieldName())
                && currentValue != null) {
            return queueConflict(write, record, currentValue);
        }

        record.writeField(write.fieldName(), write.incomingValue());
        return ImportOutcome.APPLIED;
    }

    private ImportOutcome queueConflict(ImportFieldWrite write, ImportableRecord record, String currentValue) {
        boolean alreadyQueued = conflictRepository.existsByTargetTableAndTargetRecordIdAndFieldNameAndIncomingValueHash(
                write.table(), record.getRecordKey(), write.fieldName(), ImportConflict.hashValue(write.incomingValue()));
        if (alreadyQueued) {
            return ImportOutcome.CONFLICT_ALREADY_RECORDED;
        }

        ImportConflict conflict = conflictRepository.saveAndFlush(ImportConflict.create(
                write.table(),
                record.getRecordKey(),
                write.fieldName(),
                currentValue,
                write.incomingValue(),
                record.getRecordOrigin(),
                write.incomingSource(),
                clock.instant()));
        log.info("Held back import of {}.{} for {} (origin {}): conflict {}",
                write.table(), write.fieldName(), record.getRecordKey(), record.getRecordOrigin(), conflict.getId());
        return ImportOutcome.CONFLICT_LOGGED;
    }

    private void validate(ImportFieldWrite write) {
        if (write == null || write.table() == null) {
            throw new ValidationException("Import write must name a table");
        }
        if (write.targetRecordId() == null || write.targetRecordId().isBlank()) {
            throw new ValidationException("Import write must name a target record");
        }
        if (write.fieldName() == null || !importableFields(write.table()).contains(write.fieldName())) {
            throw new ValidationException("Field " + write.fieldName() + " cannot be imported into " + write.table());
        }
    }

    private Optional<ImportableRecord> loadTarget(TargetTable table, String recordId) {
        return switch (table) {
            case PROVIDERS -> providerRepository.findById(recordId).map(ImportableRecord.class::cast);
            case PRACTICE_LOCATIONS -> locationRepository.findById(parseLocationId(recordId))
                    .map(ImportableRecord.class::cast);
        };
    }

    private static UUID parseLocationId(String recordId) {
        try {
            return UUID.fromString(recordId);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Practice location ID is not a UUID: " + recordId, e);
        }
    }

    // ==================== Resolve ====================

    /**
     * Gives a pending conflict its terminal outcome. ACCEPT_INCOMING writes the held-back value.
     *
     * @throws ValidationException               if the outcome is missing or PENDING
     * @throws NotFoundException                 if the conflict or, for ACCEPT_INCOMING, its target is gone
     * @throws ConflictAlreadyResolvedException  if the conflict already has an outcome
     */
    @Transactional
    public ImportConflict resolveConflict(UUID conflictId, Resolution outcome) {
        if (outcome == null || outcome == Resolution.PENDING) {
            throw new ValidationException("Resolution must be KEEP_CURRENT, ACCEPT_INCOMING or MANUAL");
        }
        ImportConflict conflict = conflictRepository.findById(conflictId)
                .orElseThrow(() -> new NotFoundException("Import conflict not found: " + conflictId));
        if (!conflict.isPending()) {
            throw new ConflictAlreadyResolvedException(
                    "Import conflict " + conflictId + " already resolved as " + conflict.getStatus());
        }

        conflict.resolve(outcome, clock.instant());

        if (outcome == Resolution.ACCEPT_INCOMING) {
            ImportableRecord record = loadTarget(conflict.getTargetTable(), conflict.getTargetRecordId())
                    .orElseThrow(() -> new NotFoundException("Conflict target no longer exists: "
                            + conflict.getTargetTable() + " " + conflict.getTargetRecordId()));
            record.writeField(conflict.getFieldName(), conflict.getIncomingValue());
        }

        try {
            conflictRepository.saveAndFlush(conflict);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConflictAlreadyResolvedException("Import conflict " + conflictId + " was resolved concurrently", e);
        }

        log.info("Resolved import conflict {} as {}", conflictId, outcome);
        return conflict;
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public Page<ImportConflict> listConflicts(Resolution status, int page, int size) {
        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.ASC, "createdAt"));
        return status == null
                ? conflictRepository.findAll(pageRequest)
                : conflictRepository.findByStatus(status, pageRequest);
    }

    /**
     * What an import run is about to run into: enriched records and unresolved conflicts.
     */
    @Transactional(readOnly = true)
    public PreImportSummary preImportCheck() {
        PreImportSummary summary = new PreImportSummary(
                providerRepository.countByRecordOriginNot(RecordOrigin.NPPES),
                locationRepository.countByRecordOriginNot(RecordOrigin.NPPES),
                conflictRepository.countByStatus(Resolution.PENDING));
        if (summary.pendingConflicts() > 0) {
            log.warn("{} import conflicts are still pending review", summary.pendingConflicts());
        }
        return summary;
    }

    // ==================== DTOs ====================

    public enum ImportOutcome {
        APPLIED,
        UNCHANGED,
        CONFLICT_LOGGED,
        CONFLICT_ALREADY_RECORDED,
        TARGET_MISSING
    }

    /**
     * One candidate field value from an import run.
     *
     * @param targetRecordId NPI for providers, location UUID for practice locations
     */
    public record ImportFieldWrite(
            TargetTable table,
            String targetRecordId,
            String fieldName,
            String incomingValue,
            String incomingSource) {}

    public record ImportBatchReport(Map<ImportOutcome, Integer> outcomes, int rejected) {

        public int count(ImportOutcome outcome) {
            return outcomes.getOrDefault(outcome, 0);
        }
    }

    public record PreImportSummary(long enrichedProviders, long enrichedLocations, long pendingConflicts) {

        public boolean requiresReview() {
            return pendingConflicts > 0;
        }
    }
}
