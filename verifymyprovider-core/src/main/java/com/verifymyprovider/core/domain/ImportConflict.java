package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/**
 * A bulk-import value that disagreed with an enriched or verified field and was
 * held back instead of being written.
 *
 * Status moves once from PENDING to one of the terminal outcomes. The incoming value
 * is hashed into a unique key so re-running the same import never queues it twice.
 */
@Entity
@Table(name = "import_conflicts", indexes = {
    @Index(name = "idx_import_conflicts_status", columnList = "status"),
    @Index(name = "idx_import_conflicts_target", columnList = "target_table, target_record_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_import_conflicts_field_value",
            columnNames = {"target_table", "target_record_id", "field_name", "incoming_value_hash"})
})
public class ImportConflict {

    /** Hash stored for a null incoming value. Digests are lowercase hex. */
    public static final String NULL_VALUE_HASH = "NULL";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "target_table", nullable = false, length = 30, updatable = false)
    private TargetTable targetTable;

    @NotNull
    @Column(name = "target_record_id", nullable = false, length = 64, updatable = false)
    private String targetRecordId;

    @NotNull
    @Column(name = "field_name", nullable = false, length = 64, updatable = false)
    private String fieldName;

    @Column(name = "current_value", columnDefinition = "TEXT", updatable = false)
    private String currentValue;

    @Column(name = "incoming_value", columnDefinition = "TEXT", updatable = false)
    private String incomingValue;

    @NotNull
    @Column(name = "incoming_value_hash", nullable = false, length = 64, updatable = false)
    private String incomingValueHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_source", length = 30, updatable = false)
    private RecordOrigin currentSource;

    @Column(name = "incoming_source", length = 50, updatable = false)
    private String incomingSource;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Resolution status;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Version
    private Long version;

    protected ImportConflict() {}

    public static ImportConflict create(
            TargetTable targetTable,
            String targetRecordId,
            String fieldName,
            String currentValue,
            String incomingValue,
            RecordOrigin currentSource,
            String incomingSource,
            Instant now) {
        if (targetTable == null) {
            throw new IllegalArgumentException("Target table cannot be null");
        }
        if (targetRecordId == null || targetRecordId.isBlank()) {
            throw new IllegalArgumentException("Target record ID cannot be blank");
        }
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("Field name cannot be blank");
        }
        ImportConflict conflict = new ImportConflict();
        conflict.targetTable = targetTable;
        conflict.targetRecordId = targetRecordId;
        conflict.fieldName = fieldName;
        conflict.currentValue = currentValue;
        conflict.incomingValue = incomingValue;
        conflict.incomingValueHash = hashValue(incomingValue);
        conflict.currentSource = currentSource;
        conflict.incomingSource = incomingSource;
        conflict.status = Resolution.PENDING;
        conflict.createdAt = now;
        return conflict;
    }

    /**
     * Records the terminal outcome.
     *
     * @throws IllegalStateException if the conflict was already resolved
     */
    public void resolve(Resolution outcome, Instant now) {
        if (outcome == null || outcome == Resolution.PENDING) {
            throw new IllegalArgumentException("Resolution must be a terminal outcome: " + outcome);
        }
        if (this.status != Resolution.PENDING) {
            throw new IllegalStateException("Conflict " + id + " already resolved as " + status);
        }
        this.status = outcome;
        this.resolvedAt = now;
    }

    public boolean isPending() {
        return status == Resolution.PENDING;
    }

    /**
     * SHA-256 hex of the value. Null gets {@link #NULL_VALUE_HASH}, which no digest can equal,
     * so clearing a field and setting it to "" are queued as different conflicts.
     */
    public static String hashValue(String value) {
        if (value == null) {
            return NULL_VALUE_HASH;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public enum TargetTable {
        PROVIDERS,
        PRACTICE_LOCATIONS
    }

    public enum Resolution {
        PENDING,
        KEEP_CURRENT,     // Incoming value discarded
        ACCEPT_INCOMING,  // Incoming value written once
        MANUAL            // Left to an operator
    }

    // Getters
    public UUID getId() { return id; }
    public TargetTable getTargetTable() { return targetTable; }
    public String getTargetRecordId() { return targetRecordId; }
    public String getFieldName() { return fieldName; }
    public String getCurrentValue() { return currentValue; }
    public String getIncomingValue() { return incomingValue; }
    public String getIncomingValueHash() { return incomingValueHash; }
    public RecordOrigin getCurrentSource() { return currentSource; }
    public String getIncomingSource() { return incomingSource; }
    public Resolution getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Optional<Instant> getResolvedAt() { return Optional.ofNullable(resolvedAt); }
}
