package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A practice address for a provider. Addresses come from NPPES and are
 * frequently corrected by enrichment (suite numbers, phone lines).
 */
@Entity
@Table(name = "practice_locations", indexes = {
    @Index(name = "idx_practice_locations_npi", columnList = "npi"),
    @Index(name = "idx_practice_locations_record_origin", columnList = "record_origin")
})
public class PracticeLocation implements ImportableRecord {

    public static final Set<String> IMPORTABLE_FIELDS = Set.of(
            "addressLine1", "addressLine2", "city", "state", "zipCode", "phone", "fax");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "npi", length = 10, nullable = false)
    private String npi;

    @Column(name = "address_line1", length = 200)
    private String addressLine1;

    @Column(name = "address_line2", length = 200)
    private String addressLine2;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "state", length = 2)
    private String state;

    @Column(name = "zip_code", length = 10)
    private String zipCode;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "fax", length = 20)
    private String fax;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "record_origin", nullable = false, length = 30)
    private RecordOrigin recordOrigin;

    @Column(name = "enriched_at")
    private Instant enrichedAt;

    @Column(name = "enrichment_source", length = 100)
    private String enrichmentSource;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PracticeLocation() {}

    public static PracticeLocation create(String npi, String addressLine1, String city, String state, String zipCode) {
        if (npi == null || npi.isBlank()) {
            throw new IllegalArgumentException("NPI cannot be blank");
        }
        PracticeLocation location = new PracticeLocation();
        location.npi = npi;
        location.addressLine1 = addressLine1;
        location.city = city;
        location.state = state;
        location.zipCode = zipCode;
        location.recordOrigin = RecordOrigin.NPPES;
        location.createdAt = Instant.now();
        location.updatedAt = location.createdAt;
        return location;
    }

    public void markEnriched(String enrichmentSource, Instant enrichedAt) {
        if (enrichmentSource == null || enrichmentSource.isBlank()) {
            throw new IllegalArgumentException("Enrichment source cannot be blank");
        }
        this.recordOrigin = RecordOrigin.ENRICHMENT;
        this.enrichmentSource = enrichmentSource;
        this.enrichedAt = enrichedAt;
        this.updatedAt = Instant.now();
    }

    @Override
    public String getRecordKey() {
        return id.toString();
    }

    @Override
    public String readField(String fieldName) {
        return switch (fieldName) {
            case "addressLine1" -> addressLine1;
            case "addressLine2" -> addressLine2;
            case "city" -> city;
            case "state" -> state;
            case "zipCode" -> zipCode;
            case "phone" -> phone;
            case "fax" -> fax;
            default -> throw new IllegalArgumentException("Unknown practice location field: " + fieldName);
        };
    }

    @Override
    public void writeField(String fieldName, String value) {
        switch (fieldName) {
            case "addressLine1" -> this.addressLine1 = value;
            case "addressLine2" -> this.addressLine2 = value;
            case "city" -> this.city = value;
            case "state" -> this.state = value;
            case "zipCode" -> this.zipCode = value;
            case "phone" -> this.phone = value;
            case "fax" -> this.fax = value;
            default -> throw new IllegalArgumentException("Unknown practice location field: " + fieldName);
        }
        this.updatedAt = Instant.now();
    }

    // Getters
    public UUID getId() { return id; }
    public String getNpi() { return npi; }
    public String getAddressLine1() { return addressLine1; }
    public String getAddressLine2() { return addressLine2; }
    public String getCity() { return city; }
    public String getState() { return state; }
    public String getZipCode() { return zipCode; }
    public String getPhone() { return phone; }
    public String getFax() { return fax; }
    @Override
    public RecordOrigin getRecordOrigin() { return recordOrigin; }
    public Instant getEnrichedAt() { return enrichedAt; }
    public String getEnrichmentSource() { return enrichmentSource; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
