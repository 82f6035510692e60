package com.verifymyprovider.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Instant;
import java.util.Set;

/**
 * Healthcare provider keyed by NPI.
 * Seeded from NPPES bulk imports and improved by enrichment and user verification.
 */
@Entity
@Table(name = "providers", indexes = {
    @Index(name = "idx_providers_specialty", columnList = "primary_specialty"),
    @Index(name = "idx_providers_record_origin", columnList = "record_origin")
})
public class Provider implements ImportableRecord {

    public static final Set<String> IMPORTABLE_FIELDS = Set.of(
            "firstName", "lastName", "organizationName", "credential", "primarySpecialty",
            "taxonomyDescription", "phone", "fax", "profileUrl");

    @Id
    @Pattern(regexp = "\\d{10}")
    @Column(name = "npi", length = 10, nullable = false, updatable = false)
    private String npi;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 20)
    private EntityType entityType;

    @Column(name = "first_name", length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(name = "organization_name", length = 200)
    private String organizationName;

    @Column(name = "credential", length = 50)
    private String credential;

    @Column(name = "primary_specialty", length = 200)
    private String primarySpecialty;

    @Column(name = "taxonomy_description", length = 200)
    private String taxonomyDescription;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "fax", length = 20)
    private String fax;

    @Column(name = "profile_url", length = 500)
    private String profileUrl;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "record_origin", nullable = false, length = 30)
    private RecordOrigin recordOrigin;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected Provider() {}

    public static Provider createIndividual(String npi, String firstName, String lastName, String primarySpecialty) {
        Provider provider = create(npi, EntityType.INDIVIDUAL);
        provider.firstName = firstName;
        provider.lastName = lastName;
        provider.primarySpecialty = primarySpecialty;
        return provider;
    }

    public static Provider createOrganization(String npi, String organizationName, String primarySpecialty) {
        Provider provider = create(npi, EntityType.ORGANIZATION);
        provider.organizationName = organizationName;
        provider.primarySpecialty = primarySpecialty;
        return provider;
    }

    private static Provider create(String npi, EntityType entityType) {
        if (npi == null || !npi.matches("\\d{10}")) {
            throw new IllegalArgumentException("NPI must be exactly 10 digits: " + npi);
        }
        Provider provider = new Provider();
        provider.npi = npi;
        provider.entityType = entityType;
        provider.recordOrigin = RecordOrigin.NPPES;
        provider.createdAt = Instant.now();
        provider.updatedAt = provider.createdAt;
        return provider;
    }

    /**
     * Tags the record as improved beyond the raw registry data.
     */
    public void markImproved(RecordOrigin origin) {
        if (origin == null || !origin.isImprovedOverImport()) {
            throw new IllegalArgumentException("Origin must be ENRICHMENT or USER_VERIFICATION: " + origin);
        }
        this.recordOrigin = origin;
        this.updatedAt = Instant.now();
    }

    @Override
    public String getRecordKey() {
        return npi;
    }

    @Override
    public String readField(String fieldName) {
        return switch (fieldName) {
            case "firstName" -> firstName;
            case "lastName" -> lastName;
            case "organizationName" -> organizationName;
            case "credential" -> credential;
            case "primarySpecialty" -> primarySpecialty;
            case "taxonomyDescription" -> taxonomyDescription;
            case "phone" -> phone;
            case "fax" -> fax;
            case "profileUrl" -> profileUrl;
            default -> throw new IllegalArgumentException("Unknown provider field: " + fieldName);
        };
    }

    @Override
    public void writeField(String fieldName, String value) {
        switch (fieldName) {
            case "firstName" -> this.firstName = value;
            case "lastName" -> this.lastName = value;
            case "organizationName" -> this.organizationName = value;
            case "credential" -> this.credential = value;
            case "primarySpecialty" -> this.primarySpecialty = value;
            case "taxonomyDescription" -> this.taxonomyDescription = value;
            case "phone" -> this.phone = value;
            case "fax" -> this.fax = value;
            case "profileUrl" -> this.profileUrl = value;
            default -> throw new IllegalArgumentException("Unknown provider field: " + fieldName);
        }
        this.updatedAt = Instant.now();
    }

    public enum EntityType {
        INDIVIDUAL,   // NPI type 1
        ORGANIZATION  // NPI type 2
    }

    // Getters
    public String getNpi() { return npi; }
    public EntityType getEntityType() { return entityType; }
    public String getFirstName() { return firstName; }
    public String getLastName() { return lastName; }
    public String getOrganizationName() { return organizationName; }
    public String getCredential() { return credential; }
    public String getPrimarySpecialty() { return primarySpecialty; }
    public String getTaxonomyDescription() { return taxonomyDescription; }
    public String getPhone() { return phone; }
    public String getFax() { return fax; }
    public String getProfileUrl() { return profileUrl; }
    @Override
    public RecordOrigin getRecordOrigin() { return recordOrigin; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
