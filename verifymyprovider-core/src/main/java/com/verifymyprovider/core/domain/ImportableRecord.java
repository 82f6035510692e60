package com.verifymyprovider.core.domain;

/**
 * A record the bulk importer writes into field by field.
 * Field names are the entity attribute names (e.g. {@code zipCode}).
 */
public interface ImportableRecord {

    String getRecordKey();

    RecordOrigin getRecordOrigin();

    /**
     * @throws IllegalArgumentException if the field is not importable on this record
     */
    String readField(String fieldName);

    /**
     * @throws IllegalArgumentException if the field is not importable on this record
     */
    void writeField(String fieldName, String value);
}
