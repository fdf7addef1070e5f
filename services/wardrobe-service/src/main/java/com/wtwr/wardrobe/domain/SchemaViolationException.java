package com.wtwr.wardrobe.domain;

/** A document did not satisfy the store's schema. */
public class SchemaViolationException extends StorageException {

    private final String field;

    public SchemaViolationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
