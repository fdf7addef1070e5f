package com.wtwr.wardrobe.infrastructure.storage;

import com.wtwr.wardrobe.domain.SchemaViolationException;

/** Field rules the in-memory collections enforce on write. */
final class StoreSchema {

    private StoreSchema() {}

    static void requirePresent(String field, Object value) {
        if (value == null || (value instanceof String s && s.isEmpty())) {
            throw new SchemaViolationException(field, "Path `" + field + "` is required.");
        }
    }

    static void requireLength(String field, String value, int min, int max) {
        requirePresent(field, value);
        if (value.length() < min || value.length() > max) {
            throw new SchemaViolationException(
                    field, "Path `" + field + "` must be between " + min + " and " + max + " characters.");
        }
    }

    static void requireUrlIfPresent(String field, String value) {
        if (value != null && !value.startsWith("http://") && !value.startsWith("https://")) {
            throw new SchemaViolationException(field, "You must enter a valid URL");
        }
    }

    static void requireUrl(String field, String value) {
        requirePresent(field, value);
        requireUrlIfPresent(field, value);
    }
}
