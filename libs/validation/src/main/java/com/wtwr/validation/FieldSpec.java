package com.wtwr.validation;

import java.util.List;

/**
 * Declaration of one field in a {@link ValidationSchema}. Instances are immutable; the
 * {@code with*} methods return modified copies.
 *
 * @param name          field or path variable name
 * @param type          primitive type
 * @param source        body or path
 * @param required      whether absence or emptiness is a violation
 * @param minLength     inclusive lower length bound, or null
 * @param maxLength     inclusive upper length bound, or null
 * @param allowedValues permitted values for {@link FieldType#ENUM}, in display order
 * @param defaultValue  value published when an optional field is absent or empty, or null
 * @param sensitive     never echo the offending value in error context
 */
public record FieldSpec(
        String name,
        FieldType type,
        FieldSource source,
        boolean required,
        Integer minLength,
        Integer maxLength,
        List<String> allowedValues,
        String defaultValue,
        boolean sensitive) {

    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (type == null || source == null) {
            throw new IllegalArgumentException("type and source must not be null");
        }
        if (minLength != null && minLength < 0) {
            throw new IllegalArgumentException("minLength must be >= 0");
        }
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new IllegalArgumentException("minLength must not exceed maxLength");
        }
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (type == FieldType.ENUM && allowedValues.isEmpty()) {
            throw new IllegalArgumentException("enum field " + name + " needs allowed values");
        }
    }

    public static FieldSpec string(String name) {
        return body(name, FieldType.STRING);
    }

    public static FieldSpec url(String name) {
        return body(name, FieldType.URL);
    }

    public static FieldSpec email(String name) {
        return body(name, FieldType.EMAIL);
    }

    public static FieldSpec oneOf(String name, String... values) {
        return new FieldSpec(name, FieldType.ENUM, FieldSource.BODY, true, null, null, List.of(values), null, false);
    }

    /** A required 24-hex identifier taken from the request path. */
    public static FieldSpec pathId(String name) {
        return new FieldSpec(name, FieldType.OBJECT_ID, FieldSource.PATH, true, null, null, null, null, false);
    }

    private static FieldSpec body(String name, FieldType type) {
        return new FieldSpec(name, type, FieldSource.BODY, true, null, null, null, null, false);
    }

    public FieldSpec withLength(int min, int max) {
        return new FieldSpec(name, type, source, required, min, max, allowedValues, defaultValue, sensitive);
    }

    public FieldSpec optional() {
        return new FieldSpec(name, type, source, false, minLength, maxLength, allowedValues, defaultValue, sensitive);
    }

    /** Makes the field optional with the given default. */
    public FieldSpec withDefault(String value) {
        return new FieldSpec(name, type, source, false, minLength, maxLength, allowedValues, value, sensitive);
    }

    public FieldSpec sensitiveValue() {
        return new FieldSpec(name, type, source, required, minLength, maxLength, allowedValues, defaultValue, true);
    }
}
