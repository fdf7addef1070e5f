package com.wtwr.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Values accepted by the {@link RequestValidator}: exactly the declared fields that were present
 * (or defaulted), unchanged in type and value. Undeclared input is not carried over.
 */
public final class ValidatedInput {

    /** Request attribute under which the validated input is published. */
    public static final String REQUEST_ATTRIBUTE = ValidatedInput.class.getName();

    private final Map<String, Object> values;

    ValidatedInput(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ValidatedInput of(Map<String, Object> values) {
        return new ValidatedInput(values);
    }

    /**
     * Returns a string field that the schema declared as required.
     *
     * @throws IllegalArgumentException if the field was not accepted
     */
    public String string(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("no validated value for " + name);
        }
        return (String) value;
    }

    public Optional<String> optionalString(String name) {
        return Optional.ofNullable((String) values.get(name));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValidatedInput other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ValidatedInput" + values.keySet();
    }
}
