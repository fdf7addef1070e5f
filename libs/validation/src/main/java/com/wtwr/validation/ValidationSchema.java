package com.wtwr.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static, per-route declaration of the expected input. Fields are checked in declaration order.
 *
 * <pre>
 * ValidationSchema.named("createItem")
 *         .field(FieldSpec.string("name").withLength(2, 30))
 *         .field(FieldSpec.oneOf("weather", "hot", "warm", "cold"))
 *         .field(FieldSpec.url("imageUrl"))
 *         .build();
 * </pre>
 *
 * @param name   route or schema name, used in logs
 * @param fields field declarations, unmodifiable, unique by name
 */
public record ValidationSchema(String name, List<FieldSpec> fields) {

    public ValidationSchema {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (FieldSpec field : fields) {
            if (!seen.add(field.name())) {
                throw new IllegalArgumentException("duplicate field " + field.name() + " in schema " + name);
            }
        }
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;
        private final List<FieldSpec> fields = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder field(FieldSpec field) {
            fields.add(field);
            return this;
        }

        public ValidationSchema build() {
            return new ValidationSchema(name, fields);
        }
    }
}
