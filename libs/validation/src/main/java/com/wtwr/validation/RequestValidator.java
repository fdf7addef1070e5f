package com.wtwr.validation;

import com.wtwr.common.ApiError;
import com.wtwr.common.ErrorKind;
import com.wtwr.common.ObjectIds;
import com.wtwr.common.Result;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks a request's body and path variables against a {@link ValidationSchema}.
 * <p>
 * Fields are evaluated in declaration order and the first violation wins. Violations are
 * {@code BadRequest} errors whose message names the field and the violated constraint; the
 * error context holds {@code field}, {@code constraint} and, unless the field is sensitive, the
 * offending {@code value}. Only absence or emptiness of an optional field is recovered from, by
 * publishing the declared default. No business rules (existence, uniqueness) are checked here.
 * <p>
 * Stateless; one instance can serve every route concurrently.
 */
public class RequestValidator {

    private static final Pattern EMAIL =
            Pattern.compile("^[^@\\s]+@[^@\\s.]+(\\.[^@\\s.]+)*\\.[A-Za-z]{2,}$");

    public Result<ValidatedInput> validate(
            ValidationSchema schema, Map<String, ?> body, Map<String, String> pathVariables) {
        Map<String, ?> bodyFields = body == null ? Map.of() : body;
        Map<String, String> pathFields = pathVariables == null ? Map.of() : pathVariables;
        Map<String, Object> accepted = new LinkedHashMap<>();

        for (FieldSpec field : schema.fields()) {
            Object raw = field.source() == FieldSource.PATH ? pathFields.get(field.name()) : bodyFields.get(field.name());

            if (raw == null) {
                if (field.required()) {
                    return violation(field, "required", null, quoted(field) + " is required");
                }
                applyDefault(field, accepted);
                continue;
            }
            if (!(raw instanceof String value)) {
                return violation(field, "type", raw, quoted(field) + " must be a string");
            }
            if (value.isEmpty()) {
                if (field.required()) {
                    return violation(field, "required", value, quoted(field) + " is not allowed to be empty");
                }
                applyDefault(field, accepted);
                continue;
            }

            ApiError error = check(field, value);
            if (error != null) {
                return Result.err(error);
            }
            accepted.put(field.name(), value);
        }
        return Result.ok(new ValidatedInput(accepted));
    }

    private ApiError check(FieldSpec field, String value) {
        if (field.minLength() != null && value.length() < field.minLength()) {
            return error(field, "minLength", value,
                    quoted(field) + " length must be at least " + field.minLength() + " characters long")
                    .withContext("limit", field.minLength());
        }
        if (field.maxLength() != null && value.length() > field.maxLength()) {
            return error(field, "maxLength", value,
                    quoted(field) + " length must be less than or equal to " + field.maxLength()
                            + " characters long")
                    .withContext("limit", field.maxLength());
        }
        switch (field.type()) {
            case URL:
                return isUrl(value) ? null : error(field, "url", value, quoted(field) + " must be a valid url");
            case EMAIL:
                return EMAIL.matcher(value).matches()
                        ? null
                        : error(field, "email", value, quoted(field) + " must be a valid email");
            case ENUM:
                return field.allowedValues().contains(value)
                        ? null
                        : error(field, "enum", value,
                                quoted(field) + " must be one of [" + String.join(", ", field.allowedValues()) + "]")
                                .withContext("allowed", field.allowedValues());
            case OBJECT_ID:
                return ObjectIds.isValid(value)
                        ? null
                        : error(field, "objectId", value, "Invalid id format for " + quoted(field));
            default:
                return null;
        }
    }

    private static boolean isUrl(String value) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return scheme != null
                    && (scheme.toLowerCase(Locale.ROOT).equals("http") || scheme.toLowerCase(Locale.ROOT).equals("https"))
                    && uri.getHost() != null
                    && uri.getHost().contains(".");
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static void applyDefault(FieldSpec field, Map<String, Object> accepted) {
        if (field.defaultValue() != null) {
            accepted.put(field.name(), field.defaultValue());
        }
    }

    private static Result<ValidatedInput> violation(FieldSpec field, String constraint, Object value, String message) {
        return Result.err(error(field, constraint, value, message));
    }

    private static ApiError error(FieldSpec field, String constraint, Object value, String message) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("field", field.name());
        context.put("constraint", constraint);
        if (value != null && !field.sensitive()) {
            context.put("value", value);
        }
        return new ApiError(ErrorKind.BAD_REQUEST, message, context, null);
    }

    private static String quoted(FieldSpec field) {
        return "\"" + field.name() + "\"";
    }
}
