package com.wtwr.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keeps credentials and passwords out of log records.
 * <p>
 * {@link #redact(Map)} replaces the values of sensitive keys in an error context map;
 * nested maps are redacted too. {@link #mask(String)} shortens a raw credential to a prefix
 * that is still useful for correlating log lines. Key matching is a case-insensitive substring
 * match, so {@code newPassword} and {@code x-auth-token} are both caught.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_KEYS =
            Set.of("password", "token", "secret", "authorization", "credential", "cookie");

    private static final int MASK_PREFIX = 6;

    private final Pattern sensitiveKey;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_KEYS);
    }

    /**
     * @param keys key fragments to treat as sensitive (case-insensitive); must not be empty
     */
    public SensitiveDataRedactor(Set<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("keys must not be null or empty");
        }
        String regex = String.join("|", keys.stream().map(Pattern::quote).sorted().toList());
        this.sensitiveKey = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map in the same key order with sensitive values replaced by {@value #REDACTED}.
     * Null or empty input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        return redactEntries(data);
    }

    public boolean isSensitive(String key) {
        return key != null && sensitiveKey.matcher(key).find();
    }

    /** Masks a credential for logging: {@code "eyJhbG..."}, or {@code "***"} when too short. */
    public static String mask(String credential) {
        if (credential == null || credential.length() <= MASK_PREFIX * 2) {
            return "***";
        }
        return credential.substring(0, MASK_PREFIX) + "...";
    }

    /** Nested maps may carry keys of any type; they are matched and kept by their string form. */
    private Map<String, Object> redactEntries(Map<?, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key = String.valueOf(entry.getKey());
            result.put(key, redactValue(key, entry.getValue()));
        }
        return result;
    }

    private Object redactValue(String key, Object value) {
        if (isSensitive(key)) {
            return REDACTED;
        }
        if (value instanceof Map<?, ?> nested) {
            return redactEntries(nested);
        }
        return value;
    }
}
