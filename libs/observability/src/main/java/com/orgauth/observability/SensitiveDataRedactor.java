package com.orgauth.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts credentials from structured log data before it is written.
 *
 * <p>Field names are lower-cased with {@code _} and {@code -} removed before matching. A field
 * is sensitive when its name contains one of the configured fragments ({@code token},
 * {@code secret} and so on), or equals one of the exact names. Exact names cover the short login
 * parameters ({@code code}, {@code state}, {@code nonce}) that would otherwise hit unrelated fields
 * such as {@code statusCode}. Independently of the field name, any value that looks like an
 * {@code Authorization} header or a compact signed token is redacted.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization", "credential", "cookie");

    private static final Set<String> DEFAULT_EXACT_NAMES = Set.of(
            "code", "authcode", "state", "nonce");

    private static final Pattern BEARER_VALUE = Pattern.compile("(?i)^bearer\\s+\\S+");
    private static final Pattern COMPACT_TOKEN =
            Pattern.compile("^[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}\\.[A-Za-z0-9_-]{8,}$");

    private final Set<String> fragments;
    private final Set<String> exactNames;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS, DEFAULT_EXACT_NAMES);
    }

    public SensitiveDataRedactor(Set<String> fragments, Set<String> exactNames) {
        this.fragments = normalizeAll(fragments);
        this.exactNames = normalizeAll(exactNames);
    }

    /**
     * Returns a copy of {@code data} with sensitive values replaced by {@value #REDACTED}. Null
     * input yields an empty map.
     */
    public <V> Map<String, Object> redact(Map<String, V> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> result.put(key, redactValue(key, value)));
        return result;
    }

    public Object redactValue(String fieldName, Object value) {
        if (value == null) {
            return null;
        }
        if (isSensitive(fieldName) || looksLikeCredential(value.toString())) {
            return REDACTED;
        }
        return value;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String normalized = normalize(fieldName);
        return exactNames.contains(normalized) || fragments.stream().anyMatch(normalized::contains);
    }

    private static boolean looksLikeCredential(String value) {
        return BEARER_VALUE.matcher(value).find() || COMPACT_TOKEN.matcher(value).matches();
    }

    private static Set<String> normalizeAll(Set<String> names) {
        return Set.copyOf(names.stream().map(SensitiveDataRedactor::normalize).toList());
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    }
}
