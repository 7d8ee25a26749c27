package com.phodal.anthropicbridge.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials before payloads and headers are written to debug logs
 */
public final class LogSanitizer {

    static final String MASK = "***";

    private static final Set<String> SENSITIVE_KEYS = Set.of("api_key", "apikey", "token", "authorization", "password");

    private LogSanitizer() {
    }

    /**
     * Returns a copy of maps and lists with sensitive values masked, recursively. Other values are returned as is.
     */
    public static Object sanitize(Object data) {
        if (data instanceof Map<?, ?> map) {
            Map<String, Object> sanitized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                sanitized.put(key, isSensitive(key) ? MASK : sanitize(entry.getValue()));
            }
            return sanitized;
        }
        if (data instanceof List<?> list) {
            List<Object> sanitized = new ArrayList<>(list.size());
            for (Object item : list) {
                sanitized.add(sanitize(item));
            }
            return sanitized;
        }
        return data;
    }

    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        Map<String, String> sanitized = new LinkedHashMap<>();
        headers.forEach((name, value) -> sanitized.put(name, isSensitive(name) ? MASK : value));
        return sanitized;
    }

    static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT).replace('-', '_');
        for (String sensitive : SENSITIVE_KEYS) {
            if (lower.contains(sensitive)) {
                return true;
            }
        }
        return false;
    }
}
