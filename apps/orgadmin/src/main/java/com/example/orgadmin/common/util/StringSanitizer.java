package com.example.orgadmin.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.regex.Pattern;

public final class StringSanitizer {

    private static final Pattern SAFE_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_@.:-]{1,128}$");
    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int DEFAULT_HEADER_MAX_LENGTH = 256;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    /**
     * Trims a header value and caps its length. Blank values become null.
     */
    @Nullable
    public static String headerValue(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEFAULT_HEADER_MAX_LENGTH) {
            return trimmed.substring(0, DEFAULT_HEADER_MAX_LENGTH);
        }
        return trimmed;
    }

    public static boolean isValidSafeId(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return SAFE_ID_PATTERN.matcher(id).matches();
    }
}
