package com.example.orgadmin.common.util;

import org.springframework.lang.NonNull;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Cache key helpers shared by the decision cache backends.
 */
public final class CacheKeyUtils {

    private static final char ESCAPE = '%';
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();
    private static final Pattern GLOB_CHARS = Pattern.compile("([*?\\[\\]\\\\])");

    private CacheKeyUtils() {}

    /**
     * Encodes one key component so it cannot inject a delimiter into the composed key.
     * {@code %}, colons, whitespace and control characters are percent-encoded as UTF-8 bytes.
     * The encoding is injective: distinct components always yield distinct output.
     *
     * @param component raw component, typically a user-supplied id
     * @return encoded component
     * @throws IllegalArgumentException if component is null or blank
     */
    @NonNull
    public static String sanitize(@NonNull String component) {
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("Cache key component cannot be null or blank");
        }
        StringBuilder encoded = null;
        for (int i = 0; i < component.length(); ) {
            int codePoint = component.codePointAt(i);
            int next = i + Character.charCount(codePoint);
            if (needsEncoding(codePoint)) {
                if (encoded == null) {
                    encoded = new StringBuilder(component.length() + 8).append(component, 0, i);
                }
                for (byte b : new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8)) {
                    encoded.append(ESCAPE).append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
                }
            } else if (encoded != null) {
                encoded.append(component, i, next);
            }
            i = next;
        }
        return encoded != null ? encoded.toString() : component;
    }

    private static boolean needsEncoding(int codePoint) {
        return codePoint == ESCAPE
                || codePoint == ':'
                || Character.isWhitespace(codePoint)
                || Character.isSpaceChar(codePoint)
                || Character.isISOControl(codePoint);
    }

    /**
     * Escapes Redis glob metacharacters so a prefix can be used verbatim in {@code SCAN MATCH}.
     */
    @NonNull
    public static String escapeGlob(@NonNull String prefix) {
        return GLOB_CHARS.matcher(prefix).replaceAll("\\\\$1");
    }
}
