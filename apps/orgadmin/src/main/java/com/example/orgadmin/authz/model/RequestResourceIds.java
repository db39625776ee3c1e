package com.example.orgadmin.authz.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Candidate resource identifiers captured from a request: path params, body fields and query params.
 */
public record RequestResourceIds(
        @NonNull Map<String, String> params,
        @NonNull Map<String, Object> body,
        @NonNull Map<String, String> query
) {
    private static final String ID = "id";

    public RequestResourceIds {
        params = withoutNulls(params);
        body = withoutNulls(body);
        query = withoutNulls(query);
    }

    public static RequestResourceIds empty() {
        return new RequestResourceIds(Map.of(), Map.of(), Map.of());
    }

    public static RequestResourceIds ofParam(String name, String value) {
        return new RequestResourceIds(Map.of(name, value), Map.of(), Map.of());
    }

    /**
     * Resolve the id of the given resource type.
     * Precedence: {@code params.id}, {@code params.<resource>Id}, {@code body.id},
     * {@code body.<resource>Id}, {@code query.id}, {@code query.<resource>Id}.
     *
     * @return the id, or null when none of the locations carries one
     */
    @Nullable
    public String extract(@NonNull String resource) {
        String typedKey = resource + "Id";
        String value = firstPresent(params.get(ID), params.get(typedKey));
        if (value == null) {
            value = firstPresent(asString(body.get(ID)), asString(body.get(typedKey)));
        }
        if (value == null) {
            value = firstPresent(query.get(ID), query.get(typedKey));
        }
        return value;
    }

    @Nullable
    private static String firstPresent(@Nullable String first, @Nullable String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }

    private static <V> Map<String, V> withoutNulls(@Nullable Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return source.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    @Nullable
    private static String asString(@Nullable Object value) {
        return value != null ? value.toString() : null;
    }
}
