package com.example.orgadmin.authz.model;

import org.springframework.lang.Nullable;

import java.util.Locale;

/**
 * Breadth of a permission along the ownership hierarchy.
 *
 * <p>Scopes form a total order by weight: {@code OWN < DEPARTMENT < SCHOOL < ALL}.
 * Values that are not recognised map to {@link #UNKNOWN} (weight 0), which never
 * satisfies and is never satisfied by another scope.
 */
public enum PermissionScope {
    UNKNOWN(0),
    OWN(1),
    DEPARTMENT(2),
    SCHOOL(3),
    ALL(4);

    private final int weight;

    PermissionScope(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Parse a stored or declared scope value.
     *
     * @return null for a missing/blank value ("no scope"), {@link #UNKNOWN} for unrecognised values
     */
    @Nullable
    public static PermissionScope parse(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return PermissionScope.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
