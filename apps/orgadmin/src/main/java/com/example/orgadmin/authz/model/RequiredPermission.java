package com.example.orgadmin.authz.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * A single (resource, action, scope) tuple a request declares it needs.
 */
public record RequiredPermission(
        @NonNull String resource,
        @NonNull String action,
        @Nullable PermissionScope scope
) {
    private static final String NO_SCOPE = "none";

    public RequiredPermission {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Permission resource cannot be blank");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Permission action cannot be blank");
        }
    }

    public static RequiredPermission of(String resource, String action, @Nullable String scope) {
        return new RequiredPermission(resource, action, PermissionScope.parse(scope));
    }

    public static RequiredPermission of(String resource, String action) {
        return new RequiredPermission(resource, action, null);
    }

    public boolean hasScope() {
        return scope != null;
    }

    /**
     * Scope component used in decision cache keys.
     */
    public String scopeKey() {
        return scope != null ? scope.name() : NO_SCOPE;
    }

    /**
     * {@code resource:action}, as used in decision reasons.
     */
    public String describe() {
        return resource + ":" + action;
    }
}
