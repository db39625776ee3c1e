package com.example.orgadmin.authz.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Authenticated actor snapshot handed over by the identity provider.
 * Affiliations are optional; role ids are informational, role grants are always read from the store.
 */
public record Actor(
        @NonNull String id,
        @Nullable String schoolId,
        @Nullable String departmentId,
        @Nullable String positionId,
        @NonNull Set<String> roleIds
) {
    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Actor id cannot be blank");
        }
        roleIds = roleIds != null ? Set.copyOf(roleIds) : Set.of();
    }

    public static Actor of(String id) {
        return new Actor(id, null, null, null, Set.of());
    }
}
