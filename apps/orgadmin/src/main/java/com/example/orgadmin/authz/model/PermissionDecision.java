package com.example.orgadmin.authz.model;

/**
 * Decision for one required tuple.
 */
public record PermissionDecision(
        RequiredPermission permission,
        Decision decision
) {
    public boolean allowed() {
        return decision.allowed();
    }
}
