package com.example.orgadmin.authz.model;

import java.util.List;

/**
 * Aggregate outcome of an evaluation: allowed only if every required tuple was allowed.
 */
public record AuthorizationResult(
        boolean allowed,
        List<PermissionDecision> decisions
) {
    public AuthorizationResult {
        decisions = decisions != null ? List.copyOf(decisions) : List.of();
    }

    public static AuthorizationResult of(List<PermissionDecision> decisions) {
        boolean allowed = decisions.stream().allMatch(PermissionDecision::allowed);
        return new AuthorizationResult(allowed, decisions);
    }

    public List<PermissionDecision> denied() {
        return decisions.stream()
                .filter(d -> !d.allowed())
                .toList();
    }

    public List<String> deniedReasons() {
        return denied().stream()
                .map(d -> d.decision().reason())
                .distinct()
                .toList();
    }

    public String deniedMessage() {
        return "Insufficient permissions: " + String.join(", ", deniedReasons());
    }
}
