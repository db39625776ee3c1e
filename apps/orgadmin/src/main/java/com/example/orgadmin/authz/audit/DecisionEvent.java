package com.example.orgadmin.authz.audit;

import com.example.orgadmin.authz.model.Decision;
import com.example.orgadmin.authz.model.DecisionSource;
import com.example.orgadmin.authz.model.RequiredPermission;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One resolved permission tuple, as handed to the decision recorder.
 */
public record DecisionEvent(
        String actorId,
        String resource,
        String action,
        String scope,
        boolean allowed,
        String reason,
        DecisionSource source,
        long timestampMs,
        long durationMs
) {
    public static DecisionEvent of(
            String actorId,
            RequiredPermission permission,
            Decision decision,
            long timestampMs,
            long durationMs) {
        return new DecisionEvent(
                actorId,
                permission.resource(),
                permission.action(),
                permission.hasScope() ? permission.scope().name() : null,
                decision.allowed(),
                decision.reason(),
                decision.source(),
                timestampMs,
                durationMs
        );
    }

    /**
     * Flat map for JSON logging. Null values are omitted.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("event", "authz_decision");
        log.put("timestamp", timestampMs);
        log.put("actorId", actorId);
        log.put("resource", resource);
        log.put("action", action);
        if (scope != null) {
            log.put("scope", scope);
        }
        log.put("outcome", allowed ? "ALLOW" : "DENY");
        log.put("reason", reason);
        log.put("source", source != null ? source.name() : null);
        log.put("durationMs", durationMs);
        log.values().removeIf(v -> v == null);
        return log;
    }
}
