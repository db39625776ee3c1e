package com.example.orgadmin.authz.model;

/**
 * Allow/deny outcome for one permission tuple plus its human-readable justification.
 */
public record Decision(
        boolean allowed,
        String reason,
        DecisionSource source
) {
    public static Decision allow(DecisionSource source, String reason) {
        return new Decision(true, reason, source);
    }

    public static Decision deny(DecisionSource source, String reason) {
        return new Decision(false, reason, source);
    }
}
