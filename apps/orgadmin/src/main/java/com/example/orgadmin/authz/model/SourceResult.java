package com.example.orgadmin.authz.model;

/**
 * Tri-state result of a single permission source.
 */
public record SourceResult(
        Outcome outcome,
        String reason,
        DecisionSource source
) {
    public enum Outcome {
        ALLOW,
        DENY,
        NOT_APPLICABLE  // source has nothing to say, continue with the next one
    }

    public static SourceResult allow(DecisionSource source, String reason) {
        return new SourceResult(Outcome.ALLOW, reason, source);
    }

    public static SourceResult deny(DecisionSource source, String reason) {
        return new SourceResult(Outcome.DENY, reason, source);
    }

    public static SourceResult notApplicable(DecisionSource source) {
        return new SourceResult(Outcome.NOT_APPLICABLE, "Source not applicable", source);
    }

    /**
     * DENY produced because the lookup itself failed.
     */
    public static SourceResult failed(String reason) {
        return new SourceResult(Outcome.DENY, reason, DecisionSource.ERROR);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }

    public boolean isDenied() {
        return outcome == Outcome.DENY;
    }

    public boolean isDefinitive() {
        return outcome != Outcome.NOT_APPLICABLE;
    }

    public Decision toDecision() {
        if (!isDefinitive()) {
            throw new IllegalStateException("Source result from " + source + " is not definitive");
        }
        return new Decision(isAllowed(), reason, source);
    }
}
