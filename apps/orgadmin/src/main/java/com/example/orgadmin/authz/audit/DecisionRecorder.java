package com.example.orgadmin.authz.audit;

/**
 * Fire-and-forget notification of resolved decisions.
 * Implementations never block the caller and never throw.
 */
public interface DecisionRecorder {

    void record(DecisionEvent event);
}
