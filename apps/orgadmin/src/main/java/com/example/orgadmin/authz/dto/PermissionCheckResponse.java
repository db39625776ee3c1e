package com.example.orgadmin.authz.dto;

import com.example.orgadmin.authz.model.AuthorizationResult;
import com.example.orgadmin.authz.model.PermissionDecision;

import java.util.List;

public record PermissionCheckResponse(
        boolean allowed,
        List<String> deniedReasons,
        List<TupleDecision> decisions
) {
    public record TupleDecision(
            String resource,
            String action,
            String scope,
            boolean allowed,
            String reason,
            String source
    ) {
        static TupleDecision from(PermissionDecision decision) {
            return new TupleDecision(
                    decision.permission().resource(),
                    decision.permission().action(),
                    decision.permission().hasScope() ? decision.permission().scope().name() : null,
                    decision.allowed(),
                    decision.decision().reason(),
                    decision.decision().source().name()
            );
        }
    }

    public static PermissionCheckResponse from(AuthorizationResult result) {
        return new PermissionCheckResponse(
                result.allowed(),
                result.deniedReasons(),
                result.decisions().stream().map(TupleDecision::from).toList()
        );
    }
}
