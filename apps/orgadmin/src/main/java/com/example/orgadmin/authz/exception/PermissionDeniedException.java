package com.example.orgadmin.authz.exception;

import com.example.orgadmin.authz.model.AuthorizationResult;

import java.util.List;

public class PermissionDeniedException extends RuntimeException {

    private final String actorId;
    private final List<String> reasons;

    public PermissionDeniedException(String actorId, AuthorizationResult result) {
        super(result.deniedMessage());
        this.actorId = actorId;
        this.reasons = result.deniedReasons();
    }

    public String getActorId() {
        return actorId;
    }

    public List<String> getReasons() {
        return reasons;
    }
}
