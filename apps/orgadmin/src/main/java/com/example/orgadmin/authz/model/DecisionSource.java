package com.example.orgadmin.authz.model;

/**
 * Where a decision came from.
 */
public enum DecisionSource {
    BYPASS,
    USER_OVERRIDE,
    DIRECT_PERMISSION,
    ROLE_PERMISSION,
    POSITION_PERMISSION,
    SCOPE_OWNERSHIP,
    DEFAULT,
    // a source lookup failed and the decision was closed
    ERROR
}
