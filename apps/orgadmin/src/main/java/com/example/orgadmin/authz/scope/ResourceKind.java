package com.example.orgadmin.authz.scope;

/**
 * Organizational entity kind a resource id refers to, used to resolve ownership.
 */
public enum ResourceKind {
    USER,
    DEPARTMENT,
    POSITION,
    SCHOOL
}
