package com.example.orgadmin.datastore;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Currently valid user override for a (resource, action) pair.
 */
public record OverrideGrant(
        boolean granted,
        @Nullable Instant validUntil
) {}
