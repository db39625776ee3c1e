package com.example.orgadmin.datastore;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Effective-period checks for time-bounded grants. Open bounds are unbounded.
 */
public final class TemporalValidity {

    private TemporalValidity() {}

    /**
     * {@code from} is inclusive, {@code until} is exclusive.
     */
    public static boolean isEffective(@Nullable Instant from, @Nullable Instant until, @NonNull Instant now) {
        if (from != null && now.isBefore(from)) {
            return false;
        }
        return until == null || now.isBefore(until);
    }

    public static boolean isUnexpired(@Nullable Instant until, @NonNull Instant now) {
        return isEffective(null, until, now);
    }
}
