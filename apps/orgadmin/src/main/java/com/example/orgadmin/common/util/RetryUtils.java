package com.example.orgadmin.common.util;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.lang.NonNull;

import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Retry conditions for data-store calls.
 */
public final class RetryUtils {

    private RetryUtils() {}

    /**
     * Determines if a data-store failure is transient.
     * Transient conditions:
     * - DataAccessResourceFailureException (connection refused, socket errors)
     * - TransientDataAccessException (query timeout, pessimistic lock)
     * - TimeoutException raised by the per-call timeout
     *
     * @param throwable the exception to check
     * @return true if the call may succeed when retried
     */
    public static boolean isTransient(@NonNull Throwable throwable) {
        return throwable instanceof DataAccessResourceFailureException
                || throwable instanceof TransientDataAccessException
                || throwable instanceof TimeoutException;
    }

    @NonNull
    public static Predicate<Throwable> transientPredicate() {
        return RetryUtils::isTransient;
    }
}
