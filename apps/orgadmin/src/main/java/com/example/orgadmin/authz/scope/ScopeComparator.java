package com.example.orgadmin.authz.scope;

import com.example.orgadmin.authz.model.PermissionScope;
import org.springframework.lang.Nullable;

/**
 * Total-order comparison of permission scopes.
 *
 * <p>Weights: OWN=1, DEPARTMENT=2, SCHOOL=3, ALL=4. Missing and unknown scopes weigh 0,
 * and a zero weight on either side is never sufficient.
 */
public final class ScopeComparator {

    private ScopeComparator() {}

    public static int weight(@Nullable PermissionScope scope) {
        return scope != null ? scope.weight() : 0;
    }

    /**
     * Whether a grant with {@code available} scope covers a request for {@code required} scope.
     */
    public static boolean isSufficient(@Nullable PermissionScope available, @Nullable PermissionScope required) {
        int availableWeight = weight(available);
        int requiredWeight = weight(required);
        if (availableWeight == 0 || requiredWeight == 0) {
            return false;
        }
        return availableWeight >= requiredWeight;
    }

    public static int compare(@Nullable PermissionScope left, @Nullable PermissionScope right) {
        return Integer.compare(weight(left), weight(right));
    }
}
