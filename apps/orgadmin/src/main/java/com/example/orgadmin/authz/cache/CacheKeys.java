package com.example.orgadmin.authz.cache;

import com.example.orgadmin.authz.model.RequiredPermission;
import com.example.orgadmin.common.util.CacheKeyUtils;

/**
 * Decision cache key layout.
 *
 * <pre>
 * check:&lt;actorId&gt;:&lt;resource&gt;:&lt;action&gt;:&lt;scope|none&gt;
 * hierarchy:level0:&lt;actorId&gt;
 * </pre>
 *
 * Every component is percent-encoded ({@link CacheKeyUtils#sanitize}), so the key encoding is lossless:
 * distinct actor ids never share a key, and an actor prefix never matches another actor's keys.
 */
public final class CacheKeys {

    public static final String DECISION_PREFIX = "check:";
    public static final String BYPASS_PREFIX = "hierarchy:level0:";

    private CacheKeys() {}

    public static String decision(String actorId, RequiredPermission permission) {
        return actorPrefix(actorId)
                + CacheKeyUtils.sanitize(permission.resource()) + ":"
                + CacheKeyUtils.sanitize(permission.action()) + ":"
                + permission.scopeKey();
    }

    public static String actorPrefix(String actorId) {
        return DECISION_PREFIX + CacheKeyUtils.sanitize(actorId) + ":";
    }

    public static String bypass(String actorId) {
        return BYPASS_PREFIX + CacheKeyUtils.sanitize(actorId);
    }
}
