package com.example.orgadmin.config.properties;

import com.example.orgadmin.authz.scope.ResourceKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@ConfigurationProperties(prefix = "app.authz")
public record AuthzProperties(
        boolean enabled,
        CacheProperties cache,
        RecorderProperties recorder,
        DataStoreProperties dataStore,
        OwnershipProperties ownership,
        ActorHeaderProperties actorHeaders
) {
    public AuthzProperties {
        if (cache == null) {
            cache = new CacheProperties(null, null, 0);
        }
        if (recorder == null) {
            recorder = new RecorderProperties(true, 0);
        }
        if (dataStore == null) {
            dataStore = new DataStoreProperties(null, -1, null, null);
        }
        if (ownership == null) {
            ownership = new OwnershipProperties(null);
        }
        if (actorHeaders == null) {
            actorHeaders = new ActorHeaderProperties(null, null, null, null, null);
        }
    }

    public static AuthzProperties defaults() {
        return new AuthzProperties(true, null, null, null, null, null);
    }

    public record CacheProperties(
            Duration decisionTtl,
            Duration bypassTtl,
            long maxEntries
    ) {
        public CacheProperties {
            if (decisionTtl == null) {
                decisionTtl = Duration.ofMinutes(5);
            }
            if (bypassTtl == null) {
                bypassTtl = Duration.ofMinutes(10);
            }
            if (maxEntries <= 0) {
                maxEntries = 10_000;
            }
        }
    }

    public record RecorderProperties(
            boolean enabled,
            int queueCapacity
    ) {
        public RecorderProperties {
            if (queueCapacity <= 0) {
                queueCapacity = 1000;
            }
        }
    }

    public record DataStoreProperties(
            Duration timeout,
            int maxRetries,
            Duration initialBackoff,
            Duration maxBackoff
    ) {
        public DataStoreProperties {
            if (timeout == null) {
                timeout = Duration.ofSeconds(2);
            }
            if (maxRetries < 0) {
                maxRetries = 2;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(50);
            }
            if (maxBackoff == null) {
                maxBackoff = Duration.ofMillis(500);
            }
        }
    }

    /**
     * Maps resource type names to the organizational entity their ids refer to.
     */
    public record OwnershipProperties(
            Map<String, ResourceKind> resources
    ) {
        private static final Map<String, ResourceKind> DEFAULT_RESOURCES = Map.of(
                "user", ResourceKind.USER,
                "userprofile", ResourceKind.USER,
                "department", ResourceKind.DEPARTMENT,
                "position", ResourceKind.POSITION,
                "school", ResourceKind.SCHOOL
        );

        public OwnershipProperties {
            if (resources == null || resources.isEmpty()) {
                resources = DEFAULT_RESOURCES;
            } else {
                resources = resources.entrySet().stream()
                        .collect(Collectors.toUnmodifiableMap(
                                e -> e.getKey().toLowerCase(Locale.ROOT),
                                Map.Entry::getValue));
            }
        }

        public ResourceKind kindOf(String resource) {
            return resources.get(resource.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Request headers the identity gateway uses to forward the authenticated actor.
     */
    public record ActorHeaderProperties(
            String actorId,
            String schoolId,
            String departmentId,
            String positionId,
            String roles
    ) {
        public ActorHeaderProperties {
            if (actorId == null || actorId.isBlank()) {
                actorId = "X-Actor-Id";
            }
            if (schoolId == null || schoolId.isBlank()) {
                schoolId = "X-Actor-School-Id";
            }
            if (departmentId == null || departmentId.isBlank()) {
                departmentId = "X-Actor-Department-Id";
            }
            if (positionId == null || positionId.isBlank()) {
                positionId = "X-Actor-Position-Id";
            }
            if (roles == null || roles.isBlank()) {
                roles = "X-Actor-Roles";
            }
        }
    }
}
