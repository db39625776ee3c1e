package com.example.orgadmin.authz.bypass;

import com.example.orgadmin.authz.cache.DecisionCache;
import com.example.orgadmin.authz.exception.DataStoreUnavailableException;
import com.example.orgadmin.common.util.StringSanitizer;
import com.example.orgadmin.datastore.PermissionDataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Superadmin check: an actor holding an active hierarchy-level-0 role is allowed everything.
 *
 * <p>The flag is cached under {@code hierarchy:level0:<actorId>} with its own TTL. Lookup
 * errors other than data-store unavailability count as "not a bypass authority".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BypassAuthorityCheck {

    private final PermissionDataStore dataStore;
    private final DecisionCache decisionCache;

    @NonNull
    public Mono<Boolean> isBypassAuthority(@NonNull String actorId) {
        return decisionCache.getBypassFlag(actorId)
                .switchIfEmpty(Mono.defer(() -> dataStore.hasHierarchyLevel0Role(actorId)
                        .defaultIfEmpty(false)
                        .flatMap(bypass -> decisionCache.putBypassFlag(actorId, bypass).thenReturn(bypass))))
                .onErrorResume(e -> !(e instanceof DataStoreUnavailableException), e -> {
                    log.error("Bypass authority lookup failed for actor {}: {}",
                            StringSanitizer.forLog(actorId), e.getMessage(), e);
                    return Mono.just(false);
                });
    }

    @NonNull
    public Mono<Void> invalidate(@NonNull String actorId) {
        return decisionCache.invalidateBypass(actorId).then();
    }
}
