package com.example.orgadmin.authz.audit;

import com.example.orgadmin.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Writes each decision as one JSON line to the {@code AUTHZ_AUDIT} logger.
 */
@Component
@RequiredArgsConstructor
public class DecisionAuditSink implements DecisionSink {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private final ObjectMapper objectMapper;

    @Override
    public void accept(@NonNull DecisionEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (event.allowed()) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize decision event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logFallback(@NonNull DecisionEvent event) {
        AUDIT_LOG.warn("AuthZ {} - actor={}, permission={}:{}, scope={}, source={}, reason={}",
                event.allowed() ? "ALLOW" : "DENY",
                StringSanitizer.forLog(event.actorId()),
                StringSanitizer.forLog(event.resource()),
                StringSanitizer.forLog(event.action()),
                event.scope(),
                event.source(),
                StringSanitizer.forLog(event.reason(), 256));
    }
}
