package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-user exception that takes precedence over every other grant.
 * Can grant or explicitly deny; optionally time-bounded.
 */
@Data
@Builder
@Document(collection = "user_overrides")
@CompoundIndex(name = "user_resource_action_idx", def = "{'userProfileId': 1, 'resource': 1, 'action': 1}")
public class UserOverrideDoc {

    @Id
    private String id;

    private String userProfileId;

    private String resource;

    private String action;

    private boolean granted;

    /**
     * Null means the override never expires.
     */
    private Instant validUntil;

    private String reason;

    @CreatedDate
    private Instant createdAt;
}
