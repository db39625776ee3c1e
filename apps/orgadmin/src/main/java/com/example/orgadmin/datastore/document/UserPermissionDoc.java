package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Permission granted directly to a user.
 */
@Data
@Builder
@Document(collection = "user_permissions")
public class UserPermissionDoc {

    @Id
    private String id;

    @Indexed
    private String userProfileId;

    private String permissionId;

    private boolean granted;

    private Instant effectiveFrom;

    private Instant effectiveUntil;
}
