package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Role membership of a user.
 */
@Data
@Builder
@Document(collection = "user_roles")
public class UserRoleDoc {

    @Id
    private String id;

    @Indexed
    private String userProfileId;

    @Indexed
    private String roleId;

    private boolean active;

    private Instant effectiveFrom;

    private Instant effectiveUntil;
}
