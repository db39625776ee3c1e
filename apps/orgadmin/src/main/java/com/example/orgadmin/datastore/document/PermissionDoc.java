package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Permission definition: a (resource, action, scope) triple that can be granted to users or roles.
 */
@Data
@Builder
@Document(collection = "permissions")
@CompoundIndex(name = "resource_action_idx", def = "{'resource': 1, 'action': 1}")
public class PermissionDoc {

    @Id
    private String id;

    private String resource;

    private String action;

    /**
     * Scope name (OWN, DEPARTMENT, SCHOOL, ALL). Null for unscoped permissions.
     */
    private String scope;

    private boolean active;

    private String description;
}
