package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Role definition. Hierarchy level 0 is the superadmin tier.
 */
@Data
@Builder
@Document(collection = "roles")
public class RoleDoc {

    @Id
    private String id;

    private String name;

    private int hierarchyLevel;

    private boolean active;
}
