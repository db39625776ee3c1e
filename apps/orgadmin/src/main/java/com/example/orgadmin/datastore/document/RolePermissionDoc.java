package com.example.orgadmin.datastore.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder
@Document(collection = "role_permissions")
@CompoundIndex(name = "role_permission_idx", def = "{'roleId': 1, 'permissionId': 1}", unique = true)
public class RolePermissionDoc {

    @Id
    private String id;

    private String roleId;

    private String permissionId;

    private boolean granted;
}
