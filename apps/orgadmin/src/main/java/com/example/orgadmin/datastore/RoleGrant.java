package com.example.orgadmin.datastore;

import com.example.orgadmin.authz.model.PermissionScope;
import org.springframework.lang.Nullable;

/**
 * A permission granted through one of the actor's roles, with the scope of the permission definition.
 */
public record RoleGrant(
        String roleId,
        String permissionId,
        @Nullable PermissionScope scope
) {}
