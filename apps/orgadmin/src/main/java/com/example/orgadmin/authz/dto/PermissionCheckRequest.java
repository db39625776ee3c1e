package com.example.orgadmin.authz.dto;

import com.example.orgadmin.authz.model.RequestResourceIds;
import com.example.orgadmin.authz.model.RequiredPermission;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/permissions/check}.
 */
public record PermissionCheckRequest(
        @NotEmpty List<@Valid PermissionTuple> permissions,
        ResourceIds resourceIds
) {
    public record PermissionTuple(
            @NotBlank String resource,
            @NotBlank String action,
            String scope
    ) {
        public RequiredPermission toRequiredPermission() {
            return RequiredPermission.of(resource, action, scope);
        }
    }

    public record ResourceIds(
            Map<String, String> params,
            Map<String, Object> body,
            Map<String, String> query
    ) {}

    public List<RequiredPermission> requiredPermissions() {
        if (permissions == null || permissions.isEmpty()) {
            throw new IllegalArgumentException("At least one permission is required");
        }
        return permissions.stream()
                .map(PermissionTuple::toRequiredPermission)
                .toList();
    }

    public RequestResourceIds requestResourceIds() {
        if (resourceIds == null) {
            return RequestResourceIds.empty();
        }
        return new RequestResourceIds(resourceIds.params(), resourceIds.body(), resourceIds.query());
    }
}
