package com.wpanther.licensing.dto;

import com.wpanther.licensing.entity.Permission;
import com.wpanther.licensing.entity.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Roles of a user and the de-duplicated union of their permissions, both sorted by name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedPermissions {
    private List<Role> roles;
    private List<Permission> permissions;

    public Set<String> permissionNames() {
        return permissions.stream()
                .map(Permission::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> roleNames() {
        return roles.stream()
                .map(Role::getName)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
