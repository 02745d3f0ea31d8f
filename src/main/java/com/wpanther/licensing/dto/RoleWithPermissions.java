package com.wpanther.licensing.dto;

import com.wpanther.licensing.entity.Permission;
import com.wpanther.licensing.entity.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleWithPermissions {
    private Role role;
    private List<Permission> permissions;
}
