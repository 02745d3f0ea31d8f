package com.wpanther.licensing.controller;

import com.wpanther.licensing.dto.CreateRoleRequest;
import com.wpanther.licensing.dto.RolePermissionsRequest;
import com.wpanther.licensing.dto.RoleWithPermissions;
import com.wpanther.licensing.dto.UpdateRoleRequest;
import com.wpanther.licensing.entity.Permission;
import com.wpanther.licensing.entity.Role;
import com.wpanther.licensing.security.AuthorizationContext;
import com.wpanther.licensing.security.AuthorizationGuard;
import com.wpanther.licensing.service.RbacService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Roles of the caller's organization and the global permission catalog.
 */
@RestController
@RequestMapping("/api/roles")
@RequiredArgsConstructor
public class RoleController {

    private static final AuthorizationGuard ROLE_READ = AuthorizationGuard.permission("role.read");
    private static final AuthorizationGuard ROLE_CREATE = AuthorizationGuard.permission("role.create");
    private static final AuthorizationGuard ROLE_UPDATE = AuthorizationGuard.permission("role.update");
    private static final AuthorizationGuard ROLE_DELETE = AuthorizationGuard.permission("role.delete");

    private final RbacService rbacService;

    @GetMapping
    public ResponseEntity<List<Role>> listRoles(AuthorizationContext context) {
        ROLE_READ.check(context);
        return ResponseEntity.ok(rbacService.getCompanyRoles(context.getCompanyId()));
    }

    @GetMapping("/permissions")
    public ResponseEntity<List<Permission>> listPermissions(AuthorizationContext context) {
        ROLE_READ.check(context);
        return ResponseEntity.ok(rbacService.getAllPermissions());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RoleWithPermissions> getRole(AuthorizationContext context, @PathVariable String id) {
        ROLE_READ.check(context);
        return ResponseEntity.ok(rbacService.getRoleWithPermissions(context.getCompanyId(), id));
    }

    @PostMapping
    public ResponseEntity<Role> createRole(AuthorizationContext context, @Valid @RequestBody CreateRoleRequest request) {
        ROLE_CREATE.check(context);
        return new ResponseEntity<>(rbacService.createRole(context.getCompanyId(), request), HttpStatus.CREATED);
    }

    @PutMapping("/{id}")
    public ResponseEntity<Role> updateRole(AuthorizationContext context, @PathVariable String id,
                                           @Valid @RequestBody UpdateRoleRequest request) {
        ROLE_UPDATE.check(context);
        return ResponseEntity.ok(rbacService.updateRole(context.getCompanyId(), id,
                request.getName(), request.getDescription()));
    }

    @PutMapping("/{id}/permissions")
    public ResponseEntity<RoleWithPermissions> replacePermissions(AuthorizationContext context, @PathVariable String id,
                                                                  @Valid @RequestBody RolePermissionsRequest request) {
        ROLE_UPDATE.check(context);
        return ResponseEntity.ok(rbacService.assignPermissionsToRole(context.getCompanyId(), id, request.getPermissionIds()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteRole(AuthorizationContext context, @PathVariable String id) {
        ROLE_DELETE.check(context);
        rbacService.deleteRole(context.getCompanyId(), id);
        return ResponseEntity.noContent().build();
    }
}
