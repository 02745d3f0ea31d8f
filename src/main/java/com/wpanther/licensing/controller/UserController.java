package com.wpanther.licensing.controller;

import com.wpanther.licensing.dto.AssignRoleRequest;
import com.wpanther.licensing.dto.RegisterUserRequest;
import com.wpanther.licensing.dto.UserSummary;
import com.wpanther.licensing.entity.Role;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.entity.UserRole;
import com.wpanther.licensing.security.AuthorizationContext;
import com.wpanther.licensing.security.AuthorizationGuard;
import com.wpanther.licensing.service.RbacService;
import com.wpanther.licensing.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private static final AuthorizationGuard USER_READ = AuthorizationGuard.permission("user.read");
    private static final AuthorizationGuard USER_CREATE = AuthorizationGuard.permission("user.create");
    private static final AuthorizationGuard ROLE_ASSIGN = AuthorizationGuard.permission("role.assign");
    // Granting organization admin rights takes an organization admin
    private static final AuthorizationGuard ADMIN_CREATE = USER_CREATE.and(AuthorizationGuard.orgAdmin());

    private final UserService userService;
    private final RbacService rbacService;

    @GetMapping
    public ResponseEntity<List<UserSummary>> listUsers(AuthorizationContext context) {
        USER_READ.check(context);
        List<UserSummary> users = userService.listUsers(context.getCompanyId()).stream()
                .map(UserSummary::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(users);
    }

    @PostMapping
    public ResponseEntity<UserSummary> addUser(AuthorizationContext context, @Valid @RequestBody RegisterUserRequest request) {
        AuthorizationGuard guard = request.isOrgAdmin() ? ADMIN_CREATE : USER_CREATE;
        guard.check(context);
        UserAccount user = userService.addUser(context.getCompanyId(),
                context.getLicense() != null ? context.getLicense().getFeatures() : null, request);
        return new ResponseEntity<>(UserSummary.from(user), HttpStatus.CREATED);
    }

    @GetMapping("/{id}/roles")
    public ResponseEntity<List<Role>> getUserRoles(AuthorizationContext context, @PathVariable String id) {
        USER_READ.check(context);
        UserAccount user = userService.getUser(context.getCompanyId(), id);
        return ResponseEntity.ok(rbacService.resolveForUser(user.getId()).getRoles());
    }

    @PostMapping("/{id}/roles")
    public ResponseEntity<UserRole> assignRole(AuthorizationContext context, @PathVariable String id,
                                               @Valid @RequestBody AssignRoleRequest request) {
        ROLE_ASSIGN.check(context);
        UserRole assignment = rbacService.assignRoleToUser(context.getCompanyId(), id, request.getRoleId(), context.getUserId());
        return new ResponseEntity<>(assignment, HttpStatus.CREATED);
    }

    @DeleteMapping("/{id}/roles/{roleId}")
    public ResponseEntity<Void> removeRole(AuthorizationContext context, @PathVariable String id, @PathVariable String roleId) {
        ROLE_ASSIGN.check(context);
        rbacService.removeRoleFromUser(context.getCompanyId(), id, roleId);
        return ResponseEntity.noContent().build();
    }
}
