package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.CreateRoleRequest;
import com.wpanther.licensing.dto.ResolvedPermissions;
import com.wpanther.licensing.dto.RoleWithPermissions;
import com.wpanther.licensing.entity.Permission;
import com.wpanther.licensing.entity.Role;
import com.wpanther.licensing.entity.RolePermission;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.entity.UserRole;
import com.wpanther.licensing.exception.ConflictException;
import com.wpanther.licensing.exception.ForbiddenException;
import com.wpanther.licensing.exception.ResourceNotFoundException;
import com.wpanther.licensing.repository.PermissionRepository;
import com.wpanther.licensing.repository.RolePermissionRepository;
import com.wpanther.licensing.repository.RoleRepository;
import com.wpanther.licensing.repository.UserAccountRepository;
import com.wpanther.licensing.repository.UserRoleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Roles, permissions and their assignment to users. Roles belong to one company;
 * permissions form a global catalog.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RbacService {

    public static final String ADMIN_ROLE = "Admin";
    public static final String OPERATOR_ROLE = "Operator";
    public static final String VIEWER_ROLE = "Viewer";

    // name -> description
    static final Map<String, String> PERMISSION_CATALOG = new LinkedHashMap<>();

    static {
        PERMISSION_CATALOG.put("company.read", "View company details");
        PERMISSION_CATALOG.put("company.update", "Update company settings");
        PERMISSION_CATALOG.put("company.delete", "Delete the company");
        PERMISSION_CATALOG.put("tenant.create", "Create sub-tenants");
        PERMISSION_CATALOG.put("tenant.read", "View sub-tenants");
        PERMISSION_CATALOG.put("tenant.update", "Update sub-tenants");
        PERMISSION_CATALOG.put("tenant.delete", "Delete sub-tenants");
        PERMISSION_CATALOG.put("user.create", "Create users");
        PERMISSION_CATALOG.put("user.read", "View users");
        PERMISSION_CATALOG.put("user.update", "Update users");
        PERMISSION_CATALOG.put("user.delete", "Delete users");
        PERMISSION_CATALOG.put("role.create", "Create roles");
        PERMISSION_CATALOG.put("role.read", "View roles");
        PERMISSION_CATALOG.put("role.update", "Update roles");
        PERMISSION_CATALOG.put("role.delete", "Delete roles");
        PERMISSION_CATALOG.put("role.assign", "Assign roles to users");
        PERMISSION_CATALOG.put("license.read", "View license details");
        PERMISSION_CATALOG.put("license.update", "Update licenses");
        PERMISSION_CATALOG.put("license.revoke", "Revoke licenses");
        PERMISSION_CATALOG.put("api.use", "Call the platform API");
        PERMISSION_CATALOG.put("audit.read", "View audit logs");
    }

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserRoleRepository userRoleRepository;
    private final UserAccountRepository userAccountRepository;

    /**
     * Inserts the catalog entries that are missing from the store.
     *
     * @return number of permissions created
     */
    @Transactional
    public int seedPermissionCatalog() {
        int created = 0;
        Instant now = Instant.now();
        for (Map.Entry<String, String> entry : PERMISSION_CATALOG.entrySet()) {
            if (permissionRepository.findByName(entry.getKey()).isPresent()) {
                continue;
            }
            String[] parts = entry.getKey().split("\\.", 2);
            permissionRepository.save(Permission.builder()
                    .id(UUID.randomUUID().toString())
                    .name(entry.getKey())
                    .resource(parts[0])
                    .action(parts[1])
                    .description(entry.getValue())
                    .createdAt(now)
                    .build());
            created++;
        }
        if (created > 0) {
            log.info("Seeded permission catalog: created={}", created);
        }
        return created;
    }

    /**
     * Union of the permissions granted by every role of the user. Both lists are sorted by
     * name, so the order in which roles were assigned never shows in the result.
     */
    @Transactional(readOnly = true)
    public ResolvedPermissions resolveForUser(String userId) {
        List<Role> roles = userRoleRepository.findByUserId(userId).stream()
                .map(assignment -> roleRepository.findById(assignment.getRoleId()))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(Role::getName).thenComparing(Role::getId))
                .collect(Collectors.toList());

        Set<String> permissionIds = new LinkedHashSet<>();
        for (Role role : roles) {
            rolePermissionRepository.findByRoleId(role.getId())
                    .forEach(grant -> permissionIds.add(grant.getPermissionId()));
        }

        List<Permission> permissions = permissionIds.isEmpty()
                ? new ArrayList<>()
                : permissionRepository.findAllById(permissionIds).stream()
                        .sorted(Comparator.comparing(Permission::getName))
                        .collect(Collectors.toList());

        log.debug("Resolved permissions: userId={}, roles={}, permissions={}", userId, roles.size(), permissions.size());
        return ResolvedPermissions.builder()
                .roles(roles)
                .permissions(permissions)
                .build();
    }

    /**
     * Exact {@code resource.action} match. The super user holds every permission, including
     * names that are not in the catalog.
     */
    @Transactional(readOnly = true)
    public boolean userHasPermission(String userId, String permissionName) {
        Optional<UserAccount> user = userAccountRepository.findById(userId);
        if (user.isEmpty()) {
            return false;
        }
        if (user.get().isSuperUser()) {
            return true;
        }
        return resolveForUser(userId).permissionNames().contains(permissionName);
    }

    /**
     * Creates the Admin, Operator and Viewer roles for a company. Roles that already exist
     * under the same name are left alone, so running this twice is harmless.
     *
     * @return the roles created by this call
     */
    @Transactional
    public List<Role> createDefaultRoles(String companyId) {
        List<Permission> catalog = permissionRepository.findAll();
        List<Role> created = new ArrayList<>();

        createDefaultRole(companyId, ADMIN_ROLE, "Full access to the organization", catalog, p -> true)
                .ifPresent(created::add);
        createDefaultRole(companyId, OPERATOR_ROLE, "Day-to-day operations", catalog,
                p -> "read".equals(p.getAction()) || "create".equals(p.getAction())
                        || "api.use".equals(p.getName()) || "user.read".equals(p.getName()))
                .ifPresent(created::add);
        createDefaultRole(companyId, VIEWER_ROLE, "Read-only access", catalog,
                p -> "read".equals(p.getAction()) || "api.use".equals(p.getName()))
                .ifPresent(created::add);

        log.info("Default roles bootstrapped: companyId={}, created={}", companyId, created.size());
        return created;
    }

    @Transactional
    public Role createRole(String companyId, CreateRoleRequest request) {
        if (roleRepository.existsByCompanyIdAndName(companyId, request.getName())) {
            throw new ConflictException("Role already exists: " + request.getName());
        }

        Role role = Role.builder()
                .id(UUID.randomUUID().toString())
                .companyId(companyId)
                .name(request.getName())
                .description(request.getDescription())
                .createdAt(Instant.now())
                .build();
        roleRepository.save(role);

        if (request.getPermissionIds() != null && !request.getPermissionIds().isEmpty()) {
            grantPermissions(role.getId(), request.getPermissionIds());
        }

        log.info("Created role: id={}, companyId={}, name={}", role.getId(), companyId, role.getName());
        return role;
    }

    @Transactional
    public Role updateRole(String companyId, String roleId, String name, String description) {
        Role role = findCompanyRole(companyId, roleId);

        if (name != null && !name.equals(role.getName())) {
            if (roleRepository.existsByCompanyIdAndName(companyId, name)) {
                throw new ConflictException("Role already exists: " + name);
            }
            role.setName(name);
        }
        if (description != null) {
            role.setDescription(description);
        }
        role.setUpdatedAt(Instant.now());

        log.info("Updated role: id={}, companyId={}", roleId, companyId);
        return roleRepository.save(role);
    }

    /**
     * Deletes a role that no user holds anymore.
     */
    @Transactional
    public void deleteRole(String companyId, String roleId) {
        Role role = findCompanyRole(companyId, roleId);
        if (userRoleRepository.countByRoleId(roleId) > 0) {
            throw new ConflictException("Role is still assigned to users: " + role.getName());
        }
        rolePermissionRepository.deleteByRoleId(roleId);
        roleRepository.delete(role);
        log.info("Deleted role: id={}, companyId={}", roleId, companyId);
    }

    /**
     * Replaces the permission set of a role.
     */
    @Transactional
    public RoleWithPermissions assignPermissionsToRole(String companyId, String roleId, Collection<String> permissionIds) {
        Role role = findCompanyRole(companyId, roleId);
        rolePermissionRepository.deleteByRoleId(roleId);
        // Grants re-added below share ids with the removed rows
        rolePermissionRepository.flush();
        grantPermissions(roleId, permissionIds);
        log.info("Replaced role permissions: roleId={}, count={}", roleId, permissionIds.size());
        return RoleWithPermissions.builder()
                .role(role)
                .permissions(permissionsOf(roleId))
                .build();
    }

    /**
     * Gives a role to a user. Role and user must both belong to the acting company.
     */
    @Transactional
    public UserRole assignRoleToUser(String companyId, String userId, String roleId, String assignedBy) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> new ResourceNotFoundException("Role not found: " + roleId));

        if (!role.getCompanyId().equals(user.getCompanyId())) {
            throw new ForbiddenException("Role belongs to a different organization");
        }
        if (!user.getCompanyId().equals(companyId)) {
            throw new ForbiddenException("User belongs to a different organization");
        }
        if (userRoleRepository.existsByUserIdAndRoleId(userId, roleId)) {
            throw new ConflictException("Role already assigned to user");
        }

        UserRole assignment = UserRole.builder()
                .userId(userId)
                .roleId(roleId)
                .assignedAt(Instant.now())
                .assignedBy(assignedBy)
                .build();
        userRoleRepository.save(assignment);

        log.info("Assigned role: userId={}, roleId={}, assignedBy={}", userId, roleId, assignedBy);
        return assignment;
    }

    @Transactional
    public void removeRoleFromUser(String companyId, String userId, String roleId) {
        findCompanyRole(companyId, roleId);
        if (!userRoleRepository.existsByUserIdAndRoleId(userId, roleId)) {
            throw new ResourceNotFoundException("Role is not assigned to user");
        }
        userRoleRepository.deleteByUserIdAndRoleId(userId, roleId);
        log.info("Removed role: userId={}, roleId={}", userId, roleId);
    }

    @Transactional(readOnly = true)
    public List<Role> getCompanyRoles(String companyId) {
        return roleRepository.findByCompanyIdOrderByNameAsc(companyId);
    }

    @Transactional(readOnly = true)
    public Optional<Role> findRoleByName(String companyId, String name) {
        return roleRepository.findByCompanyIdAndName(companyId, name);
    }

    @Transactional(readOnly = true)
    public RoleWithPermissions getRoleWithPermissions(String companyId, String roleId) {
        Role role = findCompanyRole(companyId, roleId);
        return RoleWithPermissions.builder()
                .role(role)
                .permissions(permissionsOf(roleId))
                .build();
    }

    @Transactional(readOnly = true)
    public List<Permission> getAllPermissions() {
        return permissionRepository.findAllByOrderByResourceAscActionAsc();
    }

    private Optional<Role> createDefaultRole(String companyId, String name, String description,
                                            List<Permission> catalog, Predicate<Permission> grants) {
        if (roleRepository.existsByCompanyIdAndName(companyId, name)) {
            log.debug("Default role already present: companyId={}, name={}", companyId, name);
            return Optional.empty();
        }

        Role role = roleRepository.save(Role.builder()
                .id(UUID.randomUUID().toString())
                .companyId(companyId)
                .name(name)
                .description(description)
                .createdAt(Instant.now())
                .build());

        catalog.stream()
                .filter(grants)
                .forEach(permission -> rolePermissionRepository.save(RolePermission.builder()
                        .roleId(role.getId())
                        .permissionId(permission.getId())
                        .build()));
        return Optional.of(role);
    }

    private void grantPermissions(String roleId, Collection<String> permissionIds) {
        for (String permissionId : new LinkedHashSet<>(permissionIds)) {
            if (!permissionRepository.existsById(permissionId)) {
                throw new IllegalArgumentException("Unknown permission: " + permissionId);
            }
            rolePermissionRepository.save(RolePermission.builder()
                    .roleId(roleId)
                    .permissionId(permissionId)
                    .build());
        }
    }

    private List<Permission> permissionsOf(String roleId) {
        List<String> ids = rolePermissionRepository.findByRoleId(roleId).stream()
                .map(RolePermission::getPermissionId)
                .collect(Collectors.toList());
        return permissionRepository.findAllById(ids).stream()
                .sorted(Comparator.comparing(Permission::getName))
                .collect(Collectors.toList());
    }

    // Roles of other companies are reported as missing
    private Role findCompanyRole(String companyId, String roleId) {
        return roleRepository.findById(roleId)
                .filter(role -> role.getCompanyId().equals(companyId))
                .orElseThrow(() -> new ResourceNotFoundException("Role not found: " + roleId));
    }
}
