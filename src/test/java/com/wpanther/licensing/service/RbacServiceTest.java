package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.ResolvedPermissions;
import com.wpanther.licensing.entity.Permission;
import com.wpanther.licensing.entity.Role;
import com.wpanther.licensing.entity.RolePermission;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.entity.UserRole;
import com.wpanther.licensing.exception.ConflictException;
import com.wpanther.licensing.exception.ForbiddenException;
import com.wpanther.licensing.repository.PermissionRepository;
import com.wpanther.licensing.repository.RolePermissionRepository;
import com.wpanther.licensing.repository.RoleRepository;
import com.wpanther.licensing.repository.UserAccountRepository;
import com.wpanther.licensing.repository.UserRoleRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RbacService
 */
@ExtendWith(MockitoExtension.class)
class RbacServiceTest {

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    @Mock
    private UserRoleRepository userRoleRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    @InjectMocks
    private RbacService rbacService;

    private static final String COMPANY_ID = "company-1";
    private static final String USER_ID = "user-1";

    @Test
    void testResolveForUser_UnionsAndDeduplicates() {
        // Arrange
        Permission read = createPermission("p-read", "role.read");
        Permission api = createPermission("p-api", "api.use");
        Permission create = createPermission("p-create", "role.create");

        stubRoles(List.of("role-viewer", "role-editor"));
        when(roleRepository.findById("role-viewer")).thenReturn(Optional.of(createRole("role-viewer", "Viewer")));
        when(roleRepository.findById("role-editor")).thenReturn(Optional.of(createRole("role-editor", "Editor")));
        when(rolePermissionRepository.findByRoleId("role-viewer")).thenReturn(grants("role-viewer", "p-read", "p-api"));
        when(rolePermissionRepository.findByRoleId("role-editor")).thenReturn(grants("role-editor", "p-read", "p-create"));
        when(permissionRepository.findAllById(any())).thenAnswer(invocation -> {
            Collection<String> ids = invocation.getArgument(0);
            return List.of(read, api, create).stream()
                    .filter(p -> ids.contains(p.getId()))
                    .collect(Collectors.toList());
        });

        // Act
        ResolvedPermissions resolved = rbacService.resolveForUser(USER_ID);

        // Assert
        assertThat(resolved.permissionNames()).containsExactly("api.use", "role.create", "role.read");
        assertThat(resolved.roleNames()).containsExactly("Editor", "Viewer");
    }

    @Test
    void testResolveForUser_IgnoresAssignmentOrder() {
        // Arrange
        Permission read = createPermission("p-read", "role.read");
        Permission api = createPermission("p-api", "api.use");

        when(roleRepository.findById("role-a")).thenReturn(Optional.of(createRole("role-a", "Alpha")));
        when(roleRepository.findById("role-b")).thenReturn(Optional.of(createRole("role-b", "Beta")));
        when(rolePermissionRepository.findByRoleId("role-a")).thenReturn(grants("role-a", "p-read"));
        when(rolePermissionRepository.findByRoleId("role-b")).thenReturn(grants("role-b", "p-api", "p-read"));
        when(permissionRepository.findAllById(any())).thenAnswer(invocation -> {
            Collection<String> ids = invocation.getArgument(0);
            // Store returns rows in insertion order of the ids
            List<Permission> rows = new ArrayList<>();
            for (String id : ids) {
                rows.add("p-read".equals(id) ? read : api);
            }
            return rows;
        });

        // Act
        stubRoles(List.of("role-a", "role-b"));
        ResolvedPermissions forward = rbacService.resolveForUser(USER_ID);
        stubRoles(List.of("role-b", "role-a"));
        ResolvedPermissions reversed = rbacService.resolveForUser(USER_ID);

        // Assert
        assertThat(forward.permissionNames()).containsExactlyElementsOf(reversed.permissionNames());
        assertThat(forward.roleNames()).containsExactlyElementsOf(reversed.roleNames());
    }

    @Test
    void testResolveForUser_WithoutRoles() {
        when(userRoleRepository.findByUserId(USER_ID)).thenReturn(List.of());

        ResolvedPermissions resolved = rbacService.resolveForUser(USER_ID);

        assertThat(resolved.getRoles()).isEmpty();
        assertThat(resolved.getPermissions()).isEmpty();
        verifyNoInteractions(permissionRepository);
    }

    @Test
    void testUserHasPermission_SuperUserHasEveryPermission() {
        when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(createUser(true)));

        assertThat(rbacService.userHasPermission(USER_ID, "license.revoke")).isTrue();
        assertThat(rbacService.userHasPermission(USER_ID, "not.in.catalog")).isTrue();
        verifyNoInteractions(userRoleRepository);
    }

    @Test
    void testUserHasPermission_RequiresExactName() {
        // Arrange
        when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(createUser(false)));
        stubRoles(List.of("role-1"));
        when(roleRepository.findById("role-1")).thenReturn(Optional.of(createRole("role-1", "Viewer")));
        when(rolePermissionRepository.findByRoleId("role-1")).thenReturn(grants("role-1", "p-read"));
        when(permissionRepository.findAllById(any())).thenReturn(List.of(createPermission("p-read", "role.read")));

        // Act & Assert
        assertThat(rbacService.userHasPermission(USER_ID, "role.read")).isTrue();
        assertThat(rbacService.userHasPermission(USER_ID, "role")).isFalse();
        assertThat(rbacService.userHasPermission(USER_ID, "role.create")).isFalse();
    }

    @Test
    void testUserHasPermission_UnknownUser() {
        when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.empty());

        assertThat(rbacService.userHasPermission(USER_ID, "role.read")).isFalse();
    }

    @Test
    void testSeedPermissionCatalog_CreatesMissingEntries() {
        when(permissionRepository.findByName(anyString())).thenReturn(Optional.empty());

        int created = rbacService.seedPermissionCatalog();

        assertThat(created).isEqualTo(21);
        ArgumentCaptor<Permission> captor = ArgumentCaptor.forClass(Permission.class);
        verify(permissionRepository, times(21)).save(captor.capture());
        Permission roleAssign = captor.getAllValues().stream()
                .filter(p -> "role.assign".equals(p.getName()))
                .findFirst()
                .orElseThrow();
        assertThat(roleAssign.getResource()).isEqualTo("role");
        assertThat(roleAssign.getAction()).isEqualTo("assign");
    }

    @Test
    void testCreateDefaultRoles_GrantsExpectedPermissions() {
        // Arrange
        List<Permission> catalog = createCatalog();
        when(permissionRepository.findAll()).thenReturn(catalog);
        when(roleRepository.existsByCompanyIdAndName(eq(COMPANY_ID), anyString())).thenReturn(false);
        when(roleRepository.save(any(Role.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // Act
        List<Role> created = rbacService.createDefaultRoles(COMPANY_ID);

        // Assert
        assertThat(created).extracting(Role::getName).containsExactly("Admin", "Operator", "Viewer");

        ArgumentCaptor<RolePermission> captor = ArgumentCaptor.forClass(RolePermission.class);
        verify(rolePermissionRepository, atLeastOnce()).save(captor.capture());
        Map<String, Set<String>> granted = grantedNamesByRole(created, catalog, captor.getAllValues());

        Set<String> allNames = catalog.stream().map(Permission::getName).collect(Collectors.toSet());
        assertThat(granted.get("Admin")).isEqualTo(allNames);
        assertThat(granted.get("Operator")).containsExactlyInAnyOrder(
                "company.read", "tenant.read", "user.read", "role.read", "license.read", "audit.read",
                "tenant.create", "user.create", "role.create", "api.use");
        assertThat(granted.get("Viewer")).containsExactlyInAnyOrder(
                "company.read", "tenant.read", "user.read", "role.read", "license.read", "audit.read", "api.use");
    }

    @Test
    void testCreateDefaultRoles_SkipsExistingRoles() {
        when(permissionRepository.findAll()).thenReturn(createCatalog());
        when(roleRepository.existsByCompanyIdAndName(eq(COMPANY_ID), anyString())).thenReturn(true);

        List<Role> created = rbacService.createDefaultRoles(COMPANY_ID);

        assertThat(created).isEmpty();
        verify(roleRepository, never()).save(any());
        verifyNoInteractions(rolePermissionRepository);
    }

    @Test
    void testAssignRole_TwiceIsConflict() {
        when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(createUser(false)));
        when(roleRepository.findById("role-1")).thenReturn(Optional.of(createRole("role-1", "Viewer")));
        when(userRoleRepository.existsByUserIdAndRoleId(USER_ID, "role-1")).thenReturn(true);

        assertThatThrownBy(() -> rbacService.assignRoleToUser(COMPANY_ID, USER_ID, "role-1", "admin-1"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Role already assigned to user");

        verify(userRoleRepository, never()).save(any());
    }

    @Test
    void testAssignRole_FromOtherOrganizationIsForbidden() {
        Role foreignRole = createRole("role-9", "Admin");
        foreignRole.setCompanyId("company-2");
        when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(createUser(false)));
        when(roleRepository.findById("role-9")).thenReturn(Optional.of(foreignRole));

        assertThatThrownBy(() -> rbacService.assignRoleToUser(COMPANY_ID, USER_ID, "role-9", "admin-1"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void testAssignRole_RecordsAssigner() {
        when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(createUser(false)));
        when(roleRepository.findById("role-1")).thenReturn(Optional.of(createRole("role-1", "Viewer")));
        when(userRoleRepository.existsByUserIdAndRoleId(USER_ID, "role-1")).thenReturn(false);

        UserRole assignment = rbacService.assignRoleToUser(COMPANY_ID, USER_ID, "role-1", "admin-1");

        assertThat(assignment.getAssignedBy()).isEqualTo("admin-1");
        assertThat(assignment.getAssignedAt()).isNotNull();
        verify(userRoleRepository).save(assignment);
    }

    @Test
    void testDeleteRole_AssignedRoleIsConflict() {
        when(roleRepository.findById("role-1")).thenReturn(Optional.of(createRole("role-1", "Viewer")));
        when(userRoleRepository.countByRoleId("role-1")).thenReturn(2L);

        assertThatThrownBy(() -> rbacService.deleteRole(COMPANY_ID, "role-1"))
                .isInstanceOf(ConflictException.class);

        verify(roleRepository, never()).delete(any());
    }

    @Test
    void testReplaceRolePermissions_UnknownPermission() {
        when(roleRepository.findById("role-1")).thenReturn(Optional.of(createRole("role-1", "Viewer")));
        when(permissionRepository.existsById("missing")).thenReturn(false);

        assertThatThrownBy(() -> rbacService.assignPermissionsToRole(COMPANY_ID, "role-1", List.of("missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    private void stubRoles(List<String> roleIds) {
        List<UserRole> assignments = roleIds.stream()
                .map(roleId -> UserRole.builder().userId(USER_ID).roleId(roleId).assignedAt(Instant.now()).build())
                .collect(Collectors.toList());
        when(userRoleRepository.findByUserId(USER_ID)).thenReturn(assignments);
    }

    private static List<RolePermission> grants(String roleId, String... permissionIds) {
        List<RolePermission> grants = new ArrayList<>();
        for (String permissionId : permissionIds) {
            grants.add(RolePermission.builder().roleId(roleId).permissionId(permissionId).build());
        }
        return grants;
    }

    private static Map<String, Set<String>> grantedNamesByRole(List<Role> roles, List<Permission> catalog,
                                                               List<RolePermission> grants) {
        Map<String, String> roleNames = roles.stream().collect(Collectors.toMap(Role::getId, Role::getName));
        Map<String, String> permissionNames = catalog.stream()
                .collect(Collectors.toMap(Permission::getId, Permission::getName));
        return grants.stream().collect(Collectors.groupingBy(
                grant -> roleNames.get(grant.getRoleId()),
                Collectors.mapping(grant -> permissionNames.get(grant.getPermissionId()), Collectors.toSet())));
    }

    private static List<Permission> createCatalog() {
        return RbacService.PERMISSION_CATALOG.keySet().stream()
                .map(name -> createPermission("id-" + name, name))
                .collect(Collectors.toList());
    }

    private static Permission createPermission(String id, String name) {
        String[] parts = name.split("\\.");
        return Permission.builder()
                .id(id)
                .name(name)
                .resource(parts[0])
                .action(parts[1])
                .createdAt(Instant.now())
                .build();
    }

    private static Role createRole(String id, String name) {
        return Role.builder()
                .id(id)
                .companyId(COMPANY_ID)
                .name(name)
                .createdAt(Instant.now())
                .build();
    }

    private static UserAccount createUser(boolean superUser) {
        return UserAccount.builder()
                .id(USER_ID)
                .email("user@acme.test")
                .fullName("Test User")
                .passwordHash("hash")
                .companyId(COMPANY_ID)
                .superUser(superUser)
                .createdAt(Instant.now())
                .build();
    }
}
