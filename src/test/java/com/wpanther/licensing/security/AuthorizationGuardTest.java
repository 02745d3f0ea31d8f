package com.wpanther.licensing.security;

import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.exception.ForbiddenException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthorizationGuardTest {

    @Test
    void testPermission_PassesWithPermission() {
        AuthorizationContext context = createContext(false, false, List.of("role.read"));

        assertThatCode(() -> AuthorizationGuard.permission("role.read").check(context))
                .doesNotThrowAnyException();
    }

    @Test
    void testPermission_NamesMissingPermission() {
        AuthorizationContext context = createContext(false, false, List.of("role.read"));

        assertThatThrownBy(() -> AuthorizationGuard.permission("role.delete").check(context))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Insufficient permissions: requires 'role.delete'");
    }

    @Test
    void testGuards_SuperUserPassesEvery() {
        AuthorizationContext context = createContext(true, false, List.of());

        assertThatCode(() -> {
            AuthorizationGuard.permission("license.revoke").check(context);
            AuthorizationGuard.orgAdmin().check(context);
            AuthorizationGuard.superUser().check(context);
        }).doesNotThrowAnyException();
    }

    @Test
    void testOrgAdmin_RequiresAdmin() {
        AuthorizationContext member = createContext(false, false, List.of("user.create"));
        AuthorizationContext admin = createContext(false, true, List.of());

        assertThatThrownBy(() -> AuthorizationGuard.orgAdmin().check(member))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Organization admin access required");
        assertThatCode(() -> AuthorizationGuard.orgAdmin().check(admin)).doesNotThrowAnyException();
    }

    @Test
    void testSuperUser_RejectsOrgAdmin() {
        AuthorizationContext admin = createContext(false, true, List.of("license.read"));

        assertThatThrownBy(() -> AuthorizationGuard.superUser().check(admin))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Super user access required");
    }

    @Test
    void testAnd_RequiresBoth() {
        AuthorizationGuard guard = AuthorizationGuard.permission("user.create").and(AuthorizationGuard.orgAdmin());

        assertThatThrownBy(() -> guard.check(createContext(false, false, List.of("user.create"))))
                .hasMessage("Organization admin access required");
        assertThatThrownBy(() -> guard.check(createContext(false, true, List.of())))
                .hasMessage("Insufficient permissions: requires 'user.create'");
        assertThatCode(() -> guard.check(createContext(false, true, List.of("user.create"))))
                .doesNotThrowAnyException();
    }

    private static AuthorizationContext createContext(boolean superUser, boolean orgAdmin, List<String> permissions) {
        UserAccount user = UserAccount.builder()
                .id("user-1")
                .email("user@acme.test")
                .companyId("company-1")
                .superUser(superUser)
                .orgAdmin(orgAdmin)
                .build();
        Company company = Company.builder()
                .id("company-1")
                .name("Acme")
                .domain("acme.test")
                .build();
        return AuthorizationContext.builder()
                .user(user)
                .company(company)
                .permissions(permissions)
                .build();
    }
}
