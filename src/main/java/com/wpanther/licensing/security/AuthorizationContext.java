package com.wpanther.licensing.security;

import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.entity.License;
import com.wpanther.licensing.entity.Tenant;
import com.wpanther.licensing.entity.UserAccount;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Everything a request handler may rely on about its caller, assembled once per request.
 * The license is absent for the super user and the tenant is absent for users outside a
 * sub-tenant. Role and permission sets are unmodifiable.
 */
@Value
@Builder
public class AuthorizationContext {

    public static final String REQUEST_ATTRIBUTE = AuthorizationContext.class.getName();

    UserAccount user;
    Company company;
    Tenant tenant;
    License license;
    @Singular
    Set<String> permissions;
    @Singular
    Set<String> roles;

    public String getUserId() {
        return user.getId();
    }

    public String getCompanyId() {
        return company.getId();
    }

    public boolean isSuperUser() {
        return user.isSuperUser();
    }

    public boolean isOrgAdmin() {
        return user.isOrgAdmin();
    }

    public boolean hasPermission(String permission) {
        return isSuperUser() || permissions.contains(permission);
    }
}
