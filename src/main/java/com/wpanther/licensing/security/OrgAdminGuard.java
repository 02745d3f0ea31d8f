package com.wpanther.licensing.security;

import com.wpanther.licensing.exception.ForbiddenException;

public class OrgAdminGuard implements AuthorizationGuard {

    static final OrgAdminGuard INSTANCE = new OrgAdminGuard();

    @Override
    public void check(AuthorizationContext context) {
        if (!context.isOrgAdmin() && !context.isSuperUser()) {
            throw new ForbiddenException("Organization admin access required");
        }
    }
}
