package com.wpanther.licensing.security;

import com.wpanther.licensing.exception.ForbiddenException;

public class SuperUserGuard implements AuthorizationGuard {

    static final SuperUserGuard INSTANCE = new SuperUserGuard();

    @Override
    public void check(AuthorizationContext context) {
        if (!context.isSuperUser()) {
            throw new ForbiddenException("Super user access required");
        }
    }
}
