package com.wpanther.licensing.security;

import com.wpanther.licensing.exception.ForbiddenException;

/**
 * A precondition on the caller. Controllers call {@link #check} before doing any work.
 */
@FunctionalInterface
public interface AuthorizationGuard {

    /**
     * @throws ForbiddenException naming the unmet requirement
     */
    void check(AuthorizationContext context);

    default AuthorizationGuard and(AuthorizationGuard other) {
        return context -> {
            check(context);
            other.check(context);
        };
    }

    static AuthorizationGuard permission(String permission) {
        return new PermissionGuard(permission);
    }

    static AuthorizationGuard orgAdmin() {
        return OrgAdminGuard.INSTANCE;
    }

    static AuthorizationGuard superUser() {
        return SuperUserGuard.INSTANCE;
    }
}
