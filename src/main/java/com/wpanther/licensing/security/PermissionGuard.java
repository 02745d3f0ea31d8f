package com.wpanther.licensing.security;

import com.wpanther.licensing.exception.ForbiddenException;

/**
 * Requires one named permission. The super user always passes.
 */
public class PermissionGuard implements AuthorizationGuard {

    private final String permission;

    public PermissionGuard(String permission) {
        this.permission = permission;
    }

    @Override
    public void check(AuthorizationContext context) {
        if (!context.hasPermission(permission)) {
            throw new ForbiddenException("Insufficient permissions: requires '" + permission + "'");
        }
    }

    public String getPermission() {
        return permission;
    }
}
