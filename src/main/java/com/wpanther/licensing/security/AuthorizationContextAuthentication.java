package com.wpanther.licensing.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.List;

/**
 * Exposes an {@link AuthorizationContext} to Spring Security. Permissions become authorities
 * as they are, the super user additionally gets {@code ROLE_SUPER_USER}.
 */
public class AuthorizationContextAuthentication extends AbstractAuthenticationToken {

    private final AuthorizationContext context;

    public AuthorizationContextAuthentication(AuthorizationContext context) {
        super(authoritiesOf(context));
        this.context = context;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public AuthorizationContext getPrincipal() {
        return context;
    }

    @Override
    public String getName() {
        return context.getUserId();
    }

    private static List<GrantedAuthority> authoritiesOf(AuthorizationContext context) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        context.getPermissions().forEach(p -> authorities.add(new SimpleGrantedAuthority(p)));
        if (context.isSuperUser()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_SUPER_USER"));
        }
        return authorities;
    }
}
