package com.wpanther.licensing.security;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Verified contents of an access token.
 */
@Value
@Builder
public class TokenClaims {
    String userId;
    String email;
    String companyId;
    String tenantId;
    boolean superUser;
    boolean orgAdmin;
    @Singular
    List<String> permissions;
    Instant issuedAt;
    Instant expiresAt;
}
