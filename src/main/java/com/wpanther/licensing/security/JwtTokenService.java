package com.wpanther.licensing.security;

import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.exception.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Issues and verifies HS256 access tokens.
 * The permission claim is a snapshot taken at login; requests resolve permissions afresh.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JwtTokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_COMPANY_ID = "companyId";
    static final String CLAIM_TENANT_ID = "tenantId";
    static final String CLAIM_SUPER_USER = "isSuperUser";
    static final String CLAIM_ORG_ADMIN = "isOrgAdmin";
    static final String CLAIM_PERMISSIONS = "permissions";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;

    @Value("${app.jwt.expiration:86400}")
    private long expirationSeconds;

    public String issue(UserAccount user, Collection<String> permissions) {
        Instant now = Instant.now();
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .subject(user.getId())
                .issuedAt(now)
                .expiresAt(now.plusSeconds(expirationSeconds))
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_COMPANY_ID, user.getCompanyId())
                .claim(CLAIM_SUPER_USER, user.isSuperUser())
                .claim(CLAIM_ORG_ADMIN, user.isOrgAdmin())
                .claim(CLAIM_PERMISSIONS, new ArrayList<>(permissions));
        if (user.getTenantId() != null) {
            claims.claim(CLAIM_TENANT_ID, user.getTenantId());
        }

        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claims.build())).getTokenValue();
    }

    /**
     * @throws UnauthenticatedException if the signature does not verify or the token has expired
     */
    public TokenClaims verify(String token) {
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new UnauthenticatedException("Invalid or expired token", e);
        }

        if (jwt.getSubject() == null) {
            throw new UnauthenticatedException("Token has no subject");
        }

        List<String> permissions = jwt.getClaimAsStringList(CLAIM_PERMISSIONS);
        return TokenClaims.builder()
                .userId(jwt.getSubject())
                .email(jwt.getClaimAsString(CLAIM_EMAIL))
                .companyId(jwt.getClaimAsString(CLAIM_COMPANY_ID))
                .tenantId(jwt.getClaimAsString(CLAIM_TENANT_ID))
                .superUser(Boolean.TRUE.equals(jwt.getClaimAsBoolean(CLAIM_SUPER_USER)))
                .orgAdmin(Boolean.TRUE.equals(jwt.getClaimAsBoolean(CLAIM_ORG_ADMIN)))
                .permissions(permissions != null ? permissions : List.of())
                .issuedAt(jwt.getIssuedAt())
                .expiresAt(jwt.getExpiresAt())
                .build();
    }
}
