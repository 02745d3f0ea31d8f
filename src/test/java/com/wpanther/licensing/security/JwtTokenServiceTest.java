package com.wpanther.licensing.security;

import com.wpanther.licensing.config.SecurityConfig;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.exception.UnauthenticatedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenServiceTest {

    private static final String SECRET = "jwt-test-secret";

    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUp() {
        jwtTokenService = createService(SECRET, 3600);
    }

    @Test
    void testIssueToken_VerifiesWithSameSecret() {
        // Arrange
        UserAccount user = createUser("tenant-1");

        // Act
        String token = jwtTokenService.issue(user, List.of("role.read", "api.use"));
        TokenClaims claims = jwtTokenService.verify(token);

        // Assert
        assertThat(claims.getUserId()).isEqualTo("user-1");
        assertThat(claims.getEmail()).isEqualTo("user@acme.test");
        assertThat(claims.getCompanyId()).isEqualTo("company-1");
        assertThat(claims.getTenantId()).isEqualTo("tenant-1");
        assertThat(claims.isOrgAdmin()).isTrue();
        assertThat(claims.isSuperUser()).isFalse();
        assertThat(claims.getPermissions()).containsExactly("role.read", "api.use");
        assertThat(claims.getExpiresAt()).isAfter(claims.getIssuedAt());
    }

    @Test
    void testIssueToken_OmitsAbsentTenant() {
        String token = jwtTokenService.issue(createUser(null), List.of());

        TokenClaims claims = jwtTokenService.verify(token);

        assertThat(claims.getTenantId()).isNull();
        assertThat(claims.getPermissions()).isEmpty();
    }

    @Test
    void testVerify_OtherSecretIsRejected() {
        String token = createService("another-secret", 3600).issue(createUser(null), List.of());

        assertThatThrownBy(() -> jwtTokenService.verify(token))
                .isInstanceOf(UnauthenticatedException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    void testVerify_ExpiredToken() {
        // Beyond the decoder's default clock skew
        String token = createService(SECRET, -600).issue(createUser(null), List.of());

        assertThatThrownBy(() -> jwtTokenService.verify(token))
                .isInstanceOf(UnauthenticatedException.class);
    }

    @Test
    void testVerify_Garbage() {
        assertThatThrownBy(() -> jwtTokenService.verify("not-a-token"))
                .isInstanceOf(UnauthenticatedException.class);
    }

    private static JwtTokenService createService(String secret, long expirationSeconds) {
        SecurityConfig securityConfig = new SecurityConfig();
        JwtTokenService service = new JwtTokenService(
                securityConfig.jwtEncoder(secret), securityConfig.jwtDecoder(secret));
        ReflectionTestUtils.setField(service, "expirationSeconds", expirationSeconds);
        return service;
    }

    private static UserAccount createUser(String tenantId) {
        return UserAccount.builder()
                .id("user-1")
                .email("user@acme.test")
                .fullName("Test User")
                .companyId("company-1")
                .tenantId(tenantId)
                .orgAdmin(true)
                .build();
    }
}
