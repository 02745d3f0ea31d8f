package com.wpanther.licensing.security;

import com.wpanther.licensing.dto.LicenseValidationResult;
import com.wpanther.licensing.dto.ResolvedPermissions;
import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.entity.License;
import com.wpanther.licensing.entity.Tenant;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.exception.ForbiddenException;
import com.wpanther.licensing.exception.OperationFailedException;
import com.wpanther.licensing.exception.UnauthenticatedException;
import com.wpanther.licensing.repository.CompanyRepository;
import com.wpanther.licensing.repository.TenantRepository;
import com.wpanther.licensing.repository.UserAccountRepository;
import com.wpanther.licensing.service.LicenseService;
import com.wpanther.licensing.service.RbacService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Turns an {@code Authorization} header into an {@link AuthorizationContext}.
 * <p>
 * Steps run in order: bearer extraction, token verification, user lookup, organization lookup,
 * license validation (skipped for the super user) and tenant lookup. Permission resolution
 * starts as soon as the user is known and runs alongside the remaining steps; it is cancelled
 * if any of them fails.
 */
@Component
@Slf4j
public class AuthenticationPipeline {

    private final BearerTokenExtractor bearerTokenExtractor;
    private final JwtTokenService jwtTokenService;
    private final UserAccountRepository userAccountRepository;
    private final CompanyRepository companyRepository;
    private final TenantRepository tenantRepository;
    private final LicenseService licenseService;
    private final RbacService rbacService;
    private final AsyncTaskExecutor authLookupExecutor;

    public AuthenticationPipeline(BearerTokenExtractor bearerTokenExtractor,
                                  JwtTokenService jwtTokenService,
                                  UserAccountRepository userAccountRepository,
                                  CompanyRepository companyRepository,
                                  TenantRepository tenantRepository,
                                  LicenseService licenseService,
                                  RbacService rbacService,
                                  @Qualifier("authLookupExecutor") AsyncTaskExecutor authLookupExecutor) {
        this.bearerTokenExtractor = bearerTokenExtractor;
        this.jwtTokenService = jwtTokenService;
        this.userAccountRepository = userAccountRepository;
        this.companyRepository = companyRepository;
        this.tenantRepository = tenantRepository;
        this.licenseService = licenseService;
        this.rbacService = rbacService;
        this.authLookupExecutor = authLookupExecutor;
    }

    public AuthorizationContext authenticate(HttpServletRequest request) {
        return authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
    }

    /**
     * @throws UnauthenticatedException when the credential is missing, invalid or names an unknown user
     * @throws ForbiddenException when the organization is missing or its license does not validate
     */
    public AuthorizationContext authenticate(String authorizationHeader) {
        String token = bearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new UnauthenticatedException("Missing or malformed bearer token"));

        TokenClaims claims = jwtTokenService.verify(token);

        UserAccount user = userAccountRepository.findById(claims.getUserId())
                .orElseThrow(() -> new UnauthenticatedException("User not found"));

        Future<ResolvedPermissions> permissionLookup =
                authLookupExecutor.submit(() -> rbacService.resolveForUser(user.getId()));
        try {
            Company company = companyRepository.findById(user.getCompanyId())
                    .orElseThrow(() -> new ForbiddenException("Organization not found"));

            License license = null;
            if (!user.isSuperUser()) {
                LicenseValidationResult validation = licenseService.validate(company.getLicenseKey());
                if (!validation.isValid()) {
                    log.warn("Request rejected by license check: userId={}, companyId={}, reason={}",
                            user.getId(), company.getId(), validation.getReason());
                    throw new ForbiddenException("Invalid or expired license", validation.getReason());
                }
                license = validation.getLicense();
            }

            Tenant tenant = loadTenant(user);
            ResolvedPermissions resolved = await(permissionLookup);

            return AuthorizationContext.builder()
                    .user(user)
                    .company(company)
                    .tenant(tenant)
                    .license(license)
                    .permissions(resolved.permissionNames())
                    .roles(resolved.roleNames())
                    .build();
        } finally {
            // No-op once the lookup has completed
            permissionLookup.cancel(true);
        }
    }

    private Tenant loadTenant(UserAccount user) {
        if (user.getTenantId() == null) {
            return null;
        }
        try {
            return tenantRepository.findById(user.getTenantId()).orElse(null);
        } catch (DataAccessException e) {
            log.warn("Tenant lookup failed, continuing without tenant: tenantId={}", user.getTenantId(), e);
            return null;
        }
    }

    private ResolvedPermissions await(Future<ResolvedPermissions> lookup) {
        try {
            return lookup.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationFailedException("Permission lookup interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new OperationFailedException("Permission lookup failed", e.getCause());
        }
    }
}
