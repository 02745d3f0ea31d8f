package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.CompanyCreationResult;
import com.wpanther.licensing.dto.LoginRequest;
import com.wpanther.licensing.dto.LoginResponse;
import com.wpanther.licensing.dto.SignupRequest;
import com.wpanther.licensing.dto.SignupResponse;
import com.wpanther.licensing.dto.UserSummary;
import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.entity.LicenseStatus;
import com.wpanther.licensing.entity.Role;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.exception.ConflictException;
import com.wpanther.licensing.exception.OperationFailedException;
import com.wpanther.licensing.exception.ResourceNotFoundException;
import com.wpanther.licensing.exception.UnauthenticatedException;
import com.wpanther.licensing.repository.CompanyRepository;
import com.wpanther.licensing.repository.UserAccountRepository;
import com.wpanther.licensing.security.JwtTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Accounts and credentials: login, registration, self-service signup, the super user and
 * password changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String SYSTEM_COMPANY_NAME = "Platform System";
    static final String SYSTEM_COMPANY_DOMAIN = "platform.system";

    private final UserAccountRepository userAccountRepository;
    private final CompanyRepository companyRepository;
    private final CompanyService companyService;
    private final RbacService rbacService;
    private final JwtTokenService jwtTokenService;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.signup.license-days:365}")
    private int signupLicenseDays;

    /**
     * Checks the password and issues an access token carrying a snapshot of the user's permissions.
     */
    @Transactional
    public LoginResponse login(LoginRequest request) {
        UserAccount user = userAccountRepository.findByEmail(normalizeEmail(request.getEmail()))
                .orElseThrow(() -> new UnauthenticatedException(INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            log.warn("Login failed: userId={}", user.getId());
            throw new UnauthenticatedException(INVALID_CREDENTIALS);
        }

        List<String> permissions = new ArrayList<>(rbacService.resolveForUser(user.getId()).permissionNames());
        String token = jwtTokenService.issue(user, permissions);

        user.setLastLogin(Instant.now());
        userAccountRepository.save(user);

        log.info("User logged in: userId={}, companyId={}", user.getId(), user.getCompanyId());
        return LoginResponse.builder()
                .token(token)
                .user(UserSummary.from(user))
                .build();
    }

    @Transactional
    public UserAccount register(String email, String password, String fullName,
                                String companyId, String tenantId, boolean orgAdmin) {
        String normalizedEmail = normalizeEmail(email);
        if (userAccountRepository.existsByEmail(normalizedEmail)) {
            throw new ConflictException("Email already registered: " + normalizedEmail);
        }

        Instant now = Instant.now();
        UserAccount user = UserAccount.builder()
                .id(UUID.randomUUID().toString())
                .email(normalizedEmail)
                .fullName(fullName)
                .passwordHash(passwordEncoder.encode(password))
                .companyId(companyId)
                .tenantId(tenantId)
                .superUser(false)
                .orgAdmin(orgAdmin)
                .createdAt(now)
                .build();
        userAccountRepository.save(user);

        log.info("Registered user: userId={}, companyId={}, orgAdmin={}", user.getId(), companyId, orgAdmin);
        return user;
    }

    /**
     * Self-service signup. Creates a company for the email domain with a default license,
     * makes the caller its organization admin and gives them the Admin role.
     * When the domain is already taken and no new company was asked for, nothing is created
     * and the response points at the existing organization instead.
     */
    @Transactional
    public SignupResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.getEmail());
        String domain = domainOf(email);

        Optional<Company> existing = companyRepository.findByDomain(domain);
        if (existing.isPresent() && !request.isCreateNewCompany()) {
            Company company = existing.get();
            String adminEmail = userAccountRepository.findFirstByCompanyIdAndOrgAdminTrue(company.getId())
                    .map(UserAccount::getEmail)
                    .orElse(null);
            return SignupResponse.builder()
                    .domainExists(true)
                    .companyName(company.getName())
                    .adminEmail(adminEmail)
                    .message("Company already exists. Request access from your admin or create a new company.")
                    .build();
        }
        if (userAccountRepository.existsByEmail(email)) {
            throw new ConflictException("Email already registered: " + email);
        }

        String companyName = StringUtils.hasText(request.getCompanyName()) ? request.getCompanyName() : domain;
        CompanyCreationResult created = companyService.createCompany(companyName, domain, defaultFeatures(), signupLicenseDays);
        String companyId = created.getCompany().getId();

        UserAccount user = register(email, request.getPassword(), request.getFullName(), companyId, null, true);

        Role admin = rbacService.findRoleByName(companyId, RbacService.ADMIN_ROLE)
                .orElseThrow(() -> new OperationFailedException("Admin role missing for company " + companyId));
        rbacService.assignRoleToUser(companyId, user.getId(), admin.getId(), user.getId());

        log.info("Signup completed: userId={}, companyId={}", user.getId(), companyId);
        return SignupResponse.builder()
                .message("Company and user created successfully")
                .userId(user.getId())
                .companyId(companyId)
                .licenseKey(created.getLicenseKey())
                .build();
    }

    /**
     * Creates the single super user inside an unlicensed system company.
     *
     * @throws ConflictException if a super user already exists
     */
    @Transactional
    public UserAccount initializeSuperUser(String email, String password) {
        if (userAccountRepository.existsBySuperUserTrue()) {
            throw new ConflictException("Super user already exists");
        }

        Instant now = Instant.now();
        Company systemCompany = companyRepository.findByDomain(SYSTEM_COMPANY_DOMAIN)
                .orElseGet(() -> companyRepository.save(Company.builder()
                        .id(UUID.randomUUID().toString())
                        .name(SYSTEM_COMPANY_NAME)
                        .domain(SYSTEM_COMPANY_DOMAIN)
                        .licenseStatus(LicenseStatus.ACTIVE)
                        .domainVerified(true)
                        .verifiedAt(now)
                        .createdAt(now)
                        .build()));

        UserAccount superUser = UserAccount.builder()
                .id(UUID.randomUUID().toString())
                .email(normalizeEmail(email))
                .fullName("System Administrator")
                .passwordHash(passwordEncoder.encode(password))
                .companyId(systemCompany.getId())
                .superUser(true)
                .superUserSlot(Boolean.TRUE)
                .orgAdmin(true)
                .createdAt(now)
                .build();
        userAccountRepository.saveAndFlush(superUser);

        log.info("Super user created: userId={}. Change the initial password immediately.", superUser.getId());
        return superUser;
    }

    @Transactional
    public void changePassword(String userId, String currentPassword, String newPassword) {
        UserAccount user = userAccountRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));

        if (!passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw new IllegalArgumentException("Current password is incorrect");
        }

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        user.setUpdatedAt(Instant.now());
        userAccountRepository.save(user);
        log.info("Password changed: userId={}", userId);
    }

    static LicenseFeatures defaultFeatures() {
        return LicenseFeatures.builder()
                .maxUsers(50)
                .maxTenants(10)
                .apiRateLimit(1000)
                .enabledModules(new ArrayList<>(List.of("core", "users", "tenants")))
                .customFeatures(new LinkedHashMap<>())
                .build();
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String domainOf(String email) {
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) {
            throw new IllegalArgumentException("Email must contain a domain");
        }
        return email.substring(at + 1);
    }
}
