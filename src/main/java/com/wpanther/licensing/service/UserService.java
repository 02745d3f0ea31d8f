package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.RegisterUserRequest;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.entity.UserAccount;
import com.wpanther.licensing.exception.ForbiddenException;
import com.wpanther.licensing.exception.ResourceNotFoundException;
import com.wpanther.licensing.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Users of one company, as seen by that company's administrators.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserAccountRepository userAccountRepository;
    private final AuthService authService;
    private final TenantService tenantService;

    /**
     * Adds a user to a company, within the {@code max_users} cap of its license.
     *
     * @param features features of the company's current license, or null when unrestricted
     */
    @Transactional
    public UserAccount addUser(String companyId, LicenseFeatures features, RegisterUserRequest request) {
        if (features != null && features.getMaxUsers() != null
                && userAccountRepository.countByCompanyId(companyId) >= features.getMaxUsers()) {
            log.warn("User limit reached: companyId={}, maxUsers={}", companyId, features.getMaxUsers());
            throw new ForbiddenException("License user limit reached (" + features.getMaxUsers() + ")");
        }
        if (request.getTenantId() != null) {
            tenantService.getTenant(companyId, request.getTenantId());
        }
        return authService.register(request.getEmail(), request.getPassword(), request.getFullName(),
                companyId, request.getTenantId(), request.isOrgAdmin());
    }

    @Transactional(readOnly = true)
    public List<UserAccount> listUsers(String companyId) {
        return userAccountRepository.findByCompanyIdOrderByEmailAsc(companyId);
    }

    // Users of other companies are reported as missing
    @Transactional(readOnly = true)
    public UserAccount getUser(String companyId, String userId) {
        return userAccountRepository.findById(userId)
                .filter(user -> user.getCompanyId().equals(companyId))
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + userId));
    }
}
