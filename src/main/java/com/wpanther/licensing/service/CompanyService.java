package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.CompanyCreationResult;
import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.entity.LicenseStatus;
import com.wpanther.licensing.exception.ConflictException;
import com.wpanther.licensing.exception.ResourceNotFoundException;
import com.wpanther.licensing.repository.CompanyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CompanyService {

    private final CompanyRepository companyRepository;
    private final LicenseService licenseService;
    private final RbacService rbacService;
    private final SecureRandom secureRandom;

    /**
     * Creates a company together with its first license and its default roles.
     * Any failure rolls back all three.
     */
    @Transactional
    public CompanyCreationResult createCompany(String name, String domain, LicenseFeatures features, Integer expiresInDays) {
        String normalizedDomain = domain.trim().toLowerCase(Locale.ROOT);
        if (companyRepository.existsByDomain(normalizedDomain)) {
            throw new ConflictException("Domain already registered: " + normalizedDomain);
        }

        Instant now = Instant.now();
        Company company = Company.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .domain(normalizedDomain)
                .licenseStatus(LicenseStatus.ACTIVE)
                .domainVerified(false)
                .domainVerificationToken(generateVerificationToken())
                .createdAt(now)
                .build();
        companyRepository.save(company);

        String licenseKey = licenseService.generate(company.getId(), name, features, expiresInDays);
        rbacService.createDefaultRoles(company.getId());

        log.info("Created company: id={}, domain={}", company.getId(), normalizedDomain);
        return CompanyCreationResult.builder()
                .company(getCompany(company.getId()))
                .licenseKey(licenseKey)
                .build();
    }

    @Transactional(readOnly = true)
    public Company getCompany(String companyId) {
        return companyRepository.findById(companyId)
                .orElseThrow(() -> new ResourceNotFoundException("Company not found: " + companyId));
    }

    private String generateVerificationToken() {
        byte[] bytes = new byte[32];
        secureRandom.nextBytes(bytes);
        return Hex.toHexString(bytes);
    }
}
