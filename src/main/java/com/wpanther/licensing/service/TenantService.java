package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.CreateTenantRequest;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.entity.Tenant;
import com.wpanther.licensing.exception.ConflictException;
import com.wpanther.licensing.exception.ForbiddenException;
import com.wpanther.licensing.exception.ResourceNotFoundException;
import com.wpanther.licensing.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Sub-tenants of a company, capped by the {@code max_tenants} feature of its license.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantService {

    private final TenantRepository tenantRepository;

    /**
     * @param features features of the company's current license, or null when unrestricted
     */
    @Transactional
    public Tenant createTenant(String companyId, LicenseFeatures features, CreateTenantRequest request) {
        if (features != null && features.getMaxTenants() != null
                && tenantRepository.countByParentCompanyId(companyId) >= features.getMaxTenants()) {
            throw new ForbiddenException("License tenant limit reached (" + features.getMaxTenants() + ")");
        }
        if (request.getSubdomain() != null && tenantRepository.existsBySubdomain(request.getSubdomain())) {
            throw new ConflictException("Subdomain already exists: " + request.getSubdomain());
        }

        Tenant tenant = Tenant.builder()
                .id(UUID.randomUUID().toString())
                .parentCompanyId(companyId)
                .name(request.getName())
                .subdomain(request.getSubdomain())
                .settings(request.getSettings() != null ? request.getSettings() : new LinkedHashMap<>())
                .active(true)
                .createdAt(Instant.now())
                .build();
        tenantRepository.save(tenant);

        log.info("Created tenant: id={}, companyId={}", tenant.getId(), companyId);
        return tenant;
    }

    @Transactional(readOnly = true)
    public List<Tenant> listTenants(String companyId) {
        return tenantRepository.findByParentCompanyIdOrderByNameAsc(companyId);
    }

    @Transactional(readOnly = true)
    public Tenant getTenant(String companyId, String tenantId) {
        return tenantRepository.findById(tenantId)
                .filter(tenant -> tenant.getParentCompanyId().equals(companyId))
                .orElseThrow(() -> new ResourceNotFoundException("Tenant not found: " + tenantId));
    }
}
