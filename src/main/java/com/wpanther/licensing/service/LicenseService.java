package com.wpanther.licensing.service;

import com.wpanther.licensing.dto.LicensePayload;
import com.wpanther.licensing.dto.LicenseValidationResult;
import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.entity.License;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.entity.LicenseStatus;
import com.wpanther.licensing.exception.LicenseCodecException;
import com.wpanther.licensing.exception.LicenseFailureReason;
import com.wpanther.licensing.exception.LicenseStateException;
import com.wpanther.licensing.exception.OperationFailedException;
import com.wpanther.licensing.exception.ResourceNotFoundException;
import com.wpanther.licensing.repository.CompanyRepository;
import com.wpanther.licensing.repository.LicenseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Issues licenses and drives them through their lifecycle.
 * The company row mirrors the key and status of its current license.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LicenseService {

    private final LicenseRepository licenseRepository;
    private final CompanyRepository companyRepository;
    private final LicenseCodec licenseCodec;

    /**
     * Generates a new license for a company and makes it the company's current one.
     *
     * @param expiresInDays days until expiry, or null for a perpetual license
     * @return the license key, which is only ever disclosed here
     */
    @Transactional
    public String generate(String companyId, String companyName, LicenseFeatures features, Integer expiresInDays) {
        if (expiresInDays != null && expiresInDays < 1) {
            throw new IllegalArgumentException("expiresInDays must be a positive number of days");
        }
        if (features == null) {
            throw new IllegalArgumentException("License features are required");
        }

        try {
            Company company = companyRepository.findById(companyId)
                    .orElseThrow(() -> new ResourceNotFoundException("Company not found: " + companyId));

            Instant now = Instant.now();
            Instant expiresAt = expiresInDays != null ? now.plus(expiresInDays, ChronoUnit.DAYS) : null;

            LicensePayload payload = LicensePayload.builder()
                    .companyId(companyId)
                    .companyName(companyName)
                    .features(features)
                    .issuedAt(now.toEpochMilli())
                    .expiresAt(expiresAt != null ? expiresAt.toEpochMilli() : null)
                    .nonce(UUID.randomUUID().toString())
                    .build();

            String licenseKey = licenseCodec.encode(payload);

            License license = License.builder()
                    .id(UUID.randomUUID().toString())
                    .companyId(companyId)
                    .licenseKey(licenseKey)
                    .status(LicenseStatus.ACTIVE)
                    .features(features)
                    .issuedAt(now)
                    .expiresAt(expiresAt)
                    .signature(licenseCodec.sign(licenseKey))
                    .build();
            licenseRepository.save(license);

            company.setLicenseKey(licenseKey);
            company.setLicenseStatus(LicenseStatus.ACTIVE);
            company.setUpdatedAt(now);
            companyRepository.save(company);

            log.info("Generated license: id={}, companyId={}, expiresAt={}", license.getId(), companyId, expiresAt);
            return licenseKey;
        } catch (DataAccessException e) {
            throw new OperationFailedException("Failed to generate license: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Checks a license key cryptographically and against its stored state.
     * An active license whose payload has run out is moved to expired on the way.
     */
    @Transactional
    public LicenseValidationResult validate(String licenseKey) {
        if (!StringUtils.hasText(licenseKey)) {
            return LicenseValidationResult.invalid(LicenseFailureReason.INVALID_FORMAT, null);
        }

        LicensePayload payload;
        try {
            payload = licenseCodec.decode(licenseKey);
        } catch (LicenseCodecException e) {
            log.warn("License key rejected: {}", e.getReason().getMessage());
            return LicenseValidationResult.invalid(e.getReason(), null);
        }

        try {
            License license = licenseRepository.findByLicenseKey(licenseKey).orElse(null);
            if (license == null) {
                return LicenseValidationResult.invalid(LicenseFailureReason.NOT_FOUND, null);
            }

            switch (license.getStatus()) {
                case REVOKED:
                    return LicenseValidationResult.invalid(LicenseFailureReason.REVOKED, license);
                case SUSPENDED:
                    return LicenseValidationResult.invalid(LicenseFailureReason.SUSPENDED, license);
                case EXPIRED:
                    return LicenseValidationResult.invalid(LicenseFailureReason.EXPIRED, license);
                default:
                    break;
            }

            if (payload.isExpiredAt(Instant.now())) {
                License expired = expire(license);
                return LicenseValidationResult.invalid(LicenseFailureReason.EXPIRED, expired);
            }

            return LicenseValidationResult.valid(license, payload);
        } catch (DataAccessException e) {
            throw new OperationFailedException("Failed to validate license: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * Moves an active license to expired. Concurrent callers are safe: only the first
     * conditional update touches the row, the others see it already expired.
     *
     * @return the license as stored after the attempt
     */
    @Transactional
    public License expire(License license) {
        int updated = licenseRepository.transitionStatus(license.getId(), LicenseStatus.ACTIVE, LicenseStatus.EXPIRED);
        if (updated > 0) {
            log.info("License expired: id={}, companyId={}", license.getId(), license.getCompanyId());
            mirrorOntoCompany(license, LicenseStatus.EXPIRED);
        }
        return licenseRepository.findById(license.getId()).orElse(license);
    }

    @Transactional
    public License revoke(String licenseId) {
        return transition(licenseId, LicenseStatus.REVOKED);
    }

    @Transactional
    public License suspend(String licenseId) {
        return transition(licenseId, LicenseStatus.SUSPENDED);
    }

    @Transactional
    public License reactivate(String licenseId) {
        return transition(licenseId, LicenseStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public License getLicense(String licenseId) {
        return licenseRepository.findById(licenseId)
                .orElseThrow(() -> new ResourceNotFoundException("License not found: " + licenseId));
    }

    /**
     * The license whose key the company currently holds
     */
    @Transactional(readOnly = true)
    public License getCurrentLicense(String companyId) {
        Company company = companyRepository.findById(companyId)
                .orElseThrow(() -> new ResourceNotFoundException("Company not found: " + companyId));
        if (company.getLicenseKey() == null) {
            throw new ResourceNotFoundException("Company has no license: " + companyId);
        }
        return licenseRepository.findByLicenseKey(company.getLicenseKey())
                .orElseThrow(() -> new ResourceNotFoundException("License not found for company: " + companyId));
    }

    @Transactional(readOnly = true)
    public List<License> listLicenses() {
        return licenseRepository.findAllByOrderByIssuedAtDesc();
    }

    /**
     * Expires every active license whose expiry date has passed.
     *
     * @return number of licenses moved to expired
     */
    @Transactional
    public int expireOverdueLicenses() {
        List<License> overdue = licenseRepository.findByStatusAndExpiresAtLessThan(LicenseStatus.ACTIVE, Instant.now());
        int expiredCount = 0;
        for (License license : overdue) {
            License after = expire(license);
            if (after.getStatus() == LicenseStatus.EXPIRED) {
                expiredCount++;
            }
        }
        return expiredCount;
    }

    private License transition(String licenseId, LicenseStatus target) {
        License license = getLicense(licenseId);
        LicenseStatus current = license.getStatus();
        if (current == target) {
            return license;
        }
        if (!current.canTransitionTo(target)) {
            throw new LicenseStateException(licenseId, current, target);
        }

        license.setStatus(target);
        if (target == LicenseStatus.REVOKED) {
            license.setRevokedAt(Instant.now());
        }
        License saved = licenseRepository.save(license);
        mirrorOntoCompany(saved, target);

        log.info("License status changed: id={}, from={}, to={}", licenseId, current.getValue(), target.getValue());
        return saved;
    }

    // Only the company's current license is mirrored; superseded ones change silently
    private void mirrorOntoCompany(License license, LicenseStatus status) {
        companyRepository.findById(license.getCompanyId())
                .filter(company -> license.getLicenseKey().equals(company.getLicenseKey()))
                .ifPresent(company -> {
                    company.setLicenseStatus(status);
                    company.setUpdatedAt(Instant.now());
                    companyRepository.save(company);
                });
    }
}
