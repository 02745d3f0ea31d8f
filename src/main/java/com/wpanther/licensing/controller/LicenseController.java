package com.wpanther.licensing.controller;

import com.wpanther.licensing.dto.GenerateLicenseRequest;
import com.wpanther.licensing.dto.GenerateLicenseResponse;
import com.wpanther.licensing.dto.LicenseValidationResult;
import com.wpanther.licensing.entity.License;
import com.wpanther.licensing.security.AuthorizationContext;
import com.wpanther.licensing.security.AuthorizationGuard;
import com.wpanther.licensing.service.LicenseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * License administration. Every operation is reserved to the super user.
 */
@RestController
@RequestMapping("/api/licenses")
@RequiredArgsConstructor
@Slf4j
public class LicenseController {

    private static final AuthorizationGuard SUPER_USER = AuthorizationGuard.superUser();

    private final LicenseService licenseService;

    @GetMapping
    public ResponseEntity<List<License>> listLicenses(AuthorizationContext context) {
        SUPER_USER.check(context);
        return ResponseEntity.ok(licenseService.listLicenses());
    }

    @GetMapping("/{id}")
    public ResponseEntity<License> getLicense(AuthorizationContext context, @PathVariable String id) {
        SUPER_USER.check(context);
        return ResponseEntity.ok(licenseService.getLicense(id));
    }

    @GetMapping("/company/{companyId}")
    public ResponseEntity<License> getCurrentLicense(AuthorizationContext context, @PathVariable String companyId) {
        SUPER_USER.check(context);
        return ResponseEntity.ok(licenseService.getCurrentLicense(companyId));
    }

    @PostMapping
    public ResponseEntity<GenerateLicenseResponse> generateLicense(AuthorizationContext context,
                                                                   @Valid @RequestBody GenerateLicenseRequest request) {
        SUPER_USER.check(context);
        log.debug("Generating license for company: {}", request.getCompanyId());

        String licenseKey = licenseService.generate(request.getCompanyId(), request.getCompanyName(),
                request.getFeatures(), request.getExpiresInDays());
        GenerateLicenseResponse response = GenerateLicenseResponse.builder()
                .message("License generated successfully")
                .licenseKey(licenseKey)
                .build();
        return new ResponseEntity<>(response, HttpStatus.CREATED);
    }

    @PostMapping("/{id}/revoke")
    public ResponseEntity<License> revokeLicense(AuthorizationContext context, @PathVariable String id) {
        SUPER_USER.check(context);
        return ResponseEntity.ok(licenseService.revoke(id));
    }

    @PostMapping("/{id}/suspend")
    public ResponseEntity<License> suspendLicense(AuthorizationContext context, @PathVariable String id) {
        SUPER_USER.check(context);
        return ResponseEntity.ok(licenseService.suspend(id));
    }

    @PostMapping("/{id}/reactivate")
    public ResponseEntity<License> reactivateLicense(AuthorizationContext context, @PathVariable String id) {
        SUPER_USER.check(context);
        return ResponseEntity.ok(licenseService.reactivate(id));
    }

    @PostMapping("/{id}/validate")
    public ResponseEntity<LicenseValidationResult> validateLicense(AuthorizationContext context, @PathVariable String id) {
        SUPER_USER.check(context);
        License license = licenseService.getLicense(id);
        return ResponseEntity.ok(licenseService.validate(license.getLicenseKey()));
    }
}
