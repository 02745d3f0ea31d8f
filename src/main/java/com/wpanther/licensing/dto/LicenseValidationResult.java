package com.wpanther.licensing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wpanther.licensing.entity.License;
import com.wpanther.licensing.exception.LicenseFailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of validating a license key. On rejection the stored license is still attached
 * when one was found, so callers can inspect it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LicenseValidationResult {
    private boolean valid;
    private License license;
    private LicensePayload payload;
    private LicenseFailureReason failure;
    private String reason;

    public static LicenseValidationResult valid(License license, LicensePayload payload) {
        return LicenseValidationResult.builder()
                .valid(true)
                .license(license)
                .payload(payload)
                .build();
    }

    public static LicenseValidationResult invalid(LicenseFailureReason failure, License license) {
        return LicenseValidationResult.builder()
                .valid(false)
                .license(license)
                .failure(failure)
                .reason(failure.getMessage())
                .build();
    }
}
