package com.wpanther.licensing.dto;

import com.wpanther.licensing.entity.LicenseFeatures;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateLicenseRequest {

    @NotBlank(message = "Company ID is required")
    private String companyId;

    @NotBlank(message = "Company name is required")
    private String companyName;

    @NotNull(message = "Features are required")
    private LicenseFeatures features;

    // Omit for a perpetual license
    @Positive(message = "Expiry must be a positive number of days")
    private Integer expiresInDays;
}
