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
public class CreateCompanyRequest {

    @NotBlank(message = "Company name is required")
    private String name;

    @NotBlank(message = "Domain is required")
    private String domain;

    @NotNull(message = "License features are required")
    private LicenseFeatures features;

    @Positive(message = "Expiry must be a positive number of days")
    private Integer expiresInDays;
}
