package com.wpanther.licensing.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature caps and flags granted by a license.
 * Stored as JSON on the license row and embedded in the encrypted payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LicenseFeatures {

    @JsonProperty("max_users")
    private Integer maxUsers;

    @JsonProperty("max_tenants")
    private Integer maxTenants;

    // Overrides the platform-wide API rate limit when set
    @JsonProperty("api_rate_limit")
    private Integer apiRateLimit;

    @Builder.Default
    @JsonProperty("enabled_modules")
    private List<String> enabledModules = new ArrayList<>();

    @Builder.Default
    @JsonProperty("custom_features")
    private Map<String, Boolean> customFeatures = new LinkedHashMap<>();
}
