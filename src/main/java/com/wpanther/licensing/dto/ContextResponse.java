package com.wpanther.licensing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wpanther.licensing.entity.LicenseFeatures;
import com.wpanther.licensing.entity.LicenseStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Set;

/**
 * What the caller's own authorization context looks like, for the current-user endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContextResponse {
    private UserSummary user;
    private String companyId;
    private String companyName;
    private String tenantId;
    private LicenseStatus licenseStatus;
    private Instant licenseExpiresAt;
    private LicenseFeatures licenseFeatures;
    private Set<String> roles;
    private Set<String> permissions;
}
