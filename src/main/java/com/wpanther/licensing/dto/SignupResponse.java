package com.wpanther.licensing.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either the newly created user and company, or a pointer to the organization that already
 * owns the email domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignupResponse {
    private String message;
    private String userId;
    private String companyId;
    private String licenseKey;

    private boolean domainExists;
    private String companyName;
    private String adminEmail;
}
