package com.wpanther.licensing.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTenantRequest {

    @NotBlank(message = "Tenant name is required")
    private String name;

    @Pattern(regexp = "^[a-z0-9-]{1,100}$", message = "Subdomain may contain lowercase letters, digits and hyphens")
    private String subdomain;

    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();
}
