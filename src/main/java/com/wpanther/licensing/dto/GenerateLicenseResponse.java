package com.wpanther.licensing.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateLicenseResponse {
    private String message;
    private String licenseKey; // Only disclosed at generation time
}
