package com.wpanther.licensing.dto;

import com.wpanther.licensing.entity.Company;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyCreationResult {
    private Company company;
    private String licenseKey;
}
