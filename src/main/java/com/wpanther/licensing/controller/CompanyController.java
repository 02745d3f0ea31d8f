package com.wpanther.licensing.controller;

import com.wpanther.licensing.dto.CompanyCreationResult;
import com.wpanther.licensing.dto.CreateCompanyRequest;
import com.wpanther.licensing.entity.Company;
import com.wpanther.licensing.security.AuthorizationContext;
import com.wpanther.licensing.security.AuthorizationGuard;
import com.wpanther.licensing.service.CompanyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/companies")
@RequiredArgsConstructor
public class CompanyController {

    private static final AuthorizationGuard SUPER_USER = AuthorizationGuard.superUser();
    private static final AuthorizationGuard COMPANY_READ = AuthorizationGuard.permission("company.read");

    private final CompanyService companyService;

    /**
     * Creates a company with its first license and default roles
     */
    @PostMapping
    public ResponseEntity<CompanyCreationResult> createCompany(AuthorizationContext context,
                                                               @Valid @RequestBody CreateCompanyRequest request) {
        SUPER_USER.check(context);
        CompanyCreationResult result = companyService.createCompany(request.getName(), request.getDomain(),
                request.getFeatures(), request.getExpiresInDays());
        return new ResponseEntity<>(result, HttpStatus.CREATED);
    }

    @GetMapping("/current")
    public ResponseEntity<Company> getCurrentCompany(AuthorizationContext context) {
        COMPANY_READ.check(context);
        return ResponseEntity.ok(companyService.getCompany(context.getCompanyId()));
    }
}
