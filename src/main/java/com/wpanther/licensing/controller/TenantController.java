package com.wpanther.licensing.controller;

import com.wpanther.licensing.dto.CreateTenantRequest;
import com.wpanther.licensing.entity.Tenant;
import com.wpanther.licensing.security.AuthorizationContext;
import com.wpanther.licensing.security.AuthorizationGuard;
import com.wpanther.licensing.service.TenantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tenants")
@RequiredArgsConstructor
public class TenantController {

    private static final AuthorizationGuard ORG_ADMIN = AuthorizationGuard.orgAdmin();
    private static final AuthorizationGuard TENANT_READ = AuthorizationGuard.permission("tenant.read");

    private final TenantService tenantService;

    @PostMapping
    public ResponseEntity<Tenant> createTenant(AuthorizationContext context, @Valid @RequestBody CreateTenantRequest request) {
        ORG_ADMIN.check(context);
        Tenant tenant = tenantService.createTenant(context.getCompanyId(),
                context.getLicense() != null ? context.getLicense().getFeatures() : null, request);
        return new ResponseEntity<>(tenant, HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<List<Tenant>> listTenants(AuthorizationContext context) {
        TENANT_READ.check(context);
        return ResponseEntity.ok(tenantService.listTenants(context.getCompanyId()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Tenant> getTenant(AuthorizationContext context, @PathVariable String id) {
        TENANT_READ.check(context);
        return ResponseEntity.ok(tenantService.getTenant(context.getCompanyId(), id));
    }
}
