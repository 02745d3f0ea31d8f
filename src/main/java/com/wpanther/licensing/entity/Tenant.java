package com.wpanther.licensing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Isolated sub-tenant managed by a parent company.
 */
@Entity
@Table(name = "tenants", indexes = @Index(name = "idx_tenants_parent_company", columnList = "parent_company_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tenant {

    @Id
    private String id;

    @Column(name = "parent_company_id", nullable = false)
    private String parentCompanyId;

    @Column(nullable = false)
    private String name;

    @Column(length = 100)
    private String subdomain;

    @Builder.Default
    @Convert(converter = JsonSettingsConverter.class)
    @Column(length = 4000)
    private Map<String, Object> settings = new LinkedHashMap<>();

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
