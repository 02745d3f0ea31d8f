package com.wpanther.licensing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "licenses", indexes = {
        @Index(name = "idx_licenses_company", columnList = "company_id"),
        @Index(name = "idx_licenses_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class License {

    @Id
    private String id;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    // The encoded and signed key is also the lookup key
    @Column(name = "license_key", nullable = false, unique = true, length = 4096)
    private String licenseKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LicenseStatus status;

    @Convert(converter = LicenseFeaturesConverter.class)
    @Column(nullable = false, length = 4000)
    private LicenseFeatures features;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    // Null for perpetual licenses
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    // HMAC of the full license key
    @Column(nullable = false, length = 128)
    private String signature;
}
