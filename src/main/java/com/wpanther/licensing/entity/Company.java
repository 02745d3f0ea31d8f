package com.wpanther.licensing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Top-level tenant (organization) owning users, sub-tenants and one current license.
 */
@Entity
@Table(name = "companies")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Company {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String domain;

    // Key of the current license; null for the system company of the super user
    @Column(name = "license_key", length = 4096)
    private String licenseKey;

    // Mirror of the current license status
    @Enumerated(EnumType.STRING)
    @Column(name = "license_status", nullable = false, length = 20)
    private LicenseStatus licenseStatus;

    @Column(name = "domain_verified", nullable = false)
    private boolean domainVerified;

    @Column(name = "domain_verification_token")
    private String domainVerificationToken;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "is_blocked", nullable = false)
    private boolean blocked;

    @Column(name = "blocked_at")
    private Instant blockedAt;

    @Column(name = "blocked_reason")
    private String blockedReason;

    @Column(name = "blocked_by_user_id")
    private String blockedByUserId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
