package com.wpanther.licensing.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_users_company", columnList = "company_id"),
        @Index(name = "idx_users_tenant", columnList = "tenant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    private String id;

    @Column(nullable = false, unique = true)
    private String email;

    @Column(name = "full_name", nullable = false)
    private String fullName;

    @JsonIgnore
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "company_id", nullable = false)
    private String companyId;

    @Column(name = "tenant_id")
    private String tenantId;

    @Column(name = "is_super_user", nullable = false)
    private boolean superUser;

    /*
     * TRUE for the super user and NULL for everybody else. The unique constraint admits any
     * number of NULLs but a single TRUE, so the store itself refuses a second super user.
     */
    @JsonIgnore
    @Column(name = "super_user_slot", unique = true)
    private Boolean superUserSlot;

    @Column(name = "is_org_admin", nullable = false)
    private boolean orgAdmin;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_login")
    private Instant lastLogin;
}
