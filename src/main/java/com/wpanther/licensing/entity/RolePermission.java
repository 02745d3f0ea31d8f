package com.wpanther.licensing.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Entity
@Table(name = "role_permissions", indexes = @Index(name = "idx_role_permissions_role", columnList = "role_id"))
@IdClass(RolePermission.Key.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RolePermission {

    @Id
    @Column(name = "role_id")
    private String roleId;

    @Id
    @Column(name = "permission_id")
    private String permissionId;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String roleId;
        private String permissionId;
    }
}
