package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.RolePermission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RolePermissionRepository extends JpaRepository<RolePermission, RolePermission.Key> {

    List<RolePermission> findByRoleId(String roleId);

    @Modifying
    void deleteByRoleId(String roleId);
}
