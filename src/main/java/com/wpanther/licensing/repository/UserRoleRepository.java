package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserRoleRepository extends JpaRepository<UserRole, UserRole.Key> {

    List<UserRole> findByUserId(String userId);

    boolean existsByUserIdAndRoleId(String userId, String roleId);

    long countByRoleId(String roleId);

    @Modifying
    void deleteByUserIdAndRoleId(String userId, String roleId);
}
