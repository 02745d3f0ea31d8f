package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.Permission;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PermissionRepository extends JpaRepository<Permission, String> {

    Optional<Permission> findByName(String name);

    /**
     * Full catalog in display order
     */
    List<Permission> findAllByOrderByResourceAscActionAsc();
}
