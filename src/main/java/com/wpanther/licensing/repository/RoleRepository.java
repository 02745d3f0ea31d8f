package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoleRepository extends JpaRepository<Role, String> {

    List<Role> findByCompanyIdOrderByNameAsc(String companyId);

    Optional<Role> findByCompanyIdAndName(String companyId, String name);

    boolean existsByCompanyIdAndName(String companyId, String name);
}
