package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TenantRepository extends JpaRepository<Tenant, String> {

    List<Tenant> findByParentCompanyIdOrderByNameAsc(String parentCompanyId);

    long countByParentCompanyId(String parentCompanyId);

    boolean existsBySubdomain(String subdomain);
}
