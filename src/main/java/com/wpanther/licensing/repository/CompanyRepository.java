package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, String> {

    Optional<Company> findByDomain(String domain);

    boolean existsByDomain(String domain);
}
