package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    Optional<UserAccount> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsBySuperUserTrue();

    long countByCompanyId(String companyId);

    List<UserAccount> findByCompanyIdOrderByEmailAsc(String companyId);

    /**
     * First organization admin of a company, used as the access-request contact
     */
    Optional<UserAccount> findFirstByCompanyIdAndOrgAdminTrue(String companyId);
}
