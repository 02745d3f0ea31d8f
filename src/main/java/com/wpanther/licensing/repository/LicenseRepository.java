package com.wpanther.licensing.repository;

import com.wpanther.licensing.entity.License;
import com.wpanther.licensing.entity.LicenseStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface LicenseRepository extends JpaRepository<License, String> {

    Optional<License> findByLicenseKey(String licenseKey);

    List<License> findByCompanyId(String companyId);

    List<License> findAllByOrderByIssuedAtDesc();

    /**
     * Find licenses in the given status whose expiry has passed
     */
    List<License> findByStatusAndExpiresAtLessThan(LicenseStatus status, Instant now);

    /**
     * Conditional status change. Only rows still in {@code from} are touched, so concurrent
     * callers racing on the same transition update the row at most once.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update License l set l.status = :to where l.id = :id and l.status = :from")
    int transitionStatus(@Param("id") String id,
                         @Param("from") LicenseStatus from,
                         @Param("to") LicenseStatus to);
}
