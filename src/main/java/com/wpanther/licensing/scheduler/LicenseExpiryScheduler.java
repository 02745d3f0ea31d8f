package com.wpanther.licensing.scheduler;

import com.wpanther.licensing.service.LicenseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves overdue licenses to expired even when their organization sends no requests.
 * Requests expire licenses lazily as well, the two never conflict.
 */
@Component
@EnableScheduling
@RequiredArgsConstructor
@Slf4j
public class LicenseExpiryScheduler {

    private final LicenseService licenseService;

    /**
     * Runs every 15 minutes by default (configurable via app.license.expiry-sweep-cron)
     */
    @Scheduled(cron = "${app.license.expiry-sweep-cron:0 */15 * * * *}")
    public void expireOverdueLicenses() {
        log.info("Starting license expiry sweep");

        try {
            int expiredCount = licenseService.expireOverdueLicenses();
            log.info("Expiry sweep completed: {} licenses marked as expired", expiredCount);
        } catch (Exception e) {
            log.error("Error during license expiry sweep", e);
        }
    }
}
