package com.wpanther.licensing.config;

import com.wpanther.licensing.exception.ConflictException;
import com.wpanther.licensing.service.AuthService;
import com.wpanther.licensing.service.RbacService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Seeds the permission catalog and creates the super user once the application is up.
 * Both steps are no-ops when their data is already present.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformBootstrap {

    private final RbacService rbacService;
    private final AuthService authService;

    @Value("${app.super-user.enabled:true}")
    private boolean superUserEnabled;

    @Value("${app.super-user.email:}")
    private String superUserEmail;

    @Value("${app.super-user.password:}")
    private String superUserPassword;

    @EventListener(ApplicationReadyEvent.class)
    public void bootstrap() {
        rbacService.seedPermissionCatalog();
        initializeSuperUser();
    }

    void initializeSuperUser() {
        if (!superUserEnabled) {
            log.info("Super user initialization disabled");
            return;
        }
        if (superUserEmail.isBlank() || superUserPassword.isBlank()) {
            log.warn("Super user credentials not configured, skipping initialization");
            return;
        }

        try {
            authService.initializeSuperUser(superUserEmail, superUserPassword);
        } catch (ConflictException e) {
            log.info("Super user already present, skipping initialization");
        } catch (DataIntegrityViolationException e) {
            // Another instance won the race for the super user slot
            log.info("Super user created concurrently, skipping initialization");
        }
    }
}
