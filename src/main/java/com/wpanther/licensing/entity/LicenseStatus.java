package com.wpanther.licensing.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a license.
 * ACTIVE -> SUSPENDED | REVOKED | EXPIRED, SUSPENDED -> ACTIVE | REVOKED.
 * REVOKED and EXPIRED are terminal.
 */
public enum LicenseStatus {
    ACTIVE("active"),
    SUSPENDED("suspended"),
    REVOKED("revoked"),
    EXPIRED("expired");

    private final String value;

    LicenseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == REVOKED || this == EXPIRED;
    }

    public boolean canTransitionTo(LicenseStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<LicenseStatus> allowedTargets() {
        switch (this) {
            case ACTIVE:
                return EnumSet.of(SUSPENDED, REVOKED, EXPIRED);
            case SUSPENDED:
                return EnumSet.of(ACTIVE, REVOKED);
            default:
                return EnumSet.noneOf(LicenseStatus.class);
        }
    }
}
