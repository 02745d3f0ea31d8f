package com.wpanther.licensing.exception;

/**
 * Why a license key was rejected. The message is what callers get to see.
 */
public enum LicenseFailureReason {
    INVALID_FORMAT("Invalid license format"),
    SIGNATURE_MISMATCH("Invalid license signature"),
    DECRYPTION_FAILED("License decryption failed"),
    NOT_FOUND("License not found in database"),
    EXPIRED("License has expired"),
    SUSPENDED("License is suspended"),
    REVOKED("License has been revoked");

    private final String message;

    LicenseFailureReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
