package com.wpanther.licensing.exception;

/**
 * Raised when a license key cannot be decoded. Never retried: a malformed key stays invalid.
 */
public class LicenseCodecException extends RuntimeException {

    private final LicenseFailureReason reason;

    public LicenseCodecException(LicenseFailureReason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public LicenseCodecException(LicenseFailureReason reason, Throwable cause) {
        super(reason.getMessage(), cause);
        this.reason = reason;
    }

    public LicenseFailureReason getReason() {
        return reason;
    }
}
