package com.wpanther.licensing.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Authenticated but not authorized. The optional reason carries the license validation
 * outcome verbatim.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class ForbiddenException extends RuntimeException {

    private final String reason;

    public ForbiddenException(String message) {
        this(message, null);
    }

    public ForbiddenException(String message, String reason) {
        super(message);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
