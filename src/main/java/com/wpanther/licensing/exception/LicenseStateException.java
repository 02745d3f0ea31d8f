package com.wpanther.licensing.exception;

import com.wpanther.licensing.entity.LicenseStatus;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class LicenseStateException extends RuntimeException {

    public LicenseStateException(String licenseId, LicenseStatus current, LicenseStatus target) {
        super("License " + licenseId + " cannot move from " + current.getValue() + " to " + target.getValue());
    }
}
