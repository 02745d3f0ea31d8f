package com.wpanther.licensing.dto;

import com.wpanther.licensing.entity.LicenseFeatures;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Plaintext sealed inside a license key. Timestamps are epoch milliseconds.
 * The nonce only makes every encoding unique; it is never tracked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LicensePayload {
    private String companyId;
    private String companyName;
    private LicenseFeatures features;
    private long issuedAt;
    private Long expiresAt;
    private String nonce;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.toEpochMilli() > expiresAt;
    }
}
