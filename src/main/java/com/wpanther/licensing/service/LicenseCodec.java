package com.wpanther.licensing.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.licensing.dto.LicensePayload;
import com.wpanther.licensing.exception.LicenseCodecException;
import com.wpanther.licensing.exception.LicenseFailureReason;
import com.wpanther.licensing.exception.OperationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Seals license payloads into tamper-evident keys and opens them again.
 * <p>
 * A key has the shape {@code hex(iv).hex(ciphertext).hex(tag).hex(signature)}: the payload is
 * encrypted with AES-256-GCM and the first three segments are then signed with HMAC-SHA256.
 * Both keys are derived by hashing the configured secrets with SHA-256.
 */
@Component
@Slf4j
public class LicenseCodec {

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final String SEPARATOR = ".";

    private final SecretKey encryptionKey;
    private final SecretKey signingKey;
    private final ObjectMapper objectMapper;
    private final SecureRandom secureRandom;

    public LicenseCodec(@Value("${app.license.encryption-key}") String encryptionSecret,
                        @Value("${app.license.signing-key}") String signingSecret,
                        ObjectMapper objectMapper,
                        SecureRandom secureRandom) {
        if (encryptionSecret == null || encryptionSecret.isBlank()
                || signingSecret == null || signingSecret.isBlank()) {
            throw new IllegalStateException("License encryption and signing keys must be configured");
        }
        this.encryptionKey = new SecretKeySpec(sha256(encryptionSecret), "AES");
        this.signingKey = new SecretKeySpec(sha256(signingSecret), HMAC_ALGORITHM);
        this.objectMapper = objectMapper;
        this.secureRandom = secureRandom;
    }

    /**
     * Encrypts and signs a payload. A fresh IV makes every call produce a different key.
     */
    public String encode(LicensePayload payload) {
        try {
            byte[] plaintext = objectMapper.writeValueAsBytes(payload);
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            // The JCE appends the tag to the ciphertext
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_LENGTH);
            byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_LENGTH, sealed.length);

            String blob = Hex.toHexString(iv) + SEPARATOR + Hex.toHexString(ciphertext) + SEPARATOR + Hex.toHexString(tag);
            return blob + SEPARATOR + sign(blob);
        } catch (JsonProcessingException | GeneralSecurityException e) {
            throw new OperationFailedException("Failed to encode license", e);
        }
    }

    /**
     * Verifies the signature and decrypts a license key.
     *
     * @throws LicenseCodecException with the reason the key was rejected
     */
    public LicensePayload decode(String licenseKey) {
        if (licenseKey == null) {
            throw new LicenseCodecException(LicenseFailureReason.INVALID_FORMAT);
        }
        String[] segments = licenseKey.split("\\.", -1);
        if (segments.length != 4) {
            throw new LicenseCodecException(LicenseFailureReason.INVALID_FORMAT);
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new LicenseCodecException(LicenseFailureReason.INVALID_FORMAT);
            }
        }

        String blob = segments[0] + SEPARATOR + segments[1] + SEPARATOR + segments[2];
        // Compared as hex text so that case changes in the signature are rejected too
        byte[] presented = segments[3].getBytes(StandardCharsets.UTF_8);
        byte[] expected = sign(blob).getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, expected)) {
            throw new LicenseCodecException(LicenseFailureReason.SIGNATURE_MISMATCH);
        }

        byte[] iv = decodeHex(segments[0]);
        byte[] ciphertext = decodeHex(segments[1]);
        byte[] tag = decodeHex(segments[2]);
        if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
            throw new LicenseCodecException(LicenseFailureReason.INVALID_FORMAT);
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, encryptionKey, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = Arrays.copyOf(ciphertext, ciphertext.length + TAG_LENGTH);
            System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_LENGTH);
            plaintext = cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            log.debug("License decryption failed: {}", e.getMessage());
            throw new LicenseCodecException(LicenseFailureReason.DECRYPTION_FAILED, e);
        }

        try {
            return objectMapper.readValue(plaintext, LicensePayload.class);
        } catch (IOException e) {
            throw new LicenseCodecException(LicenseFailureReason.DECRYPTION_FAILED, e);
        }
    }

    /**
     * Hex HMAC-SHA256 of the given data under the signing key.
     */
    public String sign(String data) {
        return Hex.toHexString(hmac(data));
    }

    private byte[] hmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not compute HMAC", e);
        }
    }

    private static byte[] decodeHex(String segment) {
        try {
            return Hex.decode(segment);
        } catch (DecoderException e) {
            throw new LicenseCodecException(LicenseFailureReason.INVALID_FORMAT, e);
        }
    }

    private static byte[] sha256(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
