package com.wpanther.licensing.security;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header.
 * The scheme is matched case-insensitively.
 */
@Component
public class BearerTokenExtractor {

    private static final String BEARER_PREFIX = "bearer ";

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the token, or empty when the header is missing or not a bearer credential
     */
    public Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String token = trimmed.substring(BEARER_PREFIX.length()).strip();
        if (token.isEmpty() || token.contains(" ")) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
