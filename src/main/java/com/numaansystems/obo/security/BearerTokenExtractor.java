package com.numaansystems.obo.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the bearer token from an {@code Authorization} header value.
 *
 * <p>Expects {@code "Bearer <token>"}. The scheme name is matched without
 * regard to case; anything else (Basic credentials, an empty value, a bare
 * scheme) yields an empty result.</p>
 */
public final class BearerTokenExtractor {

    private static final String BEARER_PREFIX = "bearer ";

    private BearerTokenExtractor() {
    }

    /**
     * @param authorizationHeader the full header value, may be null
     * @return the token, or empty if the header is missing or not a bearer credential
     */
    public static Optional<String> extract(String authorizationHeader) {
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
