package com.numaansystems.obo.service;

import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.numaansystems.obo.exception.MalformedTokenException;
import com.numaansystems.obo.model.TokenClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.text.ParseException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes the claims of a JWT access token without verifying its signature.
 *
 * <p>The gateway trusts the token because Entra ID issued it for this API and
 * the caller obtained it through MSAL. Signature, lifetime and audience checks
 * are not repeated here; the identity provider performs them again when the
 * token is presented as an OBO assertion.</p>
 *
 * <h2>Claims read</h2>
 * <ul>
 *   <li>{@code aud}, {@code iss}, {@code sub}, {@code exp}</li>
 *   <li>{@code oid}, {@code upn}, {@code appid}, {@code scp}</li>
 *   <li>{@code groups} and {@code roles}, empty when absent</li>
 *   <li>{@code _claim_names.groups}, the group overage indicator</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class ClaimsExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ClaimsExtractor.class);

    static final String CLAIM_OBJECT_ID = "oid";
    static final String CLAIM_UPN = "upn";
    static final String CLAIM_APP_ID = "appid";
    static final String CLAIM_SCOPES = "scp";
    static final String CLAIM_GROUPS = "groups";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_NAMES = "_claim_names";

    /**
     * Decodes the token payload into {@link TokenClaims}.
     *
     * @param token compact serialized JWT
     * @return the decoded claims
     * @throws MalformedTokenException if the token is not three segments of
     *         base64url data with a JSON object payload, or a claim has the wrong type
     */
    public TokenClaims extract(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }
        int segments = token.split("\\.", -1).length;
        if (segments != 3) {
            throw new MalformedTokenException("Expected 3 dot-separated segments but found " + segments);
        }

        try {
            JWT jwt = JWTParser.parse(token);
            return toTokenClaims(jwt.getJWTClaimsSet());
        } catch (ParseException e) {
            throw new MalformedTokenException("Token could not be decoded: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a token for diagnostics only.
     *
     * <p>Tokens issued to this gateway for another resource are opaque by
     * contract and may not be JWTs at all, so a decoding failure is logged and
     * reported as empty.</p>
     *
     * @param token compact serialized token
     * @return the claims, or empty if the token cannot be decoded
     */
    public Optional<TokenClaims> tryExtract(String token) {
        try {
            return Optional.of(extract(token));
        } catch (MalformedTokenException e) {
            logger.debug("Token is not a decodable JWT: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private TokenClaims toTokenClaims(JWTClaimsSet claims) throws ParseException {
        List<String> groups = claims.getStringListClaim(CLAIM_GROUPS);
        List<String> roles = claims.getStringListClaim(CLAIM_ROLES);
        Date expiration = claims.getExpirationTime();

        return new TokenClaims(
                claims.getAudience(),
                claims.getIssuer(),
                claims.getSubject(),
                claims.getStringClaim(CLAIM_OBJECT_ID),
                claims.getStringClaim(CLAIM_UPN),
                claims.getStringClaim(CLAIM_APP_ID),
                claims.getStringClaim(CLAIM_SCOPES),
                groups,
                roles,
                expiration != null ? expiration.getTime() / 1000 : null,
                hasGroupsOverage(claims));
    }

    private boolean hasGroupsOverage(JWTClaimsSet claims) throws ParseException {
        Map<String, Object> claimNames = claims.getJSONObjectClaim(CLAIM_NAMES);
        return claimNames != null && claimNames.containsKey(CLAIM_GROUPS);
    }
}
