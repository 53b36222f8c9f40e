package com.numaansystems.obo.model;

import java.util.List;

/**
 * Read-only projection of the claims carried by an access token.
 *
 * <p>Absent optional claims are represented as {@code null} for single values
 * and as empty lists for {@code aud}, {@code groups} and {@code roles}.</p>
 *
 * @param audience the {@code aud} claim, normalised to a list
 * @param issuer the {@code iss} claim
 * @param subject the {@code sub} claim
 * @param objectId the {@code oid} claim (directory object id of the user)
 * @param userPrincipalName the {@code upn} claim
 * @param appId the {@code appid} claim (client that requested the token)
 * @param scopes the {@code scp} claim, space separated
 * @param groups the {@code groups} claim
 * @param roles the {@code roles} claim
 * @param expiresAt the {@code exp} claim in epoch seconds, or null
 * @param groupsOverage true if the identity provider left groups out of the token
 */
public record TokenClaims(
        List<String> audience,
        String issuer,
        String subject,
        String objectId,
        String userPrincipalName,
        String appId,
        String scopes,
        List<String> groups,
        List<String> roles,
        Long expiresAt,
        boolean groupsOverage) {

    public TokenClaims {
        audience = audience == null ? List.of() : List.copyOf(audience);
        groups = groups == null ? List.of() : List.copyOf(groups);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public int groupCount() {
        return groups.size();
    }

    /**
     * Returns the audience the way Entra ID access tokens carry it: a single
     * value when there is exactly one, otherwise the list.
     */
    public Object audienceValue() {
        if (audience.isEmpty()) {
            return null;
        }
        return audience.size() == 1 ? audience.get(0) : audience;
    }
}
