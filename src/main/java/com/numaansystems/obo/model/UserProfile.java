package com.numaansystems.obo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The signed-in user as returned by Microsoft Graph {@code /me}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(String id, String displayName, String userPrincipalName, String jobTitle, String mail) {
}
