package com.orgauth.authservice.domain.login;

import java.time.Duration;

/**
 * A freshly issued access token.
 *
 * @param accessToken the compact signed token
 * @param expiresIn token lifetime
 * @param userId subject of the token
 * @param tenantId tenant of the token
 */
public record IssuedToken(String accessToken, Duration expiresIn, String userId, String tenantId) {

    @Override
    public String toString() {
        return "IssuedToken[userId=" + userId + ", tenantId=" + tenantId + ", expiresIn=" + expiresIn + "]";
    }
}
