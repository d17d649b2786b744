package com.orgauth.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orgauth.authservice.domain.login.IssuedToken;

/** Body of a successful callback. */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn) {

    public static TokenResponse from(IssuedToken token) {
        return new TokenResponse(token.accessToken(), "bearer", token.expiresIn().toSeconds());
    }
}
