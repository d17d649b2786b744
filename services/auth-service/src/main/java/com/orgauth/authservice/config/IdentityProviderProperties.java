package com.orgauth.authservice.config;

import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * External identity provider settings, bound from {@code orgauth.idp.*}. Endpoints default to
 * Google's.
 *
 * <pre>
 * orgauth:
 *   idp:
 *     client-id: 1234.apps.googleusercontent.com
 *     client-secret: ${GOOGLE_CLIENT_SECRET}
 *     redirect-uri: https://auth.example.com/auth/callback
 * </pre>
 *
 * @param clientId OAuth client id. Required.
 * @param clientSecret OAuth client secret. Required.
 * @param redirectUri callback URL registered with the provider
 * @param authorizationUri authorization endpoint
 * @param tokenUri token endpoint
 * @param scopes requested scopes
 * @param timeout connect and read timeout for provider calls
 */
@ConfigurationProperties(prefix = "orgauth.idp")
@Validated
public record IdentityProviderProperties(
        @NotBlank String clientId,
        @NotBlank String clientSecret,
        URI redirectUri,
        URI authorizationUri,
        URI tokenUri,
        List<String> scopes,
        Duration timeout) {

    public IdentityProviderProperties {
        if (redirectUri == null) {
            redirectUri = URI.create("http://localhost:8080/auth/callback");
        }
        if (authorizationUri == null) {
            authorizationUri = URI.create("https://accounts.google.com/o/oauth2/v2/auth");
        }
        if (tokenUri == null) {
            tokenUri = URI.create("https://oauth2.googleapis.com/token");
        }
        if (scopes == null || scopes.isEmpty()) {
            scopes = List.of("openid", "email", "profile");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = Duration.ofSeconds(5);
        }
    }

    @Override
    public String toString() {
        return "IdentityProviderProperties[clientId=%s, clientSecret=[REDACTED], redirectUri=%s, tokenUri=%s]"
                .formatted(clientId, redirectUri, tokenUri);
    }
}
