package com.orgauth.authservice.infrastructure.idp;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgauth.authservice.config.IdentityProviderProperties;
import com.orgauth.authservice.domain.login.IdentityAssertion;
import com.orgauth.authservice.domain.login.IdentityProviderClient;
import com.orgauth.security.AuthErrorCode;
import com.orgauth.security.AuthException;
import java.io.IOException;
import java.net.URI;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * OpenID Connect authorization-code client.
 *
 * <p>The code is exchanged at the token endpoint with client credentials in the form body. The
 * ID token in the response is read for {@code sub}, {@code email}, {@code name} and
 * {@code nonce}, and its audience must be this client. The ID token arrives over TLS straight
 * from the token endpoint, so its signature is not checked again here.
 */
public class OidcIdentityProviderClient implements IdentityProviderClient {

    private static final Logger log = LoggerFactory.getLogger(OidcIdentityProviderClient.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenEndpointResponse(@JsonProperty("id_token") String idToken) {}

    private final IdentityProviderProperties properties;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public OidcIdentityProviderClient(
            IdentityProviderProperties properties, RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        this.properties = properties;
        this.restClient = restClientBuilder.build();
        this.objectMapper = objectMapper;
    }

    @Override
    public URI buildAuthorizationUrl(String state, String nonce) {
        return UriComponentsBuilder.fromUri(properties.authorizationUri())
                .queryParam("response_type", "code")
                .queryParam("client_id", properties.clientId())
                .queryParam("redirect_uri", properties.redirectUri())
                .queryParam("scope", String.join(" ", properties.scopes()))
                .queryParam("state", state)
                .queryParam("nonce", nonce)
                .encode()
                .build()
                .toUri();
    }

    @Override
    public IdentityAssertion exchangeCode(String code) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", properties.redirectUri().toString());
        form.add("client_id", properties.clientId());
        form.add("client_secret", properties.clientSecret());

        TokenEndpointResponse response;
        try {
            response = restClient.post()
                    .uri(properties.tokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(TokenEndpointResponse.class);
        } catch (RestClientException e) {
            log.warn("Token endpoint call failed: {}", e.getMessage());
            throw new AuthException(AuthErrorCode.UPSTREAM_AUTH_ERROR, "Token endpoint call failed", e);
        }

        if (response == null || response.idToken() == null || response.idToken().isBlank()) {
            throw new AuthException(
                    AuthErrorCode.UPSTREAM_AUTH_ERROR, "Token endpoint returned no ID token");
        }
        return readIdToken(response.idToken());
    }

    private IdentityAssertion readIdToken(String idToken) {
        String[] parts = idToken.split("\\.");
        if (parts.length != 3) {
            throw new AuthException(AuthErrorCode.UPSTREAM_AUTH_ERROR, "ID token is not a compact JWT");
        }
        JsonNode payload;
        try {
            payload = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
        } catch (IOException | IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.UPSTREAM_AUTH_ERROR, "ID token payload is unreadable", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new AuthException(AuthErrorCode.UPSTREAM_AUTH_ERROR, "ID token payload is not an object");
        }
        if (!audienceMatches(payload.get("aud"))) {
            throw new AuthException(
                    AuthErrorCode.UPSTREAM_AUTH_ERROR, "ID token was issued for another client");
        }
        return new IdentityAssertion(
                text(payload, "sub"), text(payload, "email"), text(payload, "name"), text(payload, "nonce"));
    }

    private boolean audienceMatches(JsonNode audience) {
        if (audience == null) {
            return false;
        }
        if (audience.isArray()) {
            for (JsonNode entry : audience) {
                if (properties.clientId().equals(entry.asText())) {
                    return true;
                }
            }
            return false;
        }
        return properties.clientId().equals(audience.asText());
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
