package com.orgauth.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orgauth.security.IdentityContext;
import java.util.List;
import java.util.TreeSet;

/** The caller's identity as carried by its token. */
public record WhoAmIResponse(UserContext user) {

    public record UserContext(
            @JsonProperty("user_id") String userId,
            @JsonProperty("tenant_id") String tenantId,
            String email,
            List<String> roles) {}

    public static WhoAmIResponse from(IdentityContext identity) {
        return new WhoAmIResponse(new UserContext(
                identity.userId(),
                identity.tenantId(),
                identity.email(),
                List.copyOf(new TreeSet<>(identity.roles()))));
    }
}
