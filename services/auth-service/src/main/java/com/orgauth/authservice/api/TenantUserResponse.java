package com.orgauth.authservice.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orgauth.authservice.domain.identity.TenantDirectory;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

public record TenantUserResponse(
        @JsonProperty("user_id") String userId,
        String email,
        @JsonProperty("display_name") String displayName,
        List<String> roles,
        @JsonProperty("created_at") Instant createdAt) {

    public static TenantUserResponse from(TenantDirectory.Member member) {
        var user = member.user();
        return new TenantUserResponse(
                user.id(),
                user.email(),
                user.displayName(),
                List.copyOf(new TreeSet<>(member.roles())),
                user.createdAt());
    }
}
