package com.orgauth.authservice;

import com.orgauth.authservice.config.AuthServiceProperties;
import com.orgauth.authservice.config.IdentityProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * OrgAuth auth service.
 *
 * <p>Exchanges an OpenID Connect login for a locally signed bearer token and guards the
 * {@code /secure/**} API with it:
 *
 * <ul>
 *   <li>{@code /auth/login} redirects to the identity provider
 *   <li>{@code /auth/callback} resolves or provisions the tenant and user, then issues a token
 *   <li>{@code /secure/**} requires {@code Authorization: Bearer <token>}
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({AuthServiceProperties.class, IdentityProviderProperties.class})
public class AuthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
