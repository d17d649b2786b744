package com.orgauth.authservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgauth.authservice.domain.identity.IdentityResolver;
import com.orgauth.authservice.domain.identity.IdentityStore;
import com.orgauth.authservice.domain.identity.TenantDirectory;
import com.orgauth.authservice.domain.login.IdentityProviderClient;
import com.orgauth.authservice.domain.login.LoginHandshake;
import com.orgauth.authservice.domain.login.LoginStateStore;
import com.orgauth.authservice.infrastructure.idp.OidcIdentityProviderClient;
import com.orgauth.authservice.infrastructure.logging.LoggingSecurityEventSink;
import com.orgauth.authservice.infrastructure.login.InMemoryLoginStateStore;
import com.orgauth.authservice.infrastructure.persistence.InMemoryIdentityStore;
import com.orgauth.authservice.infrastructure.persistence.JdbcIdentityStore;
import com.orgauth.observability.SecurityMetrics;
import com.orgauth.observability.SensitiveDataRedactor;
import com.orgauth.security.AccessGate;
import com.orgauth.security.RoleChecker;
import com.orgauth.security.SecurityEventSink;
import com.orgauth.security.TokenCodec;
import io.micrometer.core.instrument.MeterRegistry;
import java.security.SecureRandom;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

/**
 * Wires the security core, the login handshake and their adapters.
 *
 * <p>Every component receives its configuration through its constructor.
 */
@Configuration(proxyBeanMethods = false)
public class AuthConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    TokenCodec tokenCodec(AuthServiceProperties properties, Clock clock) {
        var signing = properties.token().toSigningConfig();
        log.info("Token signing configured: {}", signing);
        return new TokenCodec(signing, clock);
    }

    @Bean
    SecurityMetrics securityMetrics(
            MeterRegistry registry, @Value("${spring.application.name:auth-service}") String serviceName) {
        return new SecurityMetrics(registry, serviceName);
    }

    @Bean
    SecurityEventSink securityEventSink(SecurityMetrics metrics) {
        return new LoggingSecurityEventSink(new SensitiveDataRedactor(), metrics);
    }

    @Bean
    AccessGate accessGate(TokenCodec tokenCodec, AuthServiceProperties properties, SecurityEventSink events) {
        return new AccessGate(tokenCodec, properties.exemptPaths(), events);
    }

    @Bean
    RoleChecker roleChecker(SecurityEventSink events) {
        return new RoleChecker(events);
    }

    @Bean
    @ConditionalOnProperty(name = "orgauth.auth.storage", havingValue = "jdbc", matchIfMissing = true)
    IdentityStore jdbcIdentityStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, Clock clock) {
        return new JdbcIdentityStore(jdbcTemplate, transactionTemplate, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "orgauth.auth.storage", havingValue = "memory")
    IdentityStore inMemoryIdentityStore(Clock clock) {
        log.warn("Using in-memory identity store; tenants and users are lost on restart");
        return new InMemoryIdentityStore(clock);
    }

    @Bean
    IdentityResolver identityResolver(
            IdentityStore store, AuthServiceProperties properties, SecurityEventSink events) {
        var tenancy = properties.tenancy();
        log.info("Tenant resolution policy: {}", tenancy.policy());
        return new IdentityResolver(
                store,
                tenancy.policy().create(tenancy.fixedTenantKey()),
                tenancy.ownerRole(),
                tenancy.memberRole(),
                events);
    }

    @Bean
    TenantDirectory tenantDirectory(IdentityStore store) {
        return new TenantDirectory(store);
    }

    @Bean
    LoginStateStore loginStateStore(Clock clock, AuthServiceProperties properties) {
        return new InMemoryLoginStateStore(clock, properties.loginStateTtl(), properties.loginStateMaxEntries());
    }

    @Bean
    IdentityProviderClient identityProviderClient(
            IdentityProviderProperties properties, RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        var settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.timeout())
                .withReadTimeout(properties.timeout());
        restClientBuilder.requestFactory(ClientHttpRequestFactories.get(settings));
        return new OidcIdentityProviderClient(properties, restClientBuilder, objectMapper);
    }

    @Bean
    LoginHandshake loginHandshake(
            IdentityProviderClient identityProviderClient,
            IdentityResolver identityResolver,
            TokenCodec tokenCodec,
            LoginStateStore loginStateStore,
            AuthServiceProperties properties,
            SecureRandom secureRandom,
            Clock clock,
            SecurityEventSink events) {
        return new LoginHandshake(
                identityProviderClient,
                identityResolver,
                tokenCodec,
                loginStateStore,
                properties.loginStateTtl(),
                secureRandom,
                clock,
                events);
    }
}
