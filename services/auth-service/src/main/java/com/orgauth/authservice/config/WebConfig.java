package com.orgauth.authservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgauth.authservice.infrastructure.web.AccessGateFilter;
import com.orgauth.authservice.infrastructure.ratelimit.ClientRateLimiter;
import com.orgauth.authservice.infrastructure.web.IdentityContextArgumentResolver;
import com.orgauth.authservice.infrastructure.web.LoginRateLimitFilter;
import com.orgauth.authservice.infrastructure.web.RouteAuthorizationInterceptor;
import com.orgauth.security.AccessGate;
import com.orgauth.security.RoleChecker;
import com.orgauth.security.SecurityEventSink;
import java.util.List;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: request pipeline, CORS and the identity argument resolver.
 *
 * <p>The request pipeline runs in a fixed order: {@code RequestIdFilter} (highest precedence),
 * then the {@link LoginRateLimitFilter}, then the {@link AccessGateFilter}, then the {@link RouteAuthorizationInterceptor} before the
 * handler.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final int LOGIN_RATE_LIMIT_ORDER = Ordered.HIGHEST_PRECEDENCE + 5;
    static final int ACCESS_GATE_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    private final AuthServiceProperties properties;
    private final RoleChecker roleChecker;

    public WebConfig(AuthServiceProperties properties, RoleChecker roleChecker) {
        this.properties = properties;
        this.roleChecker = roleChecker;
    }

    @Bean
    FilterRegistrationBean<LoginRateLimitFilter> loginRateLimitFilter(
            SecurityEventSink events, ObjectMapper objectMapper) {
        var limit = properties.rateLimit();
        var limiter = new ClientRateLimiter(
                "login", limit.requestsPerPeriod(), limit.period(), limit.maxTrackedClients());
        var registration = new FilterRegistrationBean<>(new LoginRateLimitFilter(limiter, events, objectMapper));
        registration.setOrder(LOGIN_RATE_LIMIT_ORDER);
        registration.addUrlPatterns("/*");
        registration.setEnabled(limit.enabled());
        return registration;
    }

    @Bean
    FilterRegistrationBean<AccessGateFilter> accessGateFilter(AccessGate accessGate, ObjectMapper objectMapper) {
        var registration = new FilterRegistrationBean<>(new AccessGateFilter(accessGate, objectMapper));
        registration.setOrder(ACCESS_GATE_ORDER);
        registration.addUrlPatterns("/*");
        return registration;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(
                new RouteAuthorizationInterceptor(properties.routeRolePolicy(), roleChecker));
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new IdentityContextArgumentResolver());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/auth/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowCredentials(true)
                .maxAge(3600);
        registry.addMapping("/secure/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);
    }
}
