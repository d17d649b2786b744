package com.orgauth.authservice.api;

import com.orgauth.authservice.domain.identity.TenantDirectory;
import com.orgauth.security.IdentityContext;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Protected API. Every route requires a verified token; role requirements come from the
 * configured route-role table.
 */
@RestController
@RequestMapping("/secure")
public class SecureController {

    private static final Logger log = LoggerFactory.getLogger(SecureController.class);

    private final TenantDirectory tenantDirectory;

    public SecureController(TenantDirectory tenantDirectory) {
        this.tenantDirectory = tenantDirectory;
    }

    @GetMapping("/whoami")
    public WhoAmIResponse whoami(IdentityContext identity) {
        log.info("User accessed whoami endpoint");
        return WhoAmIResponse.from(identity);
    }

    @GetMapping("/tenants/{tenantId}")
    public TenantResponse tenant(IdentityContext identity, @PathVariable String tenantId) {
        return tenantDirectory.tenant(identity, tenantId)
                .map(TenantResponse::from)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Tenant not found"));
    }

    @GetMapping("/tenants/{tenantId}/users")
    public List<TenantUserResponse> users(IdentityContext identity, @PathVariable String tenantId) {
        return tenantDirectory.members(identity, tenantId).stream()
                .map(TenantUserResponse::from)
                .toList();
    }
}
