package com.orgauth.authservice.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.orgauth.authservice.domain.identity.DuplicateIdentityException;
import com.orgauth.authservice.domain.identity.ExternalIdentity;
import com.orgauth.authservice.domain.identity.Membership;
import com.orgauth.authservice.domain.identity.User;
import com.orgauth.security.AuthErrorCode;
import com.orgauth.security.AuthException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

@DisplayName("JdbcIdentityStore")
class JdbcIdentityStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30.123456Z");
    private static final ExternalIdentity ADA = new ExternalIdentity("ext-1", "a@x.com", "Ada");

    private JdbcTemplate jdbc;
    private JdbcIdentityStore store;

    @BeforeEach
    void setUp() {
        var dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
                "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/migration/V1__identity_schema.sql"))
                .execute(dataSource);
        jdbc = new JdbcTemplate(dataSource);
        var transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        store = new JdbcIdentityStore(jdbc, transactions, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private int count(String table) {
        return jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    }

    @Test
    @DisplayName("creates tenant, owner and role in one go and reads them back")
    void createAndRead() {
        Membership created = store.createTenantAndOwner(ADA, null, "owner");

        User found = store.findUserByExternalSubject("ext-1").orElseThrow();
        assertThat(found).isEqualTo(created.user());
        assertThat(found.createdAt()).isEqualTo(Instant.parse("2026-03-01T10:15:30.123Z"));
        assertThat(store.getRoles(found.id(), found.tenantId())).containsExactly("owner");
        assertThat(store.findTenant(created.tenant().id())).contains(created.tenant());
        assertThat(store.listUsers(created.tenant().id())).containsExactly(found);
    }

    @Test
    @DisplayName("an unknown subject or tenant finds nothing")
    void findMissing() {
        assertThat(store.findUserByExternalSubject("nobody")).isEmpty();
        assertThat(store.findTenant("nope")).isEmpty();
        assertThat(store.findTenantByKey("domain:x.com")).isEmpty();
        assertThat(store.listUsers("nope")).isEmpty();
        assertThat(store.getRoles("u", "t")).isEmpty();
    }

    @Test
    @DisplayName("adds members to a keyed tenant")
    void addMember() {
        Membership owner = store.createTenantAndOwner(ADA, "domain:x.com", "owner");

        Membership member = store.addMember(
                owner.tenant().id(), new ExternalIdentity("ext-2", "g@x.com", "Grace"), "member");

        assertThat(store.findTenantByKey("domain:x.com")).contains(owner.tenant());
        assertThat(store.getRoles(member.user().id(), owner.tenant().id())).containsExactly("member");
        assertThat(store.listUsers(owner.tenant().id())).hasSize(2);
    }

    @Test
    @DisplayName("a duplicate subject fails without writing a second tenant")
    void duplicateSubject() {
        store.createTenantAndOwner(ADA, null, "owner");

        assertThatThrownBy(() -> store.createTenantAndOwner(
                new ExternalIdentity("ext-1", "other@x.com", "Ada again"), null, "owner"))
                .isInstanceOf(DuplicateIdentityException.class);

        assertThat(count("tenants")).isEqualTo(1);
        assertThat(count("users")).isEqualTo(1);
        assertThat(count("user_roles")).isEqualTo(1);
    }

    @Test
    @DisplayName("a duplicate email fails without writing")
    void duplicateEmail() {
        Membership owner = store.createTenantAndOwner(ADA, null, "owner");

        assertThatThrownBy(() -> store.addMember(
                owner.tenant().id(), new ExternalIdentity("ext-2", "a@x.com", "Impostor"), "member"))
                .isInstanceOf(DuplicateIdentityException.class);

        assertThat(count("users")).isEqualTo(1);
    }

    @Test
    @DisplayName("a duplicate tenant key fails")
    void duplicateTenantKey() {
        store.createTenantAndOwner(ADA, "domain:x.com", "owner");

        assertThatThrownBy(() -> store.createTenantAndOwner(
                new ExternalIdentity("ext-2", "g@x.com", "Grace"), "domain:x.com", "owner"))
                .isInstanceOf(DuplicateIdentityException.class);

        assertThat(count("tenants")).isEqualTo(1);
        assertThat(count("users")).isEqualTo(1);
    }

    @Test
    @DisplayName("database failures surface as STORE_UNAVAILABLE")
    void storeUnavailable() {
        jdbc.execute("DROP TABLE user_roles");

        assertThatThrownBy(() -> store.getRoles("u", "t"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).code())
                .isEqualTo(AuthErrorCode.STORE_UNAVAILABLE);
    }
}
