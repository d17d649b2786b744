package com.orgauth.authservice.infrastructure.persistence;

import com.orgauth.authservice.domain.identity.DuplicateIdentityException;
import com.orgauth.authservice.domain.identity.ExternalIdentity;
import com.orgauth.authservice.domain.identity.IdentityStore;
import com.orgauth.authservice.domain.identity.Membership;
import com.orgauth.authservice.domain.identity.Tenant;
import com.orgauth.authservice.domain.identity.User;
import com.orgauth.security.AuthErrorCode;
import com.orgauth.security.AuthException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link IdentityStore} over the {@code tenants}, {@code users} and {@code user_roles} tables.
 *
 * <p>Write methods run in a single transaction each. Unique-key violations roll back the whole
 * transaction and surface as {@link DuplicateIdentityException}.
 */
public class JdbcIdentityStore implements IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdentityStore.class);

    private static final String USER_COLUMNS =
            "id, tenant_id, external_subject, email, display_name, created_at";

    private static final RowMapper<User> USER_MAPPER = (rs, rowNum) -> new User(
            rs.getString("id"),
            rs.getString("tenant_id"),
            rs.getString("external_subject"),
            rs.getString("email"),
            rs.getString("display_name"),
            instant(rs, "created_at"));

    private static final RowMapper<Tenant> TENANT_MAPPER = (rs, rowNum) -> new Tenant(
            rs.getString("id"), rs.getString("tenant_key"), instant(rs, "created_at"));

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final Clock clock;

    public JdbcIdentityStore(JdbcTemplate jdbc, TransactionTemplate transactions, Clock clock) {
        this.jdbc = jdbc;
        this.transactions = transactions;
        this.clock = clock;
    }

    @Override
    public Optional<User> findUserByExternalSubject(String externalSubject) {
        return read(() -> jdbc.query(
                "SELECT " + USER_COLUMNS + " FROM users WHERE external_subject = ?",
                USER_MAPPER, externalSubject).stream().findFirst());
    }

    @Override
    public Membership createTenantAndOwner(ExternalIdentity identity, String tenantKey, String ownerRole) {
        Instant now = now();
        Tenant tenant = new Tenant(UUID.randomUUID().toString(), tenantKey, now);
        User user = newUser(tenant.id(), identity, now);
        write(() -> {
            jdbc.update(
                    "INSERT INTO tenants (id, tenant_key, created_at) VALUES (?, ?, ?)",
                    tenant.id(), tenant.tenantKey(), Timestamp.from(now));
            insertUser(user);
            insertRole(user, ownerRole);
        });
        log.info("Created tenant {} with owner {}", tenant.id(), user.id());
        return new Membership(tenant, user, Set.of(ownerRole));
    }

    @Override
    public Membership addMember(String tenantId, ExternalIdentity identity, String role) {
        Tenant tenant = findTenant(tenantId)
                .orElseThrow(() -> new AuthException(
                        AuthErrorCode.STORE_UNAVAILABLE, "Tenant " + tenantId + " does not exist"));
        User user = newUser(tenantId, identity, now());
        write(() -> {
            insertUser(user);
            insertRole(user, role);
        });
        log.info("Added user {} to tenant {}", user.id(), tenantId);
        return new Membership(tenant, user, Set.of(role));
    }

    @Override
    public Set<String> getRoles(String userId, String tenantId) {
        return read(() -> new LinkedHashSet<>(jdbc.queryForList(
                "SELECT role FROM user_roles WHERE user_id = ? AND tenant_id = ? ORDER BY role",
                String.class, userId, tenantId)));
    }

    @Override
    public Optional<Tenant> findTenant(String tenantId) {
        return read(() -> jdbc.query(
                "SELECT id, tenant_key, created_at FROM tenants WHERE id = ?",
                TENANT_MAPPER, tenantId).stream().findFirst());
    }

    @Override
    public Optional<Tenant> findTenantByKey(String tenantKey) {
        return read(() -> jdbc.query(
                "SELECT id, tenant_key, created_at FROM tenants WHERE tenant_key = ?",
                TENANT_MAPPER, tenantKey).stream().findFirst());
    }

    @Override
    public List<User> listUsers(String tenantId) {
        return read(() -> jdbc.query(
                "SELECT " + USER_COLUMNS + " FROM users WHERE tenant_id = ? ORDER BY created_at, id",
                USER_MAPPER, tenantId));
    }

    private void insertUser(User user) {
        jdbc.update(
                "INSERT INTO users (" + USER_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                user.id(), user.tenantId(), user.externalSubject(), user.email(),
                user.displayName(), Timestamp.from(user.createdAt()));
    }

    private void insertRole(User user, String role) {
        jdbc.update(
                "INSERT INTO user_roles (user_id, tenant_id, role) VALUES (?, ?, ?)",
                user.id(), user.tenantId(), role);
    }

    private static User newUser(String tenantId, ExternalIdentity identity, Instant now) {
        return new User(
                UUID.randomUUID().toString(), tenantId, identity.subject(),
                identity.email(), identity.displayName(), now);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private void write(Runnable statements) {
        try {
            transactions.executeWithoutResult(status -> statements.run());
        } catch (DuplicateKeyException e) {
            throw new DuplicateIdentityException("Unique constraint violated", e);
        } catch (DataAccessException | TransactionException e) {
            throw unavailable(e);
        }
    }

    private static <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw unavailable(e);
        }
    }

    private static AuthException unavailable(RuntimeException e) {
        return new AuthException(AuthErrorCode.STORE_UNAVAILABLE, "Identity store failed", e);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }
}
