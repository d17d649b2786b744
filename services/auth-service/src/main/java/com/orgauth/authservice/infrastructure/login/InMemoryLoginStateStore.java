package com.orgauth.authservice.infrastructure.login;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.orgauth.authservice.domain.login.LoginState;
import com.orgauth.authservice.domain.login.LoginStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link LoginStateStore} backed by a bounded Caffeine cache.
 *
 * <p>Entries are removed on first {@link #take}. The cache expires entries after the configured
 * login-state TTL and holds at most {@code maximumSize} of them, so unauthenticated login starts
 * cannot grow it without bound. A login whose state was evicted has to be started again.
 *
 * <p>Login attempts do not survive a restart and are not shared between instances; a
 * multi-instance deployment needs sticky sessions or a shared implementation.
 */
public class InMemoryLoginStateStore implements LoginStateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLoginStateStore.class);

    private record Entry(LoginState state, Instant expiresAt) {}

    private final Cache<String, Entry> entries;
    private final Clock clock;

    public InMemoryLoginStateStore(Clock clock, Duration ttl, long maximumSize) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(() -> nanos(clock.instant()))
                .build();
        log.info("Login state store: ttl={}, maximumSize={}", ttl, maximumSize);
    }

    @Override
    public void put(String attemptKey, LoginState state, Duration ttl) {
        entries.put(attemptKey, new Entry(state, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<LoginState> take(String attemptKey) {
        Entry entry = entries.asMap().remove(attemptKey);
        if (entry == null || !entry.expiresAt().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.state());
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private static long nanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }
}
