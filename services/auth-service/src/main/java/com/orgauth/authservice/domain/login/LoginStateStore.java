package com.orgauth.authservice.domain.login;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived, single-use storage for {@link LoginState}, keyed per login attempt.
 */
public interface LoginStateStore {

    void put(String attemptKey, LoginState state, Duration ttl);

    /**
     * Removes and returns the state for {@code attemptKey}. A second call for the same key, or a
     * call after the TTL has elapsed, returns empty.
     */
    Optional<LoginState> take(String attemptKey);
}
