package com.orgauth.authservice.domain.login;

import java.time.Instant;

/**
 * Anti-forgery values of one login attempt, held server-side between redirect and callback.
 *
 * @param state value echoed back by the provider in the callback
 * @param nonce value the provider embeds in the ID token
 * @param createdAt when the attempt started
 */
public record LoginState(String state, String nonce, Instant createdAt) {

    @Override
    public String toString() {
        return "LoginState[createdAt=" + createdAt + "]";
    }
}
