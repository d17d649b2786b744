package com.orgauth.authservice.api;

import com.orgauth.authservice.config.AuthServiceProperties;
import com.orgauth.authservice.domain.login.IssuedToken;
import com.orgauth.authservice.domain.login.LoginHandshake;
import com.orgauth.authservice.domain.login.LoginInitiation;
import java.time.Duration;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Login entry points. Both are exempt from the access gate.
 *
 * <p>The login-attempt key travels in an HttpOnly, SameSite=Lax cookie scoped to {@code /auth}.
 * The anti-forgery state itself never leaves the server except inside the provider redirect.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    public static final String LOGIN_COOKIE = "orgauth_login";

    private final LoginHandshake loginHandshake;
    private final boolean secureCookie;

    public AuthController(LoginHandshake loginHandshake, AuthServiceProperties properties) {
        this.loginHandshake = loginHandshake;
        this.secureCookie = properties.loginCookieSecure();
    }

    @RequestMapping(value = "/login", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<Void> login() {
        LoginInitiation initiation = loginHandshake.initiateLogin();
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(initiation.authorizationUrl())
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.SET_COOKIE,
                        loginCookie(initiation.attemptKey(), initiation.expiresIn()).toString())
                .build();
    }

    @GetMapping("/callback")
    public ResponseEntity<TokenResponse> callback(
            @RequestParam(name = "state", required = false) String state,
            @RequestParam(name = "code", required = false) String code,
            @CookieValue(name = LOGIN_COOKIE, required = false) String attemptKey) {
        IssuedToken token = loginHandshake.completeLogin(attemptKey, state, code);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.SET_COOKIE, loginCookie("", Duration.ZERO).toString())
                .body(TokenResponse.from(token));
    }

    private ResponseCookie loginCookie(String value, Duration maxAge) {
        return ResponseCookie.from(LOGIN_COOKIE, value)
                .httpOnly(true)
                .secure(secureCookie)
                .sameSite("Lax")
                .path("/auth")
                .maxAge(maxAge)
                .build();
    }
}
