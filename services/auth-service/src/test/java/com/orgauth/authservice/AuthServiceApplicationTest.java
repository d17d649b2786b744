package com.orgauth.authservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgauth.authservice.api.AuthController;
import com.orgauth.authservice.domain.login.IdentityAssertion;
import com.orgauth.authservice.domain.login.IdentityProviderClient;
import com.orgauth.security.TokenClaims;
import com.orgauth.security.TokenCodec;
import jakarta.servlet.http.Cookie;
import java.net.URI;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Auth service")
class AuthServiceApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TokenCodec tokenCodec;

    @MockBean
    private IdentityProviderClient identityProvider;

    /** A completed login: the issued token and the claims it carries. */
    private record LoggedIn(String token, String userId, String tenantId) {

        String bearer() {
            return "Bearer " + token;
        }
    }

    @BeforeEach
    void setUp() {
        when(identityProvider.buildAuthorizationUrl(anyString(), anyString())).thenAnswer(inv -> URI.create(
                "https://idp.example.test/authorize?state=" + inv.getArgument(0) + "&nonce=" + inv.getArgument(1)));
    }

    private MvcResult startLogin() throws Exception {
        return mockMvc.perform(get("/auth/login"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, "no-store"))
                .andReturn();
    }

    private LoggedIn login(String subject, String email, String name) throws Exception {
        MvcResult started = startLogin();
        MultiValueMap<String, String> redirect = UriComponentsBuilder
                .fromUriString(started.getResponse().getHeader(HttpHeaders.LOCATION)).build().getQueryParams();
        Cookie attempt = started.getResponse().getCookie(AuthController.LOGIN_COOKIE);
        String code = "code-" + subject;
        when(identityProvider.exchangeCode(code))
                .thenReturn(new IdentityAssertion(subject, email, name, redirect.getFirst("nonce")));

        MvcResult result = mockMvc.perform(get("/auth/callback")
                        .param("state", redirect.getFirst("state"))
                        .param("code", code)
                        .cookie(attempt))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.expires_in").value(900))
                .andReturn();

        String token = objectMapper.readTree(result.getResponse().getContentAsString()).get("access_token").asText();
        TokenClaims claims = tokenCodec.verify(token).claims();
        return new LoggedIn(token, claims.subject(), claims.tenantId());
    }

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("redirects to the provider and sets an HttpOnly attempt cookie")
        void redirect() throws Exception {
            MvcResult result = startLogin();

            assertThat(result.getResponse().getHeader(HttpHeaders.LOCATION))
                    .startsWith("https://idp.example.test/authorize?state=");
            Cookie cookie = result.getResponse().getCookie(AuthController.LOGIN_COOKIE);
            assertThat(cookie).isNotNull();
            assertThat(cookie.isHttpOnly()).isTrue();
            assertThat(cookie.getPath()).isEqualTo("/auth");
            assertThat(result.getResponse().getHeader(HttpHeaders.SET_COOKIE)).contains("SameSite=Lax");
        }

        @Test
        @DisplayName("first login founds a tenant and whoami reports the owner")
        void firstLogin() throws Exception {
            LoggedIn ada = login("e2e-ada", "ada@e2e.test", "Ada");

            mockMvc.perform(get("/secure/whoami").header(HttpHeaders.AUTHORIZATION, ada.bearer()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.user.user_id").value(ada.userId()))
                    .andExpect(jsonPath("$.user.tenant_id").value(ada.tenantId()))
                    .andExpect(jsonPath("$.user.email").value("ada@e2e.test"))
                    .andExpect(jsonPath("$.user.roles[0]").value("owner"));
        }

        @Test
        @DisplayName("a returning user keeps user and tenant")
        void returningUser() throws Exception {
            LoggedIn first = login("e2e-bob", "bob@e2e.test", "Bob");
            LoggedIn second = login("e2e-bob", "bob@e2e.test", "Bob");

            assertThat(second.userId()).isEqualTo(first.userId());
            assertThat(second.tenantId()).isEqualTo(first.tenantId());
        }

        @Test
        @DisplayName("a forged state is refused before the provider is called")
        void forgedState() throws Exception {
            Cookie attempt = startLogin().getResponse().getCookie(AuthController.LOGIN_COOKIE);

            MvcResult result = mockMvc.perform(get("/auth/callback")
                            .param("state", "forged")
                            .param("code", "code-x")
                            .cookie(attempt))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Login Failed"))
                    .andReturn();

            verify(identityProvider, never()).exchangeCode(anyString());
            assertThat(result.getResponse().getContentAsString()).doesNotContain("STATE_MISMATCH");
        }

        @Test
        @DisplayName("a callback without an attempt cookie is refused")
        void noCookie() throws Exception {
            mockMvc.perform(get("/auth/callback").param("state", "s").param("code", "c"))
                    .andExpect(status().isBadRequest());

            verify(identityProvider, never()).exchangeCode(anyString());
        }

        @Test
        @DisplayName("an email taken by another subject is refused with the same body")
        void identityConflict() throws Exception {
            login("e2e-carol", "carol@e2e.test", "Carol");
            MvcResult started = startLogin();
            MultiValueMap<String, String> redirect = UriComponentsBuilder
                    .fromUriString(started.getResponse().getHeader(HttpHeaders.LOCATION)).build().getQueryParams();
            when(identityProvider.exchangeCode("code-impostor"))
                    .thenReturn(new IdentityAssertion("e2e-impostor", "carol@e2e.test", "Carol", redirect.getFirst("nonce")));

            mockMvc.perform(get("/auth/callback")
                            .param("state", redirect.getFirst("state"))
                            .param("code", "code-impostor")
                            .cookie(started.getResponse().getCookie(AuthController.LOGIN_COOKIE)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Login Failed"));
        }
    }

    @Nested
    @DisplayName("access gate")
    class Gate {

        @Test
        @DisplayName("a protected route without a token is 401 with a challenge")
        void noToken() throws Exception {
            mockMvc.perform(get("/secure/whoami"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                    .andExpect(jsonPath("$.title").value("Unauthorized"));
        }

        @Test
        @DisplayName("a tampered token is 401")
        void tamperedToken() throws Exception {
            LoggedIn dave = login("e2e-dave", "dave@e2e.test", "Dave");
            String tampered = dave.token().substring(0, dave.token().length() - 4) + "AAAA";

            mockMvc.perform(get("/secure/whoami").header(HttpHeaders.AUTHORIZATION, "Bearer " + tampered))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("health is reachable without a token")
        void healthExempt() throws Exception {
            mockMvc.perform(get("/actuator/health"))
                    .andExpect(status().isOk());
        }

        @Test
        @DisplayName("echoes the request id")
        void requestId() throws Exception {
            mockMvc.perform(get("/secure/whoami").header("X-Request-ID", "e2e-req-1"))
                    .andExpect(header().string("X-Request-ID", "e2e-req-1"))
                    .andExpect(jsonPath("$.requestId").value("e2e-req-1"));
        }
    }

    @Nested
    @DisplayName("tenant resources")
    class TenantResources {

        @Test
        @DisplayName("an owner reads its tenant and members")
        void ownTenant() throws Exception {
            LoggedIn erin = login("e2e-erin", "erin@e2e.test", "Erin");

            mockMvc.perform(get("/secure/tenants/{id}", erin.tenantId())
                            .header(HttpHeaders.AUTHORIZATION, erin.bearer()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.tenant_id").value(erin.tenantId()));

            MvcResult users = mockMvc.perform(get("/secure/tenants/{id}/users", erin.tenantId())
                            .header(HttpHeaders.AUTHORIZATION, erin.bearer()))
                    .andExpect(status().isOk())
                    .andReturn();
            JsonNode list = objectMapper.readTree(users.getResponse().getContentAsString());
            assertThat(list).hasSize(1);
            assertThat(list.get(0).get("email").asText()).isEqualTo("erin@e2e.test");
        }

        @Test
        @DisplayName("another tenant's resources are forbidden")
        void crossTenant() throws Exception {
            LoggedIn frank = login("e2e-frank", "frank@e2e.test", "Frank");
            LoggedIn gina = login("e2e-gina", "gina@e2e.test", "Gina");

            mockMvc.perform(get("/secure/tenants/{id}", gina.tenantId())
                            .header(HttpHeaders.AUTHORIZATION, frank.bearer()))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.title").value("Forbidden"));
        }

        @Test
        @DisplayName("listing members requires the owner role")
        void memberCannotList() throws Exception {
            LoggedIn hank = login("e2e-hank", "hank@e2e.test", "Hank");
            String memberToken = tokenCodec.issue(
                    new TokenClaims("e2e-member", hank.tenantId(), "member@e2e.test", Set.of("member")));

            mockMvc.perform(get("/secure/tenants/{id}/users", hank.tenantId())
                            .header(HttpHeaders.AUTHORIZATION, "Bearer " + memberToken))
                    .andExpect(status().isForbidden());
        }

        @ParameterizedTest(name = "{0}")
        @ValueSource(strings = {"/users;x=1", "/%75sers", "/users;jsessionid=abc", "/%75%73%65%72%73"})
        @DisplayName("the owner requirement holds for every spelling of the members path")
        void memberCannotListUnderAlternateSpelling(String suffix) throws Exception {
            String tag = Integer.toHexString(suffix.hashCode());
            LoggedIn ivy = login("e2e-ivy-" + tag, "ivy-" + tag + "@e2e.test", "Ivy");
            String memberToken = tokenCodec.issue(
                    new TokenClaims("e2e-member-ivy", ivy.tenantId(), "member-ivy@e2e.test", Set.of("member")));

            mockMvc.perform(get(URI.create("/secure/tenants/" + ivy.tenantId() + suffix))
                            .header(HttpHeaders.AUTHORIZATION, "Bearer " + memberToken))
                    .andExpect(status().isForbidden());
        }
    }
}
