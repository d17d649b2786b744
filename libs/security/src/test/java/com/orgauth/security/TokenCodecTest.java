package com.orgauth.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.orgauth.security.testing.TestIdentityContextFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TokenCodec")
class TokenCodecTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:15:30.750Z");

    private MutableClock clock;
    private TokenCodec codec;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        codec = new TokenCodec(TestIdentityContextFactory.signingConfig(), clock);
    }

    @Nested
    @DisplayName("issue() then verify()")
    class RoundTrip {

        @Test
        @DisplayName("returns the issued claim set")
        void returnsClaims() {
            var claims = new TokenClaims(
                    "user-1", "tenant-1", "ada@example.com", Set.of("owner", "member"),
                    Map.of("locale", "en"));

            VerifiedToken verified = codec.verify(codec.issue(claims, Duration.ofMinutes(5)));

            assertThat(verified.claims()).isEqualTo(claims);
        }

        @Test
        @DisplayName("stamps iat and exp with second precision")
        void stampsTimestamps() {
            VerifiedToken verified =
                    codec.verify(codec.issue(TestIdentityContextFactory.claims("member"), Duration.ofMinutes(5)));

            assertThat(verified.issuedAt()).isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
            assertThat(verified.expiresAt()).isEqualTo(Instant.parse("2026-03-01T10:20:30Z"));
        }

        @Test
        @DisplayName("uses the configured TTL when none is given")
        void defaultTtl() {
            VerifiedToken verified = codec.verify(codec.issue(TestIdentityContextFactory.claims()));

            assertThat(Duration.between(verified.issuedAt(), verified.expiresAt()))
                    .isEqualTo(Duration.ofMinutes(15));
        }

        @Test
        @DisplayName("produces a three-segment compact token")
        void compactFormat() {
            String token = codec.issue(TestIdentityContextFactory.claims("member"));

            assertThat(token.split("\\.")).hasSize(3);
            String header = new String(Base64.getUrlDecoder().decode(token.split("\\.")[0]));
            assertThat(header).contains("\"alg\":\"HS256\"");
        }

        @Test
        @DisplayName("accepts an empty role set")
        void emptyRoles() {
            VerifiedToken verified = codec.verify(codec.issue(TestIdentityContextFactory.claims()));

            assertThat(verified.claims().roles()).isEmpty();
        }
    }

    @Nested
    @DisplayName("issue() rejects")
    class IssueRejects {

        @Test
        @DisplayName("a zero TTL")
        void zeroTtl() {
            assertThatThrownBy(() -> codec.issue(TestIdentityContextFactory.claims(), Duration.ZERO))
                    .isInstanceOf(AuthException.class)
                    .extracting(e -> ((AuthException) e).code())
                    .isEqualTo(AuthErrorCode.INTERNAL_ERROR);
        }

        @Test
        @DisplayName("a blank subject")
        void blankSubject() {
            var claims = new TokenClaims(" ", "tenant-1", "a@example.com", Set.of());

            assertThatThrownBy(() -> codec.issue(claims))
                    .isInstanceOf(AuthException.class)
                    .hasMessageContaining("subject");
        }

        @Test
        @DisplayName("an extension that shadows a reserved claim")
        void reservedExtension() {
            var claims = new TokenClaims(
                    "user-1", "tenant-1", "a@example.com", Set.of(), Map.of("tenant_id", "other"));

            assertThatThrownBy(() -> codec.issue(claims))
                    .isInstanceOf(AuthException.class)
                    .hasMessageContaining("tenant_id");
        }
    }

    @Nested
    @DisplayName("verify() rejects")
    class VerifyRejects {

        @Test
        @DisplayName("a token whose signature has a flipped bit")
        void flippedSignatureBit() {
            String[] parts = codec.issue(TestIdentityContextFactory.claims("member")).split("\\.");
            byte[] signature = Base64.getUrlDecoder().decode(parts[2]);
            signature[0] ^= 0x01;
            String tampered = parts[0] + "." + parts[1] + "."
                    + Base64.getUrlEncoder().withoutPadding().encodeToString(signature);

            assertCode(tampered, AuthErrorCode.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("a token whose payload was swapped for another tenant")
        void swappedPayload() {
            String[] original = codec.issue(TestIdentityContextFactory.claims("member")).split("\\.");
            String[] other = codec.issue(
                    new TokenClaims("user-1", "tenant-other", "a@example.com", Set.of("owner"))).split("\\.");
            String spliced = original[0] + "." + other[1] + "." + original[2];

            assertCode(spliced, AuthErrorCode.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("a token signed with another key")
        void wrongKey() {
            var otherCodec = new TokenCodec(
                    new TokenSigningConfig("HS256", "another-secret-that-is-long-enough-0123456789",
                            Duration.ofMinutes(5)),
                    clock);

            assertCode(otherCodec.issue(TestIdentityContextFactory.claims()), AuthErrorCode.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("a token signed with a different algorithm than configured")
        void algorithmMismatch() {
            String secret = "x".repeat(64);
            var hs512 = new TokenCodec(new TokenSigningConfig("HS512", secret, Duration.ofMinutes(5)), clock);
            var hs256 = new TokenCodec(new TokenSigningConfig("HS256", secret, Duration.ofMinutes(5)), clock);

            String token = hs512.issue(TestIdentityContextFactory.claims());

            assertThatThrownBy(() -> hs256.verify(token))
                    .isInstanceOf(AuthException.class)
                    .extracting(e -> ((AuthException) e).code())
                    .isEqualTo(AuthErrorCode.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("an expired token")
        void expired() {
            String token = codec.issue(TestIdentityContextFactory.claims(), Duration.ofSeconds(60));
            clock.advance(Duration.ofSeconds(61));

            assertCode(token, AuthErrorCode.EXPIRED);
        }

        @Test
        @DisplayName("an expired token with a bad signature as a signature failure")
        void signatureCheckedBeforeExpiry() {
            String[] parts = codec.issue(TestIdentityContextFactory.claims(), Duration.ofSeconds(60)).split("\\.");
            clock.advance(Duration.ofHours(1));
            byte[] signature = Base64.getUrlDecoder().decode(parts[2]);
            signature[signature.length - 1] ^= 0x10;
            String tampered = parts[0] + "." + parts[1] + "."
                    + Base64.getUrlEncoder().withoutPadding().encodeToString(signature);

            assertCode(tampered, AuthErrorCode.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("strings that are not compact tokens")
        void malformed() {
            assertCode("not-a-token", AuthErrorCode.MALFORMED);
            assertCode("", AuthErrorCode.MALFORMED);
            assertCode("a.b.c", AuthErrorCode.MALFORMED);
        }

        @Test
        @DisplayName("null")
        void nullToken() {
            assertCode(null, AuthErrorCode.MALFORMED);
        }

        private void assertCode(String token, AuthErrorCode expected) {
            assertThatThrownBy(() -> codec.verify(token))
                    .isInstanceOf(AuthException.class)
                    .extracting(e -> ((AuthException) e).code())
                    .isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("verified token projects onto an identity context")
    void toIdentityContext() {
        var claims = new TokenClaims("user-9", "tenant-9", "u9@example.com", Set.of("owner"));

        IdentityContext identity = codec.verify(codec.issue(claims)).toIdentityContext();

        assertThat(identity).isEqualTo(new IdentityContext("user-9", "tenant-9", "u9@example.com", Set.of("owner")));
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
