package com.orgauth.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.orgauth.security.testing.TestIdentityContextFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RoleChecker")
class RoleCheckerTest {

    private final List<SecurityEvent> recorded = new ArrayList<>();
    private final RoleChecker checker = new RoleChecker(recorded::add);

    @Nested
    @DisplayName("authorize()")
    class Authorize {

        @Test
        @DisplayName("permits when any required role is held")
        void anyRoleHeld() {
            var ctx = TestIdentityContextFactory.createWithRoles("member");

            assertThatCode(() -> checker.authorize(ctx, Set.of("owner", "member")))
                    .doesNotThrowAnyException();
            assertThat(recorded).isEmpty();
        }

        @Test
        @DisplayName("permits any authenticated identity when nothing is required")
        void emptyRequirement() {
            var ctx = TestIdentityContextFactory.createWithRoles();

            assertThatCode(() -> checker.authorize(ctx, Set.of())).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("denies with INSUFFICIENT_ROLE and records the denial")
        void denies() {
            var ctx = TestIdentityContextFactory.createWithRoles("member");

            assertThatThrownBy(() -> checker.authorize(ctx, Set.of("owner")))
                    .isInstanceOf(AuthException.class)
                    .satisfies(e -> assertThat(((AuthException) e).category())
                            .isEqualTo(FailureCategory.FORBIDDEN));

            assertThat(recorded).singleElement().satisfies(event -> {
                assertThat(event.type()).isEqualTo(SecurityEventType.ACCESS_DENIED);
                assertThat(event.attributes())
                        .containsEntry("heldRoles", "member")
                        .containsEntry("requiredRoles", "owner");
            });
        }

        @Test
        @DisplayName("compares role names exactly")
        void exactComparison() {
            var ctx = TestIdentityContextFactory.createWithRoles("Owner");

            assertThatThrownBy(() -> checker.authorize(ctx, Set.of("owner")))
                    .isInstanceOf(AuthException.class);
        }
    }

    @Nested
    @DisplayName("static checks")
    class StaticChecks {

        @Test
        @DisplayName("hasAnyRole treats null as no requirement")
        void hasAnyRoleNull() {
            assertThat(RoleChecker.hasAnyRole(TestIdentityContextFactory.create(), null)).isTrue();
        }
    }
}
