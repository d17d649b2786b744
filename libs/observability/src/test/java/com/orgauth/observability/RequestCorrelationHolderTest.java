package com.orgauth.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests for {@link RequestCorrelationHolder}: ThreadLocal storage, MDC bridge and identity
 * attachment.
 */
@DisplayName("RequestCorrelationHolder")
class RequestCorrelationHolderTest {

    @AfterEach
    void cleanup() {
        RequestCorrelationHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when nothing is set")
        void emptyByDefault() {
            assertThat(RequestCorrelationHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should populate and clear the MDC")
        void mdcBridge() {
            RequestCorrelationHolder.set(new RequestCorrelation("req-1", "user-1", "tenant-1"));

            assertThat(MDC.get(RequestCorrelation.MDC_REQUEST_ID)).isEqualTo("req-1");
            assertThat(MDC.get(RequestCorrelation.MDC_USER_ID)).isEqualTo("user-1");
            assertThat(MDC.get(RequestCorrelation.MDC_TENANT_ID)).isEqualTo("tenant-1");

            RequestCorrelationHolder.clear();

            assertThat(MDC.get(RequestCorrelation.MDC_REQUEST_ID)).isNull();
            assertThat(MDC.get(RequestCorrelation.MDC_USER_ID)).isNull();
            assertThat(RequestCorrelationHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null and blank request ids")
        void rejectsInvalid() {
            assertThatThrownBy(() -> RequestCorrelationHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RequestCorrelation.forRequest(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("requestId");
        }
    }

    @Nested
    @DisplayName("attachIdentity()")
    class AttachIdentity {

        @Test
        @DisplayName("should add user and tenant to the current correlation")
        void addsIdentity() {
            RequestCorrelationHolder.set(RequestCorrelation.forRequest("req-2"));

            RequestCorrelationHolder.attachIdentity("user-2", "tenant-2");

            assertThat(RequestCorrelationHolder.get())
                    .contains(new RequestCorrelation("req-2", "user-2", "tenant-2"));
            assertThat(MDC.get(RequestCorrelation.MDC_TENANT_ID)).isEqualTo("tenant-2");
        }

        @Test
        @DisplayName("should do nothing without a current correlation")
        void noCorrelation() {
            RequestCorrelationHolder.attachIdentity("user-3", "tenant-3");

            assertThat(RequestCorrelationHolder.get()).isEmpty();
            assertThat(MDC.get(RequestCorrelation.MDC_USER_ID)).isNull();
        }
    }
}
