package com.wtwr.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("returns empty when no context is set")
        void emptyWhenUnset() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("stores and clears the context")
        void storesAndClears() {
            var ctx = new CorrelationContext("corr-1", null, "GET", "/items");
            CorrelationContextHolder.set(ctx);
            assertThat(CorrelationContextHolder.get()).contains(ctx);

            CorrelationContextHolder.clear();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects a null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("rejects a blank correlation id")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, "GET", "/"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("populates MDC keys and skips null fields")
        void populatesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "POST", "/items"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("method")).isEqualTo("POST");
            assertThat(MDC.get("path")).isEqualTo("/items");
            assertThat(MDC.get("userId")).isNull();
        }

        @Test
        @DisplayName("update adds the authenticated user to the MDC")
        void updateAddsUser() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "GET", "/users/me"));

            CorrelationContextHolder.update(ctx -> ctx.withUserId("682255cb2a5cc9620dd1e058"));

            assertThat(MDC.get("userId")).isEqualTo("682255cb2a5cc9620dd1e058");
            assertThat(CorrelationContextHolder.get())
                    .hasValueSatisfying(ctx -> assertThat(ctx.correlationId()).isEqualTo("corr-1"));
        }

        @Test
        @DisplayName("update without a context is a no-op")
        void updateWithoutContext() {
            CorrelationContextHolder.update(ctx -> ctx.withUserId("u"));

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("userId")).isNull();
        }

        @Test
        @DisplayName("clear removes all MDC keys")
        void clearRemovesKeys() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "u-1", "GET", "/items"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("path")).isNull();
        }
    }
}
