package com.docgate.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
        void emptyByDefault() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("stores and clears the context")
        void storesAndClears() {
            var ctx = new CorrelationContext("corr-1", "tenant_a", "user_1", "users.get");
            CorrelationContextHolder.set(ctx);
            assertThat(CorrelationContextHolder.get()).contains(ctx);

            CorrelationContextHolder.clear();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects a null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects a blank correlation id")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" ", null, null, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("populates every non-null key")
        void populates() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "tenant_a", "user_1", "tenants.update"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("tenantId")).isEqualTo("tenant_a");
            assertThat(MDC.get("userId")).isEqualTo("user_1");
            assertThat(MDC.get("operation")).isEqualTo("tenants.update");
        }

        @Test
        @DisplayName("updateTenant rewrites only the tenant key")
        void updateTenant() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", null, "user_1", "users.get"));
            assertThat(MDC.get("tenantId")).isNull();

            CorrelationContextHolder.updateTenant("tenant_b");

            assertThat(MDC.get("tenantId")).isEqualTo("tenant_b");
            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
        }

        @Test
        @DisplayName("clear removes all keys")
        void clearRemovesKeys() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "tenant_a", "user_1", "op"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("operation")).isNull();
        }
    }

    @Nested
    @DisplayName("callWithContext")
    class CallWithContext {

        @Test
        @DisplayName("returns the result and restores the outer context")
        void restoresOuter() {
            var outer = new CorrelationContext("outer", null, null, null);
            var inner = new CorrelationContext("inner", null, null, null);
            CorrelationContextHolder.set(outer);

            String seen = CorrelationContextHolder.callWithContext(inner,
                    () -> CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElseThrow());

            assertThat(seen).isEqualTo("inner");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("clears the context even when the work throws")
        void clearsOnFailure() {
            var ctx = CorrelationContext.start("user_1", "users.delete");

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(ctx, () -> {
                throw new IllegalStateException("boom");
            })).isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("correlationId")).isNull();
        }
    }
}
