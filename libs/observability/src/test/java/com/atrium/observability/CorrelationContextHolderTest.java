package com.atrium.observability;

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
    @DisplayName("set() / get()")
    class SetAndGet {

        @Test
        @DisplayName("returns empty when nothing is set")
        void emptyByDefault() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(CorrelationContextHolder.currentCorrelationId()).isNull();
        }

        @Test
        @DisplayName("populates MDC with correlation and request IDs")
        void populatesMdc() {
            var ctx = CorrelationContext.forRequest("corr-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.currentCorrelationId()).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo(ctx.requestId());
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("bindCaller()")
    class BindCaller {

        @Test
        @DisplayName("adds tenant and user to the current context and MDC")
        void bindsCaller() {
            CorrelationContextHolder.set(CorrelationContext.forRequest("corr-2"));

            CorrelationContextHolder.bindCaller(7L, 42L);

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.correlationId()).isEqualTo("corr-2");
            assertThat(ctx.tenantId()).isEqualTo("7");
            assertThat(ctx.userId()).isEqualTo("42");
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isEqualTo("7");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("42");
        }

        @Test
        @DisplayName("is a no-op outside a request")
        void noOpWithoutContext() {
            CorrelationContextHolder.bindCaller(7L, 42L);

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }
    }

    @Test
    @DisplayName("clear() removes the context and every MDC key")
    void clearRemovesEverything() {
        CorrelationContextHolder.set(CorrelationContext.forRequest("corr-3"));
        CorrelationContextHolder.bindCaller(1L, 2L);

        CorrelationContextHolder.clear();

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
        assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
        assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isNull();
    }

    @Test
    @DisplayName("blank correlation ID is rejected")
    void blankCorrelationIdRejected() {
        assertThatThrownBy(() -> CorrelationContext.forRequest(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}
