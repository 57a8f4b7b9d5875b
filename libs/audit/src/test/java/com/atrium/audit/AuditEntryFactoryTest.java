package com.atrium.audit;

import com.atrium.observability.CorrelationContext;
import com.atrium.observability.CorrelationContextHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditEntryFactory")
class AuditEntryFactoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final AuditEntryFactory factory = new AuditEntryFactory(Clock.fixed(NOW, ZoneOffset.UTC));

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("fills id, timestamp and entity fields")
    void fillsFields() {
        var entry = factory.create(3L, 10L, AuditAction.DELETE, EntityRef.of(EntityKind.PROJECT, 77L));

        assertThat(entry.entryId())
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");
        assertThat(entry.actorUserId()).isEqualTo(3L);
        assertThat(entry.tenantId()).isEqualTo(10L);
        assertThat(entry.entityKind()).isEqualTo(EntityKind.PROJECT);
        assertThat(entry.entityId()).isEqualTo(77L);
        assertThat(entry.occurredAt()).isEqualTo(NOW);
        assertThat(entry.qualifiedAction()).isEqualTo("project.delete");
    }

    @Test
    @DisplayName("stamps the current correlation id")
    void stampsCorrelationId() {
        CorrelationContextHolder.set(CorrelationContext.forRequest("corr-42"));

        var entry = factory.create(3L, 10L, AuditAction.CREATE, EntityRef.of(EntityKind.TAG, 1L));

        assertThat(entry.correlationId()).isEqualTo("corr-42");
    }

    @Test
    @DisplayName("correlation id is null outside a request")
    void noCorrelationOutsideRequest() {
        var entry = factory.create(3L, 10L, AuditAction.CREATE, EntityRef.of(EntityKind.TAG, 1L));

        assertThat(entry.correlationId()).isNull();
    }

    @Test
    @DisplayName("two entries never share an id")
    void uniqueIds() {
        var ref = EntityRef.of(EntityKind.USER, 5L);

        assertThat(factory.create(1L, 1L, AuditAction.CREATE, ref).entryId())
                .isNotEqualTo(factory.create(1L, 1L, AuditAction.CREATE, ref).entryId());
    }
}
