package com.atrium.audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuditRecorder")
class AuditRecorderTest {

    private final InMemoryAuditStore store = new InMemoryAuditStore();
    private final AuditRecorder recorder = new AuditRecorder(store, new AuditEntryFactory());

    @Nested
    @DisplayName("record()")
    class Record {

        @Test
        @DisplayName("appends exactly one entry attributed to the actor")
        void appendsOne() {
            var entry = recorder.record(7L, 2L, AuditAction.DELETE, EntityRef.of(EntityKind.PROJECT, 11L));

            assertThat(store.entries).containsExactly(entry);
            assertThat(entry.actorUserId()).isEqualTo(7L);
            assertThat(entry.tenantId()).isEqualTo(2L);
            assertThat(entry.entity()).isEqualTo(EntityRef.of(EntityKind.PROJECT, 11L));
        }

        @Test
        @DisplayName("invalid entry is not appended")
        void invalidNotAppended() {
            assertThatThrownBy(() -> recorder.record(0L, 2L, AuditAction.CREATE, EntityRef.of(EntityKind.TAG, 1L)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("actorUserId");
            assertThat(store.entries).isEmpty();
        }

        @Test
        @DisplayName("store failure propagates to the caller")
        void storeFailure() {
            var failing = new AuditRecorder(new InMemoryAuditStore() {
                @Override
                public void append(AuditEntry entry) {
                    throw new IllegalStateException("disk full");
                }
            }, new AuditEntryFactory());

            assertThatThrownBy(() -> failing.record(1L, 1L, AuditAction.UPDATE, EntityRef.of(EntityKind.PROJECT, 1L)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("history()")
    class History {

        @Test
        @DisplayName("returns only the tenant's entries, newest first")
        void tenantScopedNewestFirst() {
            var clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
            var timed = new AuditRecorder(store, new AuditEntryFactory(clock));
            var first = timed.record(1L, 5L, AuditAction.CREATE, EntityRef.of(EntityKind.PROJECT, 1L));
            clock.advance(Duration.ofMinutes(1));
            timed.record(2L, 6L, AuditAction.CREATE, EntityRef.of(EntityKind.PROJECT, 2L));
            clock.advance(Duration.ofMinutes(1));
            var third = timed.record(1L, 5L, AuditAction.DELETE, EntityRef.of(EntityKind.PROJECT, 1L));

            List<AuditEntry> history = timed.history(5L, 10, 0);

            assertThat(history).containsExactly(third, first);
            assertThat(timed.history(5L, 1, 1)).containsExactly(first);
        }

        @Test
        @DisplayName("rejects a non-positive limit")
        void badLimit() {
            assertThatThrownBy(() -> recorder.history(1L, 0, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("publish() tolerates an entry without correlation id")
    void publish() {
        var entry = recorder.record(1L, 1L, AuditAction.CREATE, EntityRef.of(EntityKind.USER, 9L));

        recorder.publish(entry);

        assertThat(entry.correlationId()).isNull();
    }

    private static final class MutableClock extends Clock {
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
