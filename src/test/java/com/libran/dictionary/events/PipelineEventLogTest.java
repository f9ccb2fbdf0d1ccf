package com.libran.dictionary.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineEventLogTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:30Z");

    @Test
    @DisplayName("Should stamp events with the log's clock")
    void testClock() {
        PipelineEventLog log = new PipelineEventLog(Clock.fixed(NOW, ZoneOffset.UTC));

        PipelineEvent event = log.record(PipelineEventType.FRAGMENT_MERGED, "a.json", "test", Map.of("entries", 3));

        assertEquals(NOW, event.timestamp());
        assertEquals(3, event.details().get("entries"));
    }

    @Test
    @DisplayName("Should filter by type in recording order")
    void testByType() {
        PipelineEventLog log = new PipelineEventLog();
        log.record(PipelineEventType.FRAGMENT_MERGED, "a.json", "test");
        log.record(PipelineEventType.FRAGMENT_SKIPPED, "b.json", "test");
        log.record(PipelineEventType.FRAGMENT_MERGED, "c.json", "test");

        assertEquals(3, log.size());
        assertEquals(2, log.getByType(PipelineEventType.FRAGMENT_MERGED).size());
        assertEquals("c.json", log.getByType(PipelineEventType.FRAGMENT_MERGED).get(1).subject());
        assertThrows(UnsupportedOperationException.class, () -> log.getAll().clear());
    }

    @Test
    @DisplayName("Should require a timestamp on hand-built events")
    void testBuilderRequiresTimestamp() {
        assertThrows(NullPointerException.class,
                () -> PipelineEvent.builder().type(PipelineEventType.RUN_STARTED).subject("run").build());

        PipelineEvent event = PipelineEvent.builder()
                .type(PipelineEventType.RUN_STARTED)
                .subject("run")
                .timestamp(NOW)
                .build();
        assertEquals(NOW, new PipelineEventLog().record(event).timestamp());
    }
}
