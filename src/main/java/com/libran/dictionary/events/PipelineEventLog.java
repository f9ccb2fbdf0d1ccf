package com.libran.dictionary.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of pipeline events. Thread-safe so that parallel QA and audit
 * evaluation can record into the same log.
 */
public class PipelineEventLog {
    private static final Logger log = LoggerFactory.getLogger(PipelineEventLog.class);

    private final List<PipelineEvent> events = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public PipelineEventLog() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock stamps every event recorded through {@link #record(PipelineEventType, String, String, Map)}
     */
    public PipelineEventLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public PipelineEvent record(PipelineEvent event) {
        events.add(event);
        log.debug("event.recorded type={} subject={} actor={}", event.type(), event.subject(), event.actor());
        return event;
    }

    public PipelineEvent record(PipelineEventType type, String subject, String actor, Map<String, Object> details) {
        return record(PipelineEvent.builder()
                .type(type)
                .subject(subject)
                .actor(actor)
                .details(details)
                .timestamp(clock.instant())
                .build());
    }

    public PipelineEvent record(PipelineEventType type, String subject, String actor) {
        return record(type, subject, actor, null);
    }

    public List<PipelineEvent> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    public List<PipelineEvent> getByType(PipelineEventType type) {
        return events.stream()
                .filter(e -> e.type() == type)
                .toList();
    }

    public int size() {
        return events.size();
    }
}
