package com.libran.dictionary.events;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of something that happened during a run.
 *
 * @param id        unique event id
 * @param type      event type
 * @param subject   what the event is about (fragment name, English key, run id)
 * @param actor     component that recorded the event
 * @param details   extra key/value context
 * @param timestamp when the event was recorded
 */
public record PipelineEvent(
        String id,
        PipelineEventType type,
        String subject,
        String actor,
        Map<String, Object> details,
        Instant timestamp
) {
    public PipelineEvent {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private PipelineEventType type;
        private String subject;
        private String actor;
        private Map<String, Object> details;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(PipelineEventType type) {
            this.type = type;
            return this;
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public PipelineEvent build() {
            return new PipelineEvent(id, type, subject, actor, details, timestamp);
        }
    }
}
