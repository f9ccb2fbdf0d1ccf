package com.libran.dictionary.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One English-to-Libran mapping with optional Ancient and Modern forms
 * and an optional etymology note.
 * An entry with neither form is valid but will accumulate QA issues.
 */
public final class Entry {
    private final String english;
    private final Form ancient;
    private final Form modern;
    private final String notes;

    private Entry(Builder builder) {
        this.english = builder.english.trim();
        this.ancient = builder.ancient;
        this.modern = builder.modern;
        this.notes = builder.notes;
    }

    public String getEnglish() {
        return english;
    }

    public Form getAncient() {
        return ancient;
    }

    public Form getModern() {
        return modern;
    }

    public String getNotes() {
        return notes;
    }

    /**
     * Surface string of the Ancient form, or null if absent.
     */
    public String ancientSurface() {
        return ancient != null ? ancient.surface() : null;
    }

    /**
     * Surface string of the Modern form, or null if absent.
     */
    public String modernSurface() {
        return modern != null ? modern.surface() : null;
    }

    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }

    /**
     * Key used for deduplication: trimmed, root-locale lower-cased English.
     */
    public String dedupKey() {
        return english.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entry entry = (Entry) o;
        return english.equals(entry.english)
                && Objects.equals(ancient, entry.ancient)
                && Objects.equals(modern, entry.modern)
                && Objects.equals(notes, entry.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(english, ancient, modern, notes);
    }

    @Override
    public String toString() {
        return "Entry{" +
                "english='" + english + '\'' +
                ", ancient=" + ancient +
                ", modern=" + modern +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String english;
        private Form ancient;
        private Form modern;
        private String notes;

        public Builder english(String english) {
            this.english = english;
            return this;
        }

        public Builder ancient(Form ancient) {
            this.ancient = ancient;
            return this;
        }

        public Builder ancient(String ancient) {
            this.ancient = ancient != null ? Form.of(ancient) : null;
            return this;
        }

        public Builder modern(Form modern) {
            this.modern = modern;
            return this;
        }

        public Builder modern(String modern) {
            this.modern = modern != null ? Form.of(modern) : null;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Entry build() {
            Objects.requireNonNull(english, "english is required");
            if (english.isBlank()) {
                throw new IllegalArgumentException("english must not be blank");
            }
            return new Entry(this);
        }
    }
}
