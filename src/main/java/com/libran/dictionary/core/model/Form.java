package com.libran.dictionary.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A target-language form of an entry.
 * Either a plain surface string or an ordered map of grammatical sub-forms
 * (e.g. nominative/genitive). Heuristics always work on {@link #surface()}.
 */
public final class Form {

    private static final List<String> SURFACE_KEYS = List.of("base", "lemma", "nominative", "nom");

    private final String text;
    private final Map<String, String> subForms;

    private Form(String text, Map<String, String> subForms) {
        this.text = text;
        this.subForms = subForms;
    }

    /**
     * Creates a plain form.
     */
    public static Form of(String text) {
        Objects.requireNonNull(text, "text is required");
        return new Form(text, Map.of());
    }

    /**
     * Creates a structured form. Insertion order of the map is preserved.
     */
    public static Form structured(Map<String, String> subForms) {
        Objects.requireNonNull(subForms, "subForms is required");
        if (subForms.isEmpty()) {
            throw new IllegalArgumentException("structured form needs at least one sub-form");
        }
        return new Form(null, Collections.unmodifiableMap(new LinkedHashMap<>(subForms)));
    }

    public boolean isStructured() {
        return text == null;
    }

    /**
     * The surface string used for matching: the plain text, or for a structured form the
     * first of base/lemma/nominative/nom that is present, else the first sub-form.
     */
    public String surface() {
        if (text != null) {
            return text;
        }
        for (String key : SURFACE_KEYS) {
            String value = subForms.get(key);
            if (value != null) {
                return value;
            }
        }
        return subForms.values().iterator().next();
    }

    public Map<String, String> subForms() {
        return subForms;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Form form = (Form) o;
        return Objects.equals(text, form.text) && Objects.equals(subForms, form.subForms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, subForms);
    }

    @Override
    public String toString() {
        return text != null ? text : subForms.toString();
    }
}
