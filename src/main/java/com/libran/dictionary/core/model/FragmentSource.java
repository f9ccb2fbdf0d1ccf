package com.libran.dictionary.core.model;

import java.util.Objects;

/**
 * A tranche fragment as read from its store: the file name and its raw JSON text.
 *
 * @param name    fragment name (file name including extension)
 * @param content raw fragment content
 */
public record FragmentSource(String name, String content) {
    public FragmentSource {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(content, "content is required");
    }
}
