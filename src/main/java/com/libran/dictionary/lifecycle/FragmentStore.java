package com.libran.dictionary.lifecycle;

import com.libran.dictionary.core.model.FragmentSource;

import java.io.IOException;
import java.util.List;

/**
 * Storage backing the fragment lifecycle. Implementations decide what "moving" a
 * fragment means; the lifecycle itself is tracked by {@link LifecycleManifest}.
 */
public interface FragmentStore {

    /**
     * Lists fragment names in an area, sorted by name.
     */
    List<String> list(FragmentArea area) throws IOException;

    /**
     * Reads one fragment.
     */
    FragmentSource read(FragmentArea area, String name) throws IOException;

    /**
     * Moves one fragment between areas. A fragment of the same name already in the target
     * area is replaced.
     *
     * @throws IOException if the fragment is not in the source area or cannot be moved
     */
    void move(String name, FragmentArea from, FragmentArea to) throws IOException;

    /**
     * Persists the manifest of a run. Stores without durable state may ignore it.
     */
    default void saveManifest(LifecycleManifest manifest) throws IOException {
    }

    /**
     * A human-readable location of this store, used in metadata and logs.
     */
    String describe();

    /**
     * Key under which runs over this store are serialized. Two stores backed by the same
     * location must return the same key.
     */
    default String lockKey() {
        return describe();
    }
}
