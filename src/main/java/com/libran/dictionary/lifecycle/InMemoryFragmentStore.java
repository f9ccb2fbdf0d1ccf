package com.libran.dictionary.lifecycle;

import com.libran.dictionary.core.model.FragmentSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory fragment store. Used for embedding the pipeline and in tests.
 * Not thread-safe; runs over one store are serialized by the run lock.
 */
public class InMemoryFragmentStore implements FragmentStore {

    private final Map<FragmentArea, TreeMap<String, String>> areas = new EnumMap<>(FragmentArea.class);
    private final List<LifecycleManifest> manifests = new ArrayList<>();

    public InMemoryFragmentStore() {
        for (FragmentArea area : FragmentArea.values()) {
            areas.put(area, new TreeMap<>());
        }
    }

    /**
     * Adds a fragment to the pending area.
     */
    public InMemoryFragmentStore add(String name, String content) {
        areas.get(FragmentArea.PENDING).put(name, content);
        return this;
    }

    @Override
    public List<String> list(FragmentArea area) {
        return List.copyOf(areas.get(area).keySet());
    }

    @Override
    public FragmentSource read(FragmentArea area, String name) throws IOException {
        String content = areas.get(area).get(name);
        if (content == null) {
            throw new IOException("No fragment '" + name + "' in " + area);
        }
        return new FragmentSource(name, content);
    }

    /**
     * Moves a fragment, replacing one of the same name in the target area.
     */
    @Override
    public void move(String name, FragmentArea from, FragmentArea to) throws IOException {
        String content = areas.get(from).remove(name);
        if (content == null) {
            throw new IOException("No fragment '" + name + "' in " + from);
        }
        areas.get(to).put(name, content);
    }

    @Override
    public void saveManifest(LifecycleManifest manifest) {
        manifests.add(manifest);
    }

    /**
     * The most recently saved manifest.
     */
    public Optional<LifecycleManifest> lastManifest() {
        return manifests.isEmpty() ? Optional.empty() : Optional.of(manifests.get(manifests.size() - 1));
    }

    @Override
    public String describe() {
        return "memory";
    }

    @Override
    public String lockKey() {
        return "memory-" + Integer.toHexString(System.identityHashCode(this));
    }
}
