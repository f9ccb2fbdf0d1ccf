package com.libran.dictionary.lifecycle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libran.dictionary.core.model.FragmentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Fragment store backed by directories:
 * <pre>
 * &lt;root&gt;/            pending fragments
 * &lt;root&gt;/merged/     fragments consumed by a merge
 * &lt;root&gt;/delete/     fragments of a dictionary that passed QA, safe to discard
 * </pre>
 * The latest run manifest is written to {@code <root>/lifecycle-manifest.json}.
 */
public class DirectoryFragmentStore implements FragmentStore {
    private static final Logger log = LoggerFactory.getLogger(DirectoryFragmentStore.class);

    public static final String MANIFEST_FILE = "lifecycle-manifest.json";
    public static final String MERGED_DIR = "merged";
    public static final String DELETED_DIR = "delete";

    private final Path root;
    private final ObjectMapper mapper;

    public DirectoryFragmentStore(Path root) {
        this.root = Objects.requireNonNull(root, "root is required");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Resolves the directory of an area, creating it if needed.
     */
    public Path directory(FragmentArea area) throws IOException {
        Path dir = switch (area) {
            case PENDING -> root;
            case MERGED -> root.resolve(MERGED_DIR);
            case DELETED -> root.resolve(DELETED_DIR);
        };
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            log.info("store.directoryCreated path={}", dir);
        }
        return dir;
    }

    @Override
    public List<String> list(FragmentArea area) throws IOException {
        Path dir = directory(area);
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .filter(name -> !MANIFEST_FILE.equals(name))
                    .sorted()
                    .toList();
        }
    }

    @Override
    public FragmentSource read(FragmentArea area, String name) throws IOException {
        Path file = directory(area).resolve(name);
        return new FragmentSource(name, Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * Moves a fragment, replacing a fragment of the same name already in the target area.
     * A tranche resubmitted under its old name supersedes the earlier copy.
     */
    @Override
    public void move(String name, FragmentArea from, FragmentArea to) throws IOException {
        Path source = directory(from).resolve(name);
        Path target = directory(to).resolve(name);
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }
        boolean replacing = Files.exists(target);
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        if (replacing) {
            log.info("store.replaced fragment={} area={}", name, to);
        }
        log.debug("store.moved fragment={} from={} to={}", name, from, to);
    }

    @Override
    public void saveManifest(LifecycleManifest manifest) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("runId", manifest.runId());
        node.put("state", manifest.state().name());
        ArrayNode fragments = node.putArray("fragments");
        manifest.fragments().forEach(fragments::add);
        ArrayNode history = node.putArray("history");
        for (LifecycleTransition transition : manifest.history()) {
            history.addObject()
                    .put("from", transition.from().name())
                    .put("to", transition.to().name())
                    .put("at", transition.at().toString());
        }
        Files.writeString(root.resolve(MANIFEST_FILE), mapper.writeValueAsString(node), StandardCharsets.UTF_8);
    }

    @Override
    public String describe() {
        return root.toString();
    }

    /**
     * The absolute, normalized root, so relative and absolute spellings of one directory
     * share a lock.
     */
    @Override
    public String lockKey() {
        return root.toAbsolutePath().normalize().toString();
    }
}
