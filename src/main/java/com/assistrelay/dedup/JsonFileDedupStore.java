package com.assistrelay.dedup;

import com.assistrelay.shared.error.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Stores the processed set as a JSON array, rewriting the whole file on every new claim.
 */
public class JsonFileDedupStore extends FileBackedDedupStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileDedupStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;

    public JsonFileDedupStore(Path path) {
        super(readSnapshot(path));
        this.path = path;
        log.info("Loaded {} processed events from {}", size(), path);
    }

    static List<String> readSnapshot(Path path) {
        if (path == null || !Files.exists(path)) {
            return List.of();
        }
        try {
            var ids = MAPPER.readValue(path.toFile(), new TypeReference<List<String>>() {});
            return ids != null ? ids : List.of();
        } catch (Exception e) {
            log.error("Error loading processed events from {}, starting empty", path, e);
            return List.of();
        }
    }

    @Override
    protected void persist(String added, Set<String> all) {
        var target = path.toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            var tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try {
                MAPPER.writeValue(tmp.toFile(), new ArrayList<>(all));
                move(tmp, target);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to save processed events to " + path, e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
