package com.assistrelay.dedup;

import com.assistrelay.shared.error.PersistenceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Appends each claimed id as one JSON string per line. A claim costs one append instead of a full
 * rewrite. Ids from a legacy JSON snapshot, when present, are loaded alongside the log.
 */
public class AppendLogDedupStore extends FileBackedDedupStore {

    private static final Logger log = LoggerFactory.getLogger(AppendLogDedupStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;

    public AppendLogDedupStore(Path path, Path legacySnapshot) {
        super(readAll(path, legacySnapshot));
        this.path = path;
        log.info("Loaded {} processed events from {}", size(), path);
    }

    public AppendLogDedupStore(Path path) {
        this(path, null);
    }

    private static Set<String> readAll(Path path, Path legacySnapshot) {
        var ids = new LinkedHashSet<>(JsonFileDedupStore.readSnapshot(legacySnapshot));
        if (!Files.exists(path)) {
            return ids;
        }
        try {
            int lineNo = 0;
            for (var line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    ids.add(MAPPER.readValue(line, String.class));
                } catch (IOException e) {
                    // usually a write torn by a crash; the rest of the log is still good
                    log.warn("Skipping unreadable line {} in {}", lineNo, path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading processed events from {}, starting empty", path, e);
            return new LinkedHashSet<>(JsonFileDedupStore.readSnapshot(legacySnapshot));
        }
        return ids;
    }

    @Override
    protected void persist(String added, Set<String> all) {
        try {
            var target = path.toAbsolutePath();
            Files.createDirectories(target.getParent());
            Files.writeString(target, MAPPER.writeValueAsString(added) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
        } catch (IOException e) {
            throw new PersistenceException("Failed to append processed event to " + path, e);
        }
    }
}
