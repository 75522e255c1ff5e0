package com.assistrelay.shared.config;

import java.nio.file.Path;

public record DedupConfig(
    String store,
    Path path,
    Path legacyPath
) {
    public static final String APPEND_LOG = "append-log";
    public static final String JSON = "json";

    public static DedupConfig defaults() {
        return new DedupConfig(APPEND_LOG, Path.of("processed_events.log"), Path.of("processed_events.json"));
    }
}
