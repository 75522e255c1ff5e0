package com.assistrelay.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".assistrelay", "config.yaml"
    );

    public static RelayConfig load() {
        var override = System.getenv("ASSISTRELAY_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    public static RelayConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static RelayConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var assistant = (Map<String, Object>) raw.getOrDefault("assistant", Map.of());
        var slack = (Map<String, Object>) raw.getOrDefault("slack", Map.of());
        var dedup = (Map<String, Object>) raw.getOrDefault("dedup", Map.of());

        return new RelayConfig(
            parseAssistantConfig(assistant, env),
            parseSlackConfig(slack, env),
            parseDedupConfig(dedup, env)
        );
    }

    private static AssistantConfig parseAssistantConfig(Map<String, Object> assistant, Map<String, String> env) {
        var defaults = AssistantConfig.defaults();
        return new AssistantConfig(
            envOrDefault(env, "ASSISTANT_API_URL",
                String.valueOf(assistant.getOrDefault("base-url", defaults.baseUrl()))),
            envOrDefault(env, "API_KEY",
                String.valueOf(assistant.getOrDefault("api-key", defaults.apiKey()))),
            envOrDefault(env, "ASSISTANT_ID",
                String.valueOf(assistant.getOrDefault("assistant-id", defaults.assistantId()))),
            Long.parseLong(String.valueOf(assistant.getOrDefault("poll-interval-ms", defaults.pollIntervalMs()))),
            Long.parseLong(String.valueOf(assistant.getOrDefault("max-wait-ms", defaults.maxWaitMs()))),
            Integer.parseInt(String.valueOf(assistant.getOrDefault("timeout", defaults.timeoutSeconds())))
        );
    }

    private static SlackConfig parseSlackConfig(Map<String, Object> slack, Map<String, String> env) {
        var defaults = SlackConfig.defaults();
        return new SlackConfig(
            String.valueOf(slack.getOrDefault("base-url", defaults.baseUrl())),
            envOrDefault(env, "SLACK_BOT_TOKEN",
                String.valueOf(slack.getOrDefault("bot-token", defaults.botToken()))),
            envOrDefault(env, "SLACK_ADMIN_MEMBER_ID",
                String.valueOf(slack.getOrDefault("admin-member-id", defaults.adminMemberId()))),
            Integer.parseInt(String.valueOf(slack.getOrDefault("timeout", defaults.timeoutSeconds())))
        );
    }

    private static DedupConfig parseDedupConfig(Map<String, Object> dedup, Map<String, String> env) {
        var defaults = DedupConfig.defaults();
        var store = String.valueOf(dedup.getOrDefault("store", defaults.store()));
        if (!DedupConfig.APPEND_LOG.equals(store) && !DedupConfig.JSON.equals(store)) {
            throw new IllegalArgumentException("Unknown dedup.store: " + store);
        }
        var defaultPath = DedupConfig.JSON.equals(store) ? defaults.legacyPath() : defaults.path();
        return new DedupConfig(
            store,
            Path.of(envOrDefault(env, "PROCESSED_EVENTS_FILE",
                String.valueOf(dedup.getOrDefault("path", defaultPath.toString())))),
            Path.of(String.valueOf(dedup.getOrDefault("legacy-path", defaults.legacyPath().toString())))
        );
    }

    private static String envOrDefault(Map<String, String> env, String key, String fallback) {
        var val = env.get(key);
        return val != null ? val : fallback;
    }
}
