package com.assistrelay.shared.config;

import java.time.Duration;

public record AssistantConfig(
    String baseUrl,
    String apiKey,
    String assistantId,
    long pollIntervalMs,
    long maxWaitMs,
    int timeoutSeconds
) {
    public static AssistantConfig defaults() {
        return new AssistantConfig("https://api.openai.com/v1", "", "", 5_000, 0, 30);
    }

    public Duration pollInterval() {
        return Duration.ofMillis(pollIntervalMs);
    }

    /** Upper bound on a single run's polling; {@code null} waits indefinitely. */
    public Duration maxWait() {
        return maxWaitMs > 0 ? Duration.ofMillis(maxWaitMs) : null;
    }
}
