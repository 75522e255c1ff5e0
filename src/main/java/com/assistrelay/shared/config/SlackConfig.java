package com.assistrelay.shared.config;

public record SlackConfig(
    String baseUrl,
    String botToken,
    String adminMemberId,
    int timeoutSeconds
) {
    public static SlackConfig defaults() {
        return new SlackConfig("https://slack.com/api", "", "", 10);
    }
}
