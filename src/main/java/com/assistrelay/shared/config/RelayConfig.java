package com.assistrelay.shared.config;

public record RelayConfig(
    AssistantConfig assistant,
    SlackConfig slack,
    DedupConfig dedup
) {}
