package com.assistrelay.shared.model;

/**
 * A run created on the assistant backend. {@code threadId} is the backend's thread,
 * not the Slack thread the request came from.
 */
public record RunHandle(
    String runId,
    String threadId
) {}
