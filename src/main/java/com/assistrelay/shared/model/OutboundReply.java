package com.assistrelay.shared.model;

public record OutboundReply(
    String channelId,
    String threadTs,
    String text
) {}
