package com.assistrelay.shared.model;

import com.fasterxml.jackson.databind.JsonNode;

public record InboundEvent(
    String eventId,
    String channelId,
    String threadTs,
    String text,
    boolean retry
) {
    public static InboundEvent fromEnvelope(JsonNode body, String retryHeader) {
        var event = body.path("event");
        return new InboundEvent(
                textOrNull(body.path("event_id")),
                textOrNull(event.path("channel")),
                textOrNull(event.path("ts")),
                event.path("text").asText(""),
                retryHeader != null && !retryHeader.isBlank());
    }

    private static String textOrNull(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
