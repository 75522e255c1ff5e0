package com.assistrelay.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookReply(
    String status,
    String message,
    String challenge
) {
    public static WebhookReply ok() {
        return new WebhookReply("ok", null, null);
    }

    public static WebhookReply ok(String message) {
        return new WebhookReply("ok", message, null);
    }

    public static WebhookReply error(String message) {
        return new WebhookReply("error", message, null);
    }

    public static WebhookReply challenge(String challenge) {
        return new WebhookReply(null, null, challenge);
    }

    @JsonIgnore
    public boolean isOk() {
        return "ok".equals(status);
    }
}
