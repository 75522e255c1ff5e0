package com.assistrelay.shared.model;

import java.util.Set;

public record RunStatus(String value) {

    public static final RunStatus QUEUED = new RunStatus("queued");
    public static final RunStatus IN_PROGRESS = new RunStatus("in_progress");
    public static final RunStatus REQUIRES_ACTION = new RunStatus("requires_action");
    public static final RunStatus CANCELLING = new RunStatus("cancelling");
    public static final RunStatus CANCELLED = new RunStatus("cancelled");
    public static final RunStatus FAILED = new RunStatus("failed");
    public static final RunStatus COMPLETED = new RunStatus("completed");
    public static final RunStatus INCOMPLETE = new RunStatus("incomplete");
    public static final RunStatus EXPIRED = new RunStatus("expired");
    // never sent by the backend; produced when a bounded poll gives up
    public static final RunStatus TIMED_OUT = new RunStatus("timed_out");

    private static final Set<String> PENDING = Set.of("queued", "in_progress");

    public RunStatus {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Run status must not be blank");
        }
    }

    public static RunStatus of(String value) {
        return new RunStatus(value);
    }

    public boolean isTerminal() {
        return !PENDING.contains(value);
    }

    public boolean isCompleted() {
        return COMPLETED.value.equals(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
