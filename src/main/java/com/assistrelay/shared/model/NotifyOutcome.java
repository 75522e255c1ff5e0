package com.assistrelay.shared.model;

public enum NotifyOutcome {
    SENT,
    SUPPRESSED
}
