package com.assistrelay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter eventsReceived() {
        return Counter.builder("assistrelay.events.received").register(registry);
    }

    public Counter eventsDuplicate() {
        return Counter.builder("assistrelay.events.duplicate").register(registry);
    }

    public Counter runsCompleted() {
        return Counter.builder("assistrelay.runs.completed").register(registry);
    }

    public Counter runsFailed() {
        return Counter.builder("assistrelay.runs.failed").register(registry);
    }

    public Counter repliesSuppressed() {
        return Counter.builder("assistrelay.replies.suppressed").register(registry);
    }

    public Timer runLatency() {
        return Timer.builder("assistrelay.run.latency").register(registry);
    }
}
