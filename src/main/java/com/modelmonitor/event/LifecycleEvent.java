package com.modelmonitor.event;

import java.time.Instant;
import java.util.Map;

public record LifecycleEvent(
    LifecycleEventType type,
    String modelKey,
    Instant occurredAt,
    Map<String, Object> payload
) {
    public LifecycleEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }
}
