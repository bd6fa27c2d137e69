package com.modelmonitor.event;

/**
 * Outbound channel for alerts and job transitions. Delivery to live consumers is at-least-once
 * and belongs to the implementation.
 */
public interface LifecycleEventBus {

    void publish(LifecycleEvent event);
}
