package com.modelmonitor.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpringLifecycleEventBus implements LifecycleEventBus {

    private final ApplicationEventPublisher events;

    @Override
    public void publish(LifecycleEvent event) {
        try {
            events.publishEvent(event);
            log.debug("Event published | type={} | model={}", event.type(), event.modelKey());
        } catch (RuntimeException ex) {
            // The state change is already committed; a listener failure must not undo it.
            log.error("Event listener failed | type={} | model={} | error={}",
                      event.type(), event.modelKey(), ex.getMessage(), ex);
        }
    }
}
