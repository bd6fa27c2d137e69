package com.modelmonitor.config;

import com.modelmonitor.service.ResourceLimiter;
import com.modelmonitor.service.SemaphoreResourceLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class LifecycleConfig {

    @Bean
    public Clock clock(LifecycleProperties properties) {
        ZoneId zone = ZoneId.of(properties.getScheduler().getZone());
        log.info("Lifecycle clock initialised | zone={}", zone);
        return Clock.system(zone);
    }

    @Bean
    public ResourceLimiter resourceLimiter(LifecycleProperties properties) {
        return new SemaphoreResourceLimiter(properties.getLimiter().getPermits());
    }
}
