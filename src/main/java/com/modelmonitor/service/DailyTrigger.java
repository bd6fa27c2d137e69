package com.modelmonitor.service;

import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.dto.CycleReport;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * Fires {@link LifecycleCycleService#runCycle()} once a day at the configured local time. The
 * daily time is turned into a cron trigger evaluated against the injected clock.
 */
@Slf4j
@Component
public class DailyTrigger {

    private final LifecycleCycleService cycleService;
    private final Clock clock;
    private final LifecycleProperties.Scheduler config;
    private final String cron;
    private final ZoneId zone;

    private ThreadPoolTaskScheduler scheduler;
    private volatile ScheduledFuture<?> next;

    public DailyTrigger(LifecycleCycleService cycleService, Clock clock, LifecycleProperties properties) {
        this.cycleService = cycleService;
        this.clock = clock;
        this.config = properties.getScheduler();
        LocalTime dailyTime = LocalTime.parse(config.getDailyTime());
        this.cron = "0 " + dailyTime.getMinute() + " " + dailyTime.getHour() + " * * *";
        this.zone = ZoneId.of(config.getZone());
    }

    @PostConstruct
    void start() {
        if (!config.isEnabled()) {
            log.info("Daily trigger disabled");
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("lifecycle-daily-");
        scheduler.setDaemon(true);
        scheduler.setClock(clock);
        scheduler.initialize();
        next = scheduler.schedule(this::fire, new CronTrigger(cron, zone));
        log.info("Daily cycle scheduled | cron={} | zone={} | nextRun={}",
                 cron, zone, nextRunAfter(ZonedDateTime.now(clock)));
    }

    @PreDestroy
    void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
            log.info("Daily trigger stopped");
        }
    }

    public boolean isScheduled() {
        ScheduledFuture<?> current = next;
        return current != null && !current.isDone();
    }

    String cron() {
        return cron;
    }

    /**
     * The first occurrence of the daily time strictly after {@code now}.
     */
    public ZonedDateTime nextRunAfter(ZonedDateTime now) {
        return CronExpression.parse(cron).next(now.withZoneSameInstant(zone));
    }

    void fire() {
        try {
            CycleReport report = cycleService.runCycle();
            log.info("Daily cycle finished | date={} | skipped={} | models={}",
                     report.getCycleDate(), report.isSkipped(), report.getOutcomes().size());
        } catch (RuntimeException ex) {
            log.error("Daily cycle crashed | error={}", ex.getMessage(), ex);
        }
    }
}
