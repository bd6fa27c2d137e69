package com.modelmonitor.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Semaphore;

@Slf4j
public class SemaphoreResourceLimiter implements ResourceLimiter {

    private final Semaphore slots;

    public SemaphoreResourceLimiter(int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("permits must be >= 1");
        }
        this.slots = new Semaphore(permits, true);
        log.info("Resource limiter initialised | permits={}", permits);
    }

    @Override
    public void acquire() throws InterruptedException {
        slots.acquire();
    }

    @Override
    public void release() {
        slots.release();
    }
}
