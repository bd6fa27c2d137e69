package com.modelmonitor.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-model mutual exclusion for retraining, promotion and rollback. Acquisition never waits:
 * a held lock means the caller is rejected.
 */
@Component
public class ModelLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public boolean tryLock(String modelKey) {
        return locks.computeIfAbsent(modelKey, k -> new ReentrantLock()).tryLock();
    }

    public void unlock(String modelKey) {
        ReentrantLock lock = locks.get(modelKey);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    public boolean isLocked(String modelKey) {
        ReentrantLock lock = locks.get(modelKey);
        return lock != null && lock.isLocked();
    }
}
