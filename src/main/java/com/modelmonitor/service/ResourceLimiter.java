package com.modelmonitor.service;

/**
 * Compute slots that bound concurrent training and evaluation calls.
 */
public interface ResourceLimiter {

    void acquire() throws InterruptedException;

    void release();
}
