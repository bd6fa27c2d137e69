package com.modelmonitor.service;

import com.modelmonitor.config.LifecycleProperties;
import com.modelmonitor.exception.PersistenceFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Runs persistence work in a transaction, retrying transient database failures with exponential
 * backoff. Exhausted retries and other infrastructure errors surface as
 * {@link PersistenceFailureException}; unique-constraint violations and domain exceptions pass
 * through unchanged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DurableWrites {

    private final TransactionTemplate transactionTemplate;
    private final LifecycleProperties properties;

    public <T> T inTransaction(String operation, TransactionCallback<T> work) {
        return deferred(operation, work).block();
    }

    public void run(String operation, Runnable work) {
        inTransaction(operation, status -> {
            work.run();
            return null;
        });
    }

    /** The retrying pipeline behind {@link #inTransaction}; nothing runs until subscription. */
    <T> Mono<T> deferred(String operation, TransactionCallback<T> work) {
        LifecycleProperties.Persistence cfg = properties.getPersistence();
        return Mono.fromCallable(() -> transactionTemplate.execute(work))
            .retryWhen(Retry.backoff(Math.max(0, cfg.getMaxAttempts() - 1), cfg.getBackoff())
                .filter(DurableWrites::isTransient)
                .doBeforeRetry(sig -> log.warn("Retrying persistence | operation={} | attempt={} | error={}",
                    operation, sig.totalRetries() + 1, sig.failure().getMessage()))
                .onRetryExhaustedThrow((spec, sig) -> new PersistenceFailureException(operation, sig.failure())))
            .onErrorMap(DurableWrites::isInfrastructureFailure, ex -> new PersistenceFailureException(operation, ex));
    }

    private static boolean isTransient(Throwable ex) {
        return ex instanceof TransientDataAccessException
            || ex instanceof RecoverableDataAccessException;
    }

    private static boolean isInfrastructureFailure(Throwable ex) {
        return (ex instanceof DataAccessException && !(ex instanceof DataIntegrityViolationException))
            || ex instanceof TransactionException;
    }
}
