package com.oracle.optmcts.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.backoff.BackOffExecution;

import java.util.concurrent.CancellationException;

@Slf4j
public final class Retries {

    @FunctionalInterface
    public interface Attempt<T> {
        T call() throws Exception;
    }

    private Retries() {
    }

    /**
     * Run {@code attempt} until it returns, retrying any exception per the policy.
     *
     * @throws RetryExhaustedException when every attempt failed
     * @throws CancellationException when the calling thread is interrupted while waiting
     */
    public static <T> T withRetry(RetryPolicy policy, String operation, Attempt<T> attempt) {
        BackOffExecution backOff = policy.toBackOff().start();
        int attempts = 0;
        Exception last = null;
        while (attempts < policy.maxAttempts()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(operation + " cancelled");
            }
            attempts++;
            try {
                return attempt.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException(operation + " cancelled");
            } catch (Exception e) {
                last = e;
                log.warn("{} attempt {}/{} failed: {}", operation, attempts, policy.maxAttempts(), e.getMessage());
            }
            if (attempts < policy.maxAttempts()) {
                pause(backOff.nextBackOff(), operation);
            }
        }
        throw new RetryExhaustedException(operation, attempts, last);
    }

    public static void pause(long millis, String operation) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " cancelled");
        }
    }
}
