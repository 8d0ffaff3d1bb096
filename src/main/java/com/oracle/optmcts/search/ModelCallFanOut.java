package com.oracle.optmcts.search;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a small batch of independent, read-only model calls and collects whichever succeed.
 * Results keep the order of the submitted calls.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelCallFanOut {

    private final ExecutorService modelCallExecutor;

    /**
     * @return one entry per call, empty where the call failed or was still running when the batch timeout ran out
     * @throws CancellationException if the searching thread is interrupted; pending calls are cancelled
     */
    public <T> List<Optional<T>> invokeAll(String operation, List<Callable<T>> calls, SearchSettings settings) {
        if (!settings.isParallelModelCalls() || calls.size() <= 1) {
            return invokeSequentially(operation, calls);
        }

        List<Future<T>> futures = new ArrayList<>(calls.size());
        for (Callable<T> call : calls) {
            futures.add(modelCallExecutor.submit(call));
        }

        // one deadline for the whole batch, so stuck calls do not add up
        long timeoutSeconds = settings.getModelCallTimeoutSeconds();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        List<Optional<T>> results = new ArrayList<>(calls.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.add(await(operation, i, futures.get(i), remaining, timeoutSeconds));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new CancellationException(operation + " cancelled");
        }
        return results;
    }

    private <T> Optional<T> await(String operation, int index, Future<T> future, long remainingNanos,
                                  long timeoutSeconds) throws InterruptedException {
        try {
            return Optional.ofNullable(future.get(remainingNanos, TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} #{} timed out after {}s", operation, index + 1, timeoutSeconds);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("{} #{} failed: {}", operation, index + 1, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return Optional.empty();
        }
    }

    private <T> List<Optional<T>> invokeSequentially(String operation, List<Callable<T>> calls) {
        List<Optional<T>> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException(operation + " cancelled");
            }
            try {
                results.add(Optional.ofNullable(calls.get(i).call()));
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                log.warn("{} #{} failed: {}", operation, i + 1, e.getMessage());
                results.add(Optional.empty());
            }
        }
        return results;
    }
}
