package com.example.rcaengine.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator lookups on the lookup pool and waits at most until a
 * deadline. A timeout, failure or null answer yields the fallback flagged as
 * degraded; nothing is thrown to the caller.
 *
 * Batches are started with {@link #start} and collected with
 * {@link PendingLookup#await(long)} against one shared deadline, so k lookups
 * cost at most one timeout rather than k.
 */
@Slf4j
@Component
public class BoundedLookup {

    private final Executor executor;

    public BoundedLookup(@Qualifier("lookupExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> LookupResult<T> call(String what, Supplier<T> lookup, long timeoutMs, T fallback) {
        return start(what, lookup, fallback).await(deadlineAfter(timeoutMs));
    }

    /**
     * Submit a lookup without waiting for it.
     */
    public <T> PendingLookup<T> start(String what, Supplier<T> lookup, T fallback) {
        try {
            return new PendingLookup<>(what, CompletableFuture.supplyAsync(lookup, executor), fallback);
        } catch (RejectedExecutionException e) {
            log.warn("Lookup {} rejected, lookup pool saturated", what);
            return new PendingLookup<>(what, null, fallback);
        }
    }

    /** Deadline in {@link System#nanoTime()} terms. */
    public static long deadlineAfter(long timeoutMs) {
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
    }

    public static final class PendingLookup<T> {

        private final String what;
        private final CompletableFuture<T> future;
        private final T fallback;

        private PendingLookup(String what, CompletableFuture<T> future, T fallback) {
            this.what = what;
            this.future = future;
            this.fallback = fallback;
        }

        /**
         * Wait for the answer until {@code deadlineNanos}; an answer already
         * available is taken even when the deadline has passed.
         */
        public LookupResult<T> await(long deadlineNanos) {
            if (future == null) {
                return LookupResult.degraded(fallback);
            }
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            try {
                T value = future.get(remaining, TimeUnit.NANOSECONDS);
                if (value == null) {
                    return LookupResult.degraded(fallback);
                }
                return LookupResult.of(value);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Lookup {} timed out, using default", what);
                return LookupResult.degraded(fallback);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Lookup {} failed, using default: {}", what, cause.getMessage());
                return LookupResult.degraded(fallback);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                return LookupResult.degraded(fallback);
            }
        }
    }

    public record LookupResult<T>(T value, boolean degraded) {

        static <T> LookupResult<T> of(T value) {
            return new LookupResult<>(value, false);
        }

        static <T> LookupResult<T> degraded(T fallback) {
            return new LookupResult<>(fallback, true);
        }
    }
}
