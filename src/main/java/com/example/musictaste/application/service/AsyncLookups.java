package com.example.musictaste.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Fan-out helpers for independent read-only lookups. Lookups run with the
 * caller's MDC so worker log lines keep the request id. Joining rethrows the
 * lookup's own exception so store failures keep their type.
 */
final class AsyncLookups {

    private AsyncLookups() {
    }

    static <T> CompletableFuture<T> supply(Supplier<T> lookup, Executor executor) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            setContext(context);
            try {
                return lookup.get();
            } finally {
                setContext(previous);
            }
        }, executor);
    }

    private static void setContext(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Waits for every future, then returns the results in input order.
     */
    static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
        join(CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])));
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(join(future));
        }
        return results;
    }
}
