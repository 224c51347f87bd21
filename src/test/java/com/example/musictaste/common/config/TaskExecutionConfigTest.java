package com.example.musictaste.common.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskExecutionConfigTest {

    private final TaskExecutionConfig config = new TaskExecutionConfig();

    @AfterEach
    void tearDown() {
        config.shutdown();
    }

    @Test
    void lookupsShouldRunOnNamedWorkerThreads() throws Exception {
        ExecutorService executor = config.recommendationExecutor(new AppRecommendationProperties());

        String threadName = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor)
                .get(3, TimeUnit.SECONDS);

        assertTrue(threadName.startsWith("recommend-"));
    }

    @Test
    void saturatedPoolShouldRunOnCallerThread() throws Exception {
        AppRecommendationProperties properties = new AppRecommendationProperties();
        properties.setExecutorThreads(1);
        ExecutorService executor = config.recommendationExecutor(properties);
        CountDownLatch release = new CountDownLatch(1);
        for (int i = 0; i < 257; i++) {
            executor.execute(() -> {
                try {
                    release.await(3, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }
        AtomicReference<String> ranOn = new AtomicReference<>();

        executor.execute(() -> ranOn.set(Thread.currentThread().getName()));
        release.countDown();

        assertEquals(Thread.currentThread().getName(), ranOn.get());
    }

    @Test
    void shutDownPoolShouldRejectInsteadOfDroppingTasks() {
        ExecutorService executor = config.recommendationExecutor(new AppRecommendationProperties());
        config.shutdown();

        assertThrows(RejectedExecutionException.class,
                () -> CompletableFuture.supplyAsync(() -> "late", executor));
    }
}
