package com.example.musictaste.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private static final int QUEUE_SIZE = 256;

    private ExecutorService recommendationExecutor;

    /**
     * Runs the independent read-only store lookups of one request. A saturated
     * pool runs the lookup on the calling thread; a shut down pool rejects it.
     */
    @Bean
    public ExecutorService recommendationExecutor(AppRecommendationProperties properties) {
        int core = Math.max(1, Math.min(16, properties.getExecutorThreads()));
        this.recommendationExecutor = new ThreadPoolExecutor(
                core,
                core,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(QUEUE_SIZE),
                new NamedThreadFactory("recommend-"),
                new CallerRunsUnlessShutdownPolicy());
        return this.recommendationExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (recommendationExecutor != null) {
            recommendationExecutor.shutdown();
        }
    }

    private static class CallerRunsUnlessShutdownPolicy implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("recommendation executor is shut down");
            }
            r.run();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
