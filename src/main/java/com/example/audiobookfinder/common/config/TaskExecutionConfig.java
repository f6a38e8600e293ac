package com.example.audiobookfinder.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService downloadJobExecutor;

    /**
     * One thread per download job. The pool is unbounded and has no queue: every accepted
     * request starts immediately, and jobs still running at shutdown are abandoned.
     */
    @Bean
    public ExecutorService downloadJobExecutor() {
        this.downloadJobExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("download-job-"));
        return this.downloadJobExecutor;
    }

    @PreDestroy
    public void shutdown() {
        if (downloadJobExecutor != null) {
            downloadJobExecutor.shutdown();
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
