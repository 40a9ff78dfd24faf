package com.github.stormino.mediabot.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final MediaBotProperties properties;

    /**
     * One long-running worker loop per thread.
     */
    @Bean(name = "downloadExecutor")
    public Executor downloadExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDownload().getParallelDownloads());
        executor.setMaxPoolSize(properties.getDownload().getParallelDownloads());
        executor.setQueueCapacity(properties.getDownload().getParallelDownloads());
        executor.setThreadNamePrefix("download-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Subprocess output pumps. Each running subprocess holds two threads for its lifetime.
     */
    @Bean(name = "processExecutor")
    public ThreadPoolTaskExecutor processExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // stdout and stderr pump per running download plus one spare pair for a metadata call
        int threads = properties.getDownload().getParallelDownloads() * 2 + 2;

        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("process-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Progress delivery to SSE clients and listeners. Queued work never blocks a pump.
     */
    @Bean(name = "progressExecutor")
    public ThreadPoolTaskExecutor progressExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = properties.getDownload().getParallelDownloads() + 2;
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("progress-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Single thread, so queue mirror writes reach the database in the order they were issued.
     */
    @Bean(name = "mirrorExecutor")
    public ThreadPoolTaskExecutor mirrorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("mirror-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
