package com.example.ingestion.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools used by task execution.
 * <p>
 * The worker loop runs one task at a time, so the task and step pools stay
 * small; they are cached pools because a timed out body may still be rolling
 * back while the next task starts.
 */
@Slf4j
@EnableAsync
@Configuration
public class WorkerExecutorConfig {

    @Value("${worker.async-pool-size:4}")
    private int asyncPoolSize;

    /**
     * Runs a handler's transactional body, one thread per execution.
     */
    @Bean(name = "taskExecutionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService taskExecutionExecutor() {
        log.info("Creating task execution executor");
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("task-exec-"));
    }

    /**
     * Runs blocking sub-steps (downloads, parsing, remote calls) under their own deadline.
     */
    @Bean(name = "taskStepExecutor", destroyMethod = "shutdownNow")
    public ExecutorService taskStepExecutor() {
        log.info("Creating task step executor");
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("task-step-"));
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(asyncPoolSize);
        executor.setMaxPoolSize(asyncPoolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-task-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
