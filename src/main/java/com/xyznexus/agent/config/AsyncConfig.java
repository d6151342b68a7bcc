package com.xyznexus.agent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Thread pools, isolated from the web thread pool and from each other.
 *
 * - specialistExecutor: one task per activated specialist loop; each loop blocks
 *   on reasoning calls, so the pool is sized for concurrent runs x 3 specialists
 * - toolExecutor: capability invocations of one CALL_TOOLS step run in parallel
 * - traceTaskExecutor: @Async trace persistence, never blocks a response
 *
 * Specialist and tool pools are separate so a loop waiting on its tools can never
 * starve the tools of threads.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "specialistExecutor", destroyMethod = "shutdownNow")
    public ExecutorService specialistExecutor(NexusProperties properties) {
        int size = properties.getOrchestrator().getSpecialistPoolSize();
        return fixedPool(size, 100, "specialist-");
    }

    @Bean(name = "toolExecutor", destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor(NexusProperties properties) {
        int size = properties.getOrchestrator().getToolPoolSize();
        return fixedPool(size, 200, "capability-");
    }

    @Bean(name = "traceTaskExecutor")
    public Executor traceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("trace-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    private ExecutorService fixedPool(int size, int queueCapacity, String threadNamePrefix) {
        return new ThreadPoolExecutor(size, size, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                new CustomizableThreadFactory(threadNamePrefix),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
