package com.phillippitts.sitedetect.config;

import com.phillippitts.sitedetect.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for engine calls, health probes and the health-check timer.
 *
 * <p>Both executors are bounded. The detection executor uses
 * {@link ThreadPoolExecutor.AbortPolicy}: a call that would run on the request thread would escape
 * both its capability deadline and the request deadline, so a saturated pool rejects it and the
 * dispatcher reports that capability as failed. The health executor uses
 * {@link ThreadPoolExecutor.CallerRunsPolicy}; probes carry their own client timeouts, so running
 * one on the timer thread only delays the cycle. Sizing comes from {@code threadpool.detection.*}
 * and {@code threadpool.health.*}.
 *
 * <p>Log4j2 ThreadContext is copied from the submitting thread to the worker, so per-capability
 * log lines carry the request and correlation ids.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for remote engine calls of all in-flight detection requests.
     */
    @Bean(name = "detectionExecutor")
    public ThreadPoolTaskExecutor detectionExecutor() {
        return buildExecutor(threadPoolProperties.getDetection(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for liveness probes; kept apart so probing never competes with request calls.
     */
    @Bean(name = "healthExecutor")
    public ThreadPoolTaskExecutor healthExecutor() {
        return buildExecutor(threadPoolProperties.getHealth(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Timer for the health monitor and the periodic summary logs.
     */
    @Bean(name = "healthScheduler")
    public ThreadPoolTaskScheduler healthScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("health-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext into the worker for the duration of the task and
     * restores the worker's own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    ThreadContext.clearMap();
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearMap();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
