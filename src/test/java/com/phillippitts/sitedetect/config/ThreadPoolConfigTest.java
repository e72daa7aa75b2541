package com.phillippitts.sitedetect.config;

import com.phillippitts.sitedetect.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateDetectionExecutorFromDefaults() {
        ThreadPoolTaskExecutor executor = config.detectionExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(32);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("detect-pool-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRejectInsteadOfRunningOnCallerWhenDetectionPoolIsFull() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getDetection().setCorePoolSize(1);
        props.getDetection().setMaxPoolSize(1);
        props.getDetection().setQueueCapacity(0);
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(props).detectionExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            executor.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            AtomicReference<String> ranOn = new AtomicReference<>();

            assertThatThrownBy(() -> executor.execute(() -> ranOn.set(Thread.currentThread().getName())))
                    .isInstanceOf(RejectedExecutionException.class);
            assertThat(ranOn.get()).isNull();
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    void shouldKeepHealthPoolSeparate() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.healthExecutor();
        try {
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> threadName = new AtomicReference<>();
            executor.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).startsWith("health-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.detectionExecutor();
        try {
            ThreadContext.put("correlationId", "cid-9");
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> seen = new AtomicReference<>();
            executor.execute(() -> {
                seen.set(ThreadContext.get("correlationId"));
                latch.countDown();
            });

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("cid-9");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        TaskDecorator decorator = ThreadPoolConfig.mdcPropagatingDecorator();
        ThreadContext.put("correlationId", "submitter");
        Runnable decorated = decorator.decorate(() ->
                assertThat(ThreadContext.get("correlationId")).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put("worker", "own");
        decorated.run();

        assertThat(ThreadContext.get("worker")).isEqualTo("own");
        assertThat(ThreadContext.get("correlationId")).isNull();
    }

    @Test
    void shouldConfigureHealthScheduler() {
        ThreadPoolTaskScheduler scheduler = config.healthScheduler();

        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("health-timer-");
        assertThat(scheduler.getPoolSize()).isEqualTo(2);
    }
}
