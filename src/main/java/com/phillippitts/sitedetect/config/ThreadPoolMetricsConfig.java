package com.phillippitts.sitedetect.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the detection executor through Micrometer:
 * <ul>
 *   <li>sitedetect.pool.size - current number of threads</li>
 *   <li>sitedetect.pool.active - threads executing engine calls</li>
 *   <li>sitedetect.pool.queued - calls waiting in the queue</li>
 *   <li>sitedetect.pool.completed - cumulative completed calls</li>
 *   <li>sitedetect.pool.max.size - configured maximum pool size</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> detectionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("detectionExecutor") ObjectProvider<ThreadPoolTaskExecutor> detectionExecutorProvider) {
        this.detectionExecutorProvider = detectionExecutorProvider;
    }

    @Bean
    public MeterBinder detectionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = detectionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("sitedetect.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the detection pool")
                    .register(registry);
            Gauge.builder("sitedetect.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads actively executing engine calls")
                    .register(registry);
            Gauge.builder("sitedetect.pool.queued", executor, e -> e.getQueue().size())
                    .description("Engine calls waiting in the queue")
                    .register(registry);
            Gauge.builder("sitedetect.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed engine calls")
                    .register(registry);
            Gauge.builder("sitedetect.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the detection executor")
                    .register(registry);

            LOG.info("Detection pool metrics registered: sitedetect.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = detectionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Detection pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
