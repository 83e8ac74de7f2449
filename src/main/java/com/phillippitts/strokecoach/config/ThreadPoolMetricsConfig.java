package com.phillippitts.strokecoach.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes gauges for both executors ({@code strokecoach.pool.*}, tagged by pool) and
 * logs a periodic health line.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ThreadPoolTaskExecutor jobExecutor;
    private final ThreadPoolTaskExecutor computeExecutor;

    public ThreadPoolMetricsConfig(@Qualifier("jobExecutor") ThreadPoolTaskExecutor jobExecutor,
                                   @Qualifier("computeExecutor") ThreadPoolTaskExecutor computeExecutor) {
        this.jobExecutor = jobExecutor;
        this.computeExecutor = computeExecutor;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            register(registry, "job", jobExecutor.getThreadPoolExecutor());
            register(registry, "compute", computeExecutor.getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: strokecoach.pool.* available via /actuator/metrics");
        };
    }

    private static void register(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("strokecoach.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("strokecoach.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("strokecoach.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        log("job", jobExecutor.getThreadPoolExecutor());
        log("compute", computeExecutor.getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
