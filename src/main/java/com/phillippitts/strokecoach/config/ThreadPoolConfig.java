package com.phillippitts.strokecoach.config;

import com.phillippitts.strokecoach.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for analysis work.
 *
 * <p>The job pool aborts when its queue is full; the upload is then refused instead of
 * running a whole analysis on the request thread. The compute pool uses
 * {@link ThreadPoolExecutor.CallerRunsPolicy} so detector and scoring tasks slow the
 * submitting job down rather than fail it. Both copy the Log4j2 ThreadContext of the
 * submitting thread to the worker so {@code requestId}/{@code jobId} survive the hop.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs whole analyses submitted through the job service. Small by default: one
     * analysis already fans out over the compute pool.
     */
    @Bean(name = "jobExecutor")
    public ThreadPoolTaskExecutor jobExecutor() {
        return build(threadPoolProperties.getJob(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Bounded CPU pool shared by the phase detectors and corpus candidate scoring.
     */
    @Bean(name = "computeExecutor")
    public ThreadPoolTaskExecutor computeExecutor() {
        return build(threadPoolProperties.getCompute(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
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
     * Copies the submitting thread's ThreadContext into the worker and restores the
     * worker's previous context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
