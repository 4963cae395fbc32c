package com.phillippitts.audioprep.config;

import com.phillippitts.audioprep.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool used by feature extraction.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and dataset size.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool that computes log-mel features per segment.
     *
     * <p>Pool sizing configured via {@code threadpool.feature.*} properties:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 8</li>
     *   <li>Queue: default 100 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}.
     * When the pool and queue are full the submitting thread extracts the segment itself.
     *
     * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread (notably the
     * {@code split} key) is copied onto the worker for the duration of each task.
     *
     * @return configured executor for feature extraction
     */
    @Bean(name = "featureExecutor")
    public Executor featureExecutor() {
        ThreadPoolProperties.FeaturePoolProperties props = threadPoolProperties.getFeature();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagatingDecorator() {
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
