package com.phillippitts.ambientscribe.config;

import com.phillippitts.ambientscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used off the capture thread.
 * Provides one executor for diarization drain loops and one for event listener offload.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the pool that runs one diarization drain loop per capture session.
     *
     * <p>Each loop blocks on its frame subscription until the session ends, so the core pool
     * is sized for one active session plus a draining predecessor.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a drain loop on the
     * caller would block session start, so a saturated pool fails loudly instead.
     *
     * @return Configured executor for diarization
     */
    @Bean(name = "diarizationExecutor")
    public Executor diarizationExecutor() {
        return buildExecutor(threadPoolProperties.getDiarization(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Creates a bounded thread pool for event listener offload (metrics, audit log).
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.DiscardOldestPolicy}. Event delivery is
     * fire-and-forget and must never push work back onto the publishing thread, which may be
     * the capture thread.
     *
     * <p>Thread naming: {@code event-pool-N} for easy identification in logs.
     *
     * @return Configured executor for event listener offload
     */
    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        return buildExecutor(threadPoolProperties.getEvent(), new ThreadPoolExecutor.DiscardOldestPolicy());
    }

    private static Executor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                          RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so
     * {@code sessionId} survives the hop, restoring the worker's previous context afterwards.
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
