package com.phillippitts.dialoguetts.config;

import com.phillippitts.dialoguetts.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Builds the thread pool that runs synthesis worker loops.
 *
 * <p>A fresh pool is created for every run because its size comes from the run configuration
 * ({@code processing.max_workers}). The caller owns the returned executor and must
 * {@link ThreadPoolTaskExecutor#shutdown() shut it down} when the run ends.
 *
 * <p>Pool settings:
 * <ul>
 *   <li>Core and max size: the run's worker count, so the pool never grows beyond it</li>
 *   <li>Queue: {@code threadpool.synthesis.queue-capacity}</li>
 *   <li>Rejection: {@link ThreadPoolExecutor.CallerRunsPolicy}, giving backpressure instead of
 *       dropped work</li>
 *   <li>Shutdown waits up to {@code threadpool.synthesis.await-termination-seconds} for
 *       in-flight synthesis calls</li>
 * </ul>
 *
 * <p>MDC propagation: copies the Log4j2 ThreadContext (run id) from the submitting thread to
 * the worker thread so worker log lines carry the same correlation id.
 */
@Component
public class SynthesisExecutorFactory {

    private final ThreadPoolProperties threadPoolProperties;

    public SynthesisExecutorFactory(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates and initializes a pool with exactly {@code workers} threads.
     *
     * @param workers pool size, at least 1
     * @return initialized executor, owned by the caller
     */
    public ThreadPoolTaskExecutor create(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got: " + workers);
        }
        ThreadPoolProperties.SynthesisPoolProperties props = threadPoolProperties.getSynthesis();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(threadContextPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagating() {
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
