package com.servealert.config;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Executor that owns notification timers and the real-time simulation tick.
 *
 * <p>A single thread is enough: timers only hand alerts to the delivery gate, and
 * running every callback on one thread keeps the firing order equal to the deadline order.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean(name = "notificationTimerExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService notificationTimerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        UncaughtExceptionHandler handler = (thread, throwable) ->
                log.error("Uncaught error on {}: {}", thread.getName(), throwable.getMessage(), throwable);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "notification-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(handler);
            return thread;
        };
        return Executors.newSingleThreadScheduledExecutor(threadFactory);
    }
}
