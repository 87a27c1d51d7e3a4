package com.taskrunner.core.scheduling;

import com.taskrunner.core.config.TaskRunnerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Mailboxes for task and node units, backed by a fixed pool of daemon workers.
     */
    @Bean(destroyMethod = "shutdown")
    public KeyedSerialExecutor keyedSerialExecutor(TaskRunnerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(properties.getScheduler().getWorkerThreads(), r -> {
            Thread t = new Thread(r, "unit-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return new KeyedSerialExecutor(workers);
    }
}
