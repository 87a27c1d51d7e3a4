package com.taskrunner.core.retry;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The one bounded-retry helper used for every remote call: a fixed backoff schedule
 * and a fixed attempt cap. Only transient {@link RemoteCallException}s are retried.
 * <p>
 * Owning units never sleep; they ask {@link #delayBeforeAttempt(int)} for the next
 * backoff and re-arm their alarm. {@link #execute} blocks and is meant for callers that
 * are not an owning unit, such as best-effort cleanup.
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final List<Duration> backoff;
    private final Sleeper sleeper;

    /** Pause between blocking attempts; replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    @Autowired
    public RetryPolicy(TaskRunnerProperties properties) {
        this(properties.getRetry().getMaxAttempts(), properties.getRetry().getBackoff(),
                duration -> Thread.sleep(duration.toMillis()));
    }

    public RetryPolicy(int maxAttempts, List<Duration> backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoff.isEmpty()) {
            throw new IllegalArgumentException("backoff schedule must not be empty");
        }
        if (backoff.size() > maxAttempts - 1) {
            log.warn("Backoff schedule {} has {} entries but only {} retries are allowed, the rest are never used",
                    backoff, backoff.size(), maxAttempts - 1);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = List.copyOf(backoff);
        this.sleeper = sleeper;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean isRetryable(RuntimeException e) {
        return e instanceof RemoteCallException remote && remote.isTransient();
    }

    /**
     * Delay before attempt number {@code attempt} (2-based: the first attempt has no delay),
     * or empty once the cap is reached. Attempts beyond the schedule reuse its last entry.
     */
    public Optional<Duration> delayBeforeAttempt(int attempt) {
        if (attempt < 2 || attempt > maxAttempts) {
            return Optional.empty();
        }
        int index = Math.min(attempt - 2, backoff.size() - 1);
        return Optional.of(backoff.get(index));
    }

    /**
     * Runs {@code call}, retrying transient failures on the backoff schedule. The last
     * failure is rethrown once the attempt cap is reached.
     */
    public <T> T execute(String operation, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                Optional<Duration> delay = isRetryable(e) ? delayBeforeAttempt(attempt + 1) : Optional.empty();
                if (delay.isEmpty()) {
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempt, maxAttempts, delay.get().toMillis(), e.getMessage());
                pause(delay.get(), e);
                attempt++;
            }
        }
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    private void pause(Duration delay, RuntimeException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
