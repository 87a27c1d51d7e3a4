package com.taskrunner.core.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs work as a set of single-threaded mailboxes, one per key.
 * <p>
 * Work submitted under the same key runs one item at a time in submission order;
 * different keys run in parallel on the backing executor. Each task and each node is
 * one key, which is what makes a task's own fields safe to read-modify-write without locks.
 * <p>
 * Work running inside a mailbox may submit more work to its own key, but must not block
 * on the returned future: it only starts after the current item finishes.
 */
public class KeyedSerialExecutor {

    private static final Logger log = LoggerFactory.getLogger(KeyedSerialExecutor.class);

    private final Executor executor;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(Executor executor) {
        this.executor = executor;
    }

    public <T> CompletableFuture<T> submit(String key, Callable<T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, done);

        Runnable item = () -> {
            try {
                result.complete(work.call());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            } finally {
                tails.remove(key, done);
                done.complete(null);
            }
        };

        if (previous == null) {
            dispatch(key, item, result, done);
        } else {
            previous.whenComplete((ignored, error) -> dispatch(key, item, result, done));
        }
        return result;
    }

    public CompletableFuture<Void> execute(String key, Runnable work) {
        return submit(key, () -> {
            work.run();
            return null;
        });
    }

    /** Number of keys with queued or running work. */
    public int activeKeys() {
        return tails.size();
    }

    /** Stops the backing executor if it is an {@link ExecutorService}; queued work is dropped. */
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    private void dispatch(String key, Runnable item, CompletableFuture<?> result, CompletableFuture<Void> done) {
        try {
            executor.execute(item);
        } catch (RejectedExecutionException e) {
            log.warn("Work for '{}' rejected: {}", key, e.getMessage());
            result.completeExceptionally(e);
            tails.remove(key, done);
            done.complete(null);
        }
    }
}
