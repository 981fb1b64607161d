package com.example.collab.session.service;

import com.example.collab.shared.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs tasks one at a time per key, in submission order. Each task waits for the future of
 * the task queued before it on the same key.
 *
 * Keys are always taken in the order session then room, so nested calls cannot deadlock.
 * A task that re-enters a key it already holds runs inline.
 */
@Component
@Slf4j
public class KeyedSequencer {

    private static final Duration DEFAULT_WAIT = Duration.ofSeconds(30);

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final ThreadLocal<Set<String>> heldKeys = ThreadLocal.withInitial(HashSet::new);
    private final AsyncTaskExecutor executor;
    private final Duration maxWait;

    public KeyedSequencer(@Qualifier("asyncTaskExecutor") AsyncTaskExecutor executor) {
        this(executor, DEFAULT_WAIT);
    }

    public KeyedSequencer(AsyncTaskExecutor executor, Duration maxWait) {
        this.executor = executor;
        this.maxWait = maxWait;
    }

    public static String sessionKey(String sessionId) {
        return "session:" + sessionId;
    }

    public static String roomKey(String roomId) {
        return "room:" + roomId;
    }

    /**
     * Runs the task on the calling thread once every earlier task on the key has completed.
     *
     * @throws LockTimeoutException if the earlier tasks do not complete in time
     */
    public <T> T call(String key, Callable<T> task) {
        Set<String> held = heldKeys.get();
        if (held.contains(key)) {
            return invoke(task);
        }

        CompletableFuture<Void> mine = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, mine);
        if (previous != null) {
            try {
                previous.get(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                previous.whenComplete((r, ex) -> release(key, mine));
                throw new LockTimeoutException("Timed out waiting for work queued on " + key);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                previous.whenComplete((r, ex) -> release(key, mine));
                throw new LockTimeoutException("Interrupted while waiting for work queued on " + key);
            } catch (ExecutionException e) {
                log.debug("Previous task on {} completed exceptionally: {}", key, e.getMessage());
            }
        }

        held.add(key);
        try {
            return invoke(task);
        } finally {
            held.remove(key);
            release(key, mine);
        }
    }

    public void run(String key, Runnable task) {
        call(key, () -> {
            task.run();
            return null;
        });
    }

    /**
     * Queues the task on the shared executor.
     */
    public <T> CompletableFuture<T> submit(String key, Callable<T> task) {
        return CompletableFuture.supplyAsync(() -> call(key, task), executor);
    }

    public int pendingKeys() {
        return tails.size();
    }

    private void release(String key, CompletableFuture<Void> mine) {
        mine.complete(null);
        tails.remove(key, mine);
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
