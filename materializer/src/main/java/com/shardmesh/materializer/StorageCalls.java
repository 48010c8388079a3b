package com.shardmesh.materializer;

import com.shardmesh.core.StorageTimeoutException;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs storage collaborator calls with a bounded wait. A call that overruns is interrupted and surfaces as
 * {@link StorageTimeoutException}; errors thrown by the collaborator are rethrown unchanged.
 */
class StorageCalls implements AutoCloseable {
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final Duration timeout;
    private final ExecutorService executor;

    StorageCalls(Duration timeout) {
        this.timeout = timeout;
        ThreadFactory factory = r -> {
            Thread thread = new Thread(r, "shard-storage-" + THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newCachedThreadPool(factory);
    }

    <T> T call(String operation, Supplier<T> storageCall) {
        Future<T> future = executor.submit(storageCall::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StorageTimeoutException(operation + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StorageTimeoutException(operation + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
