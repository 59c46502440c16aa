package com.taskflow.engine.executor;

import com.taskflow.core.exception.TaskflowException;
import com.taskflow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs a batch concurrently on a bounded thread pool and waits for all of it.
 */
public class PooledDispatchStrategy implements DispatchStrategy {

    private static final Logger log = LoggerFactory.getLogger(PooledDispatchStrategy.class);

    private final int poolSize;
    private final ExecutorService executorService;

    public PooledDispatchStrategy(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be >= 1");
        }
        this.poolSize = poolSize;
        this.executorService = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
    }

    @Override
    public int maxBatchSize() {
        return poolSize;
    }

    @Override
    public void dispatch(List<Task> batch, Consumer<Task> runner) {
        List<Future<?>> futures = new ArrayList<>(batch.size());
        for (Task task : batch) {
            futures.add(executorService.submit(() -> runner.accept(task)));
        }

        RuntimeException failure = null;
        boolean interrupted = false;
        for (Future<?> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // Keep waiting: claimed tasks must reach a terminal status.
                    interrupted = true;
                } catch (ExecutionException e) {
                    if (failure == null) {
                        failure = asRuntime(e.getCause());
                    }
                    break;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Task dispatch pool shut down");
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new TaskflowException("DISPATCH_FAILURE", "Task dispatch failed", cause);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "taskflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
