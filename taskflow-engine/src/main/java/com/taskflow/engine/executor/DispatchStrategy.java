package com.taskflow.engine.executor;

import com.taskflow.core.model.Task;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs a batch of claimed tasks and returns once all of them have finished.
 */
public interface DispatchStrategy extends AutoCloseable {

    /**
     * Largest batch the executor should claim at once.
     */
    int maxBatchSize();

    void dispatch(List<Task> batch, Consumer<Task> runner);

    @Override
    default void close() {
    }
}
