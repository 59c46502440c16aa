package com.taskflow.engine.executor;

import com.taskflow.core.model.Task;

import java.util.List;
import java.util.function.Consumer;

/**
 * Runs one task at a time on the calling thread.
 */
public class SerialDispatchStrategy implements DispatchStrategy {

    @Override
    public int maxBatchSize() {
        return 1;
    }

    @Override
    public void dispatch(List<Task> batch, Consumer<Task> runner) {
        batch.forEach(runner);
    }
}
