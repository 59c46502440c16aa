package com.taskflow.engine.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a workflow run. Once cancelled the executor
 * issues no new dispatches; handlers already running finish.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
