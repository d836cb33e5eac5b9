package org.buildlens.bsp.reporter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks whether a task has started and finished.
 * <p>
 * Each flag moves from pending to fired exactly once. The {@code try*} methods return
 * {@code true} for the single caller that performed the transition, so only that caller
 * sends the corresponding notification.
 */
public class TaskLifecycle {

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);

    /**
     * @return {@code true} if this call marked the task as started.
     */
    public boolean tryStart() {
        return started.compareAndSet(false, true);
    }

    /**
     * @return {@code true} if this call marked the task as finished.
     */
    public boolean tryFinish() {
        return finished.compareAndSet(false, true);
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isFinished() {
        return finished.get();
    }
}
