package io.github.byzatic.inproc_scheduler.loops;

import org.jetbrains.annotations.NotNull;

public interface SchedulerLoopInterface extends AutoCloseable {
    @NotNull LoopState getState();

    /**
     * {@code true} once the worker has entered its loop; flipped only from inside the loop.
     */
    boolean isRunning();

    @Override
    void close();
}
