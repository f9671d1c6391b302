package io.github.byzatic.inproc_scheduler.engine;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Execution context handed to a {@link SuspendingJobAction}.
 */
public final class JobContext<S> {
    private final UUID jobId;
    private final S state;
    private final Executor continuationExecutor;

    public JobContext(@NotNull UUID jobId, @Nullable S state, @NotNull Executor continuationExecutor) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.state = state;
        this.continuationExecutor = Objects.requireNonNull(continuationExecutor, "continuationExecutor");
    }

    public @NotNull UUID jobId() {
        return jobId;
    }

    public @Nullable S state() {
        return state;
    }

    /**
     * Executor that resumes continuations on the job's affinity target when it has one,
     * otherwise on the engine's detached worker pool.
     */
    public @NotNull Executor continuationExecutor() {
        return continuationExecutor;
    }
}
