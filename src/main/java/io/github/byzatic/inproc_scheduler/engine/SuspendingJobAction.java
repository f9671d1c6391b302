package io.github.byzatic.inproc_scheduler.engine;

import java.util.concurrent.CompletionStage;

/**
 * Job callback that suspends: it starts work and returns a pending stage.
 * <p>
 * The scheduler does not wait for the stage; it attaches its completion handling to it.
 * Continuations that must stay on the job's loop should be chained with
 * {@link JobContext#continuationExecutor()}, e.g. {@code stage.thenRunAsync(step, context.continuationExecutor())}.
 */
@FunctionalInterface
public interface SuspendingJobAction<S> {
    CompletionStage<?> run(JobContext<S> context) throws Exception;
}
