package io.github.byzatic.inproc_scheduler.engine;

import java.time.Duration;
import java.util.UUID;

/**
 * Job event listener. Called synchronously on the thread that observed the event.
 */
public interface JobEventListener {
    /**
     * A job invocation raised. Fired once per failing invocation.
     */
    default void onError(UUID jobId, Throwable error) {
    }

    /**
     * A job started later than the engine's minimum precision allows. Advisory only.
     */
    default void onRunningBehind(UUID jobId, Duration lateness) {
    }
}
