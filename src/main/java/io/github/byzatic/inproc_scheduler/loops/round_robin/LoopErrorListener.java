package io.github.byzatic.inproc_scheduler.loops.round_robin;

/**
 * Receives failures of callbacks run by a {@link RoundRobinLoop}.
 */
@FunctionalInterface
public interface LoopErrorListener {
    void onError(Throwable error);
}
