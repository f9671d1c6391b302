package io.github.byzatic.inproc_scheduler.affinity;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs callbacks on one specific loop's worker, so state touched only from that loop
 * stays confined to it.
 * <p>
 * <b>Hazard:</b> {@link #send(Runnable)} issued from the target loop's own worker waits for an item
 * that can only run after the current one returns, and never completes. This is not detected;
 * use {@link #post(Runnable)} from inside the loop.
 */
public interface ThreadAffinityBridge {
    /**
     * Enqueue the callback on the target loop and return immediately.
     * Failures are reported through the target loop's error channel.
     */
    void post(@NotNull Runnable callback);

    /**
     * Enqueue the callback on the target loop and block the caller until it has finished.
     *
     * @throws CompletionException  wrapping the callback's failure
     * @throws InterruptedException if the caller is interrupted while waiting
     */
    void send(@NotNull Runnable callback) throws InterruptedException;

    /**
     * This bridge as an {@link Executor} backed by {@link #post(Runnable)}.
     */
    default @NotNull Executor asExecutor() {
        return this::post;
    }
}
