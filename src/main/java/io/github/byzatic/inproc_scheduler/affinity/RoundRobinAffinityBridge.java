package io.github.byzatic.inproc_scheduler.affinity;

import io.github.byzatic.inproc_scheduler.loops.round_robin.RoundRobinLoop;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Marshals callbacks onto a {@link RoundRobinLoop} through its one-shot queue.
 */
public final class RoundRobinAffinityBridge implements ThreadAffinityBridge {
    private final RoundRobinLoop loop;

    public RoundRobinAffinityBridge(@NotNull RoundRobinLoop loop) {
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    @Override
    public void post(@NotNull Runnable callback) {
        loop.scheduleOnce(callback);
    }

    @Override
    public void send(@NotNull Runnable callback) throws InterruptedException {
        SendCompletion completion = new SendCompletion(Objects.requireNonNull(callback, "callback"));
        loop.scheduleOnce(completion);
        completion.await();
    }
}
