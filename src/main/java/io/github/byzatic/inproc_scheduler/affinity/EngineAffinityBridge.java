package io.github.byzatic.inproc_scheduler.affinity;

import io.github.byzatic.inproc_scheduler.engine.Job;
import io.github.byzatic.inproc_scheduler.engine.ScheduleEngine;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Marshals callbacks onto whatever loop drives a {@link ScheduleEngine}, by registering
 * each callback as a one-shot inline job due now.
 * <p>
 * Posted failures reach the engine's {@link io.github.byzatic.inproc_scheduler.engine.JobEventListener#onError}.
 */
public final class EngineAffinityBridge implements ThreadAffinityBridge {
    private final ScheduleEngine engine;

    public EngineAffinityBridge(@NotNull ScheduleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public void post(@NotNull Runnable callback) {
        engine.register(Job.of(callback, engine.getClock().instant()));
    }

    @Override
    public void send(@NotNull Runnable callback) throws InterruptedException {
        SendCompletion completion = new SendCompletion(Objects.requireNonNull(callback, "callback"));
        engine.register(Job.of(completion, engine.getClock().instant()));
        completion.await();
    }
}
