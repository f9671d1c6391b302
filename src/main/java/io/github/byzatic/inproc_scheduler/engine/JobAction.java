package io.github.byzatic.inproc_scheduler.engine;

/**
 * Plain job callback. Receives the state object the job was built with (may be {@code null}).
 */
@FunctionalInterface
public interface JobAction<S> {
    void run(S state) throws Exception;
}
