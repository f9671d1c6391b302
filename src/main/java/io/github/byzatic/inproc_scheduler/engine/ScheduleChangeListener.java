package io.github.byzatic.inproc_scheduler.engine;

/**
 * Notified after the set of registered jobs or their order changed.
 * Used by loops that wait on a wake signal.
 */
@FunctionalInterface
public interface ScheduleChangeListener {
    void onScheduleChanged();
}
