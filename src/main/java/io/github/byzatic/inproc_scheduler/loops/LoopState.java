package io.github.byzatic.inproc_scheduler.loops;

/**
 * Lifecycle shared by all loops: STOPPED → STARTING → RUNNING → STOP_REQUESTED → STOPPED.
 */
public enum LoopState {STOPPED, STARTING, RUNNING, STOP_REQUESTED}
