package io.github.byzatic.inproc_scheduler.loops.round_robin;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.inproc_scheduler.affinity.RoundRobinAffinityBridge;
import io.github.byzatic.inproc_scheduler.affinity.ThreadAffinityBridge;
import io.github.byzatic.inproc_scheduler.config.SchedulerConfig;
import io.github.byzatic.inproc_scheduler.loops.AbstractThreadLoop;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * RoundRobinLoop: one worker thread over plain callbacks:
 * - One-shot items run in FIFO order and always before recurring items.
 * - Recurring items are visited round-robin, one per iteration.
 * - With nothing to do the worker waits on a signal (or sleeps {@code noJobDelay} when the signal is disabled).
 * - A failing callback is reported to {@link LoopErrorListener}s and the loop keeps going.
 */
@ThreadSafe
public final class RoundRobinLoop extends AbstractThreadLoop {
    private final static Logger logger = LoggerFactory.getLogger(RoundRobinLoop.class);

    private final boolean useWaitSignal;
    private final Duration noJobDelay;
    private final List<LoopErrorListener> errorListeners;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition workAvailable = lock.newCondition();
    @GuardedBy("lock")
    private final ArrayDeque<Runnable> oneShot = new ArrayDeque<>();
    @GuardedBy("lock")
    private final List<Runnable> recurring = new ArrayList<>();
    @GuardedBy("lock")
    private int recurringIndex = 0;
    @GuardedBy("lock")
    private long enqueuedCount = 0;
    @GuardedBy("lock")
    private long dequeuedCount = 0;
    // -1: plain stop, otherwise the number of one-shot items that must be taken before exiting
    @GuardedBy("lock")
    private long drainTarget = -1;

    private RoundRobinLoop(Builder builder) {
        super("round-robin-loop");
        this.useWaitSignal = builder.useWaitSignal;
        this.noJobDelay = builder.noJobDelay;
        this.errorListeners = new CopyOnWriteArrayList<>(builder.errorListeners);
    }

    public static final class Builder {
        private boolean useWaitSignal = true;
        private Duration noJobDelay = SchedulerConfig.defaults().getNoJobDelay();
        private final List<LoopErrorListener> errorListeners = new ArrayList<>();

        /**
         * {@code true} (default): an idle worker waits until work arrives.
         * {@code false}: an idle worker polls every {@code noJobDelay}.
         */
        public Builder useWaitSignal(boolean useWaitSignal) {
            this.useWaitSignal = useWaitSignal;
            return this;
        }

        public Builder noJobDelay(@NotNull Duration noJobDelay) {
            if (noJobDelay.isNegative()) {
                throw new IllegalArgumentException("noJobDelay must be >= 0");
            }
            this.noJobDelay = noJobDelay;
            return this;
        }

        public Builder config(@NotNull SchedulerConfig config) {
            this.noJobDelay = config.getNoJobDelay();
            return this;
        }

        public Builder addErrorListener(@NotNull LoopErrorListener l) {
            errorListeners.add(Objects.requireNonNull(l));
            return this;
        }

        public RoundRobinLoop build() {
            return new RoundRobinLoop(this);
        }
    }

    public void addErrorListener(@NotNull LoopErrorListener l) {
        errorListeners.add(Objects.requireNonNull(l));
    }

    public void removeErrorListener(LoopErrorListener l) {
        errorListeners.remove(l);
    }

    // ======== Work submission ========

    /**
     * Queue a callback to run once, after every one-shot callback queued before it.
     */
    public void scheduleOnce(@NotNull Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        lock.lock();
        try {
            oneShot.addLast(callback);
            enqueuedCount++;
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add a callback that runs on every round-robin turn until it is unscheduled.
     */
    public void scheduleLoop(@NotNull Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        lock.lock();
        try {
            recurring.add(callback);
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the callback was scheduled as recurring and is now removed
     */
    public boolean unscheduleLoop(@NotNull Runnable callback) {
        lock.lock();
        try {
            return recurring.remove(callback);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a callback once on the worker. Its failure completes the returned future exceptionally
     * and is not reported to the error listeners.
     */
    public @NotNull CompletableFuture<Void> runOnceAsFuture(@NotNull Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        CompletableFuture<Void> result = new CompletableFuture<>();
        scheduleOnce(() -> {
            try {
                callback.run();
                result.complete(null);
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }

    public int getPendingOnceCount() {
        lock.lock();
        try {
            return oneShot.size();
        } finally {
            lock.unlock();
        }
    }

    public int getRecurringCount() {
        lock.lock();
        try {
            return recurring.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Use this loop as the affinity target of jobs.
     */
    public @NotNull ThreadAffinityBridge asAffinityBridge() {
        return new RoundRobinAffinityBridge(this);
    }

    // ======== Shutdown ========

    @Override
    public @NotNull CompletableFuture<Void> signalStop() {
        cancelDrain();
        return super.signalStop();
    }

    @Override
    public void stopAndBlock() {
        cancelDrain();
        super.stopAndBlock();
    }

    /**
     * Request a stop that first runs, in order, every one-shot item queued at the time of this call.
     */
    public @NotNull CompletableFuture<Void> signalStopAfterDraining() {
        armDrain();
        return super.signalStop();
    }

    /**
     * Like {@link #signalStopAfterDraining()} but waits for the worker to exit.
     */
    public void stopAfterDrainingAndBlock() {
        armDrain();
        super.stopAndBlock();
    }

    private void armDrain() {
        lock.lock();
        try {
            drainTarget = enqueuedCount;
        } finally {
            lock.unlock();
        }
    }

    private void cancelDrain() {
        lock.lock();
        try {
            drainTarget = -1;
        } finally {
            lock.unlock();
        }
    }

    // ======== Worker ========

    @Override
    protected boolean shouldExit() {
        if (!isStopRequested()) return false;
        lock.lock();
        try {
            return drainTarget < 0 || dequeuedCount >= drainTarget;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void wakeUp() {
        lock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void runIteration() throws InterruptedException {
        Runnable next;
        lock.lock();
        try {
            next = takeNextLocked();
            if (next == null && useWaitSignal) {
                while (oneShot.isEmpty() && recurring.isEmpty() && !isStopRequested()) {
                    workAvailable.await();
                }
                return;
            }
        } finally {
            lock.unlock();
        }
        if (next == null) {
            if (!noJobDelay.isZero()) {
                TimeUnit.NANOSECONDS.sleep(noJobDelay.toNanos());
            } else {
                Thread.yield();
            }
            return;
        }
        execute(next);
    }

    @GuardedBy("lock")
    private Runnable takeNextLocked() {
        Runnable item = oneShot.pollFirst();
        if (item != null) {
            dequeuedCount++;
            return item;
        }
        if (recurring.isEmpty()) {
            recurringIndex = 0;
            return null;
        }
        if (recurringIndex >= recurring.size()) {
            recurringIndex = 0;
        }
        return recurring.get(recurringIndex++);
    }

    private void execute(Runnable callback) {
        try {
            callback.run();
        } catch (Throwable t) {
            logger.debug("Loop callback failed", t);
            for (LoopErrorListener l : errorListeners) {
                try {
                    l.onError(t);
                } catch (Throwable lt) {
                    logger.warn("Loop error listener failed, ignoring", lt);
                }
            }
        }
    }
}
