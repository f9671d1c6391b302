package io.github.byzatic.inproc_scheduler.loops.cooperative;

import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.inproc_scheduler.config.SchedulerConfig;
import io.github.byzatic.inproc_scheduler.engine.ScheduleChangeListener;
import io.github.byzatic.inproc_scheduler.engine.ScheduleEngine;
import io.github.byzatic.inproc_scheduler.loops.CancellationToken;
import io.github.byzatic.inproc_scheduler.loops.LoopState;
import io.github.byzatic.inproc_scheduler.loops.SchedulerLoopInterface;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CooperativeLoop: drives a {@link ScheduleEngine} as a single logical task:
 * - No thread is held while waiting; the next iteration is a timed task on a {@link ScheduledExecutorService}.
 * - Adaptive wait derived from the next due time, or a fixed precision.
 * - Schedule changes wake a pending wait when {@code interruptOnChange} is set.
 * - Cooperative cancellation through {@link CancellationToken}, checked once per iteration.
 */
@Beta
@ThreadSafe
public final class CooperativeLoop implements SchedulerLoopInterface {
    private final static Logger logger = LoggerFactory.getLogger(CooperativeLoop.class);

    private static final long ADAPTIVE_FACTOR = 128;
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ScheduleEngine engine;
    private final Duration precision;
    private final boolean interruptOnChange;
    private final boolean useAdaptiveDelay;
    private final ScheduledExecutorService executor;
    private final boolean ownsExecutor;
    private final ScheduleChangeListener changeListener = this::wake;

    private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.STOPPED);
    private volatile boolean stopping = true;
    private volatile boolean running = false;
    private volatile Thread iterationThread;

    @GuardedBy("this")
    private CompletableFuture<Void> completion = CompletableFuture.completedFuture(null);
    @GuardedBy("this")
    private CancellationToken token = new CancellationToken();
    @GuardedBy("this")
    private boolean closed = false;

    private final Object waitLock = new Object();
    @GuardedBy("waitLock")
    private ScheduledFuture<?> pendingResume;
    @GuardedBy("waitLock")
    private boolean wakeSignalled = false;

    private CooperativeLoop(Builder builder) {
        this.engine = builder.engine;
        this.precision = builder.precision;
        this.interruptOnChange = builder.interruptOnChange;
        this.useAdaptiveDelay = builder.useAdaptiveDelay;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cooperative-loop-" + THREAD_COUNTER.getAndIncrement());
                t.setDaemon(true);
                t.setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex));
                return t;
            });
            this.ownsExecutor = true;
        }
    }

    public static final class Builder {
        private final ScheduleEngine engine;
        private Duration precision;
        private boolean interruptOnChange;
        private boolean useAdaptiveDelay;
        private ScheduledExecutorService executor;

        public Builder(@NotNull ScheduleEngine engine) {
            this.engine = Objects.requireNonNull(engine);
            config(SchedulerConfig.defaults());
        }

        public Builder precision(@NotNull Duration precision) {
            if (precision.isZero() || precision.isNegative()) {
                throw new IllegalArgumentException("precision must be > 0");
            }
            this.precision = precision;
            return this;
        }

        /**
         * Wake a pending wait as soon as jobs are registered or removed.
         */
        public Builder interruptOnChange(boolean interruptOnChange) {
            this.interruptOnChange = interruptOnChange;
            return this;
        }

        /**
         * Derive the wait from the next due time instead of waiting a fixed precision.
         */
        public Builder useAdaptiveDelay(boolean useAdaptiveDelay) {
            this.useAdaptiveDelay = useAdaptiveDelay;
            return this;
        }

        public Builder config(@NotNull SchedulerConfig config) {
            this.precision = config.getPrecision();
            this.interruptOnChange = config.isInterruptOnChange();
            this.useAdaptiveDelay = config.isUseAdaptiveDelay();
            return this;
        }

        /**
         * Run iterations on your own executor. It is not shut down by {@link #close()}.
         */
        public Builder executor(@NotNull ScheduledExecutorService executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        public CooperativeLoop build() {
            return new CooperativeLoop(this);
        }
    }

    // ======== Lifecycle ========

    public @NotNull CompletableFuture<Void> start() {
        return start(new CancellationToken());
    }

    /**
     * Start the loop. Returns a future completed when the loop exits.
     * If the loop is already started the current completion is returned and {@code token} is ignored.
     * If a stop is still in progress, waits for the previous run to finish and then starts a new one.
     *
     * @throws IllegalStateException if the loop is closed, or if called from a job of a stopping run
     */
    public @NotNull CompletableFuture<Void> start(@NotNull CancellationToken token) {
        Objects.requireNonNull(token, "token");
        while (true) {
            CompletableFuture<Void> previous;
            synchronized (this) {
                if (closed) throw new IllegalStateException("CooperativeLoop is closed");
                LoopState current = state.get();
                if (current == LoopState.STOPPED) return begin(token);
                if (current != LoopState.STOP_REQUESTED) return completion;
                if (iterationThread == Thread.currentThread()) {
                    throw new IllegalStateException("Can't restart CooperativeLoop from a job of its stopping run");
                }
                previous = completion;
            }
            logger.debug("CooperativeLoop is stopping, waiting for the previous run before restart");
            try {
                previous.get();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the cooperative loop to stop");
                return previous;
            } catch (ExecutionException ee) {
                logger.warn("Cooperative loop exited abnormally", ee.getCause());
            }
        }
    }

    @GuardedBy("this")
    private CompletableFuture<Void> begin(CancellationToken token) {
        this.token = token;
        this.stopping = false;
        this.completion = new CompletableFuture<>();
        state.set(LoopState.STARTING);
        synchronized (waitLock) {
            pendingResume = null;
            wakeSignalled = false;
        }
        if (interruptOnChange) {
            engine.addChangeListener(changeListener);
        }
        token.onStopRequested(this::wake);

        CompletableFuture<Void> done = completion;
        try {
            executor.execute(this::run);
        } catch (RejectedExecutionException e) {
            finish();
            throw e;
        }
        return done;
    }

    /**
     * Request a stop and release a pending wait. Returns the completion future.
     */
    public @NotNull CompletableFuture<Void> stop() {
        CompletableFuture<Void> done;
        synchronized (this) {
            stopping = true;
            state.compareAndSet(LoopState.STARTING, LoopState.STOP_REQUESTED);
            state.compareAndSet(LoopState.RUNNING, LoopState.STOP_REQUESTED);
            done = completion;
        }
        wake();
        return done;
    }

    /**
     * Request a stop and wait for the loop to exit. From inside a job it only signals.
     */
    public void stopAndBlock() {
        CompletableFuture<Void> done = stop();
        if (iterationThread == Thread.currentThread()) return;
        try {
            done.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the cooperative loop to stop");
        } catch (ExecutionException ee) {
            logger.warn("Cooperative loop exited abnormally", ee.getCause());
        }
    }

    @Override
    public @NotNull LoopState getState() {
        return state.get();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public @NotNull Duration getPrecision() {
        return precision;
    }

    @Override
    public void close() {
        stopAndBlock();
        synchronized (this) {
            closed = true;
        }
        if (!ownsExecutor) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    // ======== Iteration ========

    private void run() {
        running = true;
        state.compareAndSet(LoopState.STARTING, LoopState.RUNNING);
        logger.debug("CooperativeLoop started, precision={}, adaptive={}, interruptOnChange={}",
                precision, useAdaptiveDelay, interruptOnChange);
        iterate();
    }

    private void iterate() {
        iterationThread = Thread.currentThread();
        try {
            if (shouldExit()) {
                finish();
                return;
            }
            try {
                // token is re-read between jobs so a stop requested by a job ends the drain
                while (!shouldExit() && engine.runSingleCheck(precision)) {
                    // drain everything that is due
                }
            } catch (Throwable t) {
                logger.error("Loop iteration failed, keep running on failure", t);
            }
            if (shouldExit()) {
                finish();
                return;
            }
            suspend(nextDelay());
        } finally {
            iterationThread = null;
        }
    }

    private boolean shouldExit() {
        CancellationToken current;
        synchronized (this) {
            current = token;
        }
        if (current.isStopRequested()) {
            if (!stopping) {
                logger.debug("Cancellation requested: {}", current.reason());
            }
            stopping = true;
            state.compareAndSet(LoopState.RUNNING, LoopState.STOP_REQUESTED);
        }
        return stopping;
    }

    private void suspend(Duration delay) {
        boolean rejected = false;
        synchronized (waitLock) {
            try {
                if (wakeSignalled) {
                    wakeSignalled = false;
                    executor.execute(this::resume);
                } else {
                    pendingResume = executor.schedule(this::resume, delay.toNanos(), TimeUnit.NANOSECONDS);
                }
            } catch (RejectedExecutionException e) {
                logger.warn("Executor rejected the next iteration, stopping", e);
                rejected = true;
            }
        }
        if (rejected) {
            stopping = true;
            finish();
        }
    }

    private void resume() {
        synchronized (waitLock) {
            pendingResume = null;
            wakeSignalled = false;
        }
        iterate();
    }

    /**
     * Release a pending wait now, or make the next suspend return immediately.
     */
    private void wake() {
        boolean rejected = false;
        synchronized (waitLock) {
            if (pendingResume != null && pendingResume.cancel(false)) {
                pendingResume = null;
                try {
                    executor.execute(this::resume);
                } catch (RejectedExecutionException e) {
                    logger.warn("Executor rejected a wake-up, stopping", e);
                    rejected = true;
                }
            } else {
                wakeSignalled = true;
            }
        }
        if (rejected) {
            stopping = true;
            finish();
        }
    }

    Duration nextDelay() {
        if (!useAdaptiveDelay) {
            return precision;
        }
        Duration min = precision.dividedBy(ADAPTIVE_FACTOR);
        if (min.isZero()) min = Duration.ofNanos(1);
        Duration max = precision.multipliedBy(ADAPTIVE_FACTOR);
        Optional<Instant> nextDue = engine.nextDueTime();
        if (nextDue.isEmpty()) {
            return max;
        }
        Duration untilDue = Duration.between(engine.getClock().instant(), nextDue.get()).minus(precision);
        if (untilDue.compareTo(min) < 0) return min;
        if (untilDue.compareTo(max) > 0) return max;
        return untilDue;
    }

    private void finish() {
        engine.removeChangeListener(changeListener);
        CompletableFuture<Void> done;
        synchronized (this) {
            running = false;
            state.set(LoopState.STOPPED);
            done = completion;
        }
        logger.debug("CooperativeLoop stopped");
        done.complete(null);
    }
}
