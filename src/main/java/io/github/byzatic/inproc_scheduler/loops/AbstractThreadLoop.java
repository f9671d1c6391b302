package io.github.byzatic.inproc_scheduler.loops;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base of loops that own one worker thread.
 * <p>
 * The worker repeatedly calls {@link #runIteration()} until a stop is requested. A stop is
 * observed at the top of the next iteration; the item in flight is never interrupted.
 * {@link #wakeUp()} is called on every stop request so a waiting iteration returns promptly.
 */
@ThreadSafe
public abstract class AbstractThreadLoop implements SchedulerLoopInterface {
    private final static Logger logger = LoggerFactory.getLogger(AbstractThreadLoop.class);

    private final ThreadFactory threadFactory;
    private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.STOPPED);
    private volatile boolean stopping = true;
    private volatile boolean running = false;

    @GuardedBy("this")
    private Thread worker;
    @GuardedBy("this")
    private CompletableFuture<Void> exited = CompletableFuture.completedFuture(null);

    protected AbstractThreadLoop(@NotNull String threadNamePrefix) {
        AtomicInteger threadCounter = new AtomicInteger();
        this.threadFactory = r -> {
            Thread t = new Thread(r, threadNamePrefix + "-" + threadCounter.getAndIncrement());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex));
            return t;
        };
    }

    /**
     * One pass of the loop. Implementations wait (sleep or signal) when there is nothing to do.
     */
    protected abstract void runIteration() throws InterruptedException;

    /**
     * Release whatever the worker is waiting on. Called on every stop request.
     */
    protected void wakeUp() {
    }

    /**
     * Whether the worker should leave the loop. Subclasses may add conditions (e.g. a drained queue).
     */
    protected boolean shouldExit() {
        return stopping;
    }

    /**
     * Start the worker thread. No-op if the loop is already running.
     * If a stop is still in progress, waits for the previous worker to exit and then starts a new one.
     *
     * @throws IllegalStateException if called from the worker of a loop that is stopping
     */
    public void start() {
        while (true) {
            CompletableFuture<Void> previous;
            synchronized (this) {
                LoopState current = state.get();
                if (current == LoopState.STARTING || current == LoopState.RUNNING) return;
                if (current == LoopState.STOPPED) {
                    beginRun();
                    worker = threadFactory.newThread(this::loop);
                    worker.start();
                    return;
                }
                if (worker == Thread.currentThread()) {
                    throw new IllegalStateException("Can't restart " + getClass().getSimpleName() + " from its own stopping worker");
                }
                previous = exited;
            }
            logger.debug("{} is stopping, waiting for the previous worker before restart", getClass().getSimpleName());
            if (!awaitExit(previous)) return;
        }
    }

    /**
     * Run the loop on the calling thread until it is stopped. A previous run is stopped and joined first.
     */
    public void runOnCurrentThread() {
        stopAndBlock();
        synchronized (this) {
            beginRun();
            worker = Thread.currentThread();
        }
        loop();
    }

    /**
     * Request a stop and return immediately. The returned future completes when the worker has exited.
     */
    public @NotNull CompletableFuture<Void> signalStop() {
        CompletableFuture<Void> done;
        synchronized (this) {
            requestStopInternal();
            done = exited;
        }
        wakeUp();
        return done;
    }

    /**
     * Request a stop and wait until the worker has exited. Idempotent.
     * Called from the worker itself it only signals, since the worker cannot join itself.
     */
    public void stopAndBlock() {
        CompletableFuture<Void> done;
        boolean onWorker;
        synchronized (this) {
            requestStopInternal();
            done = exited;
            onWorker = worker == Thread.currentThread();
        }
        wakeUp();
        if (onWorker) return;
        awaitExit(done);
    }

    /**
     * @return {@code false} if the caller was interrupted while waiting
     */
    private boolean awaitExit(CompletableFuture<Void> done) {
        try {
            done.get();
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} to stop", getClass().getSimpleName());
            return false;
        } catch (ExecutionException ee) {
            logger.warn("{} exited abnormally", getClass().getSimpleName(), ee.getCause());
            return true;
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

    /**
     * {@code true} if the caller runs on this loop's worker.
     */
    public boolean isLoopThread() {
        synchronized (this) {
            return worker == Thread.currentThread();
        }
    }

    @Override
    public void close() {
        stopAndBlock();
    }

    protected boolean isStopRequested() {
        return stopping;
    }

    @GuardedBy("this")
    protected void requestStopInternal() {
        stopping = true;
        state.compareAndSet(LoopState.STARTING, LoopState.STOP_REQUESTED);
        state.compareAndSet(LoopState.RUNNING, LoopState.STOP_REQUESTED);
    }

    @GuardedBy("this")
    private void beginRun() {
        stopping = false;
        state.set(LoopState.STARTING);
        exited = new CompletableFuture<>();
    }

    private void loop() {
        CompletableFuture<Void> done;
        synchronized (this) {
            done = exited;
        }
        running = true;
        state.compareAndSet(LoopState.STARTING, LoopState.RUNNING);
        logger.debug("{} started on {}", getClass().getSimpleName(), Thread.currentThread().getName());
        try {
            while (!shouldExit()) {
                try {
                    runIteration();
                } catch (InterruptedException ie) {
                    if (stopping) break;
                    logger.debug("Ignoring interrupt of a running loop");
                } catch (Throwable t) {
                    logger.error("Loop iteration failed, keep running on failure", t);
                }
            }
        } finally {
            running = false;
            synchronized (this) {
                if (worker == Thread.currentThread()) worker = null;
                state.set(LoopState.STOPPED);
            }
            logger.debug("{} stopped", getClass().getSimpleName());
            done.complete(null);
        }
    }
}
