package io.github.byzatic.inproc_scheduler.engine;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.inproc_scheduler.affinity.ThreadAffinityBridge;
import io.github.byzatic.inproc_scheduler.base_exceptions.JobConfigurationException;
import io.github.byzatic.inproc_scheduler.config.SchedulerConfig;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * ScheduleEngine: the ordered collection of pending jobs:
 * - Jobs ordered by next run ascending, ties by registration order.
 * - Catch-up policy: skip to the next boundary after now, or drain one run per missed interval.
 * - Dispatch inline, detached (worker pool) or through a {@link ThreadAffinityBridge}.
 * - Events: error / running-behind.
 * <p>
 * The engine has no thread of its own; a loop drives it through {@link #runSingleCheck(Duration)}.
 * Job code never runs while the engine lock is held.
 */
@ThreadSafe
public final class ScheduleEngine implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(ScheduleEngine.class);

    private static final Comparator<Job<?>> DUE_ORDER =
            Comparator.<Job<?>, Instant>comparing(Job::nextRun).thenComparingLong(Job::sequence);

    private final Clock clock;
    private final Duration minPrecision;
    private final ExecutorService detachedExecutor;
    private final boolean ownsDetachedExecutor;
    private final List<JobEventListener> listeners;
    private final List<ScheduleChangeListener> changeListeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock")
    private final List<Job<?>> jobs = new ArrayList<>();
    @GuardedBy("lock")
    private long sequenceCounter = 0;

    private ScheduleEngine(Builder builder) {
        this.clock = builder.clock;
        this.minPrecision = builder.minPrecision;
        this.listeners = new CopyOnWriteArrayList<>(builder.listeners);
        if (builder.detachedExecutor != null) {
            this.detachedExecutor = builder.detachedExecutor;
            this.ownsDetachedExecutor = false;
        } else {
            this.detachedExecutor = newDetachedExecutor();
            this.ownsDetachedExecutor = true;
        }
    }

    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private Duration minPrecision = SchedulerConfig.defaults().getMinPrecision();
        private ExecutorService detachedExecutor;
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        public Builder clock(@NotNull Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Lateness beyond which {@link JobEventListener#onRunningBehind} fires.
         */
        public Builder minPrecision(@NotNull Duration minPrecision) {
            this.minPrecision = Objects.requireNonNull(minPrecision);
            return this;
        }

        public Builder config(@NotNull SchedulerConfig config) {
            this.minPrecision = config.getMinPrecision();
            return this;
        }

        /**
         * Provide your own pool for detached jobs. It is not shut down by {@link #close()}.
         */
        public Builder detachedExecutor(@NotNull ExecutorService executor) {
            this.detachedExecutor = Objects.requireNonNull(executor);
            return this;
        }

        public Builder addListener(@NotNull JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public ScheduleEngine build() {
            return new ScheduleEngine(this);
        }
    }

    // ======== Listeners ========

    public void addListener(@NotNull JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    public void addChangeListener(@NotNull ScheduleChangeListener l) {
        changeListeners.add(Objects.requireNonNull(l));
    }

    public void removeChangeListener(ScheduleChangeListener l) {
        changeListeners.remove(l);
    }

    // ======== Registration ========

    /**
     * Register a job. A repeating job that may skip and whose first run already lies in the past
     * starts at the next interval boundary instead.
     *
     * @throws JobConfigurationException if the job is already registered on an engine
     */
    public <S> @NotNull Job<S> register(@NotNull Job<S> job) {
        Objects.requireNonNull(job, "job");
        lock.lock();
        try {
            attachInternal(job, clock.instant());
            jobs.sort(DUE_ORDER);
        } finally {
            lock.unlock();
        }
        logger.trace("Registered {}", job);
        fireChanged();
        return job;
    }

    /**
     * Register a batch of jobs with a single re-sort and change signal.
     * Either all jobs are registered or none.
     */
    public @NotNull List<Job<?>> registerAll(@NotNull Collection<? extends Job<?>> batch) {
        List<Job<?>> added = new ArrayList<>(batch.size());
        lock.lock();
        try {
            Instant now = clock.instant();
            try {
                for (Job<?> job : batch) {
                    attachInternal(Objects.requireNonNull(job, "job"), now);
                    added.add(job);
                }
            } catch (RuntimeException e) {
                for (Job<?> job : added) {
                    jobs.remove(job);
                    job.release(this);
                }
                throw e;
            }
            jobs.sort(DUE_ORDER);
        } finally {
            lock.unlock();
        }
        logger.trace("Registered {} jobs", added.size());
        fireChanged();
        return added;
    }

    /**
     * Remove a job. Unregistering a job that is not registered here is a no-op.
     *
     * @return {@code true} if the job was removed by this call
     */
    public boolean unregister(@NotNull Job<?> job) {
        boolean removed;
        lock.lock();
        try {
            removed = detachInternal(job);
        } finally {
            lock.unlock();
        }
        if (removed) {
            logger.trace("Unregistered {}", job);
            fireChanged();
        }
        return removed;
    }

    /**
     * Remove several jobs; jobs not registered here are ignored.
     *
     * @return number of jobs removed by this call
     */
    public int unregisterAll(@NotNull Collection<? extends Job<?>> batch) {
        int removed = 0;
        lock.lock();
        try {
            for (Job<?> job : batch) {
                if (detachInternal(job)) removed++;
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) fireChanged();
        return removed;
    }

    /**
     * Schedule a bare callback once at {@code at}.
     */
    public @NotNull Job<Void> schedule(@NotNull Runnable callback, @NotNull Instant at) {
        return register(Job.of(callback, at));
    }

    /**
     * Schedule a bare callback starting at {@code firstRun}, repeating every {@code interval}.
     */
    public @NotNull Job<Void> schedule(@NotNull Runnable callback, @NotNull Instant firstRun, @Nullable Duration interval) {
        return register(Job.of(callback, firstRun, interval));
    }

    /**
     * Schedule a bare callback once after {@code delay}.
     */
    public @NotNull Job<Void> runIn(@NotNull Runnable callback, @NotNull Duration delay) {
        return register(Job.of(callback, clock.instant().plus(delay)));
    }

    // ======== Queries ========

    /**
     * The earliest job if it is due before {@code now + precisionWindow}.
     */
    public @NotNull Optional<Job<?>> peekDue(@NotNull Duration precisionWindow) {
        Instant horizon = clock.instant().plus(precisionWindow);
        lock.lock();
        try {
            if (jobs.isEmpty()) return Optional.empty();
            Job<?> first = jobs.get(0);
            return first.nextRun().isBefore(horizon) ? Optional.of(first) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next run of the earliest job, if any job is registered.
     */
    public @NotNull Optional<Instant> nextDueTime() {
        lock.lock();
        try {
            return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0).nextRun());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of registered jobs in due order.
     */
    public @NotNull List<Job<?>> getScheduledJobs() {
        lock.lock();
        try {
            return List.copyOf(jobs);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }

    public @NotNull Clock getClock() {
        return clock;
    }

    public @NotNull Duration getMinPrecision() {
        return minPrecision;
    }

    /**
     * Force a re-sort of the schedule and signal waiting loops. Normally never needed.
     */
    public void reloadSchedule() {
        lock.lock();
        try {
            jobs.sort(DUE_ORDER);
        } finally {
            lock.unlock();
        }
        fireChanged();
    }

    // ======== Execution ========

    /**
     * Take the due job, if any, run it according to its dispatch mode and reschedule it.
     *
     * @return {@code true} if a due job was taken, {@code false} if nothing was due
     */
    public boolean runSingleCheck(@NotNull Duration precision) {
        Job<?> job = peekDue(precision).orElse(null);
        if (job == null) return false;

        Instant due = readNextRun(job);
        if (job.owner() != this || due == null) {
            // unregistered between peek and dispatch
            return true;
        }
        Duration lateness = Duration.between(due, clock.instant());
        if (lateness.compareTo(minPrecision) > 0) {
            fire(l -> l.onRunningBehind(job.getId(), lateness));
        }
        dispatch(job);
        reschedule(job);
        return true;
    }

    /**
     * After an execution: move a repeating job to its next run computed from its previous
     * next run, or retire a one-shot job. Does nothing for a job no longer registered here.
     */
    public void reschedule(@NotNull Job<?> job) {
        lock.lock();
        try {
            if (job.owner() != this) return;
            Duration interval = job.getInterval();
            if (interval != null) {
                job.updateNextRun(computeCatchUp(job.nextRun(), interval, job.isCanSkip(), clock.instant()));
                jobs.sort(DUE_ORDER);
            } else {
                detachInternal(job);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next run after {@code last}.
     * Skip: the first boundary {@code last + n * interval} strictly after now, at least one interval on.
     * No skip: {@code last + interval}, which may still be in the past.
     */
    public @NotNull Instant computeCatchUp(@NotNull Instant last, @NotNull Duration interval, boolean skip) {
        return computeCatchUp(last, interval, skip, clock.instant());
    }

    private static Instant computeCatchUp(Instant last, Duration interval, boolean skip, Instant now) {
        if (!skip) {
            return last.plus(interval);
        }
        long elapsed = Duration.between(last, now).toNanos();
        long steps = Math.max(Math.floorDiv(elapsed, interval.toNanos()) + 1, 1);
        return last.plus(interval.multipliedBy(steps));
    }

    private void dispatch(Job<?> job) {
        ThreadAffinityBridge target = job.getAffinityTarget();
        try {
            if (target != null) {
                if (job.isRunDetached()) {
                    target.post(() -> invoke(job));
                } else {
                    target.send(() -> invoke(job));
                }
            } else if (job.isRunDetached()) {
                detachedExecutor.execute(() -> invoke(job));
            } else {
                invoke(job);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} on its affinity target", job.getId());
        } catch (RejectedExecutionException | CompletionException e) {
            fireError(job, e instanceof CompletionException && e.getCause() != null ? e.getCause() : e);
        }
    }

    private <S> void invoke(Job<S> job) {
        try {
            if (job.action() != null) {
                job.action().run(job.getState());
                return;
            }
            JobContext<S> context = new JobContext<>(job.getId(), job.getState(), continuationExecutor(job));
            CompletionStage<?> pending = job.suspendingAction().run(context);
            if (pending != null) {
                pending.whenComplete((result, error) -> {
                    if (error != null) fireError(job, unwrap(error));
                });
            }
        } catch (Throwable ex) {
            fireError(job, ex);
        }
    }

    private Executor continuationExecutor(Job<?> job) {
        ThreadAffinityBridge target = job.getAffinityTarget();
        return target != null ? target.asExecutor() : detachedExecutor;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) return error.getCause();
        return error;
    }

    // ======== Lifecycle ========

    /**
     * Unregister every job and shut down the engine's own detached pool.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            for (Job<?> job : jobs) {
                job.release(this);
            }
            jobs.clear();
        } finally {
            lock.unlock();
        }
        fireChanged();
        if (!ownsDetachedExecutor) return;
        detachedExecutor.shutdown();
        try {
            if (!detachedExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                detachedExecutor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            detachedExecutor.shutdownNow();
        }
    }

    // ======== Internals ========

    Instant readNextRun(Job<?> job) {
        lock.lock();
        try {
            return job.nextRun();
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void attachInternal(Job<?> job, Instant now) {
        Instant first = job.claim(this);
        if (first == null) {
            throw new JobConfigurationException("Job " + job.getId() + " is already registered");
        }
        Instant next = first;
        Duration interval = job.getInterval();
        if (job.isCanSkip() && interval != null && first.isBefore(now)) {
            next = computeCatchUp(first, interval, true, now);
        }
        job.place(sequenceCounter++, next);
        jobs.add(job);
    }

    @GuardedBy("lock")
    private boolean detachInternal(Job<?> job) {
        if (job.owner() != this) return false;
        jobs.remove(job);
        job.release(this);
        return true;
    }

    private void fireChanged() {
        for (ScheduleChangeListener l : changeListeners) {
            try {
                l.onScheduleChanged();
            } catch (Throwable t) {
                logger.warn("Schedule change listener failed", t);
            }
        }
    }

    private void fireError(Job<?> job, Throwable error) {
        logger.debug("Job {} failed", job.getId(), error);
        fire(l -> l.onError(job.getId(), error));
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (Throwable t) {
                logger.warn("Job event listener failed, ignoring", t);
            }
        }
    }

    private static final AtomicInteger DETACHED_THREAD_COUNTER = new AtomicInteger();

    private static ExecutorService newDetachedExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                Math.max(2, Runtime.getRuntime().availableProcessors()),
                Math.max(4, Runtime.getRuntime().availableProcessors() * 2),
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, "schedule-detached-" + DETACHED_THREAD_COUNTER.getAndIncrement());
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, ex) ->
                            logger.error("Uncaught in {}", th.getName(), ex));
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
