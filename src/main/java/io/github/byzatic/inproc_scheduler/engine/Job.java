package io.github.byzatic.inproc_scheduler.engine;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.inproc_scheduler.affinity.ThreadAffinityBridge;
import io.github.byzatic.inproc_scheduler.base_exceptions.JobConfigurationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A schedulable unit of work plus its timing metadata.
 * <p>
 * A job is owned by at most one {@link ScheduleEngine} at a time. Its {@code nextRun}
 * is maintained by the owning engine under the engine lock; everything else is fixed
 * at build time except {@code firstRun}, which may be changed only while the job is not registered.
 *
 * @param <S> type of the state object handed back to the callback
 */
public final class Job<S> {
    private final UUID id;
    private final JobAction<S> action;
    private final SuspendingJobAction<S> suspendingAction;
    private final S state;
    private final Duration interval;
    private final boolean canSkip;
    private final boolean runDetached;
    private final ThreadAffinityBridge affinityTarget;

    // orders setFirstRun against claim, so a claimed job never sees a later firstRun write
    private final Object firstRunLock = new Object();
    private volatile Instant firstRun;

    // written by the owning engine under its lock
    @GuardedBy("owner.lock")
    private Instant nextRun;
    @GuardedBy("owner.lock")
    private long sequence;
    private final AtomicReference<ScheduleEngine> owner = new AtomicReference<>();

    private Job(Builder<S> builder) {
        this.id = UUID.randomUUID();
        this.action = builder.action;
        this.suspendingAction = builder.suspendingAction;
        this.state = builder.state;
        this.interval = builder.interval;
        this.canSkip = builder.canSkip;
        this.runDetached = builder.runDetached;
        this.affinityTarget = builder.affinityTarget;
        this.firstRun = builder.firstRun;
    }

    public static <S> Builder<S> newBuilder() {
        return new Builder<>();
    }

    /**
     * One-shot job for a bare callback.
     */
    public static @NotNull Job<Void> of(@NotNull Runnable callback, @NotNull Instant firstRun) {
        return of(callback, firstRun, null);
    }

    /**
     * Job for a bare callback, repeating every {@code interval} when one is given.
     */
    public static @NotNull Job<Void> of(@NotNull Runnable callback, @NotNull Instant firstRun, @Nullable Duration interval) {
        Objects.requireNonNull(callback, "callback");
        return Job.<Void>newBuilder()
                .action(s -> callback.run())
                .firstRun(firstRun)
                .interval(interval)
                .build();
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @Nullable S getState() {
        return state;
    }

    public @NotNull Instant getFirstRun() {
        return firstRun;
    }

    /**
     * Changes the first intended execution.
     *
     * @throws JobConfigurationException if the job is currently registered on an engine
     */
    public void setFirstRun(@NotNull Instant firstRun) {
        Objects.requireNonNull(firstRun, "firstRun");
        synchronized (firstRunLock) {
            if (isRegistered()) {
                throw new JobConfigurationException("Can't modify the first run of a registered job " + id);
            }
            this.firstRun = firstRun;
        }
    }

    /**
     * Next due execution, or {@code null} if the job has never been registered.
     * Only a snapshot; the engine may move it at any time.
     */
    public @Nullable Instant getNextRun() {
        ScheduleEngine engine = owner.get();
        if (engine == null) {
            return nextRun;
        }
        return engine.readNextRun(this);
    }

    public @Nullable Duration getInterval() {
        return interval;
    }

    public boolean isRecurring() {
        return interval != null;
    }

    public boolean isCanSkip() {
        return canSkip;
    }

    public boolean isRunDetached() {
        return runDetached;
    }

    public @Nullable ThreadAffinityBridge getAffinityTarget() {
        return affinityTarget;
    }

    public boolean isRegistered() {
        return owner.get() != null;
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", firstRun=" + firstRun +
                (interval != null ? ", interval=" + interval : "") +
                ", canSkip=" + canSkip + ", runDetached=" + runDetached +
                (affinityTarget != null ? ", affinity" : "") +
                ", registered=" + isRegistered() + '}';
    }

    // ======== Engine-side accessors ========

    JobAction<S> action() {
        return action;
    }

    SuspendingJobAction<S> suspendingAction() {
        return suspendingAction;
    }

    Instant nextRun() {
        return nextRun;
    }

    void updateNextRun(Instant nextRun) {
        this.nextRun = nextRun;
    }

    long sequence() {
        return sequence;
    }

    ScheduleEngine owner() {
        return owner.get();
    }

    /**
     * Takes ownership for {@code engine}; fails if another engine (or the same one) already owns the job.
     *
     * @return the first run the job is registered with, or {@code null} if it is already owned
     */
    @Nullable Instant claim(ScheduleEngine engine) {
        synchronized (firstRunLock) {
            return owner.compareAndSet(null, engine) ? firstRun : null;
        }
    }

    void place(long sequence, Instant nextRun) {
        this.sequence = sequence;
        this.nextRun = nextRun;
    }

    void release(ScheduleEngine engine) {
        owner.compareAndSet(engine, null);
    }

    public static final class Builder<S> {
        private JobAction<S> action;
        private SuspendingJobAction<S> suspendingAction;
        private S state;
        private Instant firstRun;
        private Duration interval;
        private boolean canSkip = true;
        private boolean runDetached = false;
        private ThreadAffinityBridge affinityTarget;

        private Builder() {
        }

        public Builder<S> action(@NotNull JobAction<S> action) {
            this.action = Objects.requireNonNull(action, "action");
            this.suspendingAction = null;
            return this;
        }

        public Builder<S> suspendingAction(@NotNull SuspendingJobAction<S> suspendingAction) {
            this.suspendingAction = Objects.requireNonNull(suspendingAction, "suspendingAction");
            this.action = null;
            return this;
        }

        public Builder<S> state(@Nullable S state) {
            this.state = state;
            return this;
        }

        public Builder<S> firstRun(@NotNull Instant firstRun) {
            this.firstRun = Objects.requireNonNull(firstRun, "firstRun");
            return this;
        }

        /**
         * Interval between runs; {@code null} for a single run.
         */
        public Builder<S> interval(@Nullable Duration interval) {
            this.interval = interval;
            return this;
        }

        /**
         * {@code true} (default): a late job jumps to the next interval boundary after now.
         * {@code false}: the job runs once per missed interval until it has caught up.
         */
        public Builder<S> canSkip(boolean canSkip) {
            this.canSkip = canSkip;
            return this;
        }

        /**
         * Run on an independent worker instead of inline on the loop.
         */
        public Builder<S> runDetached(boolean runDetached) {
            this.runDetached = runDetached;
            return this;
        }

        /**
         * Marshal execution through the given bridge instead of running it directly.
         */
        public Builder<S> affinityTarget(@Nullable ThreadAffinityBridge affinityTarget) {
            this.affinityTarget = affinityTarget;
            return this;
        }

        public Job<S> build() {
            if (action == null && suspendingAction == null) {
                throw new JobConfigurationException("Job needs an action");
            }
            if (firstRun == null) {
                throw new JobConfigurationException("Job needs a first run");
            }
            if (interval != null && (interval.isZero() || interval.isNegative())) {
                throw new JobConfigurationException("Interval must be > 0 but was " + interval);
            }
            return new Job<>(this);
        }
    }
}
