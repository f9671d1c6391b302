package io.github.byzatic.inproc_scheduler.config;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Strongly-typed scheduler options shared by the engine and the loops.
 */
public final class SchedulerConfig {
    private static final SchedulerConfig DEFAULTS = new Builder().build();

    private final Duration precision;
    private final Duration minPrecision;
    private final boolean interruptOnChange;
    private final boolean useAdaptiveDelay;
    private final Duration noJobDelay;

    private SchedulerConfig(Builder b) {
        if (b.precision.isZero() || b.precision.isNegative()) {
            throw new IllegalArgumentException("precision must be > 0");
        }
        if (b.minPrecision.isNegative()) {
            throw new IllegalArgumentException("minPrecision must be >= 0");
        }
        if (b.noJobDelay.isNegative()) {
            throw new IllegalArgumentException("noJobDelay must be >= 0");
        }
        this.precision = b.precision;
        this.minPrecision = b.minPrecision;
        this.interruptOnChange = b.interruptOnChange;
        this.useAdaptiveDelay = b.useAdaptiveDelay;
        this.noJobDelay = b.noJobDelay;
    }

    public static @NotNull SchedulerConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Target polling/wake granularity.
     */
    public @NotNull Duration getPrecision() {
        return precision;
    }

    /**
     * Lateness beyond which a running-behind event is raised.
     */
    public @NotNull Duration getMinPrecision() {
        return minPrecision;
    }

    /**
     * Whether registering or removing a job wakes a waiting cooperative loop.
     */
    public boolean isInterruptOnChange() {
        return interruptOnChange;
    }

    /**
     * Whether the cooperative loop waits until shortly before the next job instead of a fixed precision.
     */
    public boolean isUseAdaptiveDelay() {
        return useAdaptiveDelay;
    }

    /**
     * Idle sleep of a round-robin loop running without a wait signal.
     */
    public @NotNull Duration getNoJobDelay() {
        return noJobDelay;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{precision=" + precision + ", minPrecision=" + minPrecision +
                ", interruptOnChange=" + interruptOnChange + ", useAdaptiveDelay=" + useAdaptiveDelay +
                ", noJobDelay=" + noJobDelay + '}';
    }

    public static final class Builder {
        private Duration precision = Duration.ofMillis(100);
        private Duration minPrecision = Duration.ofMillis(2000);
        private boolean interruptOnChange = true;
        private boolean useAdaptiveDelay = true;
        private Duration noJobDelay = Duration.ofMillis(5);

        public Builder precision(@NotNull Duration precision) {
            this.precision = Objects.requireNonNull(precision);
            return this;
        }

        public Builder minPrecision(@NotNull Duration minPrecision) {
            this.minPrecision = Objects.requireNonNull(minPrecision);
            return this;
        }

        public Builder interruptOnChange(boolean interruptOnChange) {
            this.interruptOnChange = interruptOnChange;
            return this;
        }

        public Builder useAdaptiveDelay(boolean useAdaptiveDelay) {
            this.useAdaptiveDelay = useAdaptiveDelay;
            return this;
        }

        public Builder noJobDelay(@NotNull Duration noJobDelay) {
            this.noJobDelay = Objects.requireNonNull(noJobDelay);
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
