package io.github.byzatic.inproc_scheduler.loops.blocking;

import io.github.byzatic.inproc_scheduler.config.SchedulerConfig;
import io.github.byzatic.inproc_scheduler.engine.ScheduleEngine;
import io.github.byzatic.inproc_scheduler.loops.AbstractThreadLoop;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * BlockingLoop: a general purpose loop with a single backing thread:
 * - Runs every due job of the engine, one at a time.
 * - Sleeps a fixed precision when nothing is due, so new jobs are picked up within one precision.
 */
public final class BlockingLoop extends AbstractThreadLoop {
    private final ScheduleEngine engine;
    private final Duration precision;

    private BlockingLoop(Builder builder) {
        super("blocking-loop");
        this.engine = builder.engine;
        this.precision = builder.precision;
    }

    public static final class Builder {
        private final ScheduleEngine engine;
        private Duration precision = SchedulerConfig.defaults().getPrecision();

        public Builder(@NotNull ScheduleEngine engine) {
            this.engine = Objects.requireNonNull(engine);
        }

        public Builder precision(@NotNull Duration precision) {
            if (precision.isZero() || precision.isNegative()) {
                throw new IllegalArgumentException("precision must be > 0");
            }
            this.precision = precision;
            return this;
        }

        public Builder config(@NotNull SchedulerConfig config) {
            this.precision = config.getPrecision();
            return this;
        }

        public BlockingLoop build() {
            return new BlockingLoop(this);
        }
    }

    public @NotNull ScheduleEngine getEngine() {
        return engine;
    }

    public @NotNull Duration getPrecision() {
        return precision;
    }

    @Override
    protected void runIteration() throws InterruptedException {
        if (!engine.runSingleCheck(precision)) {
            TimeUnit.NANOSECONDS.sleep(precision.toNanos());
        }
    }
}
