package io.github.byzatic.inproc_scheduler.loops;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token. A loop checks it once per iteration.
 */
public final class CancellationToken {
    private final static Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    // null until the first stop request
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> stopCallbacks = new CopyOnWriteArrayList<>();

    public boolean isStopRequested() {
        return reason.get() != null;
    }

    public String reason() {
        String r = reason.get();
        return r != null ? r : "";
    }

    /**
     * Request a stop. Only the first request counts.
     */
    public void requestStop(@NotNull String reason) {
        if (!this.reason.compareAndSet(null, Objects.requireNonNull(reason))) return;
        for (Runnable callback : stopCallbacks) {
            if (!stopCallbacks.remove(callback)) continue;
            try {
                callback.run();
            } catch (Throwable t) {
                logger.warn("Stop callback failed", t);
            }
        }
    }

    /**
     * Run {@code callback} once when a stop is requested; immediately if it already was.
     */
    public void onStopRequested(@NotNull Runnable callback) {
        stopCallbacks.add(Objects.requireNonNull(callback));
        if (isStopRequested() && stopCallbacks.remove(callback)) {
            callback.run();
        }
    }

    /**
     * Helper: throws InterruptedException if a stop has been requested.
     */
    public void throwIfStopRequested() throws InterruptedException {
        if (isStopRequested()) throw new InterruptedException("Stop requested: " + reason());
    }
}
