package io.github.byzatic.inproc_scheduler.affinity;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;

/**
 * Per-call completion of a {@link ThreadAffinityBridge#send(Runnable)}: wraps the callback so it
 * never throws on the target loop and hands its failure back to the waiting caller.
 */
final class SendCompletion implements Runnable {
    private final Runnable callback;
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Throwable failure;

    SendCompletion(@NotNull Runnable callback) {
        this.callback = callback;
    }

    @Override
    public void run() {
        try {
            callback.run();
        } catch (Throwable t) {
            failure = t;
        } finally {
            done.countDown();
        }
    }

    void await() throws InterruptedException {
        done.await();
        Throwable t = failure;
        if (t != null) {
            throw new CompletionException(t);
        }
    }
}
