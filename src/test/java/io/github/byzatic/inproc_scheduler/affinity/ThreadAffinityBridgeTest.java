package io.github.byzatic.inproc_scheduler.affinity;

import io.github.byzatic.inproc_scheduler.engine.Job;
import io.github.byzatic.inproc_scheduler.engine.JobEventListener;
import io.github.byzatic.inproc_scheduler.engine.ScheduleEngine;
import io.github.byzatic.inproc_scheduler.loops.blocking.BlockingLoop;
import io.github.byzatic.inproc_scheduler.loops.round_robin.RoundRobinLoop;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ThreadAffinityBridgeTest {

    RoundRobinLoop target;
    List<Throwable> targetErrors;
    ScheduleEngine engine;
    BlockingLoop driver;

    @BeforeEach
    void setUp() {
        targetErrors = new CopyOnWriteArrayList<>();
        target = new RoundRobinLoop.Builder().addErrorListener(targetErrors::add).build();
        target.start();
        engine = new ScheduleEngine.Builder().build();
        driver = new BlockingLoop.Builder(engine).precision(Duration.ofMillis(10)).build();
    }

    @AfterEach
    void tearDown() {
        driver.close();
        engine.close();
        target.close();
    }

    // ======== RoundRobinAffinityBridge ========

    @Test
    void send_blocksUntilDone_andRunsOnTheTargetWorker() throws Exception {
        ThreadAffinityBridge bridge = target.asAffinityBridge();
        AtomicInteger value = new AtomicInteger();
        AtomicReference<Boolean> onWorker = new AtomicReference<>();

        bridge.send(() -> {
            onWorker.set(target.isLoopThread());
            value.set(42);
        });

        assertEquals(42, value.get());
        assertTrue(onWorker.get());
    }

    @Test
    void send_rethrowsTheCallbackFailure_andDoesNotReportIt() throws Exception {
        ThreadAffinityBridge bridge = target.asAffinityBridge();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> bridge.send(() -> { throw new IllegalStateException("inside"); }));

        assertTrue(ex.getCause() instanceof IllegalStateException);
        assertEquals("inside", ex.getCause().getMessage());
        target.runOnceAsFuture(() -> {}).get(1, TimeUnit.SECONDS);
        assertTrue(targetErrors.isEmpty());
    }

    @Test
    void post_returnsImmediately_andFailuresGoToTheTargetListeners() throws Exception {
        ThreadAffinityBridge bridge = target.asAffinityBridge();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch ran = new CountDownLatch(1);

        bridge.post(() -> {
            try {
                release.await(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ran.countDown();
        });
        bridge.post(() -> { throw new IllegalStateException("posted"); });
        // post did not wait for the blocked callback
        assertEquals(1, ran.getCount());
        release.countDown();

        assertTrue(ran.await(1, TimeUnit.SECONDS));
        target.runOnceAsFuture(() -> {}).get(1, TimeUnit.SECONDS);
        assertEquals(1, targetErrors.size());
        assertEquals("posted", targetErrors.get(0).getMessage());
    }

    @Test
    void jobWithAffinity_runsOnTheTargetLoop_plainJobStaysOnTheDriver() throws Exception {
        CountDownLatch ran = new CountDownLatch(3);
        List<Boolean> onTarget = new CopyOnWriteArrayList<>();
        AtomicReference<String> plainThread = new AtomicReference<>();
        AtomicReference<Boolean> plainOnTarget = new AtomicReference<>();
        Job<Void> inline = Job.<Void>newBuilder()
                .action(s -> {
                    onTarget.add(target.isLoopThread());
                    ran.countDown();
                })
                .firstRun(Instant.now())
                .affinityTarget(target.asAffinityBridge())
                .build();
        Job<Void> detached = Job.<Void>newBuilder()
                .action(s -> {
                    onTarget.add(target.isLoopThread());
                    ran.countDown();
                })
                .firstRun(Instant.now())
                .runDetached(true)
                .affinityTarget(target.asAffinityBridge())
                .build();
        Job<Void> plain = Job.of(() -> {
            plainThread.set(Thread.currentThread().getName());
            plainOnTarget.set(target.isLoopThread());
            ran.countDown();
        }, Instant.now());
        engine.registerAll(List.of(inline, detached, plain));

        driver.start();

        assertTrue(ran.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(true, true), onTarget);
        // without an affinity target the job stays on the driver
        assertTrue(plainThread.get().startsWith("blocking-loop-"), plainThread.get());
        assertFalse(plainOnTarget.get());
    }

    @Test
    void sideEffectsOfASentJob_areVisibleToTheNextDriverIteration() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        List<Integer> seenByNext = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        engine.register(Job.<Void>newBuilder()
                .action(s -> counter.incrementAndGet())
                .firstRun(Instant.now())
                .affinityTarget(target.asAffinityBridge())
                .build());
        engine.register(Job.of(() -> {
            seenByNext.add(counter.get());
            done.countDown();
        }, Instant.now().plusMillis(1)));

        driver.start();

        assertTrue(done.await(1, TimeUnit.SECONDS));
        assertEquals(List.of(1), seenByNext);
    }

    @Test
    void failingAffinityJob_isReportedOnTheEngine() throws Exception {
        AtomicReference<Throwable> error = new AtomicReference<>();
        CountDownLatch reported = new CountDownLatch(1);
        engine.addListener(new JobEventListener() {
            @Override public void onError(UUID jobId, Throwable e) {
                error.set(e);
                reported.countDown();
            }
        });
        engine.register(Job.<Void>newBuilder()
                .action(s -> { throw new IllegalArgumentException("affine"); })
                .firstRun(Instant.now())
                .affinityTarget(target.asAffinityBridge())
                .build());

        driver.start();

        assertTrue(reported.await(1, TimeUnit.SECONDS));
        assertEquals("affine", error.get().getMessage());
        target.runOnceAsFuture(() -> {}).get(1, TimeUnit.SECONDS);
        assertTrue(targetErrors.isEmpty());
    }

    @Test
    void suspendingJob_continuationResumesOnTheTargetLoop() throws Exception {
        ExecutorService elsewhere = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Boolean> continuationOnTarget = new CompletableFuture<>();
            engine.register(Job.<Void>newBuilder()
                    .suspendingAction(ctx -> CompletableFuture
                            .supplyAsync(() -> "io result", elsewhere)
                            .thenAcceptAsync(r -> continuationOnTarget.complete(target.isLoopThread()),
                                    ctx.continuationExecutor()))
                    .firstRun(Instant.now())
                    .runDetached(true)
                    .affinityTarget(target.asAffinityBridge())
                    .build());

            driver.start();

            assertTrue(continuationOnTarget.get(1, TimeUnit.SECONDS));
        } finally {
            elsewhere.shutdownNow();
        }
    }

    // ======== EngineAffinityBridge ========

    @Test
    void engineBridge_send_runsOnTheDriverThread() throws Exception {
        ThreadAffinityBridge bridge = new EngineAffinityBridge(engine);
        AtomicReference<String> thread = new AtomicReference<>();
        driver.start();

        bridge.send(() -> thread.set(Thread.currentThread().getName()));

        assertTrue(thread.get().startsWith("blocking-loop-"), thread.get());
    }

    @Test
    void engineBridge_send_rethrows_andPostReportsOnTheEngine() throws Exception {
        ThreadAffinityBridge bridge = new EngineAffinityBridge(engine);
        List<Throwable> engineErrors = new CopyOnWriteArrayList<>();
        CountDownLatch reported = new CountDownLatch(1);
        engine.addListener(new JobEventListener() {
            @Override public void onError(UUID jobId, Throwable e) {
                engineErrors.add(e);
                reported.countDown();
            }
        });
        driver.start();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> bridge.send(() -> { throw new IllegalStateException("sent"); }));
        assertEquals("sent", ex.getCause().getMessage());
        assertTrue(engineErrors.isEmpty());

        bridge.post(() -> { throw new IllegalStateException("posted"); });
        assertTrue(reported.await(1, TimeUnit.SECONDS));
        assertEquals("posted", engineErrors.get(0).getMessage());
    }
}
