package io.github.byzatic.inproc_scheduler.loops.cooperative;

import io.github.byzatic.inproc_scheduler.engine.Job;
import io.github.byzatic.inproc_scheduler.engine.ScheduleEngine;
import io.github.byzatic.inproc_scheduler.loops.CancellationToken;
import io.github.byzatic.inproc_scheduler.loops.LoopState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CooperativeLoopTest {

    ScheduleEngine engine;
    CooperativeLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) loop.close();
        if (engine != null) engine.close();
    }

    private void awaitRunning() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 1_000;
        while (!loop.isRunning() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(loop.isRunning(), "Loop did not start");
        // let the first iteration reach its wait
        Thread.sleep(100);
    }

    @Test
    void interruptOnChange_wakesAPendingWait() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofSeconds(10))
                .interruptOnChange(true)
                .build();
        loop.start();
        awaitRunning();

        CountDownLatch ran = new CountDownLatch(1);
        engine.schedule(ran::countDown, Instant.now());

        assertTrue(ran.await(500, TimeUnit.MILLISECONDS), "Registration did not wake the loop");
    }

    @Test
    void withoutInterruptOnChange_waitRunsItsCourse() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofSeconds(10))
                .interruptOnChange(false)
                .useAdaptiveDelay(false)
                .build();
        loop.start();
        awaitRunning();

        CountDownLatch ran = new CountDownLatch(1);
        engine.schedule(ran::countDown, Instant.now());

        assertFalse(ran.await(500, TimeUnit.MILLISECONDS), "Loop woke up without a change signal");
    }

    @Test
    void stop_releasesAPendingWait() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofSeconds(10))
                .interruptOnChange(false)
                .build();
        CompletableFuture<Void> done = loop.start();
        awaitRunning();

        loop.stop();

        done.get(1, TimeUnit.SECONDS);
        assertFalse(loop.isRunning());
        assertEquals(LoopState.STOPPED, loop.getState());
    }

    @Test
    void cancellationToken_stopsTheLoop() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofSeconds(10))
                .build();
        CancellationToken token = new CancellationToken();
        CompletableFuture<Void> done = loop.start(token);
        awaitRunning();

        token.requestStop("shutdown");

        done.get(1, TimeUnit.SECONDS);
        assertEquals(LoopState.STOPPED, loop.getState());
    }

    @Test
    void tokenStopFromAJob_endsTheBacklogDrain() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofMillis(10))
                .build();
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();
        // no skip: thousands of missed 1 ms intervals are due at once
        engine.register(Job.<Void>newBuilder()
                .action(s -> {
                    if (runs.incrementAndGet() == 5) token.requestStop("enough");
                })
                .firstRun(Instant.now().minusSeconds(10))
                .interval(Duration.ofMillis(1))
                .canSkip(false)
                .build());

        CompletableFuture<Void> done = loop.start(token);

        done.get(1, TimeUnit.SECONDS);
        assertEquals(5, runs.get());
        assertEquals(LoopState.STOPPED, loop.getState());
    }

    @Test
    void startRightAfterStop_waitsForTheRunningJob_andRunsAgain() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine).precision(Duration.ofMillis(10)).build();
        CountDownLatch busy = new CountDownLatch(1);
        engine.runIn(() -> {
            busy.countDown();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, Duration.ZERO);
        CompletableFuture<Void> first = loop.start();
        assertTrue(busy.await(1, TimeUnit.SECONDS));

        loop.stop();
        CompletableFuture<Void> second = loop.start();

        assertTrue(first.isDone());
        assertNotSame(first, second);
        CountDownLatch ran = new CountDownLatch(1);
        engine.runIn(ran::countDown, Duration.ZERO);
        assertTrue(ran.await(1, TimeUnit.SECONDS));
        assertTrue(loop.isRunning());
        assertFalse(second.isDone());
    }

    @Test
    void recurringJobs_keepRunning_andFailuresAreIsolated() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofMillis(10))
                .build();
        CountDownLatch healthy = new CountDownLatch(5);
        engine.register(Job.<Void>newBuilder()
                .action(s -> { throw new IllegalStateException("boom"); })
                .firstRun(Instant.now())
                .interval(Duration.ofMillis(20))
                .build());
        engine.schedule(healthy::countDown, Instant.now(), Duration.ofMillis(20));

        loop.start();

        assertTrue(healthy.await(2, TimeUnit.SECONDS));
        assertTrue(loop.isRunning());
    }

    @Test
    void start_whenRunning_returnsTheSameCompletion_andLoopIsRestartable() throws Exception {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine).precision(Duration.ofMillis(10)).build();

        CompletableFuture<Void> first = loop.start();
        assertSame(first, loop.start());
        loop.stopAndBlock();
        assertTrue(first.isDone());

        CountDownLatch ran = new CountDownLatch(1);
        engine.runIn(ran::countDown, Duration.ZERO);
        CompletableFuture<Void> second = loop.start();
        assertNotSame(first, second);
        assertTrue(ran.await(1, TimeUnit.SECONDS));
    }

    @Test
    void closedLoop_cannotStart() {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine).build();
        loop.close();

        assertThrows(IllegalStateException.class, loop::start);
    }

    @Test
    void adaptiveDelay_followsNextDueTime_withinBounds() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        engine = new ScheduleEngine.Builder().clock(Clock.fixed(now, ZoneOffset.UTC)).build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofMillis(128))
                .useAdaptiveDelay(true)
                .build();

        // nothing scheduled: longest wait
        assertEquals(Duration.ofMillis(128 * 128), loop.nextDelay());

        Job<Void> soon = engine.schedule(() -> {}, now.plusMillis(1000));
        assertEquals(Duration.ofMillis(1000 - 128), loop.nextDelay());
        engine.unregister(soon);

        engine.schedule(() -> {}, now);
        assertEquals(Duration.ofMillis(1), loop.nextDelay());
    }

    @Test
    void fixedDelay_isPrecision() {
        engine = new ScheduleEngine.Builder().build();
        loop = new CooperativeLoop.Builder(engine)
                .precision(Duration.ofMillis(250))
                .useAdaptiveDelay(false)
                .build();
        engine.runIn(() -> {}, Duration.ofHours(1));

        assertEquals(Duration.ofMillis(250), loop.nextDelay());
    }
}
