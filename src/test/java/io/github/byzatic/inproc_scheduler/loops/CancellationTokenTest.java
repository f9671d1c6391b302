package io.github.byzatic.inproc_scheduler.loops;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void requestStopSetsFlagAndReason() {
        CancellationToken t = new CancellationToken();
        assertFalse(t.isStopRequested());
        t.requestStop("because");
        assertTrue(t.isStopRequested());
        assertEquals("because", t.reason());
    }

    @Test
    void throwIfStopRequestedThrows() {
        CancellationToken t = new CancellationToken();
        t.requestStop("halt");
        InterruptedException ex = assertThrows(InterruptedException.class, t::throwIfStopRequested);
        assertTrue(ex.getMessage().contains("halt"));
    }

    @Test
    void stopCallbacksRunOnce_evenWhenRegisteredLate() {
        CancellationToken t = new CancellationToken();
        AtomicInteger early = new AtomicInteger();
        AtomicInteger late = new AtomicInteger();
        t.onStopRequested(early::incrementAndGet);
        t.onStopRequested(() -> { throw new IllegalStateException("ignored"); });

        t.requestStop("first");
        t.requestStop("second");
        t.onStopRequested(late::incrementAndGet);

        assertEquals(1, early.get());
        assertEquals(1, late.get());
    }
}
