package io.hookbox.queue;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultInFlightTrackerTest {

    @Test
    void secondAcquireOfSameDeliveryFails() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        assertTrue(tracker.tryAcquire("delivery-1"));
        assertFalse(tracker.tryAcquire("delivery-1"));
        assertTrue(tracker.tryAcquire("delivery-2"));
        assertEquals(2, tracker.size());
    }

    @Test
    void releaseAllowsReacquisition() {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker();

        assertTrue(tracker.tryAcquire("delivery-1"));
        tracker.release("delivery-1");
        assertTrue(tracker.tryAcquire("delivery-1"));
        tracker.release("never-acquired");
        assertEquals(1, tracker.size());
    }

    @Test
    void ttlAllowsReacquisitionAfterExpiry() throws InterruptedException {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker(50);

        assertTrue(tracker.tryAcquire("delivery-1"));
        assertFalse(tracker.tryAcquire("delivery-1"));

        Thread.sleep(100);

        assertTrue(tracker.tryAcquire("delivery-1"));
    }

    @Test
    void zeroTtlMeansNoExpiry() throws InterruptedException {
        DefaultInFlightTracker tracker = new DefaultInFlightTracker(0);

        assertTrue(tracker.tryAcquire("delivery-1"));
        Thread.sleep(10);
        assertFalse(tracker.tryAcquire("delivery-1"));
    }

    @Test
    void negativeTtlRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultInFlightTracker(-1));
    }
}
