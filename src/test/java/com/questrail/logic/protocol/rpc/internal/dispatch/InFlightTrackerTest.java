package com.questrail.logic.protocol.rpc.internal.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class InFlightTrackerTest
{
    @Test
    void idleTrackerReturnsImmediately() throws InterruptedException
    {
        assertTrue(new InFlightTracker().awaitIdle(Duration.ZERO));
    }

    @Test
    void awaitIdleTimesOutWhileCallsAreOutstanding() throws InterruptedException
    {
        InFlightTracker tracker = new InFlightTracker();
        tracker.begin();

        assertEquals(1, tracker.count());
        assertFalse(tracker.awaitIdle(Duration.ofMillis(50)));
    }

    @Test
    void awaitIdleWakesWhenLastCallEnds() throws Exception
    {
        InFlightTracker tracker = new InFlightTracker();
        tracker.begin();
        tracker.begin();

        CompletableFuture<Boolean> idle = CompletableFuture.supplyAsync(() -> {
            try {
                return tracker.awaitIdle(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        tracker.end();
        assertEquals(1, tracker.count());
        tracker.end();

        assertTrue(idle.get(2, TimeUnit.SECONDS));
        assertEquals(0, tracker.count());
    }
}
