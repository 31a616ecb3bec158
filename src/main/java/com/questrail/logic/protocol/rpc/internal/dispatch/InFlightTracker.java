package com.questrail.logic.protocol.rpc.internal.dispatch;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts outstanding calls so shutdown can wait for them.
 *
 * <p>A call is outstanding from {@link #begin()} until the matching
 * {@link #end()}, which the connection handler issues after the response
 * write has been attempted.</p>
 */
public final class InFlightTracker
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition idle = lock.newCondition();
    private int count;

    public void begin()
    {
        lock.lock();
        try {
            count++;
        } finally {
            lock.unlock();
        }
    }

    public void end()
    {
        lock.lock();
        try {
            if (count == 0) {
                throw new IllegalStateException("end() without matching begin()");
            }
            if (--count == 0) {
                idle.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public int count()
    {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until no call is outstanding.
     *
     * @return {@code true} if idle was reached, {@code false} on timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException
    {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (count > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = idle.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
