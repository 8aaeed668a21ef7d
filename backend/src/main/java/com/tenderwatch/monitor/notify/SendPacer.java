package com.tenderwatch.monitor.notify;

import com.tenderwatch.monitor.model.RunState;
import com.tenderwatch.monitor.service.CancellationToken;
import com.tenderwatch.monitor.service.RunCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Paces the sends of one dispatch. Tickets are handed out in dispatch order and a send may only
 * start once every earlier ticket has been released; independently, consecutive sends across all
 * workers are kept at least {@code intervalMs} apart.
 */
class SendPacer {
    private static final long TURN_POLL_MS = 100;

    private final long intervalMs;
    private final ReentrantLock turnLock = new ReentrantLock();
    private final Condition turnChanged = turnLock.newCondition();
    private final Set<Integer> released = new HashSet<>();
    private int nextTicket;

    private final Object slotLock = new Object();
    private Instant nextAllowedAt;

    SendPacer(long intervalMs) {
        this.intervalMs = Math.max(0L, intervalMs);
    }

    static SendPacer unpaced() {
        return new SendPacer(0L);
    }

    long intervalMs() {
        return intervalMs;
    }

    void awaitTurn(int ticket, CancellationToken token) throws InterruptedException {
        turnLock.lock();
        try {
            while (ticket > nextTicket) {
                if (token.isCancelled()) {
                    throw new RunCancelledException(RunState.NOTIFYING);
                }
                turnChanged.await(TURN_POLL_MS, TimeUnit.MILLISECONDS);
            }
        } finally {
            turnLock.unlock();
        }
    }

    void release(int ticket) {
        turnLock.lock();
        try {
            if (ticket < nextTicket || !released.add(ticket)) {
                return;
            }
            while (released.remove(nextTicket)) {
                nextTicket++;
            }
            turnChanged.signalAll();
        } finally {
            turnLock.unlock();
        }
    }

    void awaitSlot() throws InterruptedException {
        if (intervalMs == 0) {
            return;
        }
        synchronized (slotLock) {
            Instant now = Instant.now();
            if (nextAllowedAt != null && nextAllowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, nextAllowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            nextAllowedAt = Instant.now().plusMillis(intervalMs);
        }
    }
}
