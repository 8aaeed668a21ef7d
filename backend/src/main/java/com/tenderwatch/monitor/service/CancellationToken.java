package com.tenderwatch.monitor.service;

import com.tenderwatch.monitor.model.RunState;

import java.util.concurrent.atomic.AtomicBoolean;

/** Operator interrupt for one run; checked at every stage boundary and between sends. */
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled(RunState stage) {
        if (isCancelled()) {
            throw new RunCancelledException(stage);
        }
    }
}
