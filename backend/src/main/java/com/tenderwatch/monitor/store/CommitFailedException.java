package com.tenderwatch.monitor.store;

import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;

/** Nothing from the failed commit may be assumed durable. */
public class CommitFailedException extends TenderMonitorException {
    public CommitFailedException(String message, Throwable cause) {
        super(RunState.COMMITTING, message, cause);
    }
}
