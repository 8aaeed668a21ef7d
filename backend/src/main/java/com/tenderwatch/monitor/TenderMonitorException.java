package com.tenderwatch.monitor;

import com.tenderwatch.monitor.model.RunState;

/**
 * Stage-fatal failure of a monitor run. The stage is the state the run was in when the
 * collaborator failed; it is reported in the run summary and the exit log line.
 */
public class TenderMonitorException extends RuntimeException {
    private final RunState stage;

    public TenderMonitorException(RunState stage, String message) {
        super(message);
        this.stage = stage;
    }

    public TenderMonitorException(RunState stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public RunState stage() {
        return stage;
    }
}
