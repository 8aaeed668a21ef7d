package com.tenderwatch.monitor.service;

import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;

public class RunCancelledException extends TenderMonitorException {
    public RunCancelledException(RunState stage) {
        super(stage, "run cancelled during " + stage);
    }
}
