package com.tenderwatch.monitor.service;

import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;

public class ActiveRunException extends TenderMonitorException {
    public ActiveRunException(String message) {
        super(RunState.IDLE, message);
    }
}
