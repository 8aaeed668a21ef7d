package com.tenderwatch.monitor.store;

import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;

public class StoreUnavailableException extends TenderMonitorException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(RunState.DIFFING, message, cause);
    }
}
