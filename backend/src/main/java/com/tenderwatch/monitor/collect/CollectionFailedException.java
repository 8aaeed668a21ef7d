package com.tenderwatch.monitor.collect;

import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;

public class CollectionFailedException extends TenderMonitorException {
    public CollectionFailedException(String message) {
        super(RunState.COLLECTING, message);
    }

    public CollectionFailedException(String message, Throwable cause) {
        super(RunState.COLLECTING, message, cause);
    }
}
