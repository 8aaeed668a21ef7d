package com.tenderwatch.monitor.notify;

import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;

public class NotifierConfigurationException extends TenderMonitorException {
    public NotifierConfigurationException(String message) {
        super(RunState.IDLE, message);
    }
}
