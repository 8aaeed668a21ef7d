package com.tenderwatch.monitor.model;

public enum RunState {
    IDLE,
    COLLECTING,
    DIFFING,
    NOTIFYING,
    COMMITTING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
