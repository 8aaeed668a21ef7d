package com.tenderwatch.monitor.model;

public enum FailureKind {
    /** Timeouts, rate limits, 5xx and I/O errors; worth another attempt. */
    RETRYABLE,
    /** Bad credentials or a malformed destination; retrying cannot help. */
    TERMINAL
}
