package com.tenderwatch.monitor.model;

import java.util.Locale;

public enum RunMode {
    /** Collect, diff against the seen-set, notify new tenders, commit them. */
    MONITOR,
    /** Collect and notify every active tender; the seen-set is neither read nor written. */
    SEND_ALL;

    public static RunMode fromOption(String value) {
        if (value == null || value.isBlank()) {
            return MONITOR;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RunMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown mode '" + value + "' (expected monitor or send-all)");
    }
}
