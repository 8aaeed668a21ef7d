package com.tenderwatch.monitor.model;

import java.util.Optional;

public record RunRequest(
    RunMode mode,
    String scopeFilter,
    String whatsappTo,
    String emailTo,
    String exportPath
) {
    public static RunRequest monitor(String scopeFilter) {
        return new RunRequest(RunMode.MONITOR, scopeFilter, null, null, null);
    }

    public Optional<String> normalizedScope() {
        if (scopeFilter == null || scopeFilter.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(scopeFilter.trim());
    }
}
