package com.tenderwatch.monitor.model;

public record ChannelConfig(ChannelKind kind, boolean enabled, String destination) {
    public boolean hasDestination() {
        return destination != null && !destination.isBlank();
    }
}
