package com.tenderwatch.monitor.model;

public record ChannelTally(int sent, int failed) {
    public static final ChannelTally EMPTY = new ChannelTally(0, 0);

    public ChannelTally plus(SendResult result) {
        return result.sent() ? new ChannelTally(sent + 1, failed) : new ChannelTally(sent, failed + 1);
    }
}
