package com.tenderwatch.monitor.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record MonitorRunSummary(
    String runId,
    RunMode mode,
    Instant startedAt,
    Instant finishedAt,
    RunState state,
    RunState failedStage,
    String error,
    int scrapedCount,
    int rejectedCount,
    int newCount,
    int duplicateCount,
    Map<ChannelKind, ChannelTally> channelTallies,
    List<TenderDelivery> deliveries,
    boolean committed
) {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_CANCELLED = 130;

    public int exitCode() {
        return switch (state) {
            case DONE -> EXIT_OK;
            case CANCELLED -> EXIT_CANCELLED;
            default -> EXIT_FAILED;
        };
    }

    public long countDeliveries(DeliveryStatus status) {
        return deliveries.stream().filter(delivery -> delivery.status() == status).count();
    }

    public ChannelTally tally(ChannelKind kind) {
        return channelTallies.getOrDefault(kind, ChannelTally.EMPTY);
    }
}
