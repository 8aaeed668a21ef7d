package com.tenderwatch.monitor.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record DispatchReport(List<TenderDelivery> deliveries) {
    public static final DispatchReport EMPTY = new DispatchReport(List.of());

    public DispatchReport {
        deliveries = List.copyOf(deliveries);
    }

    public Map<ChannelKind, ChannelTally> channelTallies() {
        Map<ChannelKind, ChannelTally> tallies = new EnumMap<>(ChannelKind.class);
        for (TenderDelivery delivery : deliveries) {
            for (SendResult result : delivery.results()) {
                tallies.put(result.channel(), tallies.getOrDefault(result.channel(), ChannelTally.EMPTY).plus(result));
            }
        }
        return tallies;
    }

    public long countByStatus(DeliveryStatus status) {
        return deliveries.stream().filter(delivery -> delivery.status() == status).count();
    }
}
