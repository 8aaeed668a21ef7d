package com.tenderwatch.monitor.model;

import java.util.List;

public record TenderDelivery(Tender tender, List<SendResult> results) {
    public TenderDelivery {
        results = List.copyOf(results);
    }

    public DeliveryStatus status() {
        long sent = results.stream().filter(SendResult::sent).count();
        if (sent == 0) {
            return DeliveryStatus.FAILED;
        }
        return sent == results.size() ? DeliveryStatus.DELIVERED : DeliveryStatus.PARTIAL;
    }
}
