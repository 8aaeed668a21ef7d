package com.tenderwatch.monitor.model;

public enum DeliveryStatus {
    DELIVERED,
    PARTIAL,
    FAILED
}
