package com.tenderwatch.monitor.model;

public enum ChannelKind {
    WHATSAPP,
    EMAIL
}
