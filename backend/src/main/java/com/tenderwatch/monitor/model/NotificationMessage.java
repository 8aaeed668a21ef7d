package com.tenderwatch.monitor.model;

public record NotificationMessage(String subject, String body) {}
