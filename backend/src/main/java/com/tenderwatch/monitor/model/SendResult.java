package com.tenderwatch.monitor.model;

public record SendResult(
    ChannelKind channel,
    boolean sent,
    String receiptId,
    FailureKind failureKind,
    String reasonCode,
    String reason,
    int attempts
) {
    public static SendResult sent(ChannelKind channel, String receiptId) {
        return new SendResult(channel, true, receiptId, null, null, null, 1);
    }

    public static SendResult retryable(ChannelKind channel, String reasonCode, String reason) {
        return new SendResult(channel, false, null, FailureKind.RETRYABLE, reasonCode, reason, 1);
    }

    public static SendResult terminal(ChannelKind channel, String reasonCode, String reason) {
        return new SendResult(channel, false, null, FailureKind.TERMINAL, reasonCode, reason, 1);
    }

    public boolean isRetryable() {
        return !sent && failureKind == FailureKind.RETRYABLE;
    }

    public SendResult withAttempts(int attemptCount) {
        return new SendResult(channel, sent, receiptId, failureKind, reasonCode, reason, attemptCount);
    }
}
