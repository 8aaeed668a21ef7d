package com.tenderwatch.monitor.notify;

import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.NotificationMessage;
import com.tenderwatch.monitor.model.SendResult;

/**
 * One notification transport. {@link #send} makes a single delivery attempt and reports ordinary
 * delivery problems as a failed {@link SendResult}; it throws only when the channel itself is
 * misconfigured.
 */
public interface NotificationChannel {
    ChannelKind kind();

    boolean isConfigured();

    SendResult send(NotificationMessage message, String destination);
}
