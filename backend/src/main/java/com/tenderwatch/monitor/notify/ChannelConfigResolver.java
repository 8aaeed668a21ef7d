package com.tenderwatch.monitor.notify;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.ChannelConfig;
import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.RunRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-run channel set from {@code tender.whatsapp.*} / {@code tender.email.*} and the
 * destination overrides of the run request.
 */
@Component
public class ChannelConfigResolver {
    private final TenderMonitorProperties properties;
    private final Map<ChannelKind, NotificationChannel> channels = new EnumMap<>(ChannelKind.class);

    public ChannelConfigResolver(TenderMonitorProperties properties, List<NotificationChannel> channels) {
        this.properties = properties;
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.kind(), channel);
        }
    }

    public List<ChannelConfig> resolve(RunRequest request) {
        List<ChannelConfig> configs = new ArrayList<>();
        configs.add(new ChannelConfig(
            ChannelKind.WHATSAPP,
            properties.getWhatsapp().isEnabled(),
            firstNonBlank(request.whatsappTo(), properties.getWhatsapp().getTo())
        ));
        configs.add(new ChannelConfig(
            ChannelKind.EMAIL,
            properties.getEmail().isEnabled(),
            firstNonBlank(request.emailTo(), properties.getEmail().getTo())
        ));

        List<ChannelConfig> enabled = configs.stream().filter(ChannelConfig::enabled).toList();
        if (enabled.isEmpty()) {
            throw new NotifierConfigurationException(
                "No notification channel enabled (set WHATSAPP_ENABLED=true or EMAIL_ENABLED=true)");
        }
        for (ChannelConfig config : enabled) {
            if (!config.hasDestination()) {
                throw new NotifierConfigurationException(
                    config.kind() + " channel is enabled but has no destination (set " + destinationVariable(config.kind())
                        + " or " + toggleVariable(config.kind()) + "=false)");
            }
            NotificationChannel channel = channels.get(config.kind());
            if (channel == null || !channel.isConfigured()) {
                throw new NotifierConfigurationException(
                    config.kind() + " channel is enabled but its provider settings are missing (set "
                        + toggleVariable(config.kind()) + "=false to skip it)");
            }
        }
        return enabled;
    }

    private static String toggleVariable(ChannelKind kind) {
        return kind == ChannelKind.WHATSAPP ? "WHATSAPP_ENABLED" : "EMAIL_ENABLED";
    }

    private static String destinationVariable(ChannelKind kind) {
        return kind == ChannelKind.WHATSAPP ? "TWILIO_WHATSAPP_TO" : "EMAIL_TO";
    }

    private static String firstNonBlank(String override, String fallback) {
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return fallback == null ? null : fallback.trim();
    }
}
