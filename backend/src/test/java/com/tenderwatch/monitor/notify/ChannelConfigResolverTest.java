package com.tenderwatch.monitor.notify;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.ChannelConfig;
import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.RunMode;
import com.tenderwatch.monitor.model.RunRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChannelConfigResolverTest {

    @Mock
    private NotificationChannel whatsapp;
    @Mock
    private NotificationChannel email;

    @Test
    void cliOverridesReplaceConfiguredDestinations() {
        TenderMonitorProperties properties = configured();
        stubChannels(true, true);
        ChannelConfigResolver resolver = new ChannelConfigResolver(properties, List.of(whatsapp, email));

        List<ChannelConfig> configs = resolver.resolve(
            new RunRequest(RunMode.MONITOR, null, "+923339999999", null, null)
        );

        assertThat(configs).containsExactly(
            new ChannelConfig(ChannelKind.WHATSAPP, true, "+923339999999"),
            new ChannelConfig(ChannelKind.EMAIL, true, "alerts@example.com")
        );
    }

    @Test
    void disabledChannelIsLeftOut() {
        TenderMonitorProperties properties = configured();
        properties.getWhatsapp().setEnabled(false);
        stubChannels(true, true);
        ChannelConfigResolver resolver = new ChannelConfigResolver(properties, List.of(whatsapp, email));

        List<ChannelConfig> configs = resolver.resolve(RunRequest.monitor(null));

        assertThat(configs).extracting(ChannelConfig::kind).containsExactly(ChannelKind.EMAIL);
    }

    @Test
    void enabledChannelWithoutDestinationIsFatal() {
        TenderMonitorProperties properties = configured();
        properties.getEmail().setTo("");
        stubChannels(true, true);
        ChannelConfigResolver resolver = new ChannelConfigResolver(properties, List.of(whatsapp, email));

        assertThatThrownBy(() -> resolver.resolve(RunRequest.monitor(null)))
            .isInstanceOf(NotifierConfigurationException.class)
            .hasMessageContaining("EMAIL_TO")
            .hasMessageContaining("EMAIL_ENABLED=false");
    }

    @Test
    void noEnabledChannelIsFatal() {
        TenderMonitorProperties properties = configured();
        properties.getWhatsapp().setEnabled(false);
        properties.getEmail().setEnabled(false);
        stubChannels(true, true);
        ChannelConfigResolver resolver = new ChannelConfigResolver(properties, List.of(whatsapp, email));

        assertThatThrownBy(() -> resolver.resolve(RunRequest.monitor(null)))
            .isInstanceOf(NotifierConfigurationException.class);
    }

    @Test
    void channelWithoutProviderSettingsIsFatal() {
        TenderMonitorProperties properties = configured();
        stubChannels(false, true);
        ChannelConfigResolver resolver = new ChannelConfigResolver(properties, List.of(whatsapp, email));

        assertThatThrownBy(() -> resolver.resolve(RunRequest.monitor(null)))
            .isInstanceOf(NotifierConfigurationException.class)
            .hasMessageContaining("WHATSAPP_ENABLED=false");
    }

    @Test
    void channelsAreOffUntilEnabled() {
        TenderMonitorProperties properties = new TenderMonitorProperties();
        properties.getEmail().setTo("alerts@example.com");
        stubChannels(true, true);
        ChannelConfigResolver resolver = new ChannelConfigResolver(properties, List.of(whatsapp, email));

        assertThatThrownBy(() -> resolver.resolve(RunRequest.monitor(null)))
            .isInstanceOf(NotifierConfigurationException.class)
            .hasMessageContaining("EMAIL_ENABLED=true");

        properties.getEmail().setEnabled(true);
        assertThat(resolver.resolve(RunRequest.monitor(null)))
            .containsExactly(new ChannelConfig(ChannelKind.EMAIL, true, "alerts@example.com"));
    }

    private void stubChannels(boolean whatsappConfigured, boolean emailConfigured) {
        when(whatsapp.kind()).thenReturn(ChannelKind.WHATSAPP);
        when(email.kind()).thenReturn(ChannelKind.EMAIL);
        lenient().when(whatsapp.isConfigured()).thenReturn(whatsappConfigured);
        lenient().when(email.isConfigured()).thenReturn(emailConfigured);
    }

    private static TenderMonitorProperties configured() {
        TenderMonitorProperties properties = new TenderMonitorProperties();
        properties.getWhatsapp().setEnabled(true);
        properties.getWhatsapp().setTo("+923001234567");
        properties.getEmail().setEnabled(true);
        properties.getEmail().setTo("alerts@example.com");
        return properties;
    }
}
