package com.tenderwatch.monitor.notify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.NotificationMessage;
import com.tenderwatch.monitor.model.SendResult;
import com.tenderwatch.monitor.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** WhatsApp delivery through the Twilio Messages REST API. */
@Component
public class TwilioWhatsAppChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(TwilioWhatsAppChannel.class);
    private static final String PREFIX = "whatsapp:";
    private static final Pattern E164 = Pattern.compile("^\\+?[1-9]\\d{6,14}$");

    private final TenderMonitorProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public TwilioWhatsAppChannel(TenderMonitorProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getWhatsapp().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.WHATSAPP;
    }

    @Override
    public boolean isConfigured() {
        return properties.getWhatsapp().hasCredentials();
    }

    @Override
    public SendResult send(NotificationMessage message, String destination) {
        TenderMonitorProperties.Whatsapp config = properties.getWhatsapp();
        if (!config.hasCredentials()) {
            throw new NotifierConfigurationException("WhatsApp channel used without Twilio credentials");
        }
        if (destination == null || destination.isBlank()) {
            throw new NotifierConfigurationException("WhatsApp channel used without a destination number");
        }
        String number = stripPrefix(destination);
        if (!E164.matcher(number).matches()) {
            return SendResult.terminal(kind(), FailureClassifier.INVALID_DESTINATION, "not an E.164 number: " + destination);
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("To", PREFIX + number);
        form.put("From", withPrefix(config.getFrom()));
        form.put("Body", message.body());

        URI uri = URI.create(trimTrailingSlash(config.getApiBaseUrl())
            + "/2010-04-01/Accounts/" + config.getAccountSid() + "/Messages.json");
        String credentials = config.getAccountSid() + ":" + config.getAuthToken();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
            .header("Authorization", "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form), StandardCharsets.UTF_8))
            .build();

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                String sid = readField(response.body(), "sid");
                return SendResult.sent(kind(), sid == null ? "twilio-" + status : sid);
            }
            String reasonCode = FailureClassifier.fromHttpStatus(status);
            String detail = "Twilio API error " + status + describeError(response.body());
            log.debug("Twilio rejected message to {}: {}", number, detail);
            return FailureClassifier.isRetryable(reasonCode)
                ? SendResult.retryable(kind(), reasonCode, detail)
                : SendResult.terminal(kind(), reasonCode, detail);
        } catch (HttpTimeoutException e) {
            return SendResult.retryable(kind(), FailureClassifier.TIMEOUT, "Twilio request timed out");
        } catch (IOException e) {
            return SendResult.retryable(kind(), FailureClassifier.fromThrowable(e), "Twilio I/O error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.terminal(kind(), FailureClassifier.INTERRUPTED, "interrupted");
        }
    }

    private String describeError(String body) {
        String text = readField(body, "message");
        String code = readField(body, "code");
        if (text == null) {
            return "";
        }
        return ": " + text + (code == null ? "" : " (Code: " + code + ")");
    }

    private String readField(String body, String field) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(body).get(field);
            return node == null || node.isNull() ? null : node.asText();
        } catch (IOException e) {
            return null;
        }
    }

    static String stripPrefix(String value) {
        String trimmed = value.trim();
        if (trimmed.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            trimmed = trimmed.substring(PREFIX.length());
        }
        return trimmed.replaceAll("[\\s()-]", "");
    }

    private static String withPrefix(String number) {
        return PREFIX + stripPrefix(number);
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
            .map(entry -> URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }
}
