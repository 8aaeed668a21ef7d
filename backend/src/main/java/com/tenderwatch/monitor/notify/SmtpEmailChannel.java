package com.tenderwatch.monitor.notify;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.NotificationMessage;
import com.tenderwatch.monitor.model.SendResult;
import com.tenderwatch.monitor.util.FailureClassifier;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/** Email delivery over SMTP through Spring's {@link JavaMailSender}. */
@Component
public class SmtpEmailChannel implements NotificationChannel {
    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final TenderMonitorProperties properties;

    public SmtpEmailChannel(ObjectProvider<JavaMailSender> mailSenderProvider, TenderMonitorProperties properties) {
        this.mailSenderProvider = mailSenderProvider;
        this.properties = properties;
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.EMAIL;
    }

    @Override
    public boolean isConfigured() {
        String from = properties.getEmail().getFrom();
        return mailSenderProvider.getIfAvailable() != null && from != null && !from.isBlank();
    }

    @Override
    public SendResult send(NotificationMessage message, String destination) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null || !isConfigured()) {
            throw new NotifierConfigurationException("Email channel used without SMTP settings (spring.mail.host, tender.email.from)");
        }
        if (destination == null || destination.isBlank()) {
            throw new NotifierConfigurationException("Email channel used without a destination address");
        }

        InternetAddress recipient;
        try {
            recipient = new InternetAddress(destination.trim(), true);
        } catch (AddressException e) {
            return SendResult.terminal(kind(), FailureClassifier.INVALID_DESTINATION, "malformed address: " + destination);
        }

        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, false, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.getEmail().getFrom().trim());
            helper.setTo(recipient);
            helper.setSubject(message.subject());
            helper.setText(message.body(), false);
            mailSender.send(mime);
            String messageId = mime.getMessageID();
            return SendResult.sent(kind(), messageId == null ? "smtp-" + UUID.randomUUID() : messageId);
        } catch (MailAuthenticationException e) {
            return SendResult.terminal(kind(), FailureClassifier.AUTH_FAILED, "SMTP authentication failed: " + e.getMessage());
        } catch (MailParseException | MailPreparationException e) {
            return SendResult.terminal(kind(), FailureClassifier.REJECTED, "message could not be prepared: " + e.getMessage());
        } catch (MailException e) {
            Throwable cause = e.getMostSpecificCause();
            return SendResult.retryable(kind(), FailureClassifier.fromThrowable(cause), "SMTP send failed: " + e.getMessage());
        } catch (MessagingException e) {
            return SendResult.terminal(kind(), FailureClassifier.REJECTED, "message could not be prepared: " + e.getMessage());
        }
    }
}
