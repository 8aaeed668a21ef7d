package com.tenderwatch.monitor.notify;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.FailureKind;
import com.tenderwatch.monitor.model.NotificationMessage;
import com.tenderwatch.monitor.model.SendResult;
import com.tenderwatch.monitor.util.FailureClassifier;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SmtpEmailChannelTest {
    private static final NotificationMessage MESSAGE = new NotificationMessage("New Tender Alert: Roads", "Title: Roads");

    @Mock
    private JavaMailSender mailSender;
    @Mock
    private ObjectProvider<JavaMailSender> mailSenderProvider;

    private SmtpEmailChannel channel;

    @BeforeEach
    void setUp() {
        TenderMonitorProperties properties = new TenderMonitorProperties();
        properties.getEmail().setFrom("monitor@example.com");
        when(mailSenderProvider.getIfAvailable()).thenReturn(mailSender);
        lenient().when(mailSender.createMimeMessage()).thenAnswer(invocation -> new MimeMessage((Session) null));
        channel = new SmtpEmailChannel(mailSenderProvider, properties);
    }

    @Test
    void sendsPlainTextMessage() throws Exception {
        SendResult result = channel.send(MESSAGE, "alerts@example.com");

        assertThat(result.sent()).isTrue();
        assertThat(result.receiptId()).startsWith("smtp-");
        ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(captor.capture());
        MimeMessage sent = captor.getValue();
        assertThat(sent.getSubject()).isEqualTo("New Tender Alert: Roads");
        assertThat(sent.getRecipients(Message.RecipientType.TO)[0].toString()).isEqualTo("alerts@example.com");
        assertThat(sent.getFrom()[0].toString()).isEqualTo("monitor@example.com");
    }

    @Test
    void malformedAddressIsTerminalAndNotSent() {
        SendResult result = channel.send(MESSAGE, "not an address@@");

        assertThat(result.failureKind()).isEqualTo(FailureKind.TERMINAL);
        assertThat(result.reasonCode()).isEqualTo(FailureClassifier.INVALID_DESTINATION);
        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    void authenticationFailureIsTerminal() {
        doThrow(new MailAuthenticationException("535 bad credentials")).when(mailSender).send(any(MimeMessage.class));

        SendResult result = channel.send(MESSAGE, "alerts@example.com");

        assertThat(result.failureKind()).isEqualTo(FailureKind.TERMINAL);
        assertThat(result.reasonCode()).isEqualTo(FailureClassifier.AUTH_FAILED);
    }

    @Test
    void connectionTroubleIsRetryable() {
        doThrow(new MailSendException("connect failed", new SocketTimeoutException("connect timed out")))
            .when(mailSender).send(any(MimeMessage.class));

        SendResult result = channel.send(MESSAGE, "alerts@example.com");

        assertThat(result.isRetryable()).isTrue();
        assertThat(result.reasonCode()).isEqualTo(FailureClassifier.TIMEOUT);
    }
}
