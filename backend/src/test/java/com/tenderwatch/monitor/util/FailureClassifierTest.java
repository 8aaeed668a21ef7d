package com.tenderwatch.monitor.util;

import com.tenderwatch.monitor.model.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    @Test
    void httpStatusesMapToReasonCodes() {
        assertThat(FailureClassifier.fromHttpStatus(401)).isEqualTo(FailureClassifier.AUTH_FAILED);
        assertThat(FailureClassifier.fromHttpStatus(400)).isEqualTo(FailureClassifier.INVALID_DESTINATION);
        assertThat(FailureClassifier.fromHttpStatus(409)).isEqualTo(FailureClassifier.REJECTED);
        assertThat(FailureClassifier.fromHttpStatus(429)).isEqualTo(FailureClassifier.HTTP_429_RATE_LIMIT);
        assertThat(FailureClassifier.fromHttpStatus(502)).isEqualTo(FailureClassifier.HTTP_5XX);
    }

    @Test
    void transientFailuresAreRetryable() {
        assertThat(FailureClassifier.kindOf(FailureClassifier.fromHttpStatus(503))).isEqualTo(FailureKind.RETRYABLE);
        assertThat(FailureClassifier.kindOf(FailureClassifier.fromHttpStatus(403))).isEqualTo(FailureKind.TERMINAL);
        assertThat(FailureClassifier.fromThrowable(new HttpTimeoutException("request timed out")))
            .isEqualTo(FailureClassifier.TIMEOUT);
        assertThat(FailureClassifier.fromThrowable(new UnknownHostException("api.twilio.com")))
            .isEqualTo(FailureClassifier.DNS_FAILURE);
        assertThat(FailureClassifier.fromThrowable(new IOException("connection reset")))
            .isEqualTo(FailureClassifier.IO_ERROR);
        assertThat(FailureClassifier.isRetryable(FailureClassifier.INVALID_DESTINATION)).isFalse();
        assertThat(FailureClassifier.isRetryable(null)).isFalse();
    }
}
