package com.tenderwatch.monitor.notify;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.ChannelConfig;
import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.DispatchReport;
import com.tenderwatch.monitor.model.NotificationMessage;
import com.tenderwatch.monitor.model.RunState;
import com.tenderwatch.monitor.model.SendResult;
import com.tenderwatch.monitor.model.Tender;
import com.tenderwatch.monitor.model.TenderDelivery;
import com.tenderwatch.monitor.service.CancellationToken;
import com.tenderwatch.monitor.service.RunCancelledException;
import com.tenderwatch.monitor.util.FailureClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class TenderNotifier {
    private static final Logger log = LoggerFactory.getLogger(TenderNotifier.class);
    private static final long POLL_MS = 200;

    private final TenderMessageFormatter formatter;
    private final TenderMonitorProperties properties;
    private final ExecutorService executor;
    private final Map<ChannelKind, NotificationChannel> channels = new EnumMap<>(ChannelKind.class);

    public TenderNotifier(
        TenderMessageFormatter formatter,
        TenderMonitorProperties properties,
        List<NotificationChannel> channels,
        @Qualifier("notifierExecutor") ExecutorService executor
    ) {
        this.formatter = formatter;
        this.properties = properties;
        this.executor = executor;
        for (NotificationChannel channel : channels) {
            this.channels.put(channel.kind(), channel);
        }
    }

    public NotificationMessage format(Tender tender) {
        return formatter.format(tender);
    }

    /**
     * One logical send: retryable failures are retried up to {@code tender.notifier.max-retries}
     * times with exponential backoff, terminal failures return immediately.
     *
     * @throws NotifierConfigurationException if the channel has no destination or credentials
     */
    public SendResult send(NotificationChannel channel, NotificationMessage message, String destination) {
        return send(channel, message, destination, SendPacer.unpaced());
    }

    public DispatchReport dispatch(List<Tender> tenders, List<ChannelConfig> channelConfigs) {
        return dispatch(tenders, channelConfigs, CancellationToken.none());
    }

    public DispatchReport dispatch(List<Tender> tenders, List<ChannelConfig> channelConfigs, CancellationToken token) {
        if (tenders == null || tenders.isEmpty()) {
            return DispatchReport.EMPTY;
        }
        List<ChannelConfig> enabled = channelConfigs.stream().filter(ChannelConfig::enabled).toList();
        for (ChannelConfig config : enabled) {
            if (!config.hasDestination()) {
                throw new NotifierConfigurationException(config.kind() + " channel has no destination");
            }
            if (!channels.containsKey(config.kind())) {
                throw new NotifierConfigurationException("No channel implementation for " + config.kind());
            }
        }

        TenderMonitorProperties.Notifier config = properties.getNotifier();
        long intervalMs = tenders.size() > config.getPacingThreshold() ? config.getMinSendIntervalMs() : 0L;
        SendPacer pacer = new SendPacer(intervalMs);
        log.info("Dispatching {} tenders over {} channels (concurrency={}, intervalMs={})",
            tenders.size(), enabled.size(), config.getConcurrency(), intervalMs);

        List<SendTask> tasks = new ArrayList<>();
        int ticket = 0;
        for (Tender tender : tenders) {
            NotificationMessage message = formatter.format(tender);
            for (ChannelConfig channelConfig : enabled) {
                SendTask task = new SendTask(ticket++, tender, channelConfig);
                NotificationChannel channel = channels.get(channelConfig.kind());
                task.future = executor.submit(() -> pacedSend(task.ticket, channel, message, channelConfig.destination(), pacer, token));
                tasks.add(task);
            }
        }

        List<TenderDelivery> deliveries = new ArrayList<>();
        int index = 0;
        for (Tender tender : tenders) {
            List<SendResult> results = new ArrayList<>();
            for (int c = 0; c < enabled.size(); c++) {
                SendTask task = tasks.get(index++);
                results.add(await(task, tasks, pacer, token, config.getSendTimeoutSeconds()));
            }
            TenderDelivery delivery = new TenderDelivery(tender, results);
            log.info("Tender {} -> {} {}", tender.identity(), delivery.status(), describe(results));
            deliveries.add(delivery);
        }
        return new DispatchReport(deliveries);
    }

    private SendResult pacedSend(
        int ticket,
        NotificationChannel channel,
        NotificationMessage message,
        String destination,
        SendPacer pacer,
        CancellationToken token
    ) throws InterruptedException {
        try {
            pacer.awaitTurn(ticket, token);
            token.throwIfCancelled(RunState.NOTIFYING);
            pacer.awaitSlot();
        } finally {
            pacer.release(ticket);
        }
        return send(channel, message, destination, pacer);
    }

    private SendResult send(NotificationChannel channel, NotificationMessage message, String destination, SendPacer pacer) {
        int maxAttempts = 1 + properties.getNotifier().getMaxRetries();
        SendResult result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                try {
                    pacer.awaitSlot();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return result.withAttempts(attempt - 1);
                }
            }
            result = attemptOnce(channel, message, destination);
            if (!result.isRetryable() || attempt >= maxAttempts) {
                return result.withAttempts(attempt);
            }
            log.debug("{} send failed ({}), retrying attempt {} of {}",
                channel.kind(), result.reasonCode(), attempt + 1, maxAttempts);
            if (!sleepBackoff(attempt)) {
                return result.withAttempts(attempt);
            }
        }
        return result;
    }

    private SendResult attemptOnce(NotificationChannel channel, NotificationMessage message, String destination) {
        try {
            SendResult result = channel.send(message, destination);
            if (result == null) {
                return SendResult.terminal(channel.kind(), FailureClassifier.UNKNOWN, "channel returned no result");
            }
            return result;
        } catch (NotifierConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{} channel failed unexpectedly: {}", channel.kind(), e.toString());
            return SendResult.terminal(channel.kind(), FailureClassifier.UNKNOWN, e.toString());
        }
    }

    private SendResult await(SendTask task, List<SendTask> all, SendPacer pacer, CancellationToken token, int timeoutSeconds) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        while (true) {
            if (token.isCancelled()) {
                abandon(all, pacer);
                throw new RunCancelledException(RunState.NOTIFYING);
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                task.future.cancel(true);
                pacer.release(task.ticket);
                log.warn("{} send for tender {} exceeded {}s", task.config.kind(), task.tender.identity(), timeoutSeconds);
                return SendResult.retryable(task.config.kind(), FailureClassifier.TIMEOUT,
                    "send did not finish within " + timeoutSeconds + "s");
            }
            try {
                return task.future.get(Math.min(POLL_MS, remainingMs), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(all, pacer);
                throw new RunCancelledException(RunState.NOTIFYING);
            } catch (CancellationException e) {
                abandon(all, pacer);
                throw new RunCancelledException(RunState.NOTIFYING);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof NotifierConfigurationException configError) {
                    abandon(all, pacer);
                    throw configError;
                }
                if (cause instanceof RunCancelledException cancelled) {
                    abandon(all, pacer);
                    throw cancelled;
                }
                return SendResult.terminal(task.config.kind(), FailureClassifier.fromThrowable(cause), String.valueOf(cause));
            }
        }
    }

    private void abandon(List<SendTask> tasks, SendPacer pacer) {
        int abandoned = 0;
        for (SendTask task : tasks) {
            if (!task.future.isDone()) {
                task.future.cancel(true);
                abandoned++;
            }
            pacer.release(task.ticket);
        }
        if (abandoned > 0) {
            log.warn("Abandoned {} pending sends", abandoned);
        }
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getNotifier().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getNotifier().getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.min(20, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(List<SendResult> results) {
        StringBuilder text = new StringBuilder();
        for (SendResult result : results) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(result.channel()).append('=');
            text.append(result.sent() ? "sent" : result.failureKind() + ":" + result.reasonCode());
        }
        return text.toString();
    }

    private static final class SendTask {
        private final int ticket;
        private final Tender tender;
        private final ChannelConfig config;
        private Future<SendResult> future;

        private SendTask(int ticket, Tender tender, ChannelConfig config) {
            this.ticket = ticket;
            this.tender = tender;
            this.config = config;
        }
    }
}
