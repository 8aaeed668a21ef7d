package com.tenderwatch.monitor.service;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.ChannelKind;
import com.tenderwatch.monitor.model.ChannelTally;
import com.tenderwatch.monitor.model.DeliveryStatus;
import com.tenderwatch.monitor.model.MonitorRunSummary;
import com.tenderwatch.monitor.model.RunMode;
import com.tenderwatch.monitor.model.RunRequest;
import com.tenderwatch.monitor.model.SendResult;
import com.tenderwatch.monitor.model.TenderDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Component
public class MonitorCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MonitorCliRunner.class);

    private final TenderMonitorProperties properties;
    private final TenderMonitorService monitorService;
    private final ConfigurableApplicationContext applicationContext;

    public MonitorCliRunner(
        TenderMonitorProperties properties,
        TenderMonitorService monitorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.monitorService = monitorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        RunRequest request = toRequest(args, properties.getCli());
        CancellationToken token = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            if (finished.getCount() == 0) {
                return;
            }
            log.warn("Shutdown requested; cancelling the active run");
            token.cancel();
            try {
                finished.await(properties.getCli().getShutdownWaitSeconds(), TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "tender-monitor-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        MonitorRunSummary summary;
        try {
            summary = monitorService.run(request, token);
        } finally {
            finished.countDown();
        }
        removeShutdownHook(shutdownHook);
        logSummary(summary);

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, summary::exitCode);
            System.exit(exitCode);
        }
    }

    static RunRequest toRequest(ApplicationArguments args, TenderMonitorProperties.Cli cli) {
        RunMode mode = RunMode.fromOption(option(args, "mode", cli.getMode()));
        return new RunRequest(
            mode,
            option(args, "city", cli.getCity()),
            option(args, "whatsapp", null),
            option(args, "email", null),
            option(args, "export", cli.getExportPath())
        );
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down; shutdown hook stays registered");
        }
    }

    private static void logSummary(MonitorRunSummary summary) {
        log.info("Run {} ({}) finished with state {} in {} ms",
            summary.runId(),
            summary.mode(),
            summary.state(),
            Duration.between(summary.startedAt(), summary.finishedAt()).toMillis());
        if (summary.failedStage() != null) {
            log.info("Stopped during {}: {}", summary.failedStage(), summary.error());
        }
        log.info("Scraped={}, rejected={}, new={}, duplicates={}, committed={}",
            summary.scrapedCount(),
            summary.rejectedCount(),
            summary.newCount(),
            summary.duplicateCount(),
            summary.committed());
        for (ChannelKind kind : ChannelKind.values()) {
            ChannelTally tally = summary.tally(kind);
            if (tally.sent() + tally.failed() > 0) {
                log.info("{}: sent={}, failed={}", kind, tally.sent(), tally.failed());
            }
        }
        log.info("Deliveries: delivered={}, partial={}, failed={}",
            summary.countDeliveries(DeliveryStatus.DELIVERED),
            summary.countDeliveries(DeliveryStatus.PARTIAL),
            summary.countDeliveries(DeliveryStatus.FAILED));
        for (TenderDelivery delivery : summary.deliveries()) {
            if (delivery.status() == DeliveryStatus.DELIVERED) {
                continue;
            }
            for (SendResult result : delivery.results()) {
                if (!result.sent()) {
                    log.info("  {} {} {} after {} attempt(s): {}",
                        delivery.tender().identity(),
                        result.channel(),
                        result.reasonCode(),
                        result.attempts(),
                        result.reason());
                }
            }
        }
        log.info("Exit code {}", summary.exitCode());
    }
}
