package com.tenderwatch.monitor.service;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.collect.CollectionFailedException;
import com.tenderwatch.monitor.collect.TenderCollector;
import com.tenderwatch.monitor.model.ChannelConfig;
import com.tenderwatch.monitor.model.DeliveryStatus;
import com.tenderwatch.monitor.model.DiffResult;
import com.tenderwatch.monitor.model.DispatchReport;
import com.tenderwatch.monitor.model.MonitorRunSummary;
import com.tenderwatch.monitor.model.RunMode;
import com.tenderwatch.monitor.model.RunRequest;
import com.tenderwatch.monitor.model.RunState;
import com.tenderwatch.monitor.model.Tender;
import com.tenderwatch.monitor.notify.ChannelConfigResolver;
import com.tenderwatch.monitor.notify.TenderNotifier;
import com.tenderwatch.monitor.store.SeenTenderStore;
import com.tenderwatch.monitor.store.TenderDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one monitor run through {@code COLLECTING -> DIFFING -> NOTIFYING -> COMMITTING}. Each
 * stage starts only after the previous one completed; a stage-fatal error or a cancellation ends
 * the run before the store is written.
 */
@Service
public class TenderMonitorService {
    private static final Logger log = LoggerFactory.getLogger(TenderMonitorService.class);
    private static final long POLL_MS = 200;

    private final TenderCollector collector;
    private final SeenTenderStore store;
    private final TenderNotifier notifier;
    private final ChannelConfigResolver channelConfigResolver;
    private final RunLock runLock;
    private final SnapshotExporter snapshotExporter;
    private final TenderMonitorProperties properties;
    private final ExecutorService collectorExecutor;
    private final Clock clock;
    private final AtomicBoolean active = new AtomicBoolean(false);

    public TenderMonitorService(
        TenderCollector collector,
        SeenTenderStore store,
        TenderNotifier notifier,
        ChannelConfigResolver channelConfigResolver,
        RunLock runLock,
        SnapshotExporter snapshotExporter,
        TenderMonitorProperties properties,
        @Qualifier("collectorExecutor") ExecutorService collectorExecutor,
        Clock clock
    ) {
        this.collector = collector;
        this.store = store;
        this.notifier = notifier;
        this.channelConfigResolver = channelConfigResolver;
        this.runLock = runLock;
        this.snapshotExporter = snapshotExporter;
        this.properties = properties;
        this.collectorExecutor = collectorExecutor;
        this.clock = clock;
    }

    public MonitorRunSummary run(RunRequest request, CancellationToken token) {
        return request.mode() == RunMode.SEND_ALL
            ? runDryDelivery(request, token)
            : runMonitor(request, token);
    }

    public MonitorRunSummary runMonitor(RunRequest request) {
        return runMonitor(request, CancellationToken.none());
    }

    public MonitorRunSummary runMonitor(RunRequest request, CancellationToken token) {
        return execute(RunMode.MONITOR, request, token);
    }

    /** Collects and notifies every active tender without reading or writing the seen-set. */
    public MonitorRunSummary runDryDelivery(RunRequest request) {
        return runDryDelivery(request, CancellationToken.none());
    }

    public MonitorRunSummary runDryDelivery(RunRequest request, CancellationToken token) {
        return execute(RunMode.SEND_ALL, request, token);
    }

    public boolean isRunning() {
        return active.get();
    }

    private MonitorRunSummary execute(RunMode mode, RunRequest request, CancellationToken token) {
        RunProgress progress = new RunProgress(UUID.randomUUID().toString(), mode, clock.instant());
        log.info("Run {} started (mode={}, scope={})", progress.runId, mode, request.normalizedScope().orElse("all"));
        if (!active.compareAndSet(false, true)) {
            return progress.fail(new ActiveRunException("A monitor run is already active in this process"), clock.instant());
        }
        try (RunLock.Lease lease = runLock.acquire()) {
            if (mode == RunMode.SEND_ALL) {
                dryDelivery(request, token, progress);
            } else {
                monitor(request, token, progress);
            }
            return progress.finish(RunState.DONE, clock.instant());
        } catch (RunCancelledException e) {
            log.warn("Run {} cancelled during {}; nothing committed", progress.runId, progress.state);
            return progress.cancel(e, clock.instant());
        } catch (TenderMonitorException e) {
            log.error("Run {} failed during {}: {}", progress.runId, progress.state, e.getMessage(), e);
            return progress.fail(e, clock.instant());
        } catch (RuntimeException e) {
            log.error("Run {} failed unexpectedly during {}", progress.runId, progress.state, e);
            return progress.fail(e, clock.instant());
        } finally {
            active.set(false);
        }
    }

    private void monitor(RunRequest request, CancellationToken token, RunProgress progress) {
        List<ChannelConfig> channels = channelConfigResolver.resolve(request);
        token.throwIfCancelled(RunState.IDLE);

        progress.enter(RunState.COLLECTING);
        List<Tender> accepted = collectAccepted(request, token, progress);
        token.throwIfCancelled(RunState.COLLECTING);

        progress.enter(RunState.DIFFING);
        Set<String> known = store.load();
        DiffResult diff = store.diff(accepted, known);
        progress.newCount = diff.newTenders().size();
        progress.duplicateCount = diff.duplicateCount();
        log.info("Run {} diffed against {} known tenders: new={}, duplicates={}",
            progress.runId, known.size(), progress.newCount, progress.duplicateCount);
        if (!diff.hasNewTenders()) {
            return;
        }
        token.throwIfCancelled(RunState.DIFFING);

        progress.enter(RunState.NOTIFYING);
        progress.report = notifier.dispatch(diff.newTenders(), channels, token);
        logDispatch(progress);
        token.throwIfCancelled(RunState.NOTIFYING);

        progress.enter(RunState.COMMITTING);
        store.commit(diff.newTenders());
        progress.committed = true;
        log.info("Run {} committed {} tenders to {}", progress.runId, progress.newCount, store.describe());
    }

    private void dryDelivery(RunRequest request, CancellationToken token, RunProgress progress) {
        List<ChannelConfig> channels = channelConfigResolver.resolve(request);
        token.throwIfCancelled(RunState.IDLE);

        progress.enter(RunState.COLLECTING);
        List<Tender> accepted = collectAccepted(request, token, progress);
        DiffResult unique = TenderDiff.diff(accepted, Set.of());
        progress.newCount = unique.newTenders().size();
        progress.duplicateCount = unique.duplicateCount();
        if (!unique.hasNewTenders()) {
            return;
        }
        token.throwIfCancelled(RunState.COLLECTING);

        progress.enter(RunState.NOTIFYING);
        progress.report = notifier.dispatch(unique.newTenders(), channels, token);
        logDispatch(progress);
    }

    private List<Tender> collectAccepted(RunRequest request, CancellationToken token, RunProgress progress) {
        List<Tender> snapshot = collect(request.normalizedScope(), token);
        List<Tender> accepted = snapshot.stream().filter(Tender::hasIdentity).toList();
        progress.scrapedCount = snapshot.size();
        progress.rejectedCount = snapshot.size() - accepted.size();
        if (progress.rejectedCount > 0) {
            log.warn("Run {} rejected {} tenders without a tender number", progress.runId, progress.rejectedCount);
        }
        log.info("Run {} collected {} tenders ({} accepted)", progress.runId, snapshot.size(), accepted.size());
        exportIfRequested(request, snapshot);
        return accepted;
    }

    private List<Tender> collect(Optional<String> scope, CancellationToken token) {
        TenderMonitorProperties.Collector config = properties.getCollector();
        long waitSeconds = (long) config.getTimeoutSeconds() + config.getGraceSeconds();
        Future<List<Tender>> future = collectorExecutor.submit(() -> collector.collect(scope));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(waitSeconds);
        while (true) {
            if (token.isCancelled()) {
                future.cancel(true);
                throw new RunCancelledException(RunState.COLLECTING);
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                future.cancel(true);
                throw new CollectionFailedException("collector did not finish within " + waitSeconds + "s");
            }
            try {
                List<Tender> snapshot = future.get(Math.min(POLL_MS, remainingMs), TimeUnit.MILLISECONDS);
                return snapshot == null ? List.of() : snapshot;
            } catch (TimeoutException e) {
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new RunCancelledException(RunState.COLLECTING);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TenderMonitorException monitorException) {
                    throw monitorException;
                }
                throw new CollectionFailedException("collector failed: " + cause, cause);
            }
        }
    }

    private void exportIfRequested(RunRequest request, List<Tender> snapshot) {
        if (request.exportPath() == null || request.exportPath().isBlank()) {
            return;
        }
        try {
            snapshotExporter.export(snapshot, Path.of(request.exportPath().trim()));
        } catch (IOException | RuntimeException e) {
            log.warn("Snapshot export to {} failed: {}", request.exportPath(), e.getMessage());
        }
    }

    private void logDispatch(RunProgress progress) {
        DispatchReport report = progress.report;
        log.info("Run {} dispatch finished: delivered={}, partial={}, failed={}, channels={}",
            progress.runId,
            report.countByStatus(DeliveryStatus.DELIVERED),
            report.countByStatus(DeliveryStatus.PARTIAL),
            report.countByStatus(DeliveryStatus.FAILED),
            report.channelTallies());
    }

    private static final class RunProgress {
        private final String runId;
        private final RunMode mode;
        private final Instant startedAt;
        private RunState state = RunState.IDLE;
        private int scrapedCount;
        private int rejectedCount;
        private int newCount;
        private int duplicateCount;
        private DispatchReport report = DispatchReport.EMPTY;
        private boolean committed;

        private RunProgress(String runId, RunMode mode, Instant startedAt) {
            this.runId = runId;
            this.mode = mode;
            this.startedAt = startedAt;
        }

        private void enter(RunState next) {
            log.info("Run {}: {} -> {}", runId, state, next);
            state = next;
        }

        private MonitorRunSummary finish(RunState finalState, Instant finishedAt) {
            return summary(finalState, null, null, finishedAt);
        }

        private MonitorRunSummary cancel(RunCancelledException e, Instant finishedAt) {
            return summary(RunState.CANCELLED, state, e.getMessage(), finishedAt);
        }

        private MonitorRunSummary fail(RuntimeException e, Instant finishedAt) {
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return summary(RunState.FAILED, state, error, finishedAt);
        }

        private MonitorRunSummary summary(RunState finalState, RunState failedStage, String error, Instant finishedAt) {
            return new MonitorRunSummary(
                runId,
                mode,
                startedAt,
                finishedAt,
                finalState,
                failedStage,
                error,
                scrapedCount,
                rejectedCount,
                newCount,
                duplicateCount,
                report.channelTallies(),
                report.deliveries(),
                committed
            );
        }
    }
}
