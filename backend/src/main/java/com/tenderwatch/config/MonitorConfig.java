package com.tenderwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderwatch.monitor.collect.JsoupTenderPageClient;
import com.tenderwatch.monitor.collect.SeleniumTenderPageClient;
import com.tenderwatch.monitor.collect.TenderPageClient;
import com.tenderwatch.monitor.store.JdbcSeenTenderStore;
import com.tenderwatch.monitor.store.JsonFileSeenTenderStore;
import com.tenderwatch.monitor.store.SeenTenderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MonitorConfig {
    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TenderPageClient tenderPageClient(TenderMonitorProperties properties) {
        TenderMonitorProperties.Collector collector = properties.getCollector();
        TenderPageClient client = switch (collector.getRenderer()) {
            case "browser" -> new SeleniumTenderPageClient(collector.isHeadless());
            case "static" -> new JsoupTenderPageClient();
            default -> throw new IllegalStateException("Unknown tender.collector.renderer: " + collector.getRenderer());
        };
        log.info("Listing page renderer: {} ({})", collector.getRenderer(), collector.getListingUrl());
        return client;
    }

    @Bean
    public SeenTenderStore seenTenderStore(
        TenderMonitorProperties properties,
        NamedParameterJdbcTemplate jdbc,
        PlatformTransactionManager transactionManager,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        String type = properties.getStore().getType() == null
            ? "jdbc"
            : properties.getStore().getType().trim().toLowerCase(Locale.ROOT);
        SeenTenderStore store = switch (type) {
            case "file", "json" -> new JsonFileSeenTenderStore(Path.of(properties.getStore().getFile()), objectMapper, clock);
            case "jdbc" -> new JdbcSeenTenderStore(jdbc, new TransactionTemplate(transactionManager), objectMapper, clock);
            default -> throw new IllegalStateException("Unknown tender.store.type: " + type);
        };
        log.info("Seen-set store: {}", store.describe());
        return store;
    }

    @Bean(name = "collectorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService collectorExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tender-collector");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "notifierExecutor", destroyMethod = "shutdownNow")
    public ExecutorService notifierExecutor(TenderMonitorProperties properties) {
        return Executors.newFixedThreadPool(properties.getNotifier().getConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "tender-notifier");
            thread.setDaemon(true);
            return thread;
        });
    }
}
