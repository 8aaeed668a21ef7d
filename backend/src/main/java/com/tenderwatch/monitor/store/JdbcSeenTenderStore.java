package com.tenderwatch.monitor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenderwatch.monitor.model.Tender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Seen-set kept in the {@code seen_tenders} table; one transaction per commit. */
public class JdbcSeenTenderStore implements SeenTenderStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcSeenTenderStore.class);
    private static final int KEY_CHUNK_SIZE = 500;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcSeenTenderStore(
        NamedParameterJdbcTemplate jdbc,
        TransactionTemplate transactionTemplate,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Set<String> load() {
        try {
            List<String> keys = jdbc.queryForList(
                "SELECT identity_key FROM seen_tenders",
                new MapSqlParameterSource(),
                String.class
            );
            return new HashSet<>(keys);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("seen_tenders unreadable: " + e.getMessage(), e);
        }
    }

    @Override
    public void commit(List<Tender> newTenders) {
        if (newTenders == null || newTenders.isEmpty()) {
            return;
        }
        Instant committedAt = clock.instant();
        try {
            Integer inserted = transactionTemplate.execute(status -> insertAbsent(newTenders, committedAt));
            log.info("Committed {} of {} tenders to seen_tenders", inserted, newTenders.size());
        } catch (DataAccessException | TransactionException e) {
            throw new CommitFailedException("seen_tenders commit rolled back: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            throw new CommitFailedException(e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "jdbc:seen_tenders";
    }

    private int insertAbsent(List<Tender> tenders, Instant committedAt) {
        Set<String> batchKeys = new LinkedHashSet<>();
        for (Tender tender : tenders) {
            batchKeys.add(tender.identityKey());
        }
        Set<String> existing = findExistingKeys(new ArrayList<>(batchKeys));

        List<MapSqlParameterSource> rows = new ArrayList<>();
        Set<String> queued = new HashSet<>();
        for (Tender tender : tenders) {
            String key = tender.identityKey();
            if (key.isEmpty() || existing.contains(key) || !queued.add(key)) {
                continue;
            }
            rows.add(new MapSqlParameterSource()
                .addValue("identityKey", key)
                .addValue("tenderNumber", tender.identity())
                .addValue("title", tender.title())
                .addValue("category", tender.category())
                .addValue("department", tender.department())
                .addValue("advertisedDate", tender.advertisedDate())
                .addValue("closingDateText", tender.closingDateText())
                .addValue("links", writeLinks(tender.links()))
                .addValue("scrapedAt", Timestamp.from(tender.scrapedAt()))
                .addValue("committedAt", Timestamp.from(committedAt)));
        }
        if (rows.isEmpty()) {
            return 0;
        }
        jdbc.batchUpdate(
            """
                INSERT INTO seen_tenders (
                  identity_key, tender_number, title, category, department,
                  advertised_date, closing_date_text, links, scraped_at, committed_at
                ) VALUES (
                  :identityKey, :tenderNumber, :title, :category, :department,
                  :advertisedDate, :closingDateText, :links, :scrapedAt, :committedAt
                )
                """,
            rows.toArray(new MapSqlParameterSource[0])
        );
        return rows.size();
    }

    private Set<String> findExistingKeys(List<String> keys) {
        Set<String> existing = new HashSet<>();
        for (int start = 0; start < keys.size(); start += KEY_CHUNK_SIZE) {
            List<String> chunk = keys.subList(start, Math.min(keys.size(), start + KEY_CHUNK_SIZE));
            existing.addAll(jdbc.queryForList(
                "SELECT identity_key FROM seen_tenders WHERE identity_key IN (:keys)",
                new MapSqlParameterSource("keys", chunk),
                String.class
            ));
        }
        return existing;
    }

    private String writeLinks(List<String> links) {
        try {
            return objectMapper.writeValueAsString(links);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("links not serializable", e);
        }
    }
}
