package com.tenderwatch.monitor.collect;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.Tender;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the PPRA active-tenders table. Expected columns are
 * {@code Sr No | Tender No | Tender Details | Downloads | Advertised | Closing}.
 */
@Component
public class PpraTenderCollector implements TenderCollector {
    private static final Logger log = LoggerFactory.getLogger(PpraTenderCollector.class);
    private static final int MIN_CELLS = 5;
    private static final List<String> HEADER_MARKERS = List.of(
        "sr no", "tender no", "tender details", "downloads", "advertisement", "closing"
    );
    private static final List<String> DEPARTMENT_KEYS = List.of("department", "dept", "owner", "organization");

    private final TenderPageClient pageClient;
    private final TenderMonitorProperties properties;
    private final Clock clock;

    public PpraTenderCollector(TenderPageClient pageClient, TenderMonitorProperties properties, Clock clock) {
        this.pageClient = pageClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public List<Tender> collect(Optional<String> scopeFilter) {
        TenderMonitorProperties.Collector config = properties.getCollector();
        String url = config.getListingUrl();
        Document document;
        try {
            document = pageClient.fetchListingPage(url, scopeFilter.orElse(null), config.getUserAgent(), config.getTimeoutSeconds() * 1000);
        } catch (IOException e) {
            throw new CollectionFailedException("listing page unreachable: " + url + " (" + e.getMessage() + ")", e);
        }
        if (document == null) {
            throw new CollectionFailedException("listing page returned no document: " + url);
        }
        Element table = document.selectFirst("table");
        if (table == null) {
            throw new CollectionFailedException("listing table not found on " + url);
        }

        Instant scrapedAt = clock.instant();
        String scope = scopeFilter.map(value -> value.toLowerCase(Locale.ROOT)).orElse(null);
        List<Tender> tenders = new ArrayList<>();
        int skipped = 0;
        for (Element row : table.select("tr")) {
            String rowText = row.text().toLowerCase(Locale.ROOT).trim();
            if (rowText.isEmpty() || rowText.contains("no record") || rowText.contains("no data")) {
                continue;
            }
            if (isHeaderRow(rowText)) {
                continue;
            }
            Elements cells = row.select("> td");
            if (cells.size() < MIN_CELLS) {
                continue;
            }
            if (scope != null && !rowText.contains(scope)) {
                continue;
            }
            try {
                tenders.add(toTender(cells, scrapedAt));
            } catch (RuntimeException e) {
                skipped++;
                log.warn("Skipping unreadable tender row: {}", e.getMessage());
            }
        }
        log.info("Collected {} tenders from {} (scope={}, skippedRows={})",
            tenders.size(), url, scopeFilter.orElse("all"), skipped);
        return tenders;
    }

    private Tender toTender(Elements cells, Instant scrapedAt) {
        String tenderNumber = cells.get(1).text().trim();
        Element detailsCell = cells.get(2);
        List<String> lines = detailLines(detailsCell);
        TenderDetails details = parseDetails(lines);
        String advertised = cells.get(4).text().trim();
        String closing = cells.size() > 5 ? cells.get(5).text().trim() : "";

        List<String> links = new ArrayList<>();
        for (Element anchor : cells.get(3).select("a[href]")) {
            String href = anchor.absUrl("href");
            if (href.isBlank()) {
                href = anchor.attr("href");
            }
            if (!href.isBlank()) {
                links.add(href.trim());
            }
        }

        return new Tender(
            tenderNumber,
            details.title(),
            details.category(),
            details.department(),
            advertised,
            closing,
            links,
            scrapedAt
        );
    }

    static TenderDetails parseDetails(List<String> lines) {
        if (lines.isEmpty()) {
            return new TenderDetails("", "", "");
        }
        String title = lines.get(0);
        String category = "";
        String department = "";
        int categoryLine = -1;
        int departmentLine = -1;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String lower = line.toLowerCase(Locale.ROOT);
            if (category.isEmpty() && lower.contains("category")) {
                category = valueAfterLabel(line, "category");
                categoryLine = i;
            } else if (department.isEmpty() && DEPARTMENT_KEYS.stream().anyMatch(lower::contains)) {
                department = valueAfterLabel(line, null);
                departmentLine = i;
            }
        }

        if (category.isEmpty()) {
            for (int i = 1; i < Math.min(3, lines.size()); i++) {
                if (i != departmentLine) {
                    category = lines.get(i);
                    categoryLine = i;
                    break;
                }
            }
        }
        if (department.isEmpty()) {
            for (int i = 2; i < lines.size(); i++) {
                if (i != categoryLine) {
                    department = lines.get(i);
                    break;
                }
            }
        }
        return new TenderDetails(title, category, department);
    }

    private static String valueAfterLabel(String line, String label) {
        int colon = line.indexOf(':');
        if (colon >= 0) {
            return line.substring(colon + 1).trim();
        }
        int dash = line.indexOf('-');
        if (dash >= 0) {
            return line.substring(dash + 1).trim();
        }
        if (label == null) {
            return line.trim();
        }
        return line.replaceAll("(?i)" + label, "").trim();
    }

    private static List<String> detailLines(Element cell) {
        String html = cell.html().replaceAll("(?i)<br\\s*/?>|</(p|div|li)>", "\n");
        String text = Jsoup.parseBodyFragment(html).body().wholeText();
        return Arrays.stream(text.split("\\R"))
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .toList();
    }

    private static boolean isHeaderRow(String rowText) {
        boolean looksLikeHeader = HEADER_MARKERS.stream().anyMatch(rowText::contains);
        return looksLikeHeader && rowText.chars().noneMatch(Character::isDigit);
    }

    record TenderDetails(String title, String category, String department) {}
}
