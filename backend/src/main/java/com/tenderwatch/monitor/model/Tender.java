package com.tenderwatch.monitor.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * One active tender listing as extracted by a collector.
 *
 * <p>{@code identity} is the tender number published by the source. Two tenders with the same
 * {@link #identityKey()} are the same logical tender regardless of their other fields.
 */
public record Tender(
    String identity,
    String title,
    String category,
    String department,
    String advertisedDate,
    String closingDateText,
    List<String> links,
    Instant scrapedAt
) {
    private static final List<DateTimeFormatter> CLOSING_DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        lenient("dd-MM-yyyy"),
        lenient("d-M-yyyy"),
        lenient("dd/MM/yyyy"),
        lenient("d/M/yyyy"),
        lenient("d MMM yyyy"),
        lenient("dd MMM, yyyy"),
        lenient("d MMMM yyyy"),
        lenient("MMM d, yyyy")
    );

    public Tender {
        identity = identity == null ? "" : identity.trim();
        title = blankToEmpty(title);
        category = blankToEmpty(category);
        department = blankToEmpty(department);
        advertisedDate = blankToEmpty(advertisedDate);
        closingDateText = blankToEmpty(closingDateText);
        links = links == null ? List.of() : List.copyOf(links);
        scrapedAt = scrapedAt == null ? Instant.now() : scrapedAt;
    }

    public boolean hasIdentity() {
        return !identity.isBlank();
    }

    public String identityKey() {
        return normalizeIdentity(identity);
    }

    public Optional<LocalDate> closingDate() {
        String value = closingDateText.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (String candidate : dateCandidates(value)) {
            for (DateTimeFormatter format : CLOSING_DATE_FORMATS) {
                try {
                    return Optional.of(LocalDate.parse(candidate, format));
                } catch (DateTimeParseException ignored) {
                    // try the next pattern
                }
            }
        }
        return Optional.empty();
    }

    public Optional<String> firstLink() {
        return links.isEmpty() ? Optional.empty() : Optional.of(links.get(0));
    }

    public static String normalizeIdentity(String identity) {
        return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
    }

    // listings sometimes append a time, e.g. "12-11-2025 11:00 AM" or "12 Nov 2025 11:00"
    private static Set<String> dateCandidates(String value) {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(value);
        String[] tokens = value.split("\\s+");
        if (tokens.length > 1) {
            candidates.add(tokens[0]);
        }
        if (tokens.length > 3) {
            candidates.add(String.join(" ", tokens[0], tokens[1], tokens[2]));
        }
        return candidates;
    }

    private static String blankToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static DateTimeFormatter lenient(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}
