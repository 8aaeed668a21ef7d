package com.tenderwatch.monitor.notify;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.model.NotificationMessage;
import com.tenderwatch.monitor.model.Tender;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
public class TenderMessageFormatter {
    static final String PLACEHOLDER = "N/A";
    private static final DateTimeFormatter CLOSING_FORMAT = DateTimeFormatter.ofPattern("dd MMM yyyy", Locale.ENGLISH);

    private final TenderMonitorProperties properties;

    public TenderMessageFormatter(TenderMonitorProperties properties) {
        this.properties = properties;
    }

    public NotificationMessage format(Tender tender) {
        String closing = tender.closingDate()
            .map(CLOSING_FORMAT::format)
            .orElse(tender.closingDateText());

        StringBuilder body = new StringBuilder();
        body.append("New Tender Alert").append('\n')
            .append('\n')
            .append("Title: ").append(orPlaceholder(tender.title())).append('\n')
            .append("Tender No: ").append(orPlaceholder(tender.identity())).append('\n')
            .append("Category: ").append(orPlaceholder(tender.category())).append('\n')
            .append("Department: ").append(orPlaceholder(tender.department())).append('\n')
            .append("Closing Date: ").append(orPlaceholder(closing)).append('\n')
            .append("Link: ").append(tender.firstLink().orElse(PLACEHOLDER)).append('\n')
            .append("Documents: ").append(documentsNote(tender.links().size()));

        String headline = tender.title().isBlank() ? orPlaceholder(tender.identity()) : tender.title();
        String subject = properties.getEmail().getSubjectPrefix() + ": " + headline;
        return new NotificationMessage(subject, body.toString());
    }

    private static String documentsNote(int linkCount) {
        if (linkCount == 0) {
            return "No documents listed";
        }
        return linkCount == 1 ? "1 document link attached" : linkCount + " document links attached";
    }

    private static String orPlaceholder(String value) {
        return value == null || value.isBlank() ? PLACEHOLDER : value;
    }
}
