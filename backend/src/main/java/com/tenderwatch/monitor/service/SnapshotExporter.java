package com.tenderwatch.monitor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tenderwatch.monitor.model.Tender;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Writes a collected snapshot to disk as CSV or JSON, picked by the file extension. */
@Component
public class SnapshotExporter {
    private static final Logger log = LoggerFactory.getLogger(SnapshotExporter.class);
    static final String[] CSV_HEADER = {
        "tender_number", "tender_title", "category", "department_owner",
        "start_date", "closing_date", "pdf_links", "scraped_at"
    };

    private final ObjectMapper objectMapper;

    public SnapshotExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void export(List<Tender> snapshot, Path target) throws IOException {
        Path path = target.toAbsolutePath().normalize();
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            writeCsv(snapshot, path);
        } else {
            writeJson(snapshot, path);
        }
        log.info("Exported {} tenders to {}", snapshot.size(), path);
    }

    private void writeCsv(List<Tender> snapshot, Path path) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (Tender tender : snapshot) {
                printer.printRecord(
                    tender.identity(),
                    tender.title(),
                    tender.category(),
                    tender.department(),
                    tender.advertisedDate(),
                    tender.closingDateText(),
                    String.join("; ", tender.links()),
                    tender.scrapedAt().toString()
                );
            }
        }
    }

    private void writeJson(List<Tender> snapshot, Path path) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Tender tender : snapshot) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("tender_number", tender.identity());
            row.put("tender_title", tender.title());
            row.put("category", tender.category());
            row.put("department_owner", tender.department());
            row.put("start_date", tender.advertisedDate());
            row.put("closing_date", tender.closingDateText());
            row.put("pdf_links", tender.links());
            row.put("scraped_at", tender.scrapedAt().toString());
            rows.add(row);
        }
        objectMapper.writeValue(path.toFile(), rows);
    }
}
