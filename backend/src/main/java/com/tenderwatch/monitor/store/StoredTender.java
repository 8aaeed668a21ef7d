package com.tenderwatch.monitor.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tenderwatch.monitor.model.Tender;

import java.time.Instant;
import java.util.List;

/** On-disk shape of one entry in the JSON seen-set file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredTender(
    @JsonProperty("tender_number") String tenderNumber,
    @JsonProperty("tender_title") String title,
    @JsonProperty("category") String category,
    @JsonProperty("department_owner") String department,
    @JsonProperty("start_date") String advertisedDate,
    @JsonProperty("closing_date") String closingDate,
    @JsonProperty("pdf_links") List<String> links,
    @JsonProperty("scraped_at") Instant scrapedAt,
    @JsonProperty("committed_at") Instant committedAt
) {
    public static StoredTender from(Tender tender, Instant committedAt) {
        return new StoredTender(
            tender.identity(),
            tender.title(),
            tender.category(),
            tender.department(),
            tender.advertisedDate(),
            tender.closingDateText(),
            tender.links(),
            tender.scrapedAt(),
            committedAt
        );
    }

    public String identityKey() {
        return Tender.normalizeIdentity(tenderNumber);
    }
}
