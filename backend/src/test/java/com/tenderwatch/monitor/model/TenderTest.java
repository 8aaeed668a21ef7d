package com.tenderwatch.monitor.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TenderTest {

    @Test
    void identityKeyIgnoresCaseAndSurroundingWhitespace() {
        Tender upper = withClosing(" TS-1001-E ", "");
        Tender lower = withClosing("ts-1001-e", "");

        assertThat(upper.identity()).isEqualTo("TS-1001-E");
        assertThat(upper.identityKey()).isEqualTo(lower.identityKey()).isEqualTo("ts-1001-e");
        assertThat(withClosing("   ", "").hasIdentity()).isFalse();
    }

    @Test
    void closingDateAcceptsListingFormats() {
        assertThat(withClosing("T1", "25-10-2026").closingDate()).contains(LocalDate.of(2026, 10, 25));
        assertThat(withClosing("T1", "25-10-2026 11:00 AM").closingDate()).contains(LocalDate.of(2026, 10, 25));
        assertThat(withClosing("T1", "30/10/2026").closingDate()).contains(LocalDate.of(2026, 10, 30));
        assertThat(withClosing("T1", "2026-11-02").closingDate()).contains(LocalDate.of(2026, 11, 2));
        assertThat(withClosing("T1", "12 Nov 2026 11:00").closingDate()).contains(LocalDate.of(2026, 11, 12));
    }

    @Test
    void unparseableClosingDateIsEmpty() {
        assertThat(withClosing("T1", "to be announced").closingDate()).isEmpty();
        assertThat(withClosing("T1", null).closingDate()).isEmpty();
    }

    @Test
    void nullFieldsAreNormalized() {
        Tender tender = new Tender("T9", null, null, null, null, null, null, null);

        assertThat(tender.title()).isEmpty();
        assertThat(tender.links()).isEmpty();
        assertThat(tender.firstLink()).isEmpty();
        assertThat(tender.scrapedAt()).isNotNull();
    }

    private static Tender withClosing(String number, String closing) {
        return new Tender(number, "Title", "", "", "", closing, List.of(), Instant.EPOCH);
    }
}
