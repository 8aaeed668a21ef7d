package com.tenderwatch.monitor.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static com.tenderwatch.monitor.TenderFixtures.tender;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileSeenTenderStoreTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-02T09:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void missingFileIsAnEmptyStore() {
        JsonFileSeenTenderStore store = new JsonFileSeenTenderStore(dir.resolve("data/tenders.json"), objectMapper, CLOCK);

        assertThat(store.load()).isEmpty();
    }

    @Test
    void commitAppendsAndKeepsExistingEntries() throws IOException {
        Path file = dir.resolve("tenders.json");
        JsonFileSeenTenderStore store = new JsonFileSeenTenderStore(file, objectMapper, CLOCK);

        store.commit(List.of(tender("T1"), tender("T2")));
        store.commit(List.of(tender("t2"), tender("T3")));

        assertThat(store.load()).containsExactlyInAnyOrder("t1", "t2", "t3");
        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(json).contains("\"tender_number\" : \"T1\"").contains("\"committed_at\"");
        assertThat(json).doesNotContain("\"tender_number\" : \"t2\"");
    }

    @Test
    void readsFileWrittenByEarlierVersions() throws IOException {
        Path file = dir.resolve("tenders.json");
        Files.writeString(file, """
            [
              {"tender_number": "TS-77-E", "tender_title": "Old entry", "pdf_links": [], "extra": 1}
            ]
            """, StandardCharsets.UTF_8);

        JsonFileSeenTenderStore store = new JsonFileSeenTenderStore(file, objectMapper, CLOCK);

        assertThat(store.load()).containsExactly("ts-77-e");
    }

    @Test
    void corruptFileIsReportedInsteadOfTreatedAsEmpty() throws IOException {
        Path file = dir.resolve("tenders.json");
        Files.writeString(file, "[{\"tender_number\": \"T1\"", StandardCharsets.UTF_8);
        JsonFileSeenTenderStore store = new JsonFileSeenTenderStore(file, objectMapper, CLOCK);

        assertThatThrownBy(store::load).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> store.commit(List.of(tender("T2")))).isInstanceOf(CommitFailedException.class);
    }

    @Test
    void failedMoveLeavesPreviousStateAndNoTempFiles() throws IOException {
        Path file = dir.resolve("tenders.json");
        new JsonFileSeenTenderStore(file, objectMapper, CLOCK).commit(List.of(tender("T1")));
        String before = Files.readString(file, StandardCharsets.UTF_8);

        JsonFileSeenTenderStore crashing = new JsonFileSeenTenderStore(file, objectMapper, CLOCK) {
            @Override
            protected void moveIntoPlace(Path temp, Path target) throws IOException {
                throw new IOException("disk went away");
            }
        };

        assertThatThrownBy(() -> crashing.commit(List.of(tender("T2"))))
            .isInstanceOf(CommitFailedException.class)
            .hasMessageContaining("disk went away");
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(before);
        assertThat(crashing.load()).containsExactly("t1");
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void fileSystemWithoutAtomicRenameFailsCommitInsteadOfReplacing() throws IOException {
        Path file = dir.resolve("tenders.json");
        new JsonFileSeenTenderStore(file, objectMapper, CLOCK).commit(List.of(tender("T1")));
        String before = Files.readString(file, StandardCharsets.UTF_8);

        JsonFileSeenTenderStore nonAtomic = new JsonFileSeenTenderStore(file, objectMapper, CLOCK) {
            @Override
            void atomicMove(Path temp, Path target) throws IOException {
                throw new AtomicMoveNotSupportedException(temp.toString(), target.toString(), "not supported");
            }
        };

        assertThatThrownBy(() -> nonAtomic.commit(List.of(tender("T2"))))
            .isInstanceOf(CommitFailedException.class)
            .hasMessageContaining("atomically");
        assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(before);
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void leftoverTempFileFromCrashIsIgnored() throws IOException {
        Path file = dir.resolve("tenders.json");
        JsonFileSeenTenderStore store = new JsonFileSeenTenderStore(file, objectMapper, CLOCK);
        store.commit(List.of(tender("T1")));
        Files.writeString(dir.resolve("tenders.json123.tmp"), "[{\"tender_number\": \"T9\"", StandardCharsets.UTF_8);

        assertThat(store.load()).containsExactly("t1");
        store.commit(List.of(tender("T2")));
        assertThat(store.load()).containsExactlyInAnyOrder("t1", "t2");
    }
}
