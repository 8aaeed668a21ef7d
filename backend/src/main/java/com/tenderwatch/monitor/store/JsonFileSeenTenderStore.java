package com.tenderwatch.monitor.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.tenderwatch.monitor.model.Tender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Seen-set kept as a JSON array in a single file. Commits write a complete new copy next to the
 * target and rename it into place, so the target always holds a complete array.
 */
public class JsonFileSeenTenderStore implements SeenTenderStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileSeenTenderStore.class);
    private static final TypeReference<List<StoredTender>> STORED_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonFileSeenTenderStore(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @Override
    public Set<String> load() {
        List<StoredTender> stored;
        try {
            stored = readAll();
        } catch (IOException e) {
            throw new StoreUnavailableException("seen-set file unreadable: " + file + " (" + e.getMessage() + ")", e);
        }
        Set<String> keys = new HashSet<>();
        for (StoredTender entry : stored) {
            String key = entry.identityKey();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public synchronized void commit(List<Tender> newTenders) {
        if (newTenders == null || newTenders.isEmpty()) {
            return;
        }
        List<StoredTender> merged;
        try {
            merged = new ArrayList<>(readAll());
        } catch (IOException e) {
            throw new CommitFailedException("seen-set file unreadable before commit: " + file, e);
        }
        Set<String> present = new HashSet<>();
        for (StoredTender entry : merged) {
            present.add(entry.identityKey());
        }
        Instant committedAt = clock.instant();
        int appended = 0;
        for (Tender tender : newTenders) {
            String key = tender.identityKey();
            if (!key.isEmpty() && present.add(key)) {
                merged.add(StoredTender.from(tender, committedAt));
                appended++;
            }
        }
        if (appended == 0) {
            return;
        }

        Path temp = null;
        try {
            Path directory = file.getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            writeDurably(temp, objectMapper.writeValueAsBytes(merged));
            moveIntoPlace(temp, file);
            temp = null;
            log.info("Committed {} tenders to {} (total {})", appended, file, merged.size());
        } catch (IOException e) {
            throw new CommitFailedException("seen-set commit to " + file + " failed: " + e.getMessage(), e);
        } finally {
            if (temp != null) {
                discard(temp);
            }
        }
    }

    @Override
    public String describe() {
        return "file:" + file;
    }

    public Path file() {
        return file;
    }

    /**
     * Replaces the target with the fully written temp file. A file system without atomic rename
     * fails the commit; the previous file is left as it was.
     */
    protected void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            atomicMove(temp, target);
        } catch (AtomicMoveNotSupportedException e) {
            throw new IOException("file system cannot replace " + target + " atomically", e);
        }
        syncDirectory(target.toAbsolutePath().getParent());
    }

    void atomicMove(Path temp, Path target) throws IOException {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    private static void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", directory, e.getMessage());
        }
    }

    private List<StoredTender> readAll() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        byte[] payload = Files.readAllBytes(file);
        if (payload.length == 0) {
            throw new IOException("seen-set file is empty");
        }
        List<StoredTender> stored = objectMapper.readValue(payload, STORED_LIST);
        return stored == null ? List.of() : stored;
    }

    private void writeDurably(Path target, byte[] payload) throws IOException {
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}", temp, e);
        }
    }
}
