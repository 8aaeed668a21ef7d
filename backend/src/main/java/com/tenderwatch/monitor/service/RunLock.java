package com.tenderwatch.monitor.service;

import com.tenderwatch.config.TenderMonitorProperties;
import com.tenderwatch.monitor.TenderMonitorException;
import com.tenderwatch.monitor.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Optional exclusive lease on {@code tender.run-lock.file}. Two processes sharing one store must
 * not run concurrently; with the lock disabled that is left to the scheduler.
 */
@Component
public class RunLock {
    private static final Logger log = LoggerFactory.getLogger(RunLock.class);

    private final TenderMonitorProperties properties;

    public RunLock(TenderMonitorProperties properties) {
        this.properties = properties;
    }

    public Lease acquire() {
        TenderMonitorProperties.RunLock config = properties.getRunLock();
        if (!config.isEnabled()) {
            return Lease.NONE;
        }
        Path path = Path.of(config.getFile()).toAbsolutePath().normalize();
        FileChannel channel = null;
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock = channel.tryLock();
            if (lock == null) {
                closeQuietly(channel);
                throw new ActiveRunException("Another monitor run holds " + path);
            }
            log.debug("Acquired run lock {}", path);
            return new Lease(channel, lock, path);
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw new ActiveRunException("A monitor run in this process already holds " + path);
        } catch (IOException e) {
            closeQuietly(channel);
            throw new TenderMonitorException(RunState.IDLE, "Run lock unavailable: " + path + " (" + e.getMessage() + ")", e);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Closing run lock channel failed: {}", e.getMessage());
        }
    }

    public static final class Lease implements AutoCloseable {
        static final Lease NONE = new Lease(null, null, null);

        private final FileChannel channel;
        private final FileLock lock;
        private final Path path;

        private Lease(FileChannel channel, FileLock lock, Path path) {
            this.channel = channel;
            this.lock = lock;
            this.path = path;
        }

        public boolean isHeld() {
            return lock != null && lock.isValid();
        }

        @Override
        public void close() {
            if (lock == null) {
                return;
            }
            try {
                lock.release();
            } catch (IOException e) {
                log.warn("Releasing run lock {} failed: {}", path, e.getMessage());
            }
            closeQuietly(channel);
        }
    }
}
