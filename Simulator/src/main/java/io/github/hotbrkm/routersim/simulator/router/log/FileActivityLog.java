package io.github.hotbrkm.routersim.simulator.router.log;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Activity log backed by a text file opened once in append mode.
 * <p>
 * Each record is written as a single line and flushed immediately.
 */
@Slf4j
public class FileActivityLog implements ActivityLog {

    private final Path path;
    private final BufferedWriter writer;
    private boolean closed;

    public FileActivityLog(Path path) {
        this.path = path;
        this.writer = open(path);
        log.info("Activity log opened at {}", path.toAbsolutePath());
    }

    @Override
    public synchronized void append(ActivityRecord record) {
        if (closed) {
            throw new ActivityLogException("Activity log is closed: " + path);
        }
        try {
            writer.write(record.toLine());
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new ActivityLogException("Failed to write activity log: " + path, e);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.close();
        } catch (IOException e) {
            throw new ActivityLogException("Failed to close activity log: " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    private static BufferedWriter open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ActivityLogException("Failed to open activity log: " + path, e);
        }
    }
}
