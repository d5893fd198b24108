// file: src/main/java/io/tabver/server/audit/JsonlMergeAuditLog.java
package io.tabver.server.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabver.core.StorageException;
import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merge audit log as a JSON-lines file: one {@link MergeAuditRecord} per line,
 * appended and fsynced under a lock.
 */
public final class JsonlMergeAuditLog implements MergeAuditLog, AutoCloseable {
    private final ObjectMapper json = new ObjectMapper();
    private final Path file;
    private final Clock clock;
    private final FileChannel ch;

    public JsonlMergeAuditLog(Path file) {
        this(file, Clock.systemUTC());
    }

    public JsonlMergeAuditLog(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            this.ch = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("Cannot open merge audit log " + file, e);
        }
    }

    @Override
    public synchronized void append(MergeRequest request, String documentId, MergeResult result) {
        MergeAuditRecord record = MergeAuditRecord.of(Instant.now(clock), request, documentId, result);
        try {
            byte[] line = json.writeValueAsBytes(record);
            ByteBuffer buf = ByteBuffer.allocate(line.length + 1);
            buf.put(line).put((byte) '\n').flip();
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(false);
        } catch (IOException e) {
            throw new StorageException("Failed to append to merge audit log " + file, e);
        }
    }

    /** Every record in the file, oldest first. */
    public synchronized List<MergeAuditRecord> readAll() {
        List<MergeAuditRecord> out = new ArrayList<>();
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                out.add(json.readValue(line, MergeAuditRecord.class));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to read merge audit log " + file, e);
        }
        return out;
    }

    @Override
    public synchronized void close() throws IOException {
        ch.close();
    }
}
