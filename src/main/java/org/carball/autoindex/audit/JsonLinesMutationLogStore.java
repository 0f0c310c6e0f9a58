package org.carball.autoindex.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.autoindex.model.audit.MutationLogEntry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutation log as a JSON-lines file, one {@link MutationLogRow} per line.
 * Each entry is written with a single forced write of one complete line, and
 * writers are serialized, so a reader never sees half an entry from a live
 * process. A torn last line left by a crash is skipped on read, and the next
 * append starts on a fresh line so the fragment never swallows a new entry.
 */
@Slf4j
public class JsonLinesMutationLogStore implements MutationLogStore {

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesMutationLogStore(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(MutationLogEntry entry) {
        try {
            String json = objectMapper.writeValueAsString(MutationLogRow.from(entry)) + "\n";
            if (endsWithTornLine()) {
                log.warn("Mutation log {} ends with an unterminated line, starting entry {} on a new line",
                        path, entry.entryId());
                json = "\n" + json;
            }
            byte[] line = json.getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(false);
            }
        } catch (IOException e) {
            throw new AuditWriteException("Failed to append mutation log entry " + entry.entryId() + " to " + path, e);
        }
    }

    private boolean endsWithTornLine() throws IOException {
        if (!Files.exists(path)) {
            return false;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return false;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last, size - 1);
            return last.get(0) != '\n';
        }
    }

    @Override
    public synchronized List<MutationLogEntry> readAll() {
        List<MutationLogEntry> entries = new ArrayList<>();
        if (!Files.exists(path)) {
            return entries;
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read mutation log " + path, e);
        }

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, MutationLogRow.class).toEntry());
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable mutation log line {} in {}: {}", i + 1, path, e.getMessage());
            }
        }
        return entries;
    }
}
