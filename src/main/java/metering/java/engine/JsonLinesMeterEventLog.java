package metering.java.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed event log: one JSON object per line, appended and flushed per event.
 *
 * <p>Appends are serialized on this instance; one process should own a given file.
 * Blank lines are skipped on read.
 */
public final class JsonLinesMeterEventLog implements MeterEventLog {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesMeterEventLog(Path file) {
        if (file == null) throw new IllegalArgumentException("file cannot be null");
        this.file = file;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized void append(MeterEvent event) {
        if (event == null) throw new IllegalArgumentException("event cannot be null");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
                writer.write(mapper.writeValueAsString(event));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to append meter event " + event.eventId() + " to " + file, e);
        }
    }

    @Override
    public synchronized List<MeterEvent> readAll() {
        if (!Files.exists(file)) {
            return List.of();
        }
        List<MeterEvent> events = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(mapper.readValue(line, MeterEvent.class));
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("corrupt meter event at " + file + ":" + lineNo, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read meter events from " + file, e);
        }
        return events;
    }

    public Path file() {
        return file;
    }
}
