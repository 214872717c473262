package org.pokeai.runtime.services;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.pokeai.runtime.model.LogEntry;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serializes battle logs as line-delimited JSON, one {@link LogEntry} per line, with the
 * property order fixed by the record so identical logs give identical bytes.
 */
public class BattleLogWriter {

    private final ObjectWriter writer;

    public BattleLogWriter() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.writer = objectMapper.writerFor(LogEntry.class);
    }

    /**
     * Writes every entry followed by a newline. The target stays open.
     */
    public void write(List<LogEntry> entries, Writer out) throws IOException {
        for (LogEntry entry : entries) {
            out.write(writer.writeValueAsString(entry));
            out.write('\n');
        }
        out.flush();
    }

    public void write(List<LogEntry> entries, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(entries, out);
        }
    }

    /**
     * The JSONL text of a log.
     */
    public String toJsonl(List<LogEntry> entries) {
        StringBuilder sb = new StringBuilder();
        for (LogEntry entry : entries) {
            try {
                sb.append(writer.writeValueAsString(entry)).append('\n');
            } catch (IOException e) {
                throw new IllegalStateException("Failed to serialize log entry " + entry, e);
            }
        }
        return sb.toString();
    }
}
