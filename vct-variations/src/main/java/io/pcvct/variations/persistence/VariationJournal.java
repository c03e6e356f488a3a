package io.pcvct.variations.persistence;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import io.pcvct.variations.VariationLocation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines journal of inserted variation rows.
 *
 * <p>Each line records one row:
 * <pre>{@code
 * {"location":"config","id":3,"row":{"overall/max_time":2880,"save/full_data/interval":30.0}}
 * }</pre>
 *
 * <p>Lines are flushed as they are written. {@link #replay(Path)} reads the rows
 * back in insertion order.
 */
public final class VariationJournal implements Closeable {

    private static final Logger logger = LogManager.getLogger(VariationJournal.class);

    private static final Gson GSON = new GsonBuilder()
        .serializeSpecialFloatingPointValues()
        .disableHtmlEscaping()
        .create();

    private final Path path;
    private final BufferedWriter writer;

    /// A row read back from a journal.
    public record Entry(VariationLocation location, int id, Map<String, Object> row) {
    }

    private VariationJournal(Path path, BufferedWriter writer) {
        this.path = path;
        this.writer = writer;
    }

    /**
     * Opens a journal for appending, creating the file and its parent directories if needed.
     *
     * @param path the journal file
     * @return the open journal
     * @throws IOException if the file cannot be opened
     */
    public static VariationJournal open(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        return new VariationJournal(path, writer);
    }

    /**
     * Reads every row recorded in a journal.
     *
     * @param path the journal file
     * @return the rows in the order they were written, empty if the file does not exist
     * @throws IOException if the file cannot be read or a line is malformed
     */
    public static List<Entry> replay(Path path) throws IOException {
        List<Entry> entries = new ArrayList<>();
        if (!Files.exists(path)) {
            return entries;
        }
        int lineNumber = 0;
        for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonReader reader = new JsonReader(new StringReader(line));
                reader.setLenient(true);
                JsonObject obj = JsonParser.parseReader(reader).getAsJsonObject();
                VariationLocation location = VariationLocation.fromKey(obj.get("location").getAsString());
                int id = obj.get("id").getAsInt();
                Map<String, Object> row = new LinkedHashMap<>();
                for (Map.Entry<String, JsonElement> column : obj.getAsJsonObject("row").entrySet()) {
                    row.put(column.getKey(), JsonValues.fromJson(column.getValue()));
                }
                entries.add(new Entry(location, id, row));
            } catch (RuntimeException e) {
                throw new IOException("Malformed journal line " + lineNumber + " in " + path + ": " + line, e);
            }
        }
        logger.debug("Replayed {} rows from {}", entries.size(), path);
        return entries;
    }

    /**
     * Appends one row.
     *
     * @throws UncheckedIOException if the line cannot be written
     */
    public synchronized void append(VariationLocation location, int id, Map<String, ?> row) {
        JsonObject obj = new JsonObject();
        obj.addProperty("location", location.key());
        obj.addProperty("id", id);
        JsonObject columns = new JsonObject();
        for (Map.Entry<String, ?> column : row.entrySet()) {
            columns.add(column.getKey(), JsonValues.toJson(column.getValue()));
        }
        obj.add("row", columns);
        try {
            writer.write(GSON.toJson(obj));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to variation journal " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
