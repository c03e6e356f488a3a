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

import io.pcvct.variations.VariationLocation;
import io.pcvct.variations.VariationLookupException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link VariationStore} keeping every table in memory, optionally backed by a
 * {@link VariationJournal}.
 *
 * <p>Each location's table is seeded with a base row (id 0) from the builder;
 * the base row fixes the table's columns. Rows are identified by the canonical
 * string of each column value, in column order. Get-or-insert runs inside
 * {@link ConcurrentHashMap#computeIfAbsent}, so concurrent materializations of the
 * same tuple always agree on one id, and the journal line for a new row is
 * written inside the same atomic step. A row whose journal line cannot be
 * written is not stored; its id is skipped.
 *
 * <p>When a journal path is configured, rows already present in the journal are
 * replayed at build time with their original ids.
 *
 * <pre>{@code
 * InMemoryVariationStore store = InMemoryVariationStore.builder()
 *     .baseValue(VariationLocation.CONFIG, "overall/max_time", 1440)
 *     .journal(Path.of("variations.jsonl"))
 *     .build();
 * }</pre>
 */
public final class InMemoryVariationStore implements VariationStore, Closeable {

    private static final Logger logger = LogManager.getLogger(InMemoryVariationStore.class);

    private final Map<VariationLocation, Table> tables;
    private final VariationJournal journal;

    private InMemoryVariationStore(Map<VariationLocation, Table> tables, VariationJournal journal) {
        this.tables = tables;
        this.journal = journal;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int getOrInsertRow(VariationLocation location, Map<String, ?> staticColumns, Map<String, ?> variedColumns) {
        Table table = table(location);
        checkKnown(location, table, staticColumns);
        checkKnown(location, table, variedColumns);
        Map<String, Object> row = new LinkedHashMap<>();
        Map<String, Object> base = table.rowsById.get(0);
        for (String column : table.columns) {
            Object value;
            if (variedColumns.containsKey(column)) {
                value = variedColumns.get(column);
            } else if (staticColumns.containsKey(column)) {
                value = staticColumns.get(column);
            } else {
                value = base.get(column);
            }
            row.put(column, value);
        }

        List<String> key = table.key(row);
        return table.idsByKey.computeIfAbsent(key, k -> {
            int id = table.nextId.getAndIncrement();
            Map<String, Object> stored = Collections.unmodifiableMap(row);
            // journal first: a failed append must leave no row behind
            if (journal != null) {
                journal.append(location, id, stored);
            }
            table.rowsById.put(id, stored);
            logger.trace("Inserted {} row {}: {}", location.key(), id, stored);
            return id;
        });
    }

    private static void checkKnown(VariationLocation location, Table table, Map<String, ?> columns) {
        for (String column : columns.keySet()) {
            if (!table.columnIndex.containsKey(column)) {
                throw new VariationLookupException(location, "unknown column '" + column + "'; known columns: " + table.columns);
            }
        }
    }

    @Override
    public Object referenceValue(VariationLocation location, int id, String column) {
        Map<String, Object> row = referenceRow(location, id);
        if (!row.containsKey(column)) {
            throw new VariationLookupException(location, "row " + id + " has no column '" + column + "'");
        }
        return row.get(column);
    }

    @Override
    public Map<String, Object> referenceRow(VariationLocation location, int id) {
        Map<String, Object> row = table(location).rowsById.get(id);
        if (row == null) {
            throw new VariationLookupException(location, "no variation row with id " + id);
        }
        return row;
    }

    @Override
    public List<String> columns(VariationLocation location) {
        return table(location).columns;
    }

    @Override
    public int rowCount(VariationLocation location) {
        return table(location).rowsById.size();
    }

    private Table table(VariationLocation location) {
        Table table = tables.get(location);
        if (table == null) {
            throw new VariationLookupException(location, "no base values were registered for this location");
        }
        return table;
    }

    @Override
    public void close() throws IOException {
        if (journal != null) {
            journal.close();
        }
    }

    private static final class Table {
        private final List<String> columns;
        private final Map<String, Integer> columnIndex = new LinkedHashMap<>();
        private final ConcurrentMap<List<String>, Integer> idsByKey = new ConcurrentHashMap<>();
        private final ConcurrentMap<Integer, Map<String, Object>> rowsById = new ConcurrentHashMap<>();
        private final AtomicInteger nextId = new AtomicInteger(1);

        private Table(Map<String, Object> baseRow) {
            this.columns = List.copyOf(baseRow.keySet());
            for (int i = 0; i < columns.size(); i++) {
                columnIndex.put(columns.get(i), i);
            }
            Map<String, Object> base = Collections.unmodifiableMap(new LinkedHashMap<>(baseRow));
            rowsById.put(0, base);
            idsByKey.put(key(base), 0);
        }

        private List<String> key(Map<String, Object> row) {
            List<String> key = new ArrayList<>(columns.size());
            for (String column : columns) {
                key.add(JsonValues.canonical(row.get(column)));
            }
            return key;
        }

        private void restore(VariationLocation location, int id, Map<String, Object> row) {
            Map<String, Object> full = new LinkedHashMap<>();
            for (String column : columns) {
                if (!row.containsKey(column)) {
                    throw new VariationLookupException(location,
                        "journal row " + id + " lacks column '" + column + "'");
                }
                full.put(column, row.get(column));
            }
            Map<String, Object> stored = Collections.unmodifiableMap(full);
            List<String> key = key(stored);
            Integer existing = idsByKey.putIfAbsent(key, id);
            if (existing != null && existing != id) {
                logger.warn("Journal row {} of {} duplicates row {}; keeping {}", id, location.key(), existing, existing);
                return;
            }
            rowsById.putIfAbsent(id, stored);
            nextId.accumulateAndGet(id + 1, Math::max);
        }
    }

    /**
     * Builder for {@link InMemoryVariationStore}.
     */
    public static final class Builder {
        private final Map<VariationLocation, Map<String, Object>> baseRows = new EnumMap<>(VariationLocation.class);
        private Path journalPath;

        private Builder() {
        }

        /**
         * Adds one column to a location's base row.
         *
         * @param location the table
         * @param column the column name, a target path's column name
         * @param value the base value
         * @return this builder
         */
        public Builder baseValue(VariationLocation location, String column, Object value) {
            baseRows.computeIfAbsent(location, l -> new LinkedHashMap<>()).put(column, value);
            return this;
        }

        /**
         * Adds several columns to a location's base row, in iteration order.
         */
        public Builder baseValues(VariationLocation location, Map<String, ?> values) {
            values.forEach((column, value) -> baseValue(location, column, value));
            return this;
        }

        /**
         * Persists inserted rows to a JSON-lines journal and replays it at build time.
         */
        public Builder journal(Path path) {
            this.journalPath = path;
            return this;
        }

        /**
         * @return the store
         * @throws IOException if the journal cannot be read or opened
         */
        public InMemoryVariationStore build() throws IOException {
            Map<VariationLocation, Table> tables = new EnumMap<>(VariationLocation.class);
            baseRows.forEach((location, row) -> tables.put(location, new Table(row)));

            VariationJournal journal = null;
            if (journalPath != null) {
                List<VariationJournal.Entry> entries = VariationJournal.replay(journalPath);
                for (VariationJournal.Entry entry : entries) {
                    Table table = tables.get(entry.location());
                    if (table == null) {
                        throw new VariationLookupException(entry.location(),
                            "journal " + journalPath + " has rows for a location without base values");
                    }
                    table.restore(entry.location(), entry.id(), entry.row());
                }
                if (!entries.isEmpty()) {
                    logger.info("Restored {} variation rows from {}", entries.size(), journalPath);
                }
                journal = VariationJournal.open(journalPath);
            }
            return new InMemoryVariationStore(Collections.unmodifiableMap(tables), journal);
        }
    }
}
