package io.pcvct.sensitivity;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the configuration table of a study as {@code <method>_scheme.csv}.
 *
 * <p>The header row holds the column labels; each following row holds one
 * design point's configuration ids. Labels containing commas or quotes are quoted.
 */
public final class SchemeRecorder {

    private static final Logger logger = LogManager.getLogger(SchemeRecorder.class);

    private SchemeRecorder() {
    }

    /**
     * @param sampling the realized study
     * @param directory the output directory, created if missing
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public static Path record(GsaSampling<?> sampling, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(sampling.methodName() + "_scheme.csv");
        ConfigurationTable table = sampling.table();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(headerLine(table.header()));
            writer.newLine();
            for (int i = 0; i < table.rowCount(); i++) {
                StringBuilder line = new StringBuilder();
                for (int j = 0; j < table.columnCount(); j++) {
                    if (j > 0) line.append(',');
                    line.append(table.get(i, j));
                }
                writer.write(line.toString());
                writer.newLine();
            }
        }
        logger.info("Recorded {} scheme with {} rows to {}", sampling.methodName(), table.rowCount(), file);
        return file;
    }

    static String headerLine(List<String> header) {
        StringBuilder line = new StringBuilder();
        for (int j = 0; j < header.size(); j++) {
            if (j > 0) line.append(',');
            line.append(escape(header.get(j)));
        }
        return line.toString();
    }

    static String escape(String field) {
        if (field.indexOf(',') < 0 && field.indexOf('"') < 0 && field.indexOf('\n') < 0) {
            return field;
        }
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
