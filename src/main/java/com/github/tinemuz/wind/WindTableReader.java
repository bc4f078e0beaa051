/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.wind;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates and parses the whitespace-delimited text tables a simulation writes
 * for its wind.
 *
 * <p>A table of kind {@code k} for root {@code root} lives at
 * {@code <directory>/<root>.<k>.txt}, or failing that under the fallback
 * subdirectory: {@code <directory>/tables/<root>.<k>.txt}. Lines starting with
 * {@code #} are comments. The first remaining line names the columns and
 * every later line is a row of numbers.</p>
 */
public final class WindTableReader {
    private static final Logger log = LoggerFactory.getLogger(WindTableReader.class);
    private static final Pattern NUMERIC =
            Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final String root;
    private final Path directory;
    private final String fallbackDir;

    public WindTableReader(String root, Path directory, String fallbackDir) {
        this.root = root;
        this.directory = directory;
        this.fallbackDir = fallbackDir;
    }

    public String root() {
        return root;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Read the table of the given kind, e.g. {@code master} or {@code C.frac}.
     *
     * @return the parsed table, or {@link WindTable#empty()} if neither the
     *     primary nor the fallback file exists
     * @throws WindTableFormatException if the file exists but is malformed
     */
    public WindTable read(String kind) {
        Path path = locate(kind);
        if (path == null) {
            log.debug("No {} table for root '{}' in {}", kind, root, directory);
            return WindTable.empty();
        }
        return parse(path);
    }

    /** Path of the table of the given kind, or null if there is none. */
    Path locate(String kind) {
        String fileName = root + "." + kind + ".txt";
        Path primary = directory.resolve(fileName);
        if (Files.isRegularFile(primary)) return primary;
        Path fallback = directory.resolve(fallbackDir).resolve(fileName);
        if (Files.isRegularFile(fallback)) {
            log.debug("Using fallback table {}", fallback);
            return fallback;
        }
        return null;
    }

    /**
     * Parse a table file.
     *
     * @throws WindTableFormatException if the header is missing, a row is the
     *     wrong length, or a value is not a number
     * @throws UncheckedIOException if the file cannot be read
     */
    public static WindTable parse(Path path) {
        List<String> header = null;
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] toks = line.split("\\s+");
                if (header == null) {
                    if (NUMERIC.matcher(toks[0]).matches()) {
                        log.error("Table {} is missing its header line", path);
                        throw new WindTableFormatException(
                                "File is formatted incorrectly and missing header: " + path);
                    }
                    header = Arrays.asList(toks);
                    continue;
                }
                if (toks.length != header.size()) {
                    throw new WindTableFormatException(
                            String.format(
                                    "%s:%d has %d values but the header names %d columns",
                                    path, lineNumber, toks.length, header.size()));
                }
                double[] row = new double[toks.length];
                for (int k = 0; k < toks.length; k++) {
                    try {
                        row[k] = Double.parseDouble(toks[k]);
                    } catch (NumberFormatException e) {
                        throw new WindTableFormatException(
                                String.format(
                                        "%s:%d value '%s' in column %s is not a number",
                                        path, lineNumber, toks[k], header.get(k)),
                                e);
                    }
                }
                rows.add(row);
            }
        } catch (IOException e) {
            log.error("Failed to read wind table {}", path, e);
            throw new UncheckedIOException("Failed to read wind table " + path, e);
        }
        if (header == null) {
            log.error("Table {} has no header line", path);
            throw new WindTableFormatException("File has no header line: " + path);
        }
        log.debug("Read {} ({} columns, {} rows)", path, header.size(), rows.size());
        return new WindTable(path, new ArrayList<>(header), rows.toArray(new double[0][]));
    }
}
