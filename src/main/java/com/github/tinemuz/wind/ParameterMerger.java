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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the bulk parameter tables and the per-element ion tables of a
 * simulation into one {@link WindParameters} namespace.
 *
 * <p>Tables are visited in a fixed order and a column is only bound if no
 * earlier table already supplied it, so each quantity keeps the provenance of
 * the first table that defines it.</p>
 */
final class ParameterMerger {
    private static final Logger log = LoggerFactory.getLogger(ParameterMerger.class);
    // ion stage columns look like i01, i12; i, j, x, z never match
    private static final Pattern ION_STAGE = Pattern.compile("i[0-9]+");

    private final WindTableReader reader;
    private final WindConfig config;
    private final List<String> tablesRead = new ArrayList<>();
    private final List<String> ionsRead = new ArrayList<>();

    ParameterMerger(WindTableReader reader, WindConfig config) {
        this.reader = reader;
        this.config = config;
    }

    /**
     * Read every bulk parameter table, derive the grid shape from the
     * {@code i}/{@code j} columns and return the reshaped namespace.
     *
     * @throws MissingWindDataException if no bulk table exists or the shape
     *     columns are missing
     * @throws WindTableFormatException if a column does not fit the grid
     */
    WindParameters mergeParameters() {
        Map<String, double[]> flat = new LinkedHashMap<>();
        for (String kind : config.parameterTables()) {
            WindTable table = reader.read(kind);
            if (table.isEmpty()) continue;
            for (int k = 0; k < table.columnCount(); k++) {
                flat.putIfAbsent(table.header().get(k), table.column(k));
            }
            tablesRead.add(kind);
        }
        if (tablesRead.isEmpty()) {
            log.error("No wind parameter tables found for '{}' in {}", reader.root(), reader.directory());
            throw new MissingWindDataException(
                    "Have been unable to read in any wind parameter tables in " + reader.directory());
        }

        int nX = extent(flat, "i");
        int nZ = flat.containsKey("z") || flat.containsKey("theta") ? extent(flat, "j") : 1;
        WindParameters parameters = new WindParameters(nX, nZ);
        for (Map.Entry<String, double[]> e : flat.entrySet()) {
            parameters.bindIfAbsent(e.getKey(), parameters.reshape(e.getKey(), e.getValue()));
        }
        log.debug("Merged {} columns from {} with shape ({}, {})", flat.size(), tablesRead, nX, nZ);
        return parameters;
    }

    /**
     * Read every ion table ({@code <Element>.frac}, then {@code <Element>.den})
     * and bind each ion stage column under its composite name.
     *
     * @throws MissingWindDataException if no ion table exists
     */
    void mergeIons(WindParameters parameters) {
        int nRead = 0;
        for (IonRepresentation representation : IonRepresentation.values()) {
            for (String element : config.elements()) {
                WindTable table = reader.read(element + "." + representation.suffix());
                if (table.isEmpty()) continue;
                for (int k = 0; k < table.columnCount(); k++) {
                    String column = table.header().get(k);
                    if (!ION_STAGE.matcher(column).matches()) continue;
                    String name = representation.parameterName(element, column);
                    if (parameters.contains(name)) continue;
                    parameters.bindIfAbsent(name, parameters.reshape(name, table.column(k)));
                    ionsRead.add(name);
                }
                nRead++;
            }
        }
        if (nRead == 0) {
            log.error("No wind ion tables found for '{}' in {}", reader.root(), reader.directory());
            throw new MissingWindDataException(
                    "Have been unable to read in any wind ion tables in " + reader.directory());
        }
        log.debug("Bound {} ion stages from {} tables", ionsRead.size(), nRead);
    }

    List<String> tablesRead() {
        return Collections.unmodifiableList(tablesRead);
    }

    List<String> ionsRead() {
        return Collections.unmodifiableList(ionsRead);
    }

    private static int extent(Map<String, double[]> flat, String column) {
        double[] values = flat.get(column);
        if (values == null || values.length == 0) {
            log.error("Wind tables have no '{}' column; cannot determine grid shape", column);
            throw new MissingWindDataException(
                    "Wind tables have no '" + column + "' column; cannot determine grid shape");
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v > max) max = v;
        }
        return (int) max + 1;
    }
}
