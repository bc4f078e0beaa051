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

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * A parsed wind table: the column names from the header line and the numeric
 * rows below it. A table that could not be found is represented by
 * {@link #empty()}, which has no columns and no rows.
 */
public final class WindTable {
    private static final WindTable EMPTY = new WindTable(null, List.of(), new double[0][]);

    private final Path source;
    private final List<String> header;
    private final double[][] rows;

    WindTable(Path source, List<String> header, double[][] rows) {
        this.source = source;
        this.header = Collections.unmodifiableList(header);
        this.rows = rows;
    }

    /** The table returned when no file exists for a table kind. */
    public static WindTable empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return header.isEmpty();
    }

    /** File the table was read from, or null for the empty table. */
    public Path source() {
        return source;
    }

    public List<String> header() {
        return header;
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return header.size();
    }

    /** Value at row {@code row}, column {@code col}. */
    public double value(int row, int col) {
        return rows[row][col];
    }

    /** Index of a named column, or -1 if absent. */
    public int columnIndex(String name) {
        return header.indexOf(name);
    }

    /** Copy of one column as a flat array. */
    public double[] column(int col) {
        double[] out = new double[rows.length];
        for (int r = 0; r < rows.length; r++) out[r] = rows[r][col];
        return out;
    }

    /**
     * Copy of a named column.
     *
     * @throws WindTableFormatException if the column is not in the header
     */
    public double[] column(String name) {
        int col = columnIndex(name);
        if (col < 0) {
            throw new WindTableFormatException(
                    "table " + source + " has no column '" + name + "'");
        }
        return column(col);
    }

    @Override
    public String toString() {
        return "WindTable(" + source + ", " + header.size() + " columns, " + rows.length + " rows)";
    }
}
