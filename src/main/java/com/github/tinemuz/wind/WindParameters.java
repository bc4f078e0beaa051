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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named per-cell quantities of a wind grid, each an {@code [nX][nZ]} array.
 *
 * <p>The first table to bind a name owns it: later bindings of the same name
 * are ignored. Ion keys without a representation suffix (e.g. {@code C_i04})
 * resolve to the fractional population ({@code C_i04_frac}).</p>
 */
public final class WindParameters {
    private static final Pattern ION_WITHOUT_SUFFIX = Pattern.compile("[A-Z][a-z]?_i[0-9]+");

    private final int nX;
    private final int nZ;
    private final Map<String, double[][]> values = new LinkedHashMap<>();

    WindParameters(int nX, int nZ) {
        this.nX = nX;
        this.nZ = nZ;
    }

    public int nX() {
        return nX;
    }

    public int nZ() {
        return nZ;
    }

    /**
     * Bind a quantity unless the name is already taken.
     *
     * @return true if the value was bound
     * @throws WindTableFormatException if the array is not {@code [nX][nZ]}
     */
    boolean bindIfAbsent(String name, double[][] value) {
        if (values.containsKey(name)) return false;
        if (value.length != nX || (nX > 0 && value[0].length != nZ)) {
            throw new WindTableFormatException(
                    String.format("column %s does not have shape (%d, %d)", name, nX, nZ));
        }
        values.put(name, value);
        return true;
    }

    /**
     * Reshape a flat per-cell column, ordered by element number, into {@code [nX][nZ]}.
     *
     * @throws WindTableFormatException if the column length is not {@code nX * nZ}
     */
    double[][] reshape(String name, double[] flat) {
        if (flat.length != nX * nZ) {
            throw new WindTableFormatException(
                    String.format(
                            "column %s has %d values but the grid has %d cells",
                            name, flat.length, nX * nZ));
        }
        double[][] out = new double[nX][nZ];
        for (int i = 0; i < nX; i++) {
            System.arraycopy(flat, GridIndex.elemNumber(i, 0, nZ), out[i], 0, nZ);
        }
        return out;
    }

    /** Multiply a bound quantity in place; absent names are skipped. */
    void scale(String name, double factor) {
        double[][] value = values.get(name);
        if (value == null) return;
        for (double[] row : value) {
            for (int j = 0; j < row.length; j++) row[j] *= factor;
        }
    }

    /** Key after applying the ion default-suffix rule. */
    public static String normalizeKey(String key) {
        if (ION_WITHOUT_SUFFIX.matcher(key).matches()) {
            return key + "_" + IonRepresentation.FRACTION.suffix();
        }
        return key;
    }

    public boolean contains(String key) {
        return values.containsKey(normalizeKey(key));
    }

    /**
     * Copy of a quantity, looked up by name.
     *
     * @throws IllegalArgumentException if nothing is bound under the (normalized) key
     */
    public double[][] get(String key) {
        double[][] value = values.get(normalizeKey(key));
        if (value == null) {
            throw new IllegalArgumentException("no wind parameter named '" + key + "'");
        }
        double[][] copy = new double[value.length][];
        for (int i = 0; i < value.length; i++) copy[i] = value[i].clone();
        return copy;
    }

    /** Bound names, in the order they were bound. */
    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public int size() {
        return values.size();
    }
}
