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

import java.util.Set;

/** Geometric discretization scheme of a wind grid. */
public enum CoordSystem {
    CYLINDRICAL,
    SPHERICAL,
    POLAR,
    UNKNOWN;

    /**
     * Classify a grid from the names of its bound columns: {@code r} with
     * {@code theta} is polar, {@code r} alone is spherical, anything else is
     * cylindrical.
     */
    public static CoordSystem classify(Set<String> columns) {
        if (columns.contains("r") && columns.contains("theta")) return POLAR;
        if (columns.contains("r")) return SPHERICAL;
        return CYLINDRICAL;
    }

    /** Name of the column holding the first spatial axis. */
    public String xColumn() {
        return this == CYLINDRICAL ? "x" : "r";
    }

    /** Name of the column holding the second spatial axis. */
    public String zColumn() {
        return this == CYLINDRICAL ? "z" : "theta";
    }
}
