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

/**
 * Mapping between a cell's 2-D index {@code (i, j)} and the linear element
 * number the simulation uses internally: {@code elem = nZ * i + j}.
 */
public final class GridIndex {

    private GridIndex() {}

    /** Linear element number of cell {@code (i, j)} in a grid with {@code nZ} cells along z. */
    public static int elemNumber(int i, int j, int nZ) {
        checkNz(nZ);
        return nZ * i + j;
    }

    /** Inverse of {@link #elemNumber}; returns {@code {i, j}}. */
    public static int[] ij(int elem, int nZ) {
        checkNz(nZ);
        int i = elem / nZ;
        int j = elem - i * nZ;
        return new int[] {i, j};
    }

    private static void checkNz(int nZ) {
        if (nZ < 1) throw new IllegalArgumentException("nZ must be positive, got " + nZ);
    }
}
