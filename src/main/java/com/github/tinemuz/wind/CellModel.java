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
 * Reconstructed radiation-field model of one cell: the frequency bins of every
 * non-empty band, concatenated in band order, with the matching flux.
 *
 * <p>Frequencies ascend within a band but not necessarily across bands.</p>
 */
public final class CellModel {
    private final double[] frequency;
    private final double[] flux;

    CellModel(double[] frequency, double[] flux) {
        if (frequency.length != flux.length) {
            throw new IllegalArgumentException("frequency and flux lengths differ");
        }
        this.frequency = frequency;
        this.flux = flux;
    }

    /** Frequency bins (Hz). */
    public double[] frequency() {
        return frequency.clone();
    }

    /** Flux at each frequency bin. */
    public double[] flux() {
        return flux.clone();
    }

    public int size() {
        return frequency.length;
    }
}
