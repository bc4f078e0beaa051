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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emergent spectra tabulated per cell, held as {@code [nX][nZ][nFreq]} arrays.
 *
 * <p>The flux exists twice: the original values as read, and a working copy
 * that {@link #smooth(int)} replaces with a boxcar-smoothed version of the
 * original. {@link #unsmooth()} copies the original back.</p>
 */
public final class CellSpectra {
    private static final Logger log = LoggerFactory.getLogger(CellSpectra.class);

    private final double[][][] frequency;
    private final double[][][] originalFlux;
    private double[][][] flux;

    private CellSpectra(double[][][] frequency, double[][][] originalFlux) {
        this.frequency = frequency;
        this.originalFlux = originalFlux;
        this.flux = deepCopy(originalFlux);
    }

    /**
     * Find every cell-spectrum file under {@code directory} whose name matches
     * {@code pattern} and scatter its columns into a grid of {@code nX} by
     * {@code nZ} cells.
     *
     * <p>In each file the first column is the frequency axis; every other
     * column header names its cell as {@code i_j} (any leading non-digit
     * prefix is ignored, and a lone {@code i} means {@code j = 0}).</p>
     *
     * @return the spectra, or null if no file matches
     * @throws WindTableFormatException if a file is malformed or names a cell
     *     outside the grid
     */
    static CellSpectra load(Path directory, String pattern, int nX, int nZ) {
        List<Path> files = find(directory, pattern);
        if (files.isEmpty()) {
            log.debug("No cell spectra matching {} in {}", pattern, directory);
            return null;
        }

        double[][][] frequency = null;
        double[][][] flux = null;
        for (Path file : files) {
            WindTable table = WindTableReader.parse(file);
            int nFreq = table.rowCount();
            if (frequency == null) {
                frequency = new double[nX][nZ][nFreq];
                flux = new double[nX][nZ][nFreq];
            } else if (nFreq != frequency[0][0].length) {
                throw new WindTableFormatException(
                        String.format(
                                "cell spectra %s has %d frequency bins, expected %d",
                                file, nFreq, frequency[0][0].length));
            }
            double[] freq = table.column(0);
            for (int k = 1; k < table.columnCount(); k++) {
                String label = table.header().get(k);
                int[] ij = parseCellLabel(label);
                if (ij == null) {
                    log.warn("Skipping column '{}' of {}: not a cell label", label, file);
                    continue;
                }
                int i = ij[0];
                int j = nZ > 1 ? ij[1] : 0;
                if (i >= nX || j >= nZ) {
                    throw new WindTableFormatException(
                            String.format(
                                    "cell spectra %s names cell %s outside the %d x %d grid",
                                    file, label, nX, nZ));
                }
                frequency[i][j] = freq.clone();
                flux[i][j] = table.column(k);
            }
        }
        log.debug("Read cell spectra from {} files", files.size());
        return new CellSpectra(frequency, flux);
    }

    /** Decode {@code 3_1}, {@code c3_1} or {@code c3} into {@code {i, j}}; null if not a cell label. */
    static int[] parseCellLabel(String label) {
        int start = 0;
        while (start < label.length() && !Character.isDigit(label.charAt(start))) start++;
        String[] parts = label.substring(start).split("_");
        if (parts.length < 1 || parts.length > 2) return null;
        try {
            int i = Integer.parseInt(parts[0]);
            int j = parts.length == 2 ? Integer.parseInt(parts[1]) : 0;
            return new int[] {i, j};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Path> find(Path directory, String pattern) {
        if (!Files.isDirectory(directory)) return List.of();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> paths = Files.walk(directory)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to search " + directory + " for cell spectra", e);
        }
    }

    /** Number of frequency bins per cell. */
    public int binCount() {
        return frequency[0][0].length;
    }

    /** Frequency axis of cell {@code (i, j)}. */
    public double[] frequency(int i, int j) {
        return frequency[i][j].clone();
    }

    /** Working (possibly smoothed) flux of cell {@code (i, j)}. */
    public synchronized double[] flux(int i, int j) {
        return flux[i][j].clone();
    }

    /** Flux of cell {@code (i, j)} as read from disk. */
    public double[] originalFlux(int i, int j) {
        return originalFlux[i][j].clone();
    }

    /**
     * Replace the working flux of every cell with a boxcar average of width
     * {@code width} over the original flux. Widths of 0 or 1 restore the
     * original.
     */
    public synchronized void smooth(int width) {
        if (width < 0) throw new IllegalArgumentException("width must not be negative: " + width);
        if (width <= 1) {
            unsmooth();
            return;
        }
        double[][][] smoothed = new double[originalFlux.length][][];
        for (int i = 0; i < originalFlux.length; i++) {
            smoothed[i] = new double[originalFlux[i].length][];
            for (int j = 0; j < originalFlux[i].length; j++) {
                smoothed[i][j] = boxcar(originalFlux[i][j], width);
            }
        }
        flux = smoothed;
    }

    /** Restore the working flux to exactly the values read from disk. */
    public synchronized void unsmooth() {
        flux = deepCopy(originalFlux);
    }

    /**
     * Same-length convolution with a normalized boxcar of the given width,
     * treating values beyond either end as zero.
     */
    static double[] boxcar(double[] values, int width) {
        int n = values.length;
        double[] out = new double[n];
        int behind = width / 2;
        int ahead = (width - 1) / 2;
        for (int k = 0; k < n; k++) {
            int lo = Math.max(0, k - behind);
            int hi = Math.min(n - 1, k + ahead);
            double sum = 0;
            for (int m = lo; m <= hi; m++) sum += values[m];
            out[k] = sum / width;
        }
        return out;
    }

    private static double[][][] deepCopy(double[][][] src) {
        double[][][] out = new double[src.length][][];
        for (int i = 0; i < src.length; i++) {
            out[i] = new double[src[i].length][];
            for (int j = 0; j < src[i].length; j++) out[i][j] = src[i][j].clone();
        }
        return out;
    }
}
