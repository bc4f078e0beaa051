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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds each cell's piecewise radiation-field model from the compact
 * per-band coefficients of the {@code spec} table.
 *
 * <p>The table holds one row per (cell, band), ordered by band and then by
 * cell, so the row for cell {@code c} and band {@code b} is
 * {@code c + b * nCells}. Each usable band is sampled on {@code binsPerBand}
 * log-spaced frequencies between {@code fmin} and {@code fmax} and evaluated
 * as either a power law ({@code spec_mod_type == 1}) or an exponential
 * cutoff.</p>
 */
final class BandedModelReconstructor {
    private static final Logger log = LoggerFactory.getLogger(BandedModelReconstructor.class);
    static final String MODEL_TYPE = "spec_mod_type";
    // older tables truncate the header name
    static final String LEGACY_MODEL_TYPE = "spec_mod_";
    static final int POWER_LAW = 1;

    private final int binsPerBand;
    private boolean warnedUnrecognized = false;

    BandedModelReconstructor(int binsPerBand) {
        if (binsPerBand < 1) {
            throw new IllegalArgumentException("binsPerBand must be positive, got " + binsPerBand);
        }
        this.binsPerBand = binsPerBand;
    }

    /**
     * Reconstruct the models of an {@code nX} by {@code nZ} grid.
     *
     * @return the models, or null if the table is absent or has no rows
     * @throws WindTableFormatException if the table lacks the {@code nband}
     *     column, has too few rows, or a band lacks a coefficient it needs
     */
    BandedModels reconstruct(WindTable table, int nX, int nZ) {
        if (table.isEmpty() || table.rowCount() == 0) return null;

        int nbandCol = table.columnIndex("nband");
        if (nbandCol < 0) {
            throw new WindTableFormatException("model table " + table.source() + " has no nband column");
        }
        int bandCount = 0;
        for (int r = 0; r < table.rowCount(); r++) {
            bandCount = Math.max(bandCount, (int) table.value(r, nbandCol) + 1);
        }
        int nCells = nX * nZ;
        if (table.rowCount() < nCells * bandCount) {
            throw new WindTableFormatException(
                    String.format(
                            "model table %s has %d rows, expected %d cells x %d bands",
                            table.source(), table.rowCount(), nCells, bandCount));
        }

        CellModel[][] models = new CellModel[nX][nZ];
        int modelled = 0;
        for (int cell = 0; cell < nCells; cell++) {
            List<double[]> frequencies = new ArrayList<>();
            List<double[]> fluxes = new ArrayList<>();
            for (int band = 0; band < bandCount; band++) {
                Map<String, Double> row = rowParameters(table, cell + band * nCells);
                double fmin = require(row, "fmin");
                double fmax = require(row, "fmax");
                if (fmax <= fmin) continue; // empty band

                Double modelType = row.containsKey(MODEL_TYPE) ? row.get(MODEL_TYPE) : row.get(LEGACY_MODEL_TYPE);
                if (modelType == null) {
                    warnUnrecognized(table);
                    frequencies.clear();
                    fluxes.clear();
                    continue;
                }
                double[] freq = logspace(fmin, fmax, binsPerBand);
                frequencies.add(freq);
                fluxes.add(bandFlux(modelType.intValue(), row, freq));
            }
            if (!fluxes.isEmpty()) {
                int[] ij = GridIndex.ij(cell, nZ);
                models[ij[0]][ij[1]] = new CellModel(concat(frequencies), concat(fluxes));
                modelled++;
            }
        }
        log.debug("Reconstructed {} band models for {} of {} cells", bandCount, modelled, nCells);
        return new BandedModels(models, bandCount);
    }

    /**
     * Flux of one band at the given frequencies. Power law:
     * {@code 10^(pl_log_w + alpha log10(nu))}; exponential:
     * {@code exp_w exp(-h nu / (k_B exp_temp))}. An overflowing exponential
     * yields an infinite or zero flux rather than an error.
     */
    static double[] bandFlux(int modelType, Map<String, Double> row, double[] freq) {
        double[] flux = new double[freq.length];
        if (modelType == POWER_LAW) {
            double logW = require(row, "pl_log_w");
            double alpha = require(row, "pl_alpha");
            for (int k = 0; k < freq.length; k++) {
                flux[k] = Math.pow(10.0, logW + Math.log10(freq[k]) * alpha);
            }
        } else {
            double w = require(row, "exp_w");
            double temp = require(row, "exp_temp");
            for (int k = 0; k < freq.length; k++) {
                flux[k] = w * Math.exp(-PhysicalConstants.H * freq[k] / (temp * PhysicalConstants.K_B));
            }
        }
        return flux;
    }

    /** {@code n} values evenly spaced in log10 between {@code lo} and {@code hi}, both included. */
    static double[] logspace(double lo, double hi, int n) {
        double start = Math.log10(lo);
        double stop = Math.log10(hi);
        double[] out = new double[n];
        if (n == 1) {
            out[0] = Math.pow(10.0, start);
            return out;
        }
        double step = (stop - start) / (n - 1);
        for (int k = 0; k < n - 1; k++) out[k] = Math.pow(10.0, start + k * step);
        out[n - 1] = Math.pow(10.0, stop);
        return out;
    }

    private void warnUnrecognized(WindTable table) {
        if (warnedUnrecognized) return;
        warnedUnrecognized = true;
        log.warn(
                "The header of model table {} is improperly formatted and has no '{}' column; "
                        + "affected cells will have no model",
                table.source(), MODEL_TYPE);
    }

    private static Map<String, Double> rowParameters(WindTable table, int row) {
        Map<String, Double> out = new HashMap<>();
        for (int k = 0; k < table.columnCount(); k++) {
            out.put(table.header().get(k), table.value(row, k));
        }
        return out;
    }

    private static double require(Map<String, Double> row, String name) {
        Double v = row.get(name);
        if (v == null) throw new WindTableFormatException("model table has no '" + name + "' column");
        return v;
    }

    private static double[] concat(List<double[]> parts) {
        int total = 0;
        for (double[] p : parts) total += p.length;
        double[] out = new double[total];
        int at = 0;
        for (double[] p : parts) {
            System.arraycopy(p, 0, out, at, p.length);
            at += p.length;
        }
        return out;
    }
}
