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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CellSpectraTest {

    private static final String PATTERN = "*xspec.*.txt";

    @TempDir Path dir;

    @Nested
    @DisplayName("Loading")
    class LoadingTests {

        @Test
        @DisplayName("Column labelled 3_1 lands at [3][1]")
        void scatterByLabel() {
            TableFiles.write(dir, "run.xspec.0.txt",
                    "Freq. c3_1 c0_0",
                    "1e14 5 50",
                    "2e14 6 60",
                    "3e14 7 70");

            CellSpectra spectra = CellSpectra.load(dir, PATTERN, 4, 2);

            assertNotNull(spectra);
            assertEquals(3, spectra.binCount());
            assertArrayEquals(new double[] {5, 6, 7}, spectra.flux(3, 1));
            assertArrayEquals(new double[] {1e14, 2e14, 3e14}, spectra.frequency(3, 1));
            assertArrayEquals(new double[] {50, 60, 70}, spectra.flux(0, 0));
            assertArrayEquals(new double[] {0, 0, 0}, spectra.flux(2, 1), "untouched cells stay zero");
        }

        @Test
        @DisplayName("Labels without a prefix and files in subdirectories are found")
        void plainLabelsAndSubdirectories() {
            TableFiles.write(dir, "run.xspec.0.txt", "Freq. 0_0", "1e14 1", "2e14 2");
            TableFiles.write(dir.resolve("tables"), "run.xspec.1.txt", "Freq. 1_1", "1e14 3", "2e14 4");

            CellSpectra spectra = CellSpectra.load(dir, PATTERN, 2, 2);

            assertArrayEquals(new double[] {1, 2}, spectra.flux(0, 0));
            assertArrayEquals(new double[] {3, 4}, spectra.flux(1, 1));
        }

        @Test
        @DisplayName("1-D grids place every label at j = 0")
        void oneDimensional() {
            TableFiles.write(dir, "run.xspec.0.txt", "Freq. c2 c1_0", "1e14 1 3", "2e14 2 4");

            CellSpectra spectra = CellSpectra.load(dir, PATTERN, 3, 1);

            assertArrayEquals(new double[] {1, 2}, spectra.flux(2, 0));
            assertArrayEquals(new double[] {3, 4}, spectra.flux(1, 0));
        }

        @Test
        @DisplayName("No matching files means no spectra")
        void noFiles() {
            TableFiles.write(dir, "run.master.txt", "i j", "0 0");

            assertNull(CellSpectra.load(dir, PATTERN, 1, 1));
        }

        @Test
        @DisplayName("A label outside the grid is a format error")
        void outOfGrid() {
            TableFiles.write(dir, "run.xspec.0.txt", "Freq. c5_0", "1e14 1");

            assertThrows(WindTableFormatException.class, () -> CellSpectra.load(dir, PATTERN, 2, 2));
        }

        @Test
        @DisplayName("Files with a different number of bins are rejected")
        void mismatchedBins() {
            TableFiles.write(dir, "run.xspec.0.txt", "Freq. c0_0", "1e14 1", "2e14 2");
            TableFiles.write(dir, "run.xspec.1.txt", "Freq. c1_0", "1e14 1");

            assertThrows(WindTableFormatException.class, () -> CellSpectra.load(dir, PATTERN, 2, 1));
        }

        @Test
        @DisplayName("Cell label decoding")
        void labels() {
            assertArrayEquals(new int[] {3, 1}, CellSpectra.parseCellLabel("3_1"));
            assertArrayEquals(new int[] {3, 1}, CellSpectra.parseCellLabel("c3_1"));
            assertArrayEquals(new int[] {12, 0}, CellSpectra.parseCellLabel("x12"));
            assertNull(CellSpectra.parseCellLabel("flux"));
            assertNull(CellSpectra.parseCellLabel("1_2_3"));
        }
    }

    @Nested
    @DisplayName("Smoothing")
    class SmoothingTests {

        private CellSpectra spectra() {
            TableFiles.write(dir, "run.xspec.0.txt",
                    "Freq. c0_0 c1_0",
                    "1 0.1 4",
                    "2 0.7 4",
                    "3 0.3 4",
                    "4 1.9 4",
                    "5 0.55 4");
            return CellSpectra.load(dir, PATTERN, 2, 1);
        }

        @Test
        @DisplayName("Unsmooth restores bit-identical flux")
        void unsmoothRestores() {
            CellSpectra spectra = spectra();
            double[] before = spectra.flux(0, 0);

            spectra.smooth(3);
            assertFalse(Arrays.equals(before, spectra.flux(0, 0)), "smoothing changed the flux");
            spectra.unsmooth();

            assertArrayEquals(before, spectra.flux(0, 0));
            assertArrayEquals(spectra.originalFlux(1, 0), spectra.flux(1, 0));
        }

        @Test
        @DisplayName("Smoothing twice equals smoothing once")
        void notCumulative() {
            CellSpectra spectra = spectra();

            spectra.smooth(3);
            double[] once = spectra.flux(0, 0);
            spectra.smooth(3);

            assertArrayEquals(once, spectra.flux(0, 0));
        }

        @Test
        @DisplayName("Boxcar is a zero-padded centered mean")
        void boxcarValues() {
            CellSpectra spectra = spectra();

            spectra.smooth(3);

            double[] flat = spectra.flux(1, 0);
            assertEquals(8.0 / 3, flat[0], 1e-12, "edge sees one zero");
            assertEquals(4.0, flat[2], 1e-12);
            assertEquals(8.0 / 3, flat[4], 1e-12);
            assertArrayEquals(
                    new double[] {0.5, 1.5, 2.5, 3.5},
                    CellSpectra.boxcar(new double[] {1, 2, 3, 4}, 2),
                    1e-12);
        }

        @Test
        @DisplayName("Returned flux is a copy of the working flux")
        void fluxIsCopied() {
            CellSpectra spectra = spectra();

            spectra.flux(0, 0)[0] = 99.0;

            assertEquals(0.1, spectra.flux(0, 0)[0]);
        }

        @Test
        @DisplayName("Width 1 leaves the flux unchanged")
        void widthOne() {
            CellSpectra spectra = spectra();
            spectra.smooth(1);
            assertArrayEquals(spectra.originalFlux(0, 0), spectra.flux(0, 0));
            assertThrows(IllegalArgumentException.class, () -> spectra.smooth(-2));
        }
    }
}
