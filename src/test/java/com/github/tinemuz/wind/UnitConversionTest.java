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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UnitConversionTest {

    private static final double TOLERANCE = 1e-12;

    @TempDir Path dir;

    private static double[][] copy(double[][] values) {
        double[][] out = new double[values.length][];
        for (int i = 0; i < values.length; i++) out[i] = values[i].clone();
        return out;
    }

    private static void assertScaled(double[][] before, double[][] after, double factor) {
        for (int i = 0; i < before.length; i++) {
            for (int j = 0; j < before[i].length; j++) {
                assertEquals(before[i][j] * factor, after[i][j], Math.abs(before[i][j] * factor) * TOLERANCE);
            }
        }
    }

    @Nested
    @DisplayName("Distance units")
    class DistanceTests {

        private Wind wind;

        @BeforeEach
        void load() {
            TableFiles.cylindricalGrid(dir, "run");
            wind = Wind.load("run", dir);
        }

        @Test
        @DisplayName("Grid starts in centimetres")
        void defaultUnits() {
            assertEquals(DistanceUnits.CENTIMETRES, wind.distanceUnits());
            assertEquals(VelocityUnits.CENTIMETRES_PER_SECOND, wind.velocityUnits());
        }

        @Test
        @DisplayName("cm -> km scales every distance column and the axes")
        void centimetresToKilometres() {
            double[][] x = copy(wind.get("x"));
            double[][] zCen = copy(wind.get("z_cen"));
            double[][] temperature = copy(wind.get("t_e"));

            wind.changeUnits(DistanceUnits.KILOMETRES);

            assertEquals(DistanceUnits.KILOMETRES, wind.distanceUnits());
            assertScaled(x, wind.get("x"), 1e-5);
            assertScaled(zCen, wind.get("z_cen"), 1e-5);
            assertArrayEquals(temperature[2], wind.get("t_e")[2], "non-distance columns untouched");
            assertEquals(1e4, wind.xCoords()[0], 1e4 * TOLERANCE);
            assertEquals(1e4, wind.zCoords()[1], 1e4 * TOLERANCE);
        }

        @Test
        @DisplayName("cm -> km -> cm restores the original values")
        void roundTrip() {
            double[][] x = copy(wind.get("x"));
            double[][] xCen = copy(wind.get("x_cen"));

            wind.changeUnits(DistanceUnits.KILOMETRES);
            wind.changeUnits(DistanceUnits.CENTIMETRES);

            assertScaled(x, wind.get("x"), 1.0);
            assertScaled(xCen, wind.get("x_cen"), 1.0);
            assertEquals(DistanceUnits.CENTIMETRES, wind.distanceUnits());
        }

        @Test
        @DisplayName("Converting to the current unit is a no-op")
        void sameUnit() {
            double[][] x = copy(wind.get("x"));

            wind.changeUnits(DistanceUnits.CENTIMETRES);

            assertArrayEquals(x[1], wind.get("x")[1]);
        }

        @Test
        @DisplayName("Gravitational radius without a central mass is rejected untouched")
        void unknownGravitationalRadius() {
            double[][] x = copy(wind.get("x"));

            assertThrows(
                    UnitConversionException.class,
                    () -> wind.changeUnits(DistanceUnits.GRAVITATIONAL_RADIUS));

            assertEquals(DistanceUnits.CENTIMETRES, wind.distanceUnits());
            assertArrayEquals(x[2], wind.get("x")[2]);
            assertTrue(wind.gravitationalRadius().isEmpty());
        }

        @Test
        @DisplayName("Null target is a unit error")
        void nullTarget() {
            assertThrows(UnitConversionException.class, () -> wind.changeUnits((DistanceUnits) null));
            assertThrows(UnitConversionException.class, () -> wind.changeUnits((VelocityUnits) null));
        }
    }

    @Nested
    @DisplayName("Gravitational radius")
    class GravitationalRadiusTests {

        @Test
        @DisplayName("Central mass in the parameter file defines r_g")
        void fromParameterFile() {
            TableFiles.cylindricalGrid(dir, "run");
            TableFiles.write(dir, "run.pf",
                    "# central object",
                    "Central_object.mass(msol)   1e8   # supermassive",
                    "Wind.number_of_components  1");
            Wind wind = Wind.load("run", dir);
            double rgCm = 6.6743e-8 * 1e8 * 1.98840987e33 / (2.99792458e10 * 2.99792458e10);
            double[][] x = copy(wind.get("x"));

            assertEquals(rgCm, wind.gravitationalRadius().getAsDouble(), rgCm * TOLERANCE);

            wind.changeUnits(DistanceUnits.GRAVITATIONAL_RADIUS);
            assertEquals(1.0, wind.gravitationalRadius().getAsDouble(), TOLERANCE);
            assertScaled(x, wind.get("x"), 1.0 / rgCm);

            wind.changeUnits(DistanceUnits.METRES);
            assertEquals(rgCm / 100, wind.gravitationalRadius().getAsDouble(), rgCm / 100 * TOLERANCE);
            assertScaled(x, wind.get("x"), 0.01);
        }
    }

    @Nested
    @DisplayName("Velocity units")
    class VelocityTests {

        @Test
        @DisplayName("cm/s -> km/s and -> c scale every velocity component")
        void velocity() {
            TableFiles.cylindricalGrid(dir, "run");
            Wind wind = Wind.load("run", dir);
            double[][] vX = copy(wind.get("v_x"));
            double[][] x = copy(wind.get("x"));

            wind.changeUnits(VelocityUnits.KILOMETRES_PER_SECOND);
            assertScaled(vX, wind.get("v_x"), 1e-5);
            assertArrayEquals(x[0], wind.get("x")[0], "distances untouched");

            wind.changeUnits(VelocityUnits.SPEED_OF_LIGHT);
            assertScaled(vX, wind.get("v_x"), 0.01 / 2.99792e8);
            assertEquals(VelocityUnits.SPEED_OF_LIGHT, wind.velocityUnits());
        }

        @Test
        @DisplayName("Polar grids convert r and v_r but not theta")
        void polar() {
            TableFiles.polarGrid(dir, "run");
            Wind wind = Wind.load("run", dir);

            wind.changeUnits(DistanceUnits.METRES);
            wind.changeUnits(VelocityUnits.METRES_PER_SECOND);

            assertEquals(2e8, wind.get("r")[1][0], 2e8 * TOLERANCE);
            assertEquals(4e5, wind.get("v_r")[1][1], 4e5 * TOLERANCE);
            assertEquals(20.0, wind.get("theta")[1][1]);
            assertArrayEquals(new double[] {10, 20}, wind.zCoords());
            assertEquals(1e8, wind.xCoords()[0], 1e8 * TOLERANCE);
        }
    }

    @Test
    @DisplayName("Unit tags")
    void tags() {
        assertEquals(DistanceUnits.KILOMETRES, DistanceUnits.fromTag("km"));
        assertEquals(DistanceUnits.GRAVITATIONAL_RADIUS, DistanceUnits.fromTag("rg"));
        assertEquals(VelocityUnits.SPEED_OF_LIGHT, VelocityUnits.fromTag("c"));
        assertEquals(VelocityUnits.METRES_PER_SECOND, VelocityUnits.fromTag("m/s"));
        assertThrows(UnitConversionException.class, () -> DistanceUnits.fromTag("parsec"));
        assertThrows(UnitConversionException.class, () -> VelocityUnits.fromTag("mph"));
    }
}
