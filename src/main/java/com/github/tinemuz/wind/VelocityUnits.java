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

import java.util.List;

/** Units for the velocity components of a wind grid; each carries its size in m/s. */
public enum VelocityUnits {
    CENTIMETRES_PER_SECOND("cm/s", 0.01),
    METRES_PER_SECOND("m/s", 1.0),
    KILOMETRES_PER_SECOND("km/s", 1000.0),
    SPEED_OF_LIGHT("c", 2.99792e8);

    /** Columns expressed in velocity units. */
    public static final List<String> QUANTITIES = List.of("v_x", "v_y", "v_z", "v_r", "v_theta");

    private final String tag;
    private final double metresPerSecond;

    VelocityUnits(String tag, double metresPerSecond) {
        this.tag = tag;
        this.metresPerSecond = metresPerSecond;
    }

    public String tag() {
        return tag;
    }

    double metresPerSecond() {
        return metresPerSecond;
    }

    /**
     * Look up a unit by its short tag ({@code cm/s}, {@code m/s}, {@code km/s}, {@code c}).
     *
     * @throws UnitConversionException if the tag is not recognized
     */
    public static VelocityUnits fromTag(String tag) {
        for (VelocityUnits u : values()) {
            if (u.tag.equals(tag)) return u;
        }
        throw new UnitConversionException("unrecognized velocity unit '" + tag + "'");
    }
}
