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

/**
 * Units for the spatial quantities of a wind grid.
 *
 * <p>Each unit carries its size in metres. The gravitational radius has no
 * fixed size: it depends on the mass of the central object, so its factor is
 * supplied by the grid doing the conversion.</p>
 */
public enum DistanceUnits {
    CENTIMETRES("cm", 0.01),
    METRES("m", 1.0),
    KILOMETRES("km", 1000.0),
    GRAVITATIONAL_RADIUS("rg", Double.NaN);

    /** Columns expressed in distance units. */
    public static final List<String> QUANTITIES = List.of("x", "z", "x_cen", "z_cen", "r", "r_cen");

    private final String tag;
    private final double metres;

    DistanceUnits(String tag, double metres) {
        this.tag = tag;
        this.metres = metres;
    }

    public String tag() {
        return tag;
    }

    /**
     * Size of this unit in metres.
     *
     * @param gravRadiusMetres size of one gravitational radius in metres, or NaN if unknown
     * @throws UnitConversionException if this is the gravitational radius and it is unknown
     */
    double metres(double gravRadiusMetres) {
        if (this != GRAVITATIONAL_RADIUS) return metres;
        if (!(gravRadiusMetres > 0) || Double.isInfinite(gravRadiusMetres)) {
            throw new UnitConversionException(
                    "gravitational radius is unknown for this grid; "
                            + "cannot convert to or from " + tag);
        }
        return gravRadiusMetres;
    }

    /**
     * Look up a unit by its short tag ({@code cm}, {@code m}, {@code km}, {@code rg}).
     *
     * @throws UnitConversionException if the tag is not recognized
     */
    public static DistanceUnits fromTag(String tag) {
        for (DistanceUnits u : values()) {
            if (u.tag.equals(tag)) return u;
        }
        throw new UnitConversionException("unrecognized distance unit '" + tag + "'");
    }
}
