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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The simulation's input parameter file ({@code <root>.pf}): one
 * {@code name value} pair per line, {@code #} starting a comment.
 */
final class ParameterFile {
    private static final Logger log = LoggerFactory.getLogger(ParameterFile.class);
    static final String CENTRAL_OBJECT_MASS = "Central_object.mass(msol)";

    private final Map<String, String> values;

    private ParameterFile(Map<String, String> values) {
        this.values = values;
    }

    /** Read a parameter file; a missing file reads as one with no parameters. */
    static ParameterFile read(Path path) {
        Map<String, String> values = new LinkedHashMap<>();
        if (!Files.isRegularFile(path)) {
            log.debug("No parameter file at {}", path);
            return new ParameterFile(values);
        }
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                int hash = line.indexOf('#');
                if (hash >= 0) line = line.substring(0, hash);
                line = line.trim();
                if (line.isEmpty()) continue;
                String[] toks = line.split("\\s+", 2);
                if (toks.length == 2) values.putIfAbsent(toks[0], toks[1].trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read parameter file " + path, e);
        }
        return new ParameterFile(values);
    }

    /** Numeric value of a parameter; empty if absent or not a number. */
    OptionalDouble getDouble(String name) {
        String v = values.get(name);
        if (v == null) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(v.split("\\s+")[0]));
        } catch (NumberFormatException e) {
            log.warn("Parameter {} has non-numeric value '{}'", name, v);
            return OptionalDouble.empty();
        }
    }

    /** Gravitational radius {@code G M / c^2} of the central object in cm, if its mass is given. */
    OptionalDouble gravitationalRadiusCm() {
        OptionalDouble mass = getDouble(CENTRAL_OBJECT_MASS);
        if (mass.isEmpty()) return OptionalDouble.empty();
        double grams = mass.getAsDouble() * PhysicalConstants.MSOL;
        return OptionalDouble.of(
                PhysicalConstants.G * grams / (PhysicalConstants.C * PhysicalConstants.C));
    }
}
