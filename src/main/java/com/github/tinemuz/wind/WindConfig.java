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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings that control how a wind is read. Defaults come from the classpath
 * resource {@code windgrid.properties}; instances are immutable and the
 * {@code with*} methods return modified copies.
 */
public final class WindConfig {
    private static final Logger log = LoggerFactory.getLogger(WindConfig.class);
    static final String RESOURCE = "windgrid.properties";
    private static volatile WindConfig defaults;

    private final int binsPerBand;
    private final List<String> parameterTables;
    private final List<String> elements;
    private final String fallbackDir;
    private final String cellSpectraPattern;
    private final String versionFile;

    private WindConfig(
            int binsPerBand,
            List<String> parameterTables,
            List<String> elements,
            String fallbackDir,
            String cellSpectraPattern,
            String versionFile) {
        this.binsPerBand = binsPerBand;
        this.parameterTables = List.copyOf(parameterTables);
        this.elements = List.copyOf(elements);
        this.fallbackDir = fallbackDir;
        this.cellSpectraPattern = cellSpectraPattern;
        this.versionFile = versionFile;
    }

    /**
     * Settings loaded from {@code windgrid.properties}.
     *
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static WindConfig defaults() {
        WindConfig d = defaults;
        if (d == null) {
            synchronized (WindConfig.class) {
                d = defaults;
                if (d == null) {
                    d = loadFromResource();
                    defaults = d;
                }
            }
        }
        return d;
    }

    private static WindConfig loadFromResource() {
        InputStream in = WindConfig.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Wind configuration '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Wind configuration '" + RESOURCE + "' not found on classpath");
        }
        Properties props = new Properties();
        try (in) {
            props.load(in);
        } catch (IOException e) {
            log.error("Failed to read wind configuration", e);
            throw new IllegalStateException("Failed to read wind configuration", e);
        }
        try {
            return new WindConfig(
                    Integer.parseInt(required(props, "model.bins-per-band")),
                    splitList(required(props, "tables.parameters")),
                    splitList(required(props, "tables.elements")),
                    required(props, "tables.fallback-dir"),
                    required(props, "cell-spectra.pattern"),
                    required(props, "version.file"));
        } catch (NumberFormatException e) {
            log.error("Failed to parse wind configuration", e);
            throw new IllegalStateException("Failed to parse wind configuration", e);
        }
    }

    private static String required(Properties props, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) {
            throw new IllegalStateException("Wind configuration has no value for '" + key + "'");
        }
        return v.trim();
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        for (String t : value.split(",")) {
            if (!t.isBlank()) out.add(t.trim());
        }
        return out;
    }

    /** Frequency bins used to sample each band of a cell model. */
    public int binsPerBand() {
        return binsPerBand;
    }

    /** Bulk parameter table kinds, in merge order. */
    public List<String> parameterTables() {
        return parameterTables;
    }

    /** Element symbols whose ion tables are read. */
    public List<String> elements() {
        return elements;
    }

    public String fallbackDir() {
        return fallbackDir;
    }

    public String cellSpectraPattern() {
        return cellSpectraPattern;
    }

    public String versionFile() {
        return versionFile;
    }

    public WindConfig withBinsPerBand(int bins) {
        if (bins < 1) throw new IllegalArgumentException("bins per band must be positive, got " + bins);
        return new WindConfig(bins, parameterTables, elements, fallbackDir, cellSpectraPattern, versionFile);
    }

    public WindConfig withElements(List<String> symbols) {
        return new WindConfig(binsPerBand, parameterTables, symbols, fallbackDir, cellSpectraPattern, versionFile);
    }
}
