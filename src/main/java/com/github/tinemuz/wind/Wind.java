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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The wind of a finished simulation, assembled from its save tables into a
 * 2-D grid of cells.
 *
 * <p>Loading reads, in order, the bulk parameter tables, the ion tables, the
 * per-cell spectra and the banded model table, then derives the coordinate
 * system and axes. Any failure that leaves the grid shape undetermined aborts
 * the load; optional data that is simply absent is reported as empty.</p>
 *
 * <p>Distances start in centimetres and velocities in cm/s. The only way the
 * loaded values change afterwards is {@link #changeUnits(DistanceUnits)},
 * {@link #changeUnits(VelocityUnits)} and cell-spectrum smoothing.</p>
 */
public final class Wind {
    private static final Logger log = LoggerFactory.getLogger(Wind.class);
    /** Version reported when the simulation left no version marker. */
    public static final String UNKNOWN_VERSION = "UNKNOWN";

    private final String root;
    private final Path directory;
    private final String version;
    private final int nX;
    private final int nZ;
    private final CoordSystem coordSystem;
    private final WindParameters parameters;
    private final List<String> tablesRead;
    private final List<String> ionsRead;
    private final BandedModels models;
    private final CellSpectra cellSpectra;
    private final double[] xCoords;
    private final double[] zCoords;
    // size of one gravitational radius in metres; NaN when the mass is unknown
    private final double gravRadiusMetres;

    private double gravRadius;
    private DistanceUnits distanceUnits = DistanceUnits.CENTIMETRES;
    private VelocityUnits velocityUnits = VelocityUnits.CENTIMETRES_PER_SECOND;

    private Wind(Builder b) {
        this.root = b.root;
        this.directory = b.directory;
        this.version = b.version;
        this.nX = b.parameters.nX();
        this.nZ = b.parameters.nZ();
        this.coordSystem = b.coordSystem;
        this.parameters = b.parameters;
        this.tablesRead = b.tablesRead;
        this.ionsRead = b.ionsRead;
        this.models = b.models;
        this.cellSpectra = b.cellSpectra;
        this.xCoords = b.xCoords;
        this.zCoords = b.zCoords;
        this.gravRadius = b.gravRadiusCm;
        this.gravRadiusMetres = b.gravRadiusCm * DistanceUnits.CENTIMETRES.metres(Double.NaN);
    }

    /** Load a wind with the default configuration. */
    public static Wind load(String root, Path directory) {
        return load(root, directory, WindConfig.defaults());
    }

    /** Load a wind, reading the simulation version from its marker file. */
    public static Wind load(String root, Path directory, WindConfig config) {
        return load(root, directory, config, null);
    }

    /**
     * Load a wind.
     *
     * @param root root name of the simulation; may carry a relative path and a
     *     {@code .pf} extension, e.g. {@code runs/agn.pf}
     * @param directory directory the root is relative to
     * @param config reading settings
     * @param version simulation version, or null to read it from the marker file
     * @throws MissingWindDataException if no parameter or ion tables exist, or
     *     the shape and coordinate columns are missing
     * @throws WindTableFormatException if a table is malformed
     */
    public static Wind load(String root, Path directory, WindConfig config, String version) {
        Builder b = new Builder();
        Path rootPath = Paths.get(root.endsWith(".pf") ? root.substring(0, root.length() - 3) : root);
        b.root = rootPath.getFileName().toString();
        b.directory = rootPath.getParent() == null ? directory : directory.resolve(rootPath.getParent());
        b.version = version != null ? version : readVersion(b.directory.resolve(config.versionFile()));

        WindTableReader reader = new WindTableReader(b.root, b.directory, config.fallbackDir());
        ParameterMerger merger = new ParameterMerger(reader, config);
        b.parameters = merger.mergeParameters();
        merger.mergeIons(b.parameters);
        b.tablesRead = merger.tablesRead();
        b.ionsRead = merger.ionsRead();

        int nX = b.parameters.nX();
        int nZ = b.parameters.nZ();
        b.cellSpectra = CellSpectra.load(b.directory, config.cellSpectraPattern(), nX, nZ);
        b.models = new BandedModelReconstructor(config.binsPerBand()).reconstruct(reader.read("spec"), nX, nZ);

        b.coordSystem = CoordSystem.classify(b.parameters.names());
        b.xCoords = uniqueSorted(b.parameters, b.coordSystem.xColumn());
        b.zCoords = nZ > 1 ? uniqueSorted(b.parameters, b.coordSystem.zColumn()) : new double[b.xCoords.length];
        b.gravRadiusCm = ParameterFile.read(b.directory.resolve(b.root + ".pf"))
                .gravitationalRadiusCm()
                .orElse(Double.NaN);

        Wind wind = new Wind(b);
        log.info(
                "Loaded wind '{}' from {}: {} x {} {} grid, tables {}, {} ion stages",
                wind.root, wind.directory, nX, nZ, wind.coordSystem, wind.tablesRead, wind.ionsRead.size());
        return wind;
    }

    private static String readVersion(Path marker) {
        if (!Files.isRegularFile(marker)) {
            log.warn("No version marker at {}; version is {}", marker, UNKNOWN_VERSION);
            return UNKNOWN_VERSION;
        }
        try {
            return Files.readString(marker, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read version marker " + marker, e);
        }
    }

    private static double[] uniqueSorted(WindParameters parameters, String column) {
        if (!parameters.contains(column)) {
            log.error("Wind tables have no '{}' column; cannot derive grid axes", column);
            throw new MissingWindDataException("Wind tables have no '" + column + "' column");
        }
        return Arrays.stream(parameters.get(column))
                .flatMapToDouble(Arrays::stream)
                .distinct()
                .sorted()
                .toArray();
    }

    // Queries ------------------------------------------------------------------

    public String root() {
        return root;
    }

    public Path directory() {
        return directory;
    }

    /** Version of the simulation that wrote the tables, or {@link #UNKNOWN_VERSION}. */
    public String version() {
        return version;
    }

    public int nX() {
        return nX;
    }

    public int nZ() {
        return nZ;
    }

    public int nCells() {
        return nX * nZ;
    }

    public CoordSystem coordSystem() {
        return coordSystem;
    }

    /** Sorted distinct values of the first spatial axis ({@code x} or {@code r}). */
    public synchronized double[] xCoords() {
        return xCoords.clone();
    }

    /** Sorted distinct values of {@code z} or {@code theta}; zeros for a 1-D grid. */
    public synchronized double[] zCoords() {
        return zCoords.clone();
    }

    /**
     * Copy of a per-cell quantity as an {@code [nX][nZ]} array. Ion keys
     * without a representation suffix ({@code C_i04}) return the fractional
     * population.
     *
     * @throws IllegalArgumentException if no quantity has that name
     */
    public synchronized double[][] get(String key) {
        return parameters.get(key);
    }

    public boolean contains(String key) {
        return parameters.contains(key);
    }

    /** Names of every bound quantity, in binding order. */
    public Set<String> parameterNames() {
        return parameters.names();
    }

    /** Bulk parameter tables that were found. */
    public List<String> tablesRead() {
        return tablesRead;
    }

    /** Composite names of every ion stage that was bound. */
    public List<String> ionsRead() {
        return ionsRead;
    }

    /** Banded models, if the simulation wrote a model table. */
    public Optional<BandedModels> models() {
        return Optional.ofNullable(models);
    }

    /** Model of cell {@code (i, j)}; empty if there is no model table or the cell has no usable band. */
    public Optional<CellModel> model(int i, int j) {
        return models == null ? Optional.empty() : models.get(i, j);
    }

    /** Per-cell spectra, if any cell-spectrum files exist. */
    public Optional<CellSpectra> cellSpectra() {
        return Optional.ofNullable(cellSpectra);
    }

    public int elemNumber(int i, int j) {
        return GridIndex.elemNumber(i, j, nZ);
    }

    public int[] ij(int elem) {
        return GridIndex.ij(elem, nZ);
    }

    public synchronized DistanceUnits distanceUnits() {
        return distanceUnits;
    }

    public synchronized VelocityUnits velocityUnits() {
        return velocityUnits;
    }

    /** Gravitational radius of the central object in the current distance units, if its mass is known. */
    public synchronized OptionalDouble gravitationalRadius() {
        return Double.isNaN(gravRadius) ? OptionalDouble.empty() : OptionalDouble.of(gravRadius);
    }

    // Mutations ----------------------------------------------------------------

    /**
     * Convert every distance quantity, the axes and the gravitational radius
     * into {@code target} units. Does nothing if already in those units.
     *
     * @throws UnitConversionException if {@code target} is null, or the
     *     conversion involves the gravitational radius and it is unknown
     */
    public synchronized void changeUnits(DistanceUnits target) {
        if (target == null) throw new UnitConversionException("no distance unit given");
        if (target == distanceUnits) return;
        double ratio = distanceUnits.metres(gravRadiusMetres) / target.metres(gravRadiusMetres);
        for (String quantity : DistanceUnits.QUANTITIES) parameters.scale(quantity, ratio);
        for (int k = 0; k < xCoords.length; k++) xCoords[k] *= ratio;
        if (coordSystem == CoordSystem.CYLINDRICAL) {
            for (int k = 0; k < zCoords.length; k++) zCoords[k] *= ratio;
        }
        gravRadius *= ratio;
        log.info("Changed distance units of '{}' from {} to {}", root, distanceUnits.tag(), target.tag());
        distanceUnits = target;
    }

    /**
     * Convert every velocity component into {@code target} units. Does nothing
     * if already in those units.
     *
     * @throws UnitConversionException if {@code target} is null
     */
    public synchronized void changeUnits(VelocityUnits target) {
        if (target == null) throw new UnitConversionException("no velocity unit given");
        if (target == velocityUnits) return;
        double ratio = velocityUnits.metresPerSecond() / target.metresPerSecond();
        for (String quantity : VelocityUnits.QUANTITIES) parameters.scale(quantity, ratio);
        log.info("Changed velocity units of '{}' from {} to {}", root, velocityUnits.tag(), target.tag());
        velocityUnits = target;
    }

    /**
     * Boxcar-smooth every cell spectrum with the given width, starting from the
     * original flux each time.
     *
     * @throws IllegalStateException if the wind has no cell spectra
     */
    public void smoothCellSpectra(int width) {
        requireCellSpectra().smooth(width);
    }

    /** Restore every cell spectrum to the flux read from disk. */
    public void unsmoothCellSpectra() {
        requireCellSpectra().unsmooth();
    }

    private CellSpectra requireCellSpectra() {
        if (cellSpectra == null) {
            throw new IllegalStateException("wind '" + root + "' has no cell spectra");
        }
        return cellSpectra;
    }

    @Override
    public String toString() {
        return "Wind(root=" + root + " directory=" + directory + " coords=" + coordSystem + ")";
    }

    // Values gathered during load
    private static final class Builder {
        String root;
        Path directory;
        String version;
        WindParameters parameters;
        List<String> tablesRead;
        List<String> ionsRead;
        BandedModels models;
        CellSpectra cellSpectra;
        CoordSystem coordSystem;
        double[] xCoords;
        double[] zCoords;
        double gravRadiusCm;
    }
}
