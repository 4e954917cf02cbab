/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import dev.nifits.data.ComplexNdArray;
import dev.nifits.data.NdArray;
import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * The {@code NI_MOD} extension: time-dependent, collector-wise information. Each row is
 * one frame of the observation.
 * <p>
 * The modulation phasors describe what the instrument applies to the light at its
 * inputs, on top of the static effects held by the transfer matrix.
 * </p>
 *
 * <table>
 *   <caption>Columns</caption>
 *   <tr><th>Name</th><th>Cell</th><th>Unit</th></tr>
 *   <tr><td>APP_INDEX</td><td>int[n_a]</td><td></td></tr>
 *   <tr><td>TARGET_ID</td><td>int</td><td></td></tr>
 *   <tr><td>TIME</td><td>double</td><td>s</td></tr>
 *   <tr><td>MJD</td><td>double</td><td>day</td></tr>
 *   <tr><td>INT_TIME</td><td>double</td><td>s</td></tr>
 *   <tr><td>MOD_PHAS</td><td>complex[n_wl, n_a]</td><td></td></tr>
 *   <tr><td>APPXY</td><td>double[n_a, 2]</td><td>m</td></tr>
 *   <tr><td>ARRCOL</td><td>double[n_a]</td><td>m^2</td></tr>
 *   <tr><td>FOV_INDEX</td><td>int[n_a]</td><td></td></tr>
 * </table>
 */
public final class ModulationSeries extends TableExtension {

    static final String APP_INDEX = "APP_INDEX";
    static final String TARGET_ID = "TARGET_ID";
    static final String TIME = "TIME";
    static final String MJD = "MJD";
    static final String INT_TIME = "INT_TIME";
    static final String MOD_PHAS = "MOD_PHAS";
    static final String APPXY = "APPXY";
    static final String ARRCOL = "ARRCOL";
    static final String FOV_INDEX = "FOV_INDEX";

    public ModulationSeries(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.MODULATION_SERIES;
    }

    public static ModulationSeries fromRecord(FitsRecord record) {
        return new ModulationSeries(decodeTable(record, ExtensionKind.MODULATION_SERIES), record.header().copy());
    }

    /**
     * Returns a new header with the unit keywords of the phasor and collecting-area columns.
     */
    public static Header defaultHeader() {
        Header header = new Header();
        header.set("MOD_PHAS_UNITS", "rad", "The units for modulation phasors");
        header.set("ARRCOL_UNITS", "m^2", "The units for collecting area");
        return header;
    }

    /**
     * Creates an empty series for the given number of spectral channels and apertures.
     */
    public static ModulationSeries create(int channels, int apertures) {
        Table table = Table.of(
                ColumnSchema.array(APP_INDEX, ColumnType.INT32, apertures),
                ColumnSchema.scalar(TARGET_ID, ColumnType.INT32),
                ColumnSchema.scalar(TIME, ColumnType.FLOAT64).withUnit("s"),
                ColumnSchema.scalar(MJD, ColumnType.FLOAT64).withUnit("day"),
                ColumnSchema.scalar(INT_TIME, ColumnType.FLOAT64).withUnit("s"),
                ColumnSchema.array(MOD_PHAS, ColumnType.COMPLEX128, channels, apertures),
                ColumnSchema.array(APPXY, ColumnType.FLOAT64, apertures, 2).withUnit("m"),
                ColumnSchema.array(ARRCOL, ColumnType.FLOAT64, apertures).withUnit("m^2"),
                ColumnSchema.array(FOV_INDEX, ColumnType.INT32, apertures));
        return new ModulationSeries(table, defaultHeader());
    }

    /**
     * Appends one frame. Aperture indices are numbered from 0.
     *
     * @param phasors modulation phasors, shape {@code (channels, apertures)}
     * @param apertureXy projected aperture positions, shape {@code (apertures, 2)}
     */
    public void addFrame(int targetId, double time, double mjd, double integrationTime, ComplexNdArray phasors,
                         NdArray apertureXy, double[] collectingAreas, int[] fovIndices) {
        int[] phasorShape = getTable().getColumn(MOD_PHAS).cellShape();
        if (phasors.rank() != 2 || phasors.dim(0) != phasorShape[0] || phasors.dim(1) != phasorShape[1]) {
            throw new IllegalArgumentException("Expected phasors of shape (" + phasorShape[0] + ", "
                    + phasorShape[1] + "), got " + phasors);
        }
        int apertures = phasorShape[1];
        int[] appIndex = new int[apertures];
        for (int i = 0; i < apertures; i++) {
            appIndex[i] = i;
        }
        getTable().addRow(appIndex, targetId, time, mjd, integrationTime, phasors, apertureXy,
                collectingAreas, fovIndices);
    }

    public int frameCount() {
        return getRowCount();
    }

    /**
     * Modulation phasors of all frames, shape {@code (frames, channels, apertures)}.
     */
    public ComplexNdArray phasors() {
        return getTable().getComplexColumn(MOD_PHAS);
    }

    /**
     * Projected aperture positions, shape {@code (frames, apertures, 2)}.
     */
    public NdArray apertureXy() {
        return getTable().getDoubleColumn(APPXY);
    }

    /**
     * Collecting areas, shape {@code (frames, apertures)}.
     */
    public NdArray collectingAreas() {
        return getTable().getDoubleColumn(ARRCOL);
    }

    public double[] integrationTimes() {
        return getTable().getDoubleColumn(INT_TIME).toArray();
    }

    public double[] mjd() {
        return getTable().getDoubleColumn(MJD).toArray();
    }

    public double[] times() {
        return getTable().getDoubleColumn(TIME).toArray();
    }

    public long[] targetIds() {
        return getTable().getLongColumn(TARGET_ID);
    }

    /**
     * Field-of-view row of each aperture, shape {@code (frames, apertures)} flattened.
     */
    public long[] fovIndices() {
        return getTable().getLongColumn(FOV_INDEX);
    }

    /**
     * Mean observation date, weighting each frame's {@code MJD} by its integration time.
     * Falls back to the plain mean when all integration times are zero.
     *
     * @throws IllegalStateException if there are no frames
     */
    public double meanObservationMjd() {
        if (frameCount() == 0) {
            throw new IllegalStateException("NI_MOD has no frames");
        }
        double[] mjd = mjd();
        double[] weights = integrationTimes();
        double weighted = 0;
        double total = 0;
        double plain = 0;
        for (int i = 0; i < mjd.length; i++) {
            weighted += mjd[i] * weights[i];
            total += weights[i];
            plain += mjd[i];
        }
        return total != 0 ? weighted / total : plain / mjd.length;
    }
}
