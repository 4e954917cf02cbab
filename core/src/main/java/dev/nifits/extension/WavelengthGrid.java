/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * The {@code OI_WAVELENGTH} extension: center and width of each spectral channel, in meters.
 */
public final class WavelengthGrid extends TableExtension {

    public static final double SPEED_OF_LIGHT = 299_792_458.0;

    static final String EFF_WAVE = "EFF_WAVE";
    static final String EFF_BAND = "EFF_BAND";

    public WavelengthGrid(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.WAVELENGTH_GRID;
    }

    public static WavelengthGrid fromRecord(FitsRecord record) {
        return new WavelengthGrid(decodeTable(record, ExtensionKind.WAVELENGTH_GRID), record.header().copy());
    }

    /**
     * @param wavelengths channel centers in meters
     * @param bandwidths channel widths in meters
     */
    public static WavelengthGrid create(double[] wavelengths, double[] bandwidths) {
        if (wavelengths.length != bandwidths.length) {
            throw new IllegalArgumentException("Got " + wavelengths.length + " wavelengths but "
                    + bandwidths.length + " bandwidths");
        }
        Table table = Table.of(
                ColumnSchema.scalar(EFF_WAVE, ColumnType.FLOAT64).withUnit("m"),
                ColumnSchema.scalar(EFF_BAND, ColumnType.FLOAT64).withUnit("m"));
        for (int i = 0; i < wavelengths.length; i++) {
            table.addRow(wavelengths[i], bandwidths[i]);
        }
        return new WavelengthGrid(table, new Header());
    }

    public int channelCount() {
        return getRowCount();
    }

    /**
     * Channel centers in meters.
     */
    public double[] wavelengths() {
        return getTable().getDoubleColumn(EFF_WAVE).toArray();
    }

    /**
     * Channel widths in meters.
     */
    public double[] bandwidths() {
        return getTable().getDoubleColumn(EFF_BAND).toArray();
    }

    /**
     * Channel center frequencies in Hz.
     */
    public double[] frequencies() {
        double[] lambdas = wavelengths();
        double[] nus = new double[lambdas.length];
        for (int i = 0; i < lambdas.length; i++) {
            nus[i] = SPEED_OF_LIGHT / lambdas[i];
        }
        return nus;
    }

    /**
     * Channel widths in Hz, {@code c * dlambda / lambda^2}.
     */
    public double[] frequencyWidths() {
        double[] lambdas = wavelengths();
        double[] widths = bandwidths();
        double[] dnus = new double[lambdas.length];
        for (int i = 0; i < lambdas.length; i++) {
            dnus[i] = SPEED_OF_LIGHT * widths[i] / (lambdas[i] * lambdas[i]);
        }
        return dnus;
    }
}
