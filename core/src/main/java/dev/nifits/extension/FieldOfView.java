/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Locale;

import dev.nifits.data.Complex;
import dev.nifits.data.ComplexNdArray;
import dev.nifits.data.NdArray;
import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * The {@code NI_FOV} extension: the field-of-view (vignetting) function of each frame.
 * <p>
 * How the table is interpreted depends on the {@code FOV_MODE} header keyword. The only
 * mode currently understood is {@value #GAUSSIAN_RADIAL}: a radial gaussian falloff of
 * size {@code lambda / D}, shifted by a chromatic offset for each spectral channel.
 * </p>
 */
public final class FieldOfView extends TableExtension {

    public static final String GAUSSIAN_RADIAL = "diameter_gaussian_radial";

    static final double RAD_TO_MAS = 180.0 / Math.PI * 3.6e6;

    private static final String INDEX = "INDEX";
    private static final String OFFSETS = "offsets";

    /**
     * Evaluates the injection phasor at a set of sky positions.
     */
    @FunctionalInterface
    public interface PhasorFunction {

        /**
         * @param alpha offsets along right ascension, in mas
         * @param beta offsets along declination, in mas
         * @return phasors of shape {@code (channels, alpha.length)}
         */
        ComplexNdArray evaluate(double[] alpha, double[] beta);
    }

    public FieldOfView(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.FIELD_OF_VIEW;
    }

    public static FieldOfView fromRecord(FitsRecord record) {
        return new FieldOfView(decodeTable(record, ExtensionKind.FIELD_OF_VIEW), record.header().copy());
    }

    /**
     * Returns a new header describing an 8 m telescope with gaussian radial profile.
     */
    public static Header defaultHeader() {
        Header header = new Header();
        header.set("FOV_MODE", GAUSSIAN_RADIAL, "Type of FOV definition");
        header.set("FOV_TELDIAM", 8.0, "Telescope diameter for FOV");
        header.set("FOV_TELDIAM_UNIT", "m", "Unit of FOV_TELDIAM");
        header.set("WL_SHIFT_MODE", "", "Chromatic offset mode");
        return header;
    }

    /**
     * Creates a field of view with chromatic gaussian profile and zero offsets.
     *
     * @param header header providing {@code FOV_TELDIAM} and {@code FOV_TELDIAM_UNIT};
     *               {@link #defaultHeader()} is used if {@code null}
     * @param wavelengths channel centers in meters
     * @param frames number of rows to create
     */
    public static FieldOfView simpleFromHeader(Header header, double[] wavelengths, int frames) {
        Header effective = header != null ? header.copy() : defaultHeader();
        FieldOfView fov = new FieldOfView(createTable(wavelengths.length), effective);
        // validates the diameter keywords before any row is created
        fov.telescopeDiameter();
        for (int frame = 0; frame < frames; frame++) {
            fov.getTable().addRow(frame, new double[wavelengths.length * 2]);
        }
        return fov;
    }

    private static Table createTable(int channels) {
        return Table.of(
                ColumnSchema.scalar(INDEX, ColumnType.INT32),
                ColumnSchema.array(OFFSETS, ColumnType.FLOAT64, channels, 2).withUnit("mas"));
    }

    public String mode() {
        return getHeader().getString("FOV_MODE");
    }

    /**
     * Telescope diameter in meters, converted from {@code FOV_TELDIAM_UNIT}.
     */
    public double telescopeDiameter() {
        double value = getHeader().getDouble("FOV_TELDIAM");
        String unit = getHeader().getString("FOV_TELDIAM_UNIT", "m").trim().toLowerCase(Locale.ROOT);
        return switch (unit) {
            case "m" -> value;
            case "cm" -> value * 1e-2;
            case "mm" -> value * 1e-3;
            case "um" -> value * 1e-6;
            case "km" -> value * 1e3;
            default -> throw new IllegalArgumentException("Unsupported FOV_TELDIAM_UNIT: " + unit);
        };
    }

    /**
     * Offsets of all frames, shape {@code (frames, channels, 2)}.
     */
    public NdArray offsets() {
        return getTable().getDoubleColumn(OFFSETS);
    }

    /**
     * Returns the phasor function of one frame.
     *
     * @param wavelengths channel centers in meters, one per row of the frame's offsets
     * @throws IllegalStateException if the mode is not {@value #GAUSSIAN_RADIAL}
     */
    public PhasorFunction phasorFunction(double[] wavelengths, int frame) {
        if (!GAUSSIAN_RADIAL.equals(mode())) {
            throw new IllegalStateException("Unsupported FOV_MODE: " + mode());
        }
        double diameter = telescopeDiameter();
        NdArray offset = offsets().slice(frame);
        if (offset.dim(0) != wavelengths.length) {
            throw new IllegalArgumentException("Frame " + frame + " has offsets for " + offset.dim(0)
                    + " channels, got " + wavelengths.length + " wavelengths");
        }
        double[] r0 = new double[wavelengths.length];
        for (int w = 0; w < wavelengths.length; w++) {
            r0[w] = wavelengths[w] / diameter * RAD_TO_MAS;
        }
        return (alpha, beta) -> {
            if (alpha.length != beta.length) {
                throw new IllegalArgumentException("alpha and beta must have the same length");
            }
            ComplexNdArray phasors = ComplexNdArray.zeros(r0.length, alpha.length);
            for (int w = 0; w < r0.length; w++) {
                for (int p = 0; p < alpha.length; p++) {
                    double r = Math.hypot(alpha[p] - offset.get(w, 0), beta[p] - offset.get(w, 1));
                    double ratio = r / r0[w];
                    phasors.set(new Complex(Math.exp(-ratio * ratio), 0.0), w, p);
                }
            }
            return phasors;
        };
    }
}
