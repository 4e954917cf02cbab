/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

import java.util.List;

import dev.nifits.data.Complex;
import dev.nifits.data.ComplexNdArray;
import dev.nifits.data.NdArray;
import dev.nifits.extension.ArrayGeometry;
import dev.nifits.extension.ExtensionKind;
import dev.nifits.extension.FieldOfView;
import dev.nifits.extension.KernelMatrix;
import dev.nifits.extension.KernelOutput;
import dev.nifits.extension.ModulationSeries;
import dev.nifits.extension.NifitsExtension;
import dev.nifits.extension.OutputCovariance;
import dev.nifits.extension.RawOutput;
import dev.nifits.extension.Station;
import dev.nifits.extension.Target;
import dev.nifits.extension.TargetList;
import dev.nifits.extension.TransferMatrix;
import dev.nifits.extension.WavelengthGrid;

/**
 * Small but fully populated extensions of every kind: 3 channels, 2 inputs,
 * 3 outputs, 2 kernels and 4 frames.
 */
public final class TestExtensions {

    public static final int CHANNELS = 3;
    public static final int INPUTS = 2;
    public static final int OUTPUTS = 3;
    public static final int KERNELS = 2;
    public static final int FRAMES = 4;

    public static final double[] WAVELENGTHS = { 3.5e-6, 3.75e-6, 4.0e-6 };

    private TestExtensions() {
    }

    public static NifitsExtension create(ExtensionKind kind) {
        return switch (kind) {
            case ARRAY_GEOMETRY -> arrayGeometry();
            case WAVELENGTH_GRID -> wavelengthGrid();
            case TRANSFER_MATRIX -> transferMatrix();
            case FIELD_OF_VIEW -> fieldOfView();
            case KERNEL_MATRIX -> kernelMatrix();
            case MODULATION_SERIES -> modulationSeries();
            case RAW_OUTPUT -> rawOutput();
            case KERNEL_OUTPUT -> kernelOutput();
            case OUTPUT_COVARIANCE -> outputCovariance();
            case TARGET_LIST -> targetList();
        };
    }

    public static Nifits full() {
        Nifits nifits = new Nifits();
        for (ExtensionKind kind : ExtensionKind.values()) {
            nifits.setExtension(create(kind));
        }
        return nifits;
    }

    public static ArrayGeometry arrayGeometry() {
        return ArrayGeometry.fromStations("TEST", List.of(
                new Station("UT1", "U1", 8.2, new double[]{ -9.925, -20.335, 0.0 }, 0.5, "RADIUS", 2),
                new Station("UT2", "U2", 8.2, new double[]{ 14.887, 30.502, 0.0 }, null, null, 2)));
    }

    public static WavelengthGrid wavelengthGrid() {
        return WavelengthGrid.create(WAVELENGTHS, new double[]{ 0.25e-6, 0.25e-6, 0.25e-6 });
    }

    public static TransferMatrix transferMatrix() {
        ComplexNdArray matrix = ComplexNdArray.zeros(CHANNELS, OUTPUTS, INPUTS);
        for (int c = 0; c < CHANNELS; c++) {
            for (int o = 0; o < OUTPUTS; o++) {
                for (int i = 0; i < INPUTS; i++) {
                    matrix.set(Complex.polar(1.0 / Math.sqrt(OUTPUTS), 2 * Math.PI * o * i / OUTPUTS + 0.1 * c), c, o, i);
                }
            }
        }
        return TransferMatrix.create(matrix);
    }

    public static FieldOfView fieldOfView() {
        return FieldOfView.simpleFromHeader(FieldOfView.defaultHeader(), WAVELENGTHS, FRAMES);
    }

    public static KernelMatrix kernelMatrix() {
        return KernelMatrix.create(NdArray.matrix(new double[][]{
                { 1.0, -1.0, 0.0 },
                { 0.0, 1.0, -1.0 } }));
    }

    public static ModulationSeries modulationSeries() {
        ModulationSeries series = ModulationSeries.create(CHANNELS, INPUTS);
        for (int frame = 0; frame < FRAMES; frame++) {
            ComplexNdArray phasors = ComplexNdArray.zeros(CHANNELS, INPUTS);
            for (int c = 0; c < CHANNELS; c++) {
                for (int a = 0; a < INPUTS; a++) {
                    phasors.set(Complex.polar(1.0, 0.01 * frame * (a + 1)), c, a);
                }
            }
            NdArray xy = NdArray.matrix(new double[][]{ { -10.0 + frame, 0.5 }, { 10.0 - frame, -0.5 } });
            series.addFrame(0, 60.0 * frame, 60000.0 + frame / 1440.0, 30.0, phasors, xy,
                    new double[]{ 50.0, 50.0 }, new int[]{ frame, frame });
        }
        return series;
    }

    public static RawOutput rawOutput() {
        RawOutput output = RawOutput.create(CHANNELS, OUTPUTS);
        for (int frame = 0; frame < FRAMES; frame++) {
            NdArray values = NdArray.zeros(CHANNELS, OUTPUTS);
            for (int c = 0; c < CHANNELS; c++) {
                for (int o = 0; o < OUTPUTS; o++) {
                    values.set(100.0 * frame + 10.0 * c + o, c, o);
                }
            }
            output.addFrame(values);
        }
        return output;
    }

    public static KernelOutput kernelOutput() {
        KernelOutput output = KernelOutput.create(CHANNELS, KERNELS);
        for (int frame = 0; frame < FRAMES; frame++) {
            NdArray values = NdArray.zeros(CHANNELS, KERNELS);
            values.set(0.125 * frame, 0, 0);
            values.set(-0.5, CHANNELS - 1, KERNELS - 1);
            output.addFrame(values);
        }
        return output;
    }

    public static OutputCovariance outputCovariance() {
        int size = CHANNELS * KERNELS;
        NdArray covariance = NdArray.zeros(size, size);
        for (int i = 0; i < size; i++) {
            covariance.set(1.0 + i, i, i);
        }
        return OutputCovariance.create(covariance);
    }

    public static TargetList targetList() {
        TargetList targets = TargetList.fromScratch();
        targets.addTarget(Target.builder()
                .targetId(0)
                .target("HD 1234")
                .coordinates(12.5, -45.25, 2000.0)
                .spectralType("G2V")
                .build());
        targets.addTarget(Target.builder()
                .targetId(1)
                .target("Calibrator")
                .parallax(1.5e-6, 1.0e-8)
                .category("CAL")
                .build());
        return targets;
    }
}
