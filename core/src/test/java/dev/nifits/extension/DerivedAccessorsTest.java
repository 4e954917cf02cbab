/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import org.junit.jupiter.api.Test;

import dev.nifits.TestExtensions;
import dev.nifits.data.Complex;
import dev.nifits.data.ComplexNdArray;
import dev.nifits.data.NdArray;
import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for the convenience accessors of the table and array kinds.
 */
public class DerivedAccessorsTest {

    // ==================== WavelengthGrid Tests ====================

    @Test
    void testWavelengthGrid() {
        WavelengthGrid grid = WavelengthGrid.create(new double[]{ 1.0e-6, 2.0e-6 }, new double[]{ 1.0e-8, 2.0e-8 });

        assertThat(grid.channelCount()).isEqualTo(2);
        assertThat(grid.wavelengths()).containsExactly(1.0e-6, 2.0e-6);
        assertThat(grid.bandwidths()).containsExactly(1.0e-8, 2.0e-8);
        assertThat(grid.frequencies()[0]).isCloseTo(2.99792458e14, within(1.0));
        assertThat(grid.frequencies()[1]).isCloseTo(1.49896229e14, within(1.0));
        assertThat(grid.frequencyWidths()[0]).isCloseTo(2.99792458e12, within(1.0));
        assertThat(grid.frequencyWidths()[1]).isCloseTo(1.49896229e12, within(1.0));
    }

    @Test
    void testWavelengthGridRejectsMismatchedLengths() {
        assertThatThrownBy(() -> WavelengthGrid.create(new double[2], new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== ModulationSeries Tests ====================

    @Test
    void testDecodedSeriesDoesNotShareRecordCells() {
        FitsRecord record = TestExtensions.modulationSeries().toRecord();
        ModulationSeries decoded = ModulationSeries.fromRecord(record);

        Table table = record.table();
        ComplexNdArray original = ((ComplexNdArray) table.getValue(0, "MOD_PHAS")).copy();
        ((ComplexNdArray) decoded.getTable().getValue(0, "MOD_PHAS")).set(new Complex(7.0, 7.0), 0, 0);

        assertThat(table.getValue(0, "MOD_PHAS")).isEqualTo(original);
    }

    @Test
    void testModulationSeriesShapes() {
        ModulationSeries series = TestExtensions.modulationSeries();

        assertThat(series.frameCount()).isEqualTo(TestExtensions.FRAMES);
        assertThat(series.phasors().shape())
                .containsExactly(TestExtensions.FRAMES, TestExtensions.CHANNELS, TestExtensions.INPUTS);
        assertThat(series.apertureXy().shape()).containsExactly(TestExtensions.FRAMES, TestExtensions.INPUTS, 2);
        assertThat(series.collectingAreas().shape()).containsExactly(TestExtensions.FRAMES, TestExtensions.INPUTS);
        assertThat(series.times()).containsExactly(0.0, 60.0, 120.0, 180.0);
        assertThat(series.targetIds()).containsOnly(0L);
        assertThat(series.fovIndices()).containsExactly(0L, 0L, 1L, 1L, 2L, 2L, 3L, 3L);
        assertThat(series.getTable().getLongColumn("APP_INDEX")).containsExactly(0L, 1L, 0L, 1L, 0L, 1L, 0L, 1L);
        assertThat(series.getHeader().getString("MOD_PHAS_UNITS")).isEqualTo("rad");
    }

    @Test
    void testMeanObservationMjdIsWeightedByIntegrationTime() {
        ModulationSeries series = ModulationSeries.create(1, 1);
        addFrame(series, 60000.0, 10.0);
        addFrame(series, 60001.0, 30.0);

        assertThat(series.meanObservationMjd()).isCloseTo(60000.75, within(1e-9));
    }

    @Test
    void testMeanObservationMjdWithZeroIntegrationTimes() {
        ModulationSeries series = ModulationSeries.create(1, 1);
        addFrame(series, 60000.0, 0.0);
        addFrame(series, 60001.0, 0.0);

        assertThat(series.meanObservationMjd()).isCloseTo(60000.5, within(1e-9));
    }

    @Test
    void testMeanObservationMjdOfEmptySeries() {
        assertThatThrownBy(() -> ModulationSeries.create(1, 1).meanObservationMjd())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testAddFrameRejectsWrongPhasorShape() {
        ModulationSeries series = ModulationSeries.create(3, 2);

        assertThatThrownBy(() -> series.addFrame(0, 0.0, 60000.0, 1.0, ComplexNdArray.zeros(2, 3),
                NdArray.zeros(2, 2), new double[2], new int[2]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("phasors");
    }

    @Test
    void testDefaultHeadersAreIndependent() {
        Header first = ModulationSeries.defaultHeader();
        first.set("MOD_PHAS_UNITS", "deg");

        assertThat(ModulationSeries.defaultHeader().getString("MOD_PHAS_UNITS")).isEqualTo("rad");
        assertThat(RawOutput.defaultHeader()).isNotSameAs(RawOutput.defaultHeader());
    }

    private static void addFrame(ModulationSeries series, double mjd, double integrationTime) {
        series.addFrame(0, 0.0, mjd, integrationTime, ComplexNdArray.zeros(1, 1), NdArray.zeros(1, 2),
                new double[]{ 1.0 }, new int[]{ 0 });
    }

    // ==================== Output Tests ====================

    @Test
    void testRawOutputValues() {
        RawOutput output = TestExtensions.rawOutput();

        NdArray values = output.values();
        assertThat(values.shape()).containsExactly(TestExtensions.FRAMES, TestExtensions.CHANNELS, TestExtensions.OUTPUTS);
        assertThat(values.get(2, 1, 2)).isEqualTo(212.0);
        assertThat(output.getHeader().getString("UNITS")).isEqualTo("ADU");
    }

    @Test
    void testRawOutputCheckedAgainstTransferMatrix() {
        RawOutput output = TestExtensions.rawOutput();
        output.checkAgainst(TestExtensions.transferMatrix());

        RawOutput mismatched = RawOutput.create(TestExtensions.CHANNELS, TestExtensions.OUTPUTS + 1);
        assertThatThrownBy(() -> mismatched.checkAgainst(TestExtensions.transferMatrix()))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("NI_IOUT")
                .hasMessageContaining("NI_CATM");
    }

    @Test
    void testKernelOutputCheckedAgainstKernelMatrix() {
        KernelOutput output = TestExtensions.kernelOutput();
        output.checkAgainst(TestExtensions.kernelMatrix());

        KernelMatrix wider = KernelMatrix.create(NdArray.zeros(5, TestExtensions.OUTPUTS));
        assertThatThrownBy(() -> output.checkAgainst(wider))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("NI_KMAT");
    }

    @Test
    void testKernelMatrixCounts() {
        KernelMatrix matrix = TestExtensions.kernelMatrix();

        assertThat(matrix.kernelCount()).isEqualTo(TestExtensions.KERNELS);
        assertThat(matrix.outputCount()).isEqualTo(TestExtensions.OUTPUTS);
    }

    @Test
    void testOutputCovariance() {
        OutputCovariance covariance = TestExtensions.outputCovariance();

        assertThat(covariance.covariance().get(3, 3)).isEqualTo(4.0);
        assertThat(covariance.covariance().get(3, 2)).isZero();
    }

    @Test
    void testAddFrameRejectsWrongValueShape() {
        RawOutput output = RawOutput.create(2, 3);

        assertThatThrownBy(() -> output.addFrame(NdArray.zeros(3, 2)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
