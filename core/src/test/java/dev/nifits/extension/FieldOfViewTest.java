/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import org.junit.jupiter.api.Test;

import dev.nifits.data.ComplexNdArray;
import dev.nifits.metadata.Header;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for the field-of-view extension.
 */
public class FieldOfViewTest {

    private static final double[] WAVELENGTHS = { 4.0e-6, 8.0e-6 };

    @Test
    void testSimpleFromHeader() {
        FieldOfView fov = FieldOfView.simpleFromHeader(FieldOfView.defaultHeader(), WAVELENGTHS, 3);

        assertThat(fov.getRowCount()).isEqualTo(3);
        assertThat(fov.mode()).isEqualTo(FieldOfView.GAUSSIAN_RADIAL);
        assertThat(fov.telescopeDiameter()).isEqualTo(8.0);
        assertThat(fov.offsets().shape()).containsExactly(3, 2, 2);
        assertThat(fov.offsets().toArray()).containsOnly(0.0);
        assertThat(fov.getTable().getLongColumn("INDEX")).containsExactly(0L, 1L, 2L);
    }

    @Test
    void testDiameterUnitConversion() {
        Header header = FieldOfView.defaultHeader();
        header.set("FOV_TELDIAM", 180.0);
        header.set("FOV_TELDIAM_UNIT", "cm");

        FieldOfView fov = FieldOfView.simpleFromHeader(header, WAVELENGTHS, 1);

        assertThat(fov.telescopeDiameter()).isCloseTo(1.8, within(1e-12));
    }

    @Test
    void testUnknownUnitRejected() {
        Header header = FieldOfView.defaultHeader();
        header.set("FOV_TELDIAM_UNIT", "furlong");

        assertThatThrownBy(() -> FieldOfView.simpleFromHeader(header, WAVELENGTHS, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("furlong");
    }

    @Test
    void testGaussianProfile() {
        FieldOfView fov = FieldOfView.simpleFromHeader(FieldOfView.defaultHeader(), WAVELENGTHS, 1);
        double r0 = WAVELENGTHS[0] / 8.0 * FieldOfView.RAD_TO_MAS;

        ComplexNdArray phasors = fov.phasorFunction(WAVELENGTHS, 0)
                .evaluate(new double[]{ 0.0, r0 }, new double[]{ 0.0, 0.0 });

        assertThat(phasors.shape()).containsExactly(2, 2);
        assertThat(phasors.get(0, 0).real()).isEqualTo(1.0);
        assertThat(phasors.get(0, 1).real()).isCloseTo(Math.exp(-1.0), within(1e-12));
        assertThat(phasors.get(1, 1).real()).isCloseTo(Math.exp(-0.25), within(1e-12));
        assertThat(phasors.get(1, 1).imag()).isZero();
    }

    @Test
    void testUnsupportedModeRejected() {
        FieldOfView fov = FieldOfView.simpleFromHeader(FieldOfView.defaultHeader(), WAVELENGTHS, 1);
        fov.getHeader().set("FOV_MODE", "tabulated");

        assertThatThrownBy(() -> fov.phasorFunction(WAVELENGTHS, 0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tabulated");
    }

    @Test
    void testCallerHeaderNotShared() {
        Header header = FieldOfView.defaultHeader();
        FieldOfView fov = FieldOfView.simpleFromHeader(header, WAVELENGTHS, 1);
        header.set("FOV_TELDIAM", 1.0);

        assertThat(fov.telescopeDiameter()).isEqualTo(8.0);
    }
}
