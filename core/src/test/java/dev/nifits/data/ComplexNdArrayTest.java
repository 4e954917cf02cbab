/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.data;

import java.util.Random;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for complex arrays and their plane representation.
 */
public class ComplexNdArrayTest {

    @Test
    void testPlanesRoundTripBitExact() {
        Random random = new Random(17);
        ComplexNdArray array = ComplexNdArray.zeros(3, 4, 5);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 4; j++) {
                for (int k = 0; k < 5; k++) {
                    array.set(new Complex(random.nextGaussian(), random.nextGaussian() * 1e-300), i, j, k);
                }
            }
        }
        array.set(new Complex(-0.0, Double.MIN_VALUE), 0, 0, 0);

        ComplexNdArray decoded = ComplexNdArray.fromPlanes(array.toPlanes());

        assertThat(decoded).isEqualTo(array);
        assertThat(Double.doubleToRawLongBits(decoded.get(0, 0, 0).real()))
                .isEqualTo(Double.doubleToRawLongBits(-0.0));
    }

    @Test
    void testPlaneLayout() {
        ComplexNdArray array = new ComplexNdArray(new int[]{ 2 }, new double[]{ 1, 2 }, new double[]{ 3, 4 });

        NdArray planes = array.toPlanes();

        assertThat(planes.shape()).containsExactly(2, 2);
        assertThat(planes.toArray()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void testFromPlanesRequiresTwoLayers() {
        assertThatThrownBy(() -> ComplexNdArray.fromPlanes(NdArray.zeros(3, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("length 2");
        assertThatThrownBy(() -> ComplexNdArray.fromPlanes(NdArray.vector()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testAbsAndSlice() {
        ComplexNdArray array = ComplexNdArray.zeros(2, 2);
        array.set(new Complex(3.0, 4.0), 1, 0);

        assertThat(array.abs().get(1, 0)).isEqualTo(5.0);
        assertThat(array.slice(1).get(0)).isEqualTo(new Complex(3.0, 4.0));
    }

    @Test
    void testShapeMismatchRejected() {
        assertThatThrownBy(() -> new ComplexNdArray(new int[]{ 2, 2 }, new double[4], new double[3]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
