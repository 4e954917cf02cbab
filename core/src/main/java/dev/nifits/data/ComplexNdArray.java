/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.data;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense N-dimensional array of complex values in row-major order, held as two parallel
 * planes of doubles.
 * <p>
 * FITS has no complex image type; on disk such an array becomes a real array with an
 * extra leading axis of length 2, see {@link #toPlanes()} and {@link #fromPlanes(NdArray)}.
 * </p>
 */
public final class ComplexNdArray {

    private final int[] shape;
    private final double[] real;
    private final double[] imag;

    public ComplexNdArray(int[] shape, double[] real, double[] imag) {
        long size = NdArray.sizeOf(shape);
        if (real.length != size || imag.length != size) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " requires " + size
                    + " values, got " + real.length + " real and " + imag.length + " imaginary");
        }
        this.shape = shape.clone();
        this.real = real.clone();
        this.imag = imag.clone();
    }

    public static ComplexNdArray zeros(int... shape) {
        int size = Math.toIntExact(NdArray.sizeOf(shape));
        return new ComplexNdArray(shape, new double[size], new double[size]);
    }

    /**
     * Merges the two planes of a real array whose leading axis has length 2
     * (plane 0 holds the real parts, plane 1 the imaginary parts).
     *
     * @throws IllegalArgumentException if the leading dimension is not exactly 2
     */
    public static ComplexNdArray fromPlanes(NdArray planes) {
        if (planes.rank() < 1 || planes.dim(0) != 2) {
            throw new IllegalArgumentException("Expected a leading axis of length 2 for (real, imag) planes, got shape "
                    + Arrays.toString(planes.shape()));
        }
        int[] shape = Arrays.copyOfRange(planes.shape(), 1, planes.rank());
        double[] values = planes.values();
        int half = values.length / 2;
        return new ComplexNdArray(shape, Arrays.copyOfRange(values, 0, half), Arrays.copyOfRange(values, half, values.length));
    }

    /**
     * Stacks the real and imaginary parts along a new leading axis of length 2.
     */
    public NdArray toPlanes() {
        int[] planeShape = new int[shape.length + 1];
        planeShape[0] = 2;
        System.arraycopy(shape, 0, planeShape, 1, shape.length);
        double[] values = new double[real.length * 2];
        System.arraycopy(real, 0, values, 0, real.length);
        System.arraycopy(imag, 0, values, real.length, imag.length);
        return NdArray.wrap(planeShape, values);
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return real.length;
    }

    public Complex get(int... index) {
        int offset = offset(index);
        return new Complex(real[offset], imag[offset]);
    }

    public void set(Complex value, int... index) {
        int offset = offset(index);
        real[offset] = value.real();
        imag[offset] = value.imag();
    }

    public Complex getFlat(int i) {
        return new Complex(real[i], imag[i]);
    }

    public NdArray real() {
        return NdArray.wrap(shape.clone(), real.clone());
    }

    public NdArray imag() {
        return NdArray.wrap(shape.clone(), imag.clone());
    }

    /**
     * Element-wise modulus.
     */
    public NdArray abs() {
        double[] values = new double[real.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.hypot(real[i], imag[i]);
        }
        return NdArray.wrap(shape.clone(), values);
    }

    /**
     * Returns the sub-array at {@code index} along the leading axis, as a copy.
     */
    public ComplexNdArray slice(int index) {
        if (shape.length == 0) {
            throw new IllegalStateException("Cannot slice a rank-0 array");
        }
        Objects.checkIndex(index, shape[0]);
        int[] subShape = Arrays.copyOfRange(shape, 1, shape.length);
        int stride = Math.toIntExact(NdArray.sizeOf(subShape));
        return new ComplexNdArray(subShape,
                Arrays.copyOfRange(real, index * stride, (index + 1) * stride),
                Arrays.copyOfRange(imag, index * stride, (index + 1) * stride));
    }

    public ComplexNdArray copy() {
        return new ComplexNdArray(shape, real, imag);
    }

    public ComplexNdArray reshape(int... newShape) {
        return new ComplexNdArray(newShape, real, imag);
    }

    private int offset(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int offset = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            Objects.checkIndex(index[axis], shape[axis]);
            offset = offset * shape[axis] + index[axis];
        }
        return offset;
    }

    /**
     * Bit-exact comparison of shape and both planes.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ComplexNdArray other)) {
            return false;
        }
        return Arrays.equals(shape, other.shape) && Arrays.equals(real, other.real) && Arrays.equals(imag, other.imag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(shape), Arrays.hashCode(real), Arrays.hashCode(imag));
    }

    @Override
    public String toString() {
        return "ComplexNdArray" + Arrays.toString(shape);
    }
}
