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
 * Dense N-dimensional array of doubles in row-major order (the last axis varies fastest).
 * <p>
 * The shape follows the C convention, which is the reverse of the FITS {@code NAXISn}
 * order: an image with {@code NAXIS1 = 4} and {@code NAXIS2 = 3} has shape {@code [3, 4]}.
 * </p>
 */
public final class NdArray implements Payload {

    private final int[] shape;
    private final double[] data;

    /**
     * Creates an array over the given values. Both arguments are copied.
     */
    public NdArray(int[] shape, double[] data) {
        this(shape.clone(), data.clone(), false);
    }

    private NdArray(int[] shape, double[] data, boolean ignored) {
        long size = sizeOf(shape);
        if (size != data.length) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " requires " + size
                    + " values, got " + data.length);
        }
        this.shape = shape;
        this.data = data;
    }

    /**
     * Wraps the given arrays without copying. The caller must not retain them.
     */
    static NdArray wrap(int[] shape, double[] data) {
        return new NdArray(shape, data, false);
    }

    public static NdArray zeros(int... shape) {
        return wrap(shape.clone(), new double[Math.toIntExact(sizeOf(shape))]);
    }

    public static NdArray vector(double... values) {
        return wrap(new int[]{ values.length }, values.clone());
    }

    /**
     * Creates a two-dimensional array from a rectangular matrix.
     */
    public static NdArray matrix(double[][] rows) {
        int columns = rows.length == 0 ? 0 : rows[0].length;
        double[] data = new double[rows.length * columns];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != columns) {
                throw new IllegalArgumentException("Row " + i + " has " + rows[i].length + " values, expected " + columns);
            }
            System.arraycopy(rows[i], 0, data, i * columns, columns);
        }
        return wrap(new int[]{ rows.length, columns }, data);
    }

    static long sizeOf(int[] shape) {
        long size = 1;
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            size *= dim;
        }
        return size;
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
        return data.length;
    }

    /**
     * Returns a copy of the values in row-major order.
     */
    public double[] toArray() {
        return data.clone();
    }

    /**
     * Direct view of the values, for codecs that stream them without copying.
     */
    double[] values() {
        return data;
    }

    public double get(int... index) {
        return data[offset(index)];
    }

    public void set(double value, int... index) {
        data[offset(index)] = value;
    }

    public double getFlat(int i) {
        return data[i];
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
     * Returns the sub-array at {@code index} along the leading axis, as a copy.
     */
    public NdArray slice(int index) {
        if (shape.length == 0) {
            throw new IllegalStateException("Cannot slice a rank-0 array");
        }
        Objects.checkIndex(index, shape[0]);
        int[] subShape = Arrays.copyOfRange(shape, 1, shape.length);
        int stride = Math.toIntExact(sizeOf(subShape));
        return wrap(subShape, Arrays.copyOfRange(data, index * stride, (index + 1) * stride));
    }

    public NdArray reshape(int... newShape) {
        return new NdArray(newShape, data);
    }

    public NdArray copy() {
        return wrap(shape.clone(), data.clone());
    }

    /**
     * Stacks equally shaped arrays along a new leading axis.
     */
    public static NdArray stack(int[] itemShape, double[]... items) {
        int itemSize = Math.toIntExact(sizeOf(itemShape));
        double[] data = new double[items.length * itemSize];
        for (int i = 0; i < items.length; i++) {
            if (items[i].length != itemSize) {
                throw new IllegalArgumentException("Item " + i + " has " + items[i].length + " values, expected " + itemSize);
            }
            System.arraycopy(items[i], 0, data, i * itemSize, itemSize);
        }
        int[] shape = new int[itemShape.length + 1];
        shape[0] = items.length;
        System.arraycopy(itemShape, 0, shape, 1, itemShape.length);
        return wrap(shape, data);
    }

    /**
     * Bit-exact comparison of shape and values.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NdArray other)) {
            return false;
        }
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NdArray" + Arrays.toString(shape);
    }
}
