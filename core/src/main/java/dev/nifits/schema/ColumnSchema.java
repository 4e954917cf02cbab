/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.schema;

import java.util.Arrays;
import java.util.Objects;

/**
 * A binary table column: its name, element type, the shape of one cell and an
 * optional physical unit.
 * <p>
 * Scalar columns have an empty cell shape. String columns are always scalar; their
 * on-disk width is derived from the longest value when the table is written.
 * </p>
 */
public record ColumnSchema(String name, ColumnType type, int[] cellShape, String unit) {

    public ColumnSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        cellShape = cellShape == null ? new int[0] : cellShape.clone();
        for (int dim : cellShape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in cell shape of column " + name);
            }
        }
        if (type == ColumnType.STRING && cellShape.length > 0) {
            throw new IllegalArgumentException("String column " + name + " must be scalar");
        }
    }

    public static ColumnSchema scalar(String name, ColumnType type) {
        return new ColumnSchema(name, type, new int[0], null);
    }

    public static ColumnSchema array(String name, ColumnType type, int... cellShape) {
        return new ColumnSchema(name, type, cellShape, null);
    }

    public ColumnSchema withUnit(String unit) {
        return new ColumnSchema(name, type, cellShape, unit);
    }

    @Override
    public int[] cellShape() {
        return cellShape.clone();
    }

    public boolean isScalar() {
        return cellShape.length == 0;
    }

    /**
     * Number of elements in one cell.
     */
    public int cellSize() {
        int size = 1;
        for (int dim : cellShape) {
            size = Math.multiplyExact(size, dim);
        }
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnSchema other)) {
            return false;
        }
        return name.equals(other.name) && type == other.type && Arrays.equals(cellShape, other.cellShape)
                && Objects.equals(unit, other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, Arrays.hashCode(cellShape), unit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type.name().toLowerCase());
        if (!isScalar()) {
            sb.append(Arrays.toString(cellShape));
        }
        sb.append(" ").append(name);
        if (unit != null) {
            sb.append(" [").append(unit).append("]");
        }
        return sb.toString();
    }
}
