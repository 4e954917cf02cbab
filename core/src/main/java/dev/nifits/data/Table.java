/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * In-memory binary table: an ordered list of typed columns and a variable number of rows.
 * <p>
 * Cells are stored in a normalized representation which depends on the column type and
 * on whether the column is scalar:
 * </p>
 * <table>
 *   <caption>Cell representation</caption>
 *   <tr><th>Type</th><th>Scalar</th><th>Array</th></tr>
 *   <tr><td>BOOLEAN</td><td>{@code Boolean}</td><td>{@code boolean[]}</td></tr>
 *   <tr><td>BYTE, INT16, INT32, INT64</td><td>{@code Long}</td><td>{@code long[]}</td></tr>
 *   <tr><td>FLOAT32, FLOAT64</td><td>{@code Double}</td><td>{@code double[]}</td></tr>
 *   <tr><td>COMPLEX64, COMPLEX128</td><td>{@link Complex}</td><td>{@link ComplexNdArray}</td></tr>
 *   <tr><td>STRING</td><td>{@code String}</td><td>n/a</td></tr>
 * </table>
 * <p>
 * Array cells are flattened in row-major order of the column's cell shape. Values of
 * single precision columns are rounded to {@code float} on insertion so that they survive
 * a write/read cycle unchanged.
 * </p>
 */
public final class Table implements Payload {

    private final List<ColumnSchema> columns;
    private final List<List<Object>> cells;
    private int rowCount;

    public Table(List<ColumnSchema> columns) {
        this.columns = List.copyOf(columns);
        this.cells = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            String name = columns.get(i).name();
            for (int j = 0; j < i; j++) {
                if (columns.get(j).name().equalsIgnoreCase(name)) {
                    throw new IllegalArgumentException("Duplicate column name: " + name);
                }
            }
            cells.add(new ArrayList<>());
        }
    }

    public static Table of(ColumnSchema... columns) {
        return new Table(Arrays.asList(columns));
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rowCount;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    public ColumnSchema getColumn(String name) {
        return columns.get(requireIndex(name));
    }

    public boolean hasColumn(String name) {
        return indexOf(name) >= 0;
    }

    /**
     * Case-insensitive column lookup, as FITS column names are.
     *
     * @return the column index, or -1 if there is no such column
     */
    public int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private int requireIndex(String name) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return index;
    }

    /**
     * Appends one row. Values are given in column order and converted to the
     * normalized cell representation.
     */
    public void addRow(Object... values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " values, got " + values.length);
        }
        List<Object> row = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            row.add(normalize(columns.get(i), values[i]));
        }
        for (int i = 0; i < values.length; i++) {
            cells.get(i).add(row.get(i));
        }
        rowCount++;
    }

    public void removeRow(int row) {
        Objects.checkIndex(row, rowCount);
        for (List<Object> column : cells) {
            column.remove(row);
        }
        rowCount--;
    }

    /**
     * Returns a cell value. Array cells are returned as copies.
     */
    public Object getValue(int row, int column) {
        Objects.checkIndex(row, rowCount);
        return copyCell(cells.get(column).get(row));
    }

    public Object getValue(int row, String column) {
        return getValue(row, requireIndex(column));
    }

    public void setValue(int row, String column, Object value) {
        Objects.checkIndex(row, rowCount);
        int index = requireIndex(column);
        cells.get(index).set(row, normalize(columns.get(index), value));
    }

    public List<Object> getRow(int row) {
        Objects.checkIndex(row, rowCount);
        List<Object> values = new ArrayList<>(columns.size());
        for (List<Object> column : cells) {
            values.add(copyCell(column.get(row)));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Returns a numeric column as an array of shape {@code (rows, cellShape...)}.
     */
    public NdArray getDoubleColumn(String name) {
        int index = requireIndex(name);
        ColumnSchema column = columns.get(index);
        if (!column.type().isInteger() && !column.type().isFloatingPoint()) {
            throw new IllegalArgumentException("Column " + name + " is not numeric: " + column.type());
        }
        int cellSize = column.cellSize();
        double[] data = new double[rowCount * cellSize];
        List<Object> values = cells.get(index);
        for (int row = 0; row < rowCount; row++) {
            Object cell = values.get(row);
            if (cell instanceof Number number) {
                data[row] = number.doubleValue();
            }
            else if (cell instanceof double[] doubles) {
                System.arraycopy(doubles, 0, data, row * cellSize, cellSize);
            }
            else {
                long[] longs = (long[]) cell;
                for (int i = 0; i < cellSize; i++) {
                    data[row * cellSize + i] = longs[i];
                }
            }
        }
        return NdArray.wrap(rowShape(column), data);
    }

    /**
     * Returns an integer column flattened in row-major order.
     */
    public long[] getLongColumn(String name) {
        int index = requireIndex(name);
        ColumnSchema column = columns.get(index);
        if (!column.type().isInteger()) {
            throw new IllegalArgumentException("Column " + name + " is not an integer column: " + column.type());
        }
        int cellSize = column.cellSize();
        long[] data = new long[rowCount * cellSize];
        List<Object> values = cells.get(index);
        for (int row = 0; row < rowCount; row++) {
            Object cell = values.get(row);
            if (cell instanceof Long value) {
                data[row] = value;
            }
            else {
                System.arraycopy((long[]) cell, 0, data, row * cellSize, cellSize);
            }
        }
        return data;
    }

    /**
     * Returns a complex column as an array of shape {@code (rows, cellShape...)}.
     */
    public ComplexNdArray getComplexColumn(String name) {
        int index = requireIndex(name);
        ColumnSchema column = columns.get(index);
        if (!column.type().isComplex()) {
            throw new IllegalArgumentException("Column " + name + " is not complex: " + column.type());
        }
        int cellSize = column.cellSize();
        double[] real = new double[rowCount * cellSize];
        double[] imag = new double[rowCount * cellSize];
        List<Object> values = cells.get(index);
        for (int row = 0; row < rowCount; row++) {
            Object cell = values.get(row);
            if (cell instanceof Complex value) {
                real[row] = value.real();
                imag[row] = value.imag();
            }
            else {
                ComplexNdArray array = (ComplexNdArray) cell;
                for (int i = 0; i < cellSize; i++) {
                    Complex value = array.getFlat(i);
                    real[row * cellSize + i] = value.real();
                    imag[row * cellSize + i] = value.imag();
                }
            }
        }
        return new ComplexNdArray(rowShape(column), real, imag);
    }

    public List<String> getStringColumn(String name) {
        int index = requireIndex(name);
        if (columns.get(index).type() != ColumnType.STRING) {
            throw new IllegalArgumentException("Column " + name + " is not a string column");
        }
        List<String> values = new ArrayList<>(rowCount);
        for (Object cell : cells.get(index)) {
            values.add((String) cell);
        }
        return Collections.unmodifiableList(values);
    }

    public boolean[] getBooleanColumn(String name) {
        int index = requireIndex(name);
        ColumnSchema column = columns.get(index);
        if (column.type() != ColumnType.BOOLEAN) {
            throw new IllegalArgumentException("Column " + name + " is not a boolean column");
        }
        int cellSize = column.cellSize();
        boolean[] data = new boolean[rowCount * cellSize];
        List<Object> values = cells.get(index);
        for (int row = 0; row < rowCount; row++) {
            Object cell = values.get(row);
            if (cell instanceof Boolean value) {
                data[row] = value;
            }
            else {
                System.arraycopy((boolean[]) cell, 0, data, row * cellSize, cellSize);
            }
        }
        return data;
    }

    private int[] rowShape(ColumnSchema column) {
        int[] cellShape = column.cellShape();
        int[] shape = new int[cellShape.length + 1];
        shape[0] = rowCount;
        System.arraycopy(cellShape, 0, shape, 1, cellShape.length);
        return shape;
    }

    /**
     * Deep copy; the returned table shares no mutable state with this one.
     */
    public Table copy() {
        Table copy = new Table(columns);
        for (int i = 0; i < cells.size(); i++) {
            List<Object> target = copy.cells.get(i);
            for (Object cell : cells.get(i)) {
                target.add(copyCell(cell));
            }
        }
        copy.rowCount = rowCount;
        return copy;
    }

    static Object normalize(ColumnSchema column, Object value) {
        Objects.requireNonNull(value, () -> "Null value for column " + column.name());
        ColumnType type = column.type();
        if (column.isScalar()) {
            return switch (type) {
                case BOOLEAN -> requireType(column, value, Boolean.class);
                case BYTE, INT16, INT32, INT64 -> checkRange(column, requireInteger(column, value));
                case FLOAT32 -> (double) (float) requireType(column, value, Number.class).doubleValue();
                case FLOAT64 -> requireType(column, value, Number.class).doubleValue();
                case COMPLEX64, COMPLEX128 -> toComplex(column, value);
                case STRING -> requireType(column, value, CharSequence.class).toString();
            };
        }
        int cellSize = column.cellSize();
        Object cell = switch (type) {
            case BOOLEAN -> requireType(column, value, boolean[].class).clone();
            case BYTE, INT16, INT32, INT64 -> toLongs(column, value);
            case FLOAT32, FLOAT64 -> toDoubles(column, value);
            case COMPLEX64, COMPLEX128 -> toComplexArray(column, value);
            case STRING -> throw new IllegalArgumentException("String column " + column.name() + " must be scalar");
        };
        int length;
        if (cell instanceof ComplexNdArray array) {
            length = array.size();
        }
        else if (cell instanceof double[] doubles) {
            length = doubles.length;
        }
        else if (cell instanceof long[] longs) {
            length = longs.length;
        }
        else {
            length = ((boolean[]) cell).length;
        }
        if (length != cellSize) {
            throw new IllegalArgumentException("Column " + column.name() + " expects " + cellSize
                    + " values per cell, got " + length);
        }
        return cell;
    }

    private static <T> T requireType(ColumnSchema column, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Column " + column.name() + " of type " + column.type()
                    + " does not accept " + value.getClass().getSimpleName());
        }
        return type.cast(value);
    }

    private static long requireInteger(ColumnSchema column, Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("Column " + column.name() + " of type " + column.type()
                + " does not accept " + value.getClass().getSimpleName());
    }

    private static long checkRange(ColumnSchema column, long value) {
        boolean inRange = switch (column.type()) {
            case BYTE -> value >= 0 && value <= 0xFF;
            case INT16 -> value >= Short.MIN_VALUE && value <= Short.MAX_VALUE;
            case INT32 -> value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            default -> true;
        };
        if (!inRange) {
            throw new IllegalArgumentException("Value " + value + " out of range for column " + column.name()
                    + " of type " + column.type());
        }
        return value;
    }

    private static long[] toLongs(ColumnSchema column, Object value) {
        long[] longs;
        if (value instanceof long[] array) {
            longs = array.clone();
        }
        else if (value instanceof int[] array) {
            longs = new long[array.length];
            for (int i = 0; i < array.length; i++) {
                longs[i] = array[i];
            }
        }
        else {
            throw new IllegalArgumentException("Column " + column.name() + " of type " + column.type()
                    + " does not accept " + value.getClass().getSimpleName());
        }
        for (long l : longs) {
            checkRange(column, l);
        }
        return longs;
    }

    private static double[] toDoubles(ColumnSchema column, Object value) {
        double[] doubles;
        if (value instanceof double[] array) {
            doubles = array.clone();
        }
        else if (value instanceof float[] array) {
            doubles = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                doubles[i] = array[i];
            }
        }
        else if (value instanceof NdArray array) {
            doubles = array.toArray();
        }
        else {
            throw new IllegalArgumentException("Column " + column.name() + " of type " + column.type()
                    + " does not accept " + value.getClass().getSimpleName());
        }
        if (column.type() == ColumnType.FLOAT32) {
            for (int i = 0; i < doubles.length; i++) {
                doubles[i] = (float) doubles[i];
            }
        }
        return doubles;
    }

    private static Complex toComplex(ColumnSchema column, Object value) {
        Complex complex;
        if (value instanceof Complex c) {
            complex = c;
        }
        else if (value instanceof Number number) {
            complex = new Complex(number.doubleValue(), 0.0);
        }
        else {
            throw new IllegalArgumentException("Column " + column.name() + " of type " + column.type()
                    + " does not accept " + value.getClass().getSimpleName());
        }
        if (column.type() == ColumnType.COMPLEX64) {
            complex = new Complex((float) complex.real(), (float) complex.imag());
        }
        return complex;
    }

    private static ComplexNdArray toComplexArray(ColumnSchema column, Object value) {
        ComplexNdArray array = requireType(column, value, ComplexNdArray.class);
        int[] shape = column.cellShape();
        NdArray real = array.real();
        NdArray imag = array.imag();
        double[] re = real.values();
        double[] im = imag.values();
        if (column.type() == ColumnType.COMPLEX64) {
            for (int i = 0; i < re.length; i++) {
                re[i] = (float) re[i];
                im[i] = (float) im[i];
            }
        }
        if (re.length != column.cellSize()) {
            throw new IllegalArgumentException("Column " + column.name() + " expects " + column.cellSize()
                    + " values per cell, got " + re.length);
        }
        return new ComplexNdArray(shape, re, im);
    }

    private static Object copyCell(Object cell) {
        if (cell instanceof double[] doubles) {
            return doubles.clone();
        }
        if (cell instanceof long[] longs) {
            return longs.clone();
        }
        if (cell instanceof boolean[] booleans) {
            return booleans.clone();
        }
        if (cell instanceof ComplexNdArray array) {
            return array.copy();
        }
        return cell;
    }

    private static boolean cellEquals(Object a, Object b) {
        if (a instanceof double[] x && b instanceof double[] y) {
            return Arrays.equals(x, y);
        }
        if (a instanceof long[] x && b instanceof long[] y) {
            return Arrays.equals(x, y);
        }
        if (a instanceof boolean[] x && b instanceof boolean[] y) {
            return Arrays.equals(x, y);
        }
        return Objects.equals(a, b);
    }

    private static int cellHash(Object cell) {
        if (cell instanceof double[] doubles) {
            return Arrays.hashCode(doubles);
        }
        if (cell instanceof long[] longs) {
            return Arrays.hashCode(longs);
        }
        if (cell instanceof boolean[] booleans) {
            return Arrays.hashCode(booleans);
        }
        return Objects.hashCode(cell);
    }

    /**
     * Two tables are equal if they have the same columns and equal rows, compared
     * cell by cell (floating point values bit-exact).
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table other)) {
            return false;
        }
        if (rowCount != other.rowCount || !columns.equals(other.columns)) {
            return false;
        }
        for (int i = 0; i < cells.size(); i++) {
            List<Object> mine = cells.get(i);
            List<Object> theirs = other.cells.get(i);
            for (int row = 0; row < rowCount; row++) {
                if (!cellEquals(mine.get(row), theirs.get(row))) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = columns.hashCode();
        for (List<Object> column : cells) {
            for (Object cell : column) {
                hash = 31 * hash + cellHash(cell);
            }
        }
        return hash;
    }

    @Override
    public String toString() {
        return "Table" + columns + " (" + rowCount + " rows)";
    }
}
