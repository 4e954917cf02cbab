/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.internal.fits;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import dev.nifits.data.Complex;
import dev.nifits.data.ComplexNdArray;
import dev.nifits.data.Table;
import dev.nifits.io.FitsFormatException;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.FitsException;
import nom.tam.util.ArrayFuncs;

/**
 * Converts between {@link Table} and nom.tam {@link BinaryTable} data.
 * <p>
 * Cell shapes are taken from {@code TDIMn} (or the repeat count of {@code TFORMn}),
 * column names and units from {@code TTYPEn} and {@code TUNITn}. Scaled columns
 * ({@code TSCALn}/{@code TZEROn}) are read as physical values: integer columns with an
 * integral offset are widened to the next integer type, all others become
 * {@link ColumnType#FLOAT64}. Variable-length array columns are not supported.
 * </p>
 */
public final class BinaryTableConverter {

    private static final Pattern TFORM = Pattern.compile("\\s*([0-9]*)([A-Z])(.*)");

    private BinaryTableConverter() {
    }

    // ==================== Reading ====================

    /**
     * One column as stored on disk and as exposed in the table.
     *
     * @param stored the type of the elements on disk
     * @param repeat number of elements per cell (characters for strings)
     */
    private record Field(ColumnSchema column, ColumnType stored, int repeat, double scale, double zero) {

        boolean isScaled() {
            return scale != 1.0 || zero != 0.0;
        }
    }

    public static Table read(BinaryTable data, Header header) throws FitsException, FitsFormatException {
        int fieldCount = header.getInt("TFIELDS");
        List<Field> fields = new ArrayList<>(fieldCount);
        List<ColumnSchema> columns = new ArrayList<>(fieldCount);
        for (int n = 1; n <= fieldCount; n++) {
            Field field = parseField(header, n);
            fields.add(field);
            columns.add(field.column());
        }
        Table table;
        try {
            table = new Table(columns);
        }
        catch (IllegalArgumentException e) {
            throw new FitsFormatException("Invalid table columns: " + e.getMessage(), e);
        }

        Object[] row = new Object[fieldCount];
        for (int r = 0; r < data.getNRows(); r++) {
            for (int i = 0; i < fieldCount; i++) {
                row[i] = decode(fields.get(i), data.getElement(r, i));
            }
            table.addRow(row);
        }
        return table;
    }

    private static Field parseField(Header header, int n) throws FitsFormatException {
        String tform = header.getString("TFORM" + n, null);
        if (tform == null) {
            throw new FitsFormatException("Missing TFORM" + n);
        }
        Matcher matcher = TFORM.matcher(tform.toUpperCase());
        if (!matcher.matches()) {
            throw new FitsFormatException("Invalid TFORM" + n + ": " + tform);
        }
        int repeat = matcher.group(1).isEmpty() ? 1 : Integer.parseInt(matcher.group(1));
        char code = matcher.group(2).charAt(0);
        if (code == 'P' || code == 'Q') {
            throw new FitsFormatException("Variable-length array column TFORM" + n + " is not supported: " + tform);
        }
        ColumnType stored;
        try {
            stored = ColumnType.fromTformCode(code);
        }
        catch (IllegalArgumentException e) {
            throw new FitsFormatException("Unsupported TFORM" + n + ": " + tform, e);
        }

        double scale = header.getDouble("TSCAL" + n, 1.0);
        double zero = header.getDouble("TZERO" + n, 0.0);
        ColumnType type = stored;
        if (scale != 1.0 || zero != 0.0) {
            type = physicalType(stored, scale, zero, n);
        }

        String tdim = header.getString("TDIM" + n, null);
        int[] cellShape;
        if (stored == ColumnType.STRING) {
            cellShape = new int[0];
        }
        else if (tdim != null) {
            cellShape = parseTdim(tdim, n, repeat);
        }
        else {
            cellShape = repeat == 1 ? new int[0] : new int[]{ repeat };
        }
        String name = header.getString("TTYPE" + n, "COL" + n);
        String unit = header.getString("TUNIT" + n, null);
        return new Field(new ColumnSchema(name, type, cellShape, unit), stored, repeat, scale, zero);
    }

    private static ColumnType physicalType(ColumnType stored, double scale, double zero, int n) throws FitsFormatException {
        if (stored.isInteger() && scale == 1.0 && zero == Math.rint(zero)) {
            switch (stored) {
                case BYTE:
                    return ColumnType.INT16;
                case INT16:
                    return ColumnType.INT32;
                case INT32:
                    return ColumnType.INT64;
                default:
                    if (Math.abs(zero) >= 0x1p63) {
                        throw new FitsFormatException("TZERO" + n + " = " + zero + " exceeds the 64-bit integer range");
                    }
                    return ColumnType.INT64;
            }
        }
        if (stored.isInteger() || stored.isFloatingPoint()) {
            return ColumnType.FLOAT64;
        }
        throw new FitsFormatException("Scaling (TSCAL" + n + "/TZERO" + n + ") of " + stored + " columns is not supported");
    }

    private static int[] parseTdim(String tdim, int n, int repeat) throws FitsFormatException {
        String body = tdim.trim();
        if (!body.startsWith("(") || !body.endsWith(")")) {
            throw new FitsFormatException("Invalid TDIM" + n + ": " + tdim);
        }
        String[] parts = body.substring(1, body.length() - 1).split(",");
        int[] shape = new int[parts.length];
        long size = 1;
        try {
            for (int i = 0; i < parts.length; i++) {
                int dim = Integer.parseInt(parts[i].trim());
                shape[parts.length - 1 - i] = dim;
                size *= dim;
            }
        }
        catch (NumberFormatException e) {
            throw new FitsFormatException("Invalid TDIM" + n + ": " + tdim, e);
        }
        if (size != repeat) {
            throw new FitsFormatException("TDIM" + n + " " + tdim + " does not match repeat count " + repeat);
        }
        return shape;
    }

    private static Object decode(Field field, Object element) throws FitsFormatException {
        ColumnSchema column = field.column();
        if (field.stored() == ColumnType.STRING) {
            return decodeString(element);
        }
        Object flat = element.getClass().isArray() ? ArrayFuncs.flatten(element) : element;
        int expected = field.stored().isComplex() ? 2 * field.repeat() : field.repeat();
        switch (field.stored()) {
            case BOOLEAN: {
                boolean[] values = booleans(flat);
                checkLength(column, values.length, expected);
                return column.isScalar() ? (Object) values[0] : values;
            }
            case BYTE:
            case INT16:
            case INT32:
            case INT64: {
                long[] raw = longs(flat);
                checkLength(column, raw.length, expected);
                if (column.type() == ColumnType.FLOAT64) {
                    double[] values = new double[raw.length];
                    for (int i = 0; i < raw.length; i++) {
                        values[i] = raw[i] * field.scale() + field.zero();
                    }
                    return column.isScalar() ? (Object) values[0] : values;
                }
                long offset = (long) field.zero();
                for (int i = 0; i < raw.length; i++) {
                    raw[i] = Math.addExact(raw[i], offset);
                }
                return column.isScalar() ? (Object) raw[0] : raw;
            }
            case FLOAT32:
            case FLOAT64: {
                double[] values = doubles(flat);
                checkLength(column, values.length, expected);
                if (field.isScaled()) {
                    for (int i = 0; i < values.length; i++) {
                        values[i] = values[i] * field.scale() + field.zero();
                    }
                }
                return column.isScalar() ? (Object) values[0] : values;
            }
            default: {
                // complex elements are interleaved (real, imag) pairs
                double[] pairs = doubles(flat);
                checkLength(column, pairs.length, expected);
                double[] real = new double[field.repeat()];
                double[] imag = new double[field.repeat()];
                for (int i = 0; i < real.length; i++) {
                    real[i] = pairs[2 * i];
                    imag[i] = pairs[2 * i + 1];
                }
                return column.isScalar()
                        ? new Complex(real[0], imag[0])
                        : new ComplexNdArray(column.cellShape(), real, imag);
            }
        }
    }

    private static void checkLength(ColumnSchema column, int actual, int expected) throws FitsFormatException {
        if (actual != expected) {
            throw new FitsFormatException("Column " + column.name() + " holds " + actual + " elements per cell, expected "
                    + expected);
        }
    }

    private static String decodeString(Object element) throws FitsFormatException {
        String value;
        if (element instanceof String s) {
            value = s;
        }
        else if (element instanceof String[] strings) {
            value = strings.length == 0 ? "" : strings[0];
        }
        else if (element instanceof byte[] bytes) {
            value = new String(bytes, StandardCharsets.US_ASCII);
        }
        else if (element instanceof char[] chars) {
            value = new String(chars);
        }
        else {
            throw new FitsFormatException("Unexpected string cell representation: " + element.getClass().getName());
        }
        int end = value.indexOf('\0');
        return (end >= 0 ? value.substring(0, end) : value).stripTrailing();
    }

    private static boolean[] booleans(Object flat) throws FitsFormatException {
        if (flat instanceof boolean[] values) {
            return values.clone();
        }
        if (flat instanceof Boolean[] boxed) {
            boolean[] values = new boolean[boxed.length];
            for (int i = 0; i < boxed.length; i++) {
                values[i] = Boolean.TRUE.equals(boxed[i]);
            }
            return values;
        }
        if (flat instanceof Boolean b) {
            return new boolean[]{ b };
        }
        throw new FitsFormatException("Unexpected logical cell representation: " + flat.getClass().getName());
    }

    private static long[] longs(Object flat) throws FitsFormatException {
        long[] values;
        if (flat instanceof long[] array) {
            values = array.clone();
        }
        else if (flat instanceof int[] array) {
            values = new long[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
        }
        else if (flat instanceof short[] array) {
            values = new long[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
        }
        else if (flat instanceof byte[] array) {
            // FITS bytes are unsigned
            values = new long[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i] & 0xFF;
            }
        }
        else if (flat instanceof Byte b) {
            values = new long[]{ b & 0xFF };
        }
        else if (flat instanceof Number number) {
            values = new long[]{ number.longValue() };
        }
        else {
            throw new FitsFormatException("Unexpected integer cell representation: " + flat.getClass().getName());
        }
        return values;
    }

    private static double[] doubles(Object flat) throws FitsFormatException {
        if (flat instanceof double[] array) {
            return array.clone();
        }
        if (flat instanceof float[] array) {
            double[] values = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
            return values;
        }
        if (flat instanceof Number number) {
            return new double[]{ number.doubleValue() };
        }
        throw new FitsFormatException("Unexpected floating-point cell representation: " + flat.getClass().getName());
    }

    // ==================== Writing ====================

    /**
     * Builds the table data for writing. A table without rows is given one row of
     * placeholder values, since nom.tam derives column formats from the data; callers
     * delete that row once the HDU exists.
     */
    public static BinaryTable write(Table table) throws FitsException {
        BinaryTable data = new BinaryTable();
        int rows = Math.max(1, table.getRowCount());
        for (int i = 0; i < table.getColumnCount(); i++) {
            data.addColumn(columnData(table, i, rows));
            if (table.getColumn(i).type().isComplex()) {
                data.setComplexColumn(i);
            }
        }
        return data;
    }

    private static Object columnData(Table table, int index, int rows) {
        ColumnSchema column = table.getColumn(index);
        boolean placeholder = table.getRowCount() == 0;
        int cellSize = column.cellSize();
        switch (column.type()) {
            case STRING: {
                String[] values = new String[rows];
                for (int r = 0; r < rows; r++) {
                    values[r] = placeholder ? "" : requireAscii(column, (String) table.getValue(r, index));
                }
                return values;
            }
            case BOOLEAN: {
                boolean[] values = new boolean[rows * cellSize];
                for (int r = 0; r < rows && !placeholder; r++) {
                    Object cell = table.getValue(r, index);
                    if (cell instanceof boolean[] array) {
                        System.arraycopy(array, 0, values, r * cellSize, cellSize);
                    }
                    else {
                        values[r] = (Boolean) cell;
                    }
                }
                return shape(values, rows, column.cellShape(), false);
            }
            case BYTE:
            case INT16:
            case INT32:
            case INT64: {
                long[] values = new long[rows * cellSize];
                for (int r = 0; r < rows && !placeholder; r++) {
                    Object cell = table.getValue(r, index);
                    if (cell instanceof long[] array) {
                        System.arraycopy(array, 0, values, r * cellSize, cellSize);
                    }
                    else {
                        values[r] = (Long) cell;
                    }
                }
                return shape(narrow(values, column.type()), rows, column.cellShape(), false);
            }
            case FLOAT32:
            case FLOAT64: {
                double[] values = new double[rows * cellSize];
                for (int r = 0; r < rows && !placeholder; r++) {
                    Object cell = table.getValue(r, index);
                    if (cell instanceof double[] array) {
                        System.arraycopy(array, 0, values, r * cellSize, cellSize);
                    }
                    else {
                        values[r] = (Double) cell;
                    }
                }
                if (column.type() == ColumnType.FLOAT32) {
                    float[] floats = new float[values.length];
                    for (int i = 0; i < values.length; i++) {
                        floats[i] = (float) values[i];
                    }
                    return shape(floats, rows, column.cellShape(), false);
                }
                return shape(values, rows, column.cellShape(), false);
            }
            default: {
                double[] pairs = new double[rows * cellSize * 2];
                for (int r = 0; r < rows && !placeholder; r++) {
                    Object cell = table.getValue(r, index);
                    int base = r * cellSize * 2;
                    if (cell instanceof ComplexNdArray array) {
                        for (int i = 0; i < cellSize; i++) {
                            Complex value = array.getFlat(i);
                            pairs[base + 2 * i] = value.real();
                            pairs[base + 2 * i + 1] = value.imag();
                        }
                    }
                    else {
                        Complex value = (Complex) cell;
                        pairs[base] = value.real();
                        pairs[base + 1] = value.imag();
                    }
                }
                if (column.type() == ColumnType.COMPLEX64) {
                    float[] floats = new float[pairs.length];
                    for (int i = 0; i < pairs.length; i++) {
                        floats[i] = (float) pairs[i];
                    }
                    return shape(floats, rows, column.cellShape(), true);
                }
                return shape(pairs, rows, column.cellShape(), true);
            }
        }
    }

    private static Object narrow(long[] values, ColumnType type) {
        switch (type) {
            case BYTE: {
                byte[] bytes = new byte[values.length];
                for (int i = 0; i < values.length; i++) {
                    bytes[i] = (byte) values[i];
                }
                return bytes;
            }
            case INT16: {
                short[] shorts = new short[values.length];
                for (int i = 0; i < values.length; i++) {
                    shorts[i] = (short) values[i];
                }
                return shorts;
            }
            case INT32: {
                int[] ints = new int[values.length];
                for (int i = 0; i < values.length; i++) {
                    ints[i] = (int) values[i];
                }
                return ints;
            }
            default:
                return values;
        }
    }

    /**
     * Reshapes a flat column into one Java array per row; complex columns get a
     * trailing axis of length 2.
     */
    private static Object shape(Object flat, int rows, int[] cellShape, boolean complex) {
        if (cellShape.length == 0 && !complex) {
            return flat;
        }
        int[] dims = new int[cellShape.length + (complex ? 2 : 1)];
        dims[0] = rows;
        System.arraycopy(cellShape, 0, dims, 1, cellShape.length);
        if (complex) {
            dims[dims.length - 1] = 2;
        }
        return ArrayFuncs.curl(flat, dims);
    }

    private static String requireAscii(ColumnSchema column, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c > 0x7E || c < 0x20) {
                throw new IllegalArgumentException("Column " + column.name()
                        + " contains a non-printable or non-ASCII character");
            }
        }
        return value;
    }
}
