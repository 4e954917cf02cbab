/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Arrays;

import dev.nifits.data.NdArray;
import dev.nifits.data.Table;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * Layout shared by the output tables: one row per frame, with a {@code value} cell of
 * shape {@code (channels, outputs)}.
 */
final class OutputValues {

    static final String VALUE = "value";

    private OutputValues() {
    }

    static Header defaultHeader() {
        Header header = new Header();
        header.set("UNITS", "ADU", "The units for output values");
        return header;
    }

    static Table createTable(int channels, int outputs) {
        return Table.of(ColumnSchema.array(VALUE, ColumnType.FLOAT64, channels, outputs));
    }

    static void addFrame(Table table, NdArray values) {
        int[] expected = table.getColumn(VALUE).cellShape();
        if (!Arrays.equals(values.shape(), expected)) {
            throw new IllegalArgumentException("Expected values of shape " + Arrays.toString(expected)
                    + ", got " + Arrays.toString(values.shape()));
        }
        table.addRow(values);
    }

    /**
     * Checks that the value cells have {@code channels} rows and {@code outputs} columns.
     */
    static void check(ExtensionKind kind, Table table, int channels, int outputs, String against) {
        int[] shape = table.getColumn(VALUE).cellShape();
        if (shape.length != 2 || shape[0] != channels || shape[1] != outputs) {
            throw new StructuralException(kind, "value cells of shape " + Arrays.toString(shape)
                    + " do not match " + against + " (" + channels + ", " + outputs + ")");
        }
    }
}
