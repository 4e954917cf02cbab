/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.schema;

/**
 * Element types of binary table columns, keyed by their FITS {@code TFORMn} code.
 */
public enum ColumnType {
    BOOLEAN('L', 1),
    BYTE('B', 1),
    INT16('I', 2),
    INT32('J', 4),
    INT64('K', 8),
    FLOAT32('E', 4),
    FLOAT64('D', 8),
    COMPLEX64('C', 8),
    COMPLEX128('M', 16),
    STRING('A', 1);

    private final char tformCode;
    private final int elementSize;

    ColumnType(char tformCode, int elementSize) {
        this.tformCode = tformCode;
        this.elementSize = elementSize;
    }

    public char getTformCode() {
        return tformCode;
    }

    /**
     * Size in bytes of one element on disk (one character for strings).
     */
    public int getElementSize() {
        return elementSize;
    }

    public boolean isInteger() {
        return this == BYTE || this == INT16 || this == INT32 || this == INT64;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isComplex() {
        return this == COMPLEX64 || this == COMPLEX128;
    }

    public static ColumnType fromTformCode(char code) {
        for (ColumnType type : values()) {
            if (type.tformCode == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported TFORM code: " + code);
    }
}
