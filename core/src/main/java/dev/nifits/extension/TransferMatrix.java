/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Arrays;

import dev.nifits.data.ComplexNdArray;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * The {@code NI_CATM} extension: the complex amplitude transfer matrix of the combiner,
 * of shape {@code (channels, outputs, inputs)}.
 */
public final class TransferMatrix extends ComplexArrayExtension {

    public TransferMatrix(ComplexNdArray matrix, Header header) {
        super(matrix, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.TRANSFER_MATRIX;
    }

    /**
     * @throws StructuralException if the image does not have a leading axis of length 2, or
     *         the complex array is not of rank 3
     */
    public static TransferMatrix fromRecord(FitsRecord record) {
        ComplexNdArray matrix = decodeComplex(record, ExtensionKind.TRANSFER_MATRIX);
        if (matrix.rank() != 3) {
            throw new StructuralException(ExtensionKind.TRANSFER_MATRIX,
                    "expected rank 3 (channels, outputs, inputs), got shape " + Arrays.toString(matrix.shape()));
        }
        return new TransferMatrix(matrix, record.header().copy());
    }

    public static TransferMatrix create(ComplexNdArray matrix) {
        return new TransferMatrix(matrix, new Header());
    }

    public ComplexNdArray matrix() {
        return getArray();
    }

    public int channelCount() {
        return dimension(0);
    }

    public int outputCount() {
        return dimension(1);
    }

    public int inputCount() {
        return dimension(2);
    }

    private int dimension(int axis) {
        ComplexNdArray matrix = getArray();
        if (matrix.rank() != 3) {
            throw new IllegalStateException("NI_CATM should have rank 3 (channels, outputs, inputs), got " + matrix);
        }
        return matrix.dim(axis);
    }
}
