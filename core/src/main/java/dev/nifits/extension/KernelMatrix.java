/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import dev.nifits.data.NdArray;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * The {@code NI_KMAT} extension: the real matrix that combines outputs into kernels,
 * of shape {@code (kernels, outputs)}.
 */
public final class KernelMatrix extends ArrayExtension {

    public KernelMatrix(NdArray matrix, Header header) {
        super(matrix, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.KERNEL_MATRIX;
    }

    public static KernelMatrix fromRecord(FitsRecord record) {
        return new KernelMatrix(decodeArray(record, ExtensionKind.KERNEL_MATRIX), record.header().copy());
    }

    public static KernelMatrix create(NdArray matrix) {
        return new KernelMatrix(matrix, new Header());
    }

    public NdArray matrix() {
        return getArray();
    }

    public int kernelCount() {
        requireMatrix();
        return getArray().dim(0);
    }

    public int outputCount() {
        requireMatrix();
        return getArray().dim(1);
    }

    private void requireMatrix() {
        if (getArray().rank() != 2) {
            throw new IllegalStateException("NI_KMAT should have rank 2 (kernels, outputs), got " + getArray());
        }
    }
}
