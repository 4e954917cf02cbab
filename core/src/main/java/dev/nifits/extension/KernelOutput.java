/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import dev.nifits.data.NdArray;
import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * The {@code NI_KIOUT} extension: output values after post-processing with the kernel
 * matrix, typically differential or kernel nulls.
 */
public final class KernelOutput extends TableExtension {

    public KernelOutput(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.KERNEL_OUTPUT;
    }

    public static KernelOutput fromRecord(FitsRecord record) {
        return new KernelOutput(decodeTable(record, ExtensionKind.KERNEL_OUTPUT), record.header().copy());
    }

    public static KernelOutput create(int channels, int kernels) {
        return new KernelOutput(OutputValues.createTable(channels, kernels), OutputValues.defaultHeader());
    }

    public void addFrame(NdArray values) {
        OutputValues.addFrame(getTable(), values);
    }

    /**
     * Processed values of all frames, shape {@code (frames, channels, kernels)}.
     */
    public NdArray values() {
        return getTable().getDoubleColumn(OutputValues.VALUE);
    }

    /**
     * Verifies that the value cells have one column per row of the kernel matrix.
     *
     * @throws StructuralException if they do not
     */
    public void checkAgainst(KernelMatrix kernelMatrix) {
        int[] shape = getTable().getColumn(OutputValues.VALUE).cellShape();
        int channels = shape.length > 0 ? shape[0] : 0;
        OutputValues.check(kind(), getTable(), channels, kernelMatrix.kernelCount(),
                ExtensionKind.KERNEL_MATRIX.extensionName());
    }
}
