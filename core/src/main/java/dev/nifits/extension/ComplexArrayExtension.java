/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Arrays;
import java.util.Objects;

import dev.nifits.data.ComplexNdArray;
import dev.nifits.data.NdArray;
import dev.nifits.internal.fits.StructuralKeywords;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * Base of extensions holding a complex array.
 * <p>
 * The array is kept complex in memory; on disk it is a real image with an extra
 * leading axis of length 2, plane 0 holding the real parts and plane 1 the imaginary
 * parts. Splitting and stacking the planes copies values without any rounding.
 * </p>
 */
public abstract sealed class ComplexArrayExtension implements NifitsExtension permits TransferMatrix {

    private ComplexNdArray array;
    private Header header;

    protected ComplexArrayExtension(ComplexNdArray array, Header header) {
        this.array = Objects.requireNonNull(array, "array");
        this.header = header != null ? header : new Header();
    }

    public ComplexNdArray getArray() {
        return array;
    }

    public void setArray(ComplexNdArray array) {
        this.array = Objects.requireNonNull(array, "array");
    }

    @Override
    public Header getHeader() {
        return header;
    }

    @Override
    public void setHeader(Header header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    @Override
    public FitsRecord toRecord() {
        NdArray planes = array.toPlanes();
        header = StructuralKeywords.resync(header, kind().extensionName(), planes, false);
        return new FitsRecord(kind().extensionName(), header.copy(), planes);
    }

    /**
     * Merges the (real, imag) planes of the image held by a record.
     *
     * @throws StructuralException if the record does not hold an image or its leading
     *                             dimension is not exactly 2
     */
    static ComplexNdArray decodeComplex(FitsRecord record, ExtensionKind kind) {
        if (!(record.payload() instanceof NdArray planes)) {
            throw new StructuralException(kind, "expected an image, found " + record.payload());
        }
        if (planes.rank() < 1 || planes.dim(0) != 2) {
            throw new StructuralException(kind, "data should have 2 layers for real and imag, got shape "
                    + Arrays.toString(planes.shape()));
        }
        return ComplexNdArray.fromPlanes(planes);
    }

    @Override
    public String toString() {
        return kind().extensionName() + array;
    }
}
