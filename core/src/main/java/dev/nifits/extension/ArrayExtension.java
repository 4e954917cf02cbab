/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Objects;

import dev.nifits.data.NdArray;
import dev.nifits.internal.fits.StructuralKeywords;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * Base of extensions whose payload is a real-valued image.
 */
public abstract sealed class ArrayExtension implements NifitsExtension permits KernelMatrix, OutputCovariance {

    private NdArray array;
    private Header header;

    protected ArrayExtension(NdArray array, Header header) {
        this.array = Objects.requireNonNull(array, "array");
        this.header = header != null ? header : new Header();
    }

    public NdArray getArray() {
        return array;
    }

    public void setArray(NdArray array) {
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
        header = StructuralKeywords.resync(header, kind().extensionName(), array, false);
        return new FitsRecord(kind().extensionName(), header.copy(), array.copy());
    }

    /**
     * Extracts a copy of the image held by a record.
     *
     * @throws StructuralException if the record does not hold an image
     */
    static NdArray decodeArray(FitsRecord record, ExtensionKind kind) {
        if (!(record.payload() instanceof NdArray array)) {
            throw new StructuralException(kind, "expected an image, found " + record.payload());
        }
        return array.copy();
    }

    @Override
    public String toString() {
        return kind().extensionName() + array;
    }
}
