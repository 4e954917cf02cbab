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
 * The {@code NI_IOUT} extension: recorded output values (intensity, flux, counts or
 * arbitrary units), one row per frame.
 */
public final class RawOutput extends TableExtension {

    public RawOutput(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.RAW_OUTPUT;
    }

    public static RawOutput fromRecord(FitsRecord record) {
        return new RawOutput(decodeTable(record, ExtensionKind.RAW_OUTPUT), record.header().copy());
    }

    /**
     * Returns a new header declaring the output units as {@code ADU}.
     */
    public static Header defaultHeader() {
        return OutputValues.defaultHeader();
    }

    public static RawOutput create(int channels, int outputs) {
        return new RawOutput(OutputValues.createTable(channels, outputs), defaultHeader());
    }

    /**
     * @param values output values of shape {@code (channels, outputs)}
     */
    public void addFrame(NdArray values) {
        OutputValues.addFrame(getTable(), values);
    }

    /**
     * Output values of all frames, shape {@code (frames, channels, outputs)}.
     */
    public NdArray values() {
        return getTable().getDoubleColumn(OutputValues.VALUE);
    }

    /**
     * Verifies that the value cells match the channel and output counts of a transfer matrix.
     *
     * @throws StructuralException if they do not
     */
    public void checkAgainst(TransferMatrix transferMatrix) {
        OutputValues.check(kind(), getTable(), transferMatrix.channelCount(), transferMatrix.outputCount(),
                ExtensionKind.TRANSFER_MATRIX.extensionName());
    }
}
