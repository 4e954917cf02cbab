/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import dev.nifits.io.FitsRecord;

/**
 * Maps each {@link ExtensionKind} to the decoder of its extension class. The mapping
 * is a switch over the closed set of kinds, so adding a kind without a decoder does
 * not compile.
 */
public final class ExtensionCodec {

    private static final System.Logger LOG = System.getLogger(ExtensionCodec.class.getName());

    private ExtensionCodec() {
    }

    /**
     * Decodes a record as the given kind.
     *
     * @throws StructuralException if the record payload does not fit the kind
     */
    public static NifitsExtension decode(ExtensionKind kind, FitsRecord record) {
        LOG.log(System.Logger.Level.DEBUG, "Decoding ''{0}'' as {1}", record.name(), kind.tag());
        return switch (kind) {
            case ARRAY_GEOMETRY -> ArrayGeometry.fromRecord(record);
            case WAVELENGTH_GRID -> WavelengthGrid.fromRecord(record);
            case TRANSFER_MATRIX -> TransferMatrix.fromRecord(record);
            case FIELD_OF_VIEW -> FieldOfView.fromRecord(record);
            case KERNEL_MATRIX -> KernelMatrix.fromRecord(record);
            case MODULATION_SERIES -> ModulationSeries.fromRecord(record);
            case RAW_OUTPUT -> RawOutput.fromRecord(record);
            case KERNEL_OUTPUT -> KernelOutput.fromRecord(record);
            case OUTPUT_COVARIANCE -> OutputCovariance.fromRecord(record);
            case TARGET_LIST -> TargetList.fromRecord(record);
        };
    }

    /**
     * Encodes an extension; its header is resynchronized as a side effect.
     */
    public static FitsRecord encode(NifitsExtension extension) {
        FitsRecord record = extension.toRecord();
        LOG.log(System.Logger.Level.DEBUG, "Encoded {0} as ''{1}''", extension.kind().tag(), record.name());
        return record;
    }
}
