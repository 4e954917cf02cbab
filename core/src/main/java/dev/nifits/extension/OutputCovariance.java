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
 * The {@code NI_KCOV} extension: covariance of the processed outputs.
 */
public final class OutputCovariance extends ArrayExtension {

    public OutputCovariance(NdArray covariance, Header header) {
        super(covariance, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.OUTPUT_COVARIANCE;
    }

    public static OutputCovariance fromRecord(FitsRecord record) {
        return new OutputCovariance(decodeArray(record, ExtensionKind.OUTPUT_COVARIANCE), record.header().copy());
    }

    public static OutputCovariance create(NdArray covariance) {
        return new OutputCovariance(covariance, new Header());
    }

    public NdArray covariance() {
        return getArray();
    }
}
