/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * An extension of a NIFITS file: a header and a payload of the variant bound to its kind.
 */
public sealed interface NifitsExtension permits TableExtension, ArrayExtension, ComplexArrayExtension {

    ExtensionKind kind();

    Header getHeader();

    void setHeader(Header header);

    /**
     * Encodes this extension as a record. The structural keywords of the header are
     * recomputed from the current payload and the resynchronized header replaces this
     * extension's header.
     */
    FitsRecord toRecord();
}
