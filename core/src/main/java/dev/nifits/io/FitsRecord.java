/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.io;

import java.util.Objects;

import dev.nifits.data.EmptyPayload;
import dev.nifits.data.NdArray;
import dev.nifits.data.Payload;
import dev.nifits.data.Table;
import dev.nifits.metadata.Header;

/**
 * One named header-and-data unit of a FITS file.
 *
 * @param name the extension name ({@code EXTNAME}), or {@link #PRIMARY} for the first unit
 */
public record FitsRecord(String name, Header header, Payload payload) {

    public static final String PRIMARY = "PRIMARY";

    public FitsRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(payload, "payload");
    }

    public static FitsRecord primary(Header header) {
        return new FitsRecord(PRIMARY, header, EmptyPayload.INSTANCE);
    }

    public boolean hasName(String other) {
        return name.equalsIgnoreCase(other);
    }

    public boolean isTable() {
        return payload instanceof Table;
    }

    public boolean isImage() {
        return payload instanceof NdArray;
    }

    public Table table() {
        if (!(payload instanceof Table table)) {
            throw new IllegalStateException("Record " + name + " does not hold a table");
        }
        return table;
    }

    public NdArray image() {
        if (!(payload instanceof NdArray array)) {
            throw new IllegalStateException("Record " + name + " does not hold an image");
        }
        return array;
    }
}
