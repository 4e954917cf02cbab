/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

import java.util.Objects;

/**
 * Options for {@link Nifits#write}.
 *
 * @param selection which extensions to write
 * @param staticHash value of the {@code STATHASH} keyword identifying the static
 *                   extensions a dynamic-only file belongs to; empty or {@code null} for none
 * @param overwrite whether an existing file may be replaced
 */
public record WriteOptions(Selection selection, String staticHash, boolean overwrite) {

    static final String OVERWRITE_PROPERTY = "nifits.overwrite";

    public WriteOptions {
        Objects.requireNonNull(selection, "selection");
        staticHash = staticHash == null ? "" : staticHash;
    }

    /**
     * Full selection, no static hash; {@code nifits.overwrite} defaults to {@code false}.
     */
    public static WriteOptions defaults() {
        return new WriteOptions(Selection.FULL, "", Boolean.getBoolean(OVERWRITE_PROPERTY));
    }

    public WriteOptions withSelection(Selection selection) {
        return new WriteOptions(selection, staticHash, overwrite);
    }

    public WriteOptions withStaticHash(String staticHash) {
        return new WriteOptions(selection, staticHash, overwrite);
    }

    public WriteOptions withOverwrite(boolean overwrite) {
        return new WriteOptions(selection, staticHash, overwrite);
    }
}
