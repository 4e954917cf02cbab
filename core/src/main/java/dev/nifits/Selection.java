/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

import java.util.List;

import dev.nifits.extension.ExtensionKind;
import dev.nifits.extension.Partition;

/**
 * Which extensions a save operation emits.
 */
public enum Selection {

    /** Every populated extension. */
    FULL,
    /** Only the extensions describing the instrument. */
    STATIC_ONLY,
    /** Only the extensions describing the observation. */
    DYNAMIC_ONLY;

    /**
     * Maps the pair of flags used by callers that select by partition.
     *
     * @throws IllegalArgumentException if both flags are set
     */
    public static Selection of(boolean staticOnly, boolean dynamicOnly) {
        if (staticOnly && dynamicOnly) {
            throw new IllegalArgumentException("Cannot select static only and dynamic only at the same time");
        }
        return staticOnly ? STATIC_ONLY : dynamicOnly ? DYNAMIC_ONLY : FULL;
    }

    public boolean includes(ExtensionKind kind) {
        return switch (this) {
            case FULL -> true;
            case STATIC_ONLY -> kind.partition() == Partition.STATIC;
            case DYNAMIC_ONLY -> kind.partition() == Partition.DYNAMIC;
        };
    }

    public List<ExtensionKind> kinds() {
        return switch (this) {
            case FULL -> List.of(ExtensionKind.values());
            case STATIC_ONLY -> ExtensionKind.ofPartition(Partition.STATIC);
            case DYNAMIC_ONLY -> ExtensionKind.ofPartition(Partition.DYNAMIC);
        };
    }
}
