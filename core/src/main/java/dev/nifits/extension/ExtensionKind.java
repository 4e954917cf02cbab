/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The extensions a NIFITS file may contain, in the order they are read and written.
 * Each kind is bound to exactly one payload variant and one partition.
 */
public enum ExtensionKind {
    ARRAY_GEOMETRY("OI_ARRAY", PayloadVariant.TABLE, Partition.STATIC),
    WAVELENGTH_GRID("OI_WAVELENGTH", PayloadVariant.TABLE, Partition.STATIC),
    TRANSFER_MATRIX("NI_CATM", PayloadVariant.COMPLEX_ARRAY, Partition.STATIC),
    FIELD_OF_VIEW("NI_FOV", PayloadVariant.TABLE, Partition.STATIC),
    KERNEL_MATRIX("NI_KMAT", PayloadVariant.ARRAY, Partition.DYNAMIC),
    MODULATION_SERIES("NI_MOD", PayloadVariant.TABLE, Partition.DYNAMIC),
    RAW_OUTPUT("NI_IOUT", PayloadVariant.TABLE, Partition.DYNAMIC),
    KERNEL_OUTPUT("NI_KIOUT", PayloadVariant.TABLE, Partition.DYNAMIC),
    OUTPUT_COVARIANCE("NI_KCOV", PayloadVariant.ARRAY, Partition.DYNAMIC),
    TARGET_LIST("OI_TARGET", PayloadVariant.TABLE, Partition.STATIC);

    private final String extensionName;
    private final PayloadVariant payloadVariant;
    private final Partition partition;

    ExtensionKind(String extensionName, PayloadVariant payloadVariant, Partition partition) {
        this.extensionName = extensionName;
        this.payloadVariant = payloadVariant;
        this.partition = partition;
    }

    /**
     * The {@code EXTNAME} of records of this kind.
     */
    public String extensionName() {
        return extensionName;
    }

    public PayloadVariant payloadVariant() {
        return payloadVariant;
    }

    public Partition partition() {
        return partition;
    }

    public boolean isStatic() {
        return partition == Partition.STATIC;
    }

    /**
     * Lower-case hyphenated tag, e.g. {@code transfer-matrix}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public static Optional<ExtensionKind> fromExtensionName(String extensionName) {
        for (ExtensionKind kind : values()) {
            if (kind.extensionName.equalsIgnoreCase(extensionName.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static List<ExtensionKind> ofPartition(Partition partition) {
        List<ExtensionKind> kinds = new ArrayList<>();
        for (ExtensionKind kind : values()) {
            if (kind.partition == partition) {
                kinds.add(kind);
            }
        }
        return Collections.unmodifiableList(kinds);
    }
}
