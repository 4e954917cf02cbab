/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.nifits.TestExtensions;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the kind registry and its partition table.
 */
public class ExtensionKindTest {

    @Test
    void testPartitionsCoverEveryKindExactlyOnce() {
        List<ExtensionKind> union = new ArrayList<>(ExtensionKind.ofPartition(Partition.STATIC));
        union.addAll(ExtensionKind.ofPartition(Partition.DYNAMIC));

        assertThat(union).containsExactlyInAnyOrder(ExtensionKind.values());
        assertThat(ExtensionKind.ofPartition(Partition.STATIC))
                .doesNotContainAnyElementsOf(ExtensionKind.ofPartition(Partition.DYNAMIC));
    }

    @Test
    void testStaticKinds() {
        assertThat(ExtensionKind.ofPartition(Partition.STATIC)).containsExactly(
                ExtensionKind.ARRAY_GEOMETRY, ExtensionKind.WAVELENGTH_GRID, ExtensionKind.TRANSFER_MATRIX,
                ExtensionKind.FIELD_OF_VIEW, ExtensionKind.TARGET_LIST);
    }

    @Test
    void testExtensionNames() {
        assertThat(ExtensionKind.values()).extracting(ExtensionKind::extensionName).containsExactly(
                "OI_ARRAY", "OI_WAVELENGTH", "NI_CATM", "NI_FOV", "NI_KMAT",
                "NI_MOD", "NI_IOUT", "NI_KIOUT", "NI_KCOV", "OI_TARGET");
        assertThat(ExtensionKind.TRANSFER_MATRIX.tag()).isEqualTo("transfer-matrix");
    }

    @Test
    void testFromExtensionName() {
        assertThat(ExtensionKind.fromExtensionName("ni_catm")).contains(ExtensionKind.TRANSFER_MATRIX);
        assertThat(ExtensionKind.fromExtensionName("OI_VIS2")).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(ExtensionKind.class)
    void testCodecDecodesWhatItEncodes(ExtensionKind kind) {
        NifitsExtension extension = TestExtensions.create(kind);

        NifitsExtension decoded = ExtensionCodec.decode(kind, ExtensionCodec.encode(extension));

        assertThat(decoded.kind()).isEqualTo(kind);
        assertThat(decoded.getClass()).isEqualTo(extension.getClass());
        assertThat(decoded.toRecord().payload()).isEqualTo(extension.toRecord().payload());
    }
}
