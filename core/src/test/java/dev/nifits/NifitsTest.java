/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import dev.nifits.data.NdArray;
import dev.nifits.extension.ArrayExtension;
import dev.nifits.extension.ComplexArrayExtension;
import dev.nifits.extension.ExtensionKind;
import dev.nifits.extension.NifitsExtension;
import dev.nifits.extension.Partition;
import dev.nifits.extension.StructuralException;
import dev.nifits.extension.TableExtension;
import dev.nifits.extension.TransferMatrix;
import dev.nifits.io.FitsFileReader;
import dev.nifits.io.FitsFileWriter;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for loading and saving NIFITS containers.
 */
public class NifitsTest {

    @TempDir
    Path tempDir;

    // ==================== Round-trip Tests ====================

    @Test
    void testFullRoundTripThroughFile() throws Exception {
        Nifits original = TestExtensions.full();
        Path file = tempDir.resolve("full.nifits");

        original.write(file, WriteOptions.defaults());
        Nifits loaded = Nifits.load(file);

        assertThat(loaded.getPopulatedKinds()).containsExactlyInAnyOrder(ExtensionKind.values());
        assertThat(loaded.getLoadReport().isComplete()).isTrue();
        for (ExtensionKind kind : ExtensionKind.values()) {
            assertThat(payloadOf(loaded.getExtension(kind)))
                    .as(kind.extensionName())
                    .isEqualTo(payloadOf(original.getExtension(kind)));
        }
    }

    /**
     * Every bit pattern of the 10 kinds selects one subset; saving and loading it must
     * reproduce exactly that subset with identical payloads.
     */
    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 5, 8, 15, 16, 42, 255, 341, 512, 682, 1000, 1023 })
    void testRoundTripOfKindSubset(int mask) {
        Nifits original = new Nifits();
        Set<ExtensionKind> subset = EnumSet.noneOf(ExtensionKind.class);
        for (ExtensionKind kind : ExtensionKind.values()) {
            if ((mask & (1 << kind.ordinal())) != 0) {
                subset.add(kind);
                original.setExtension(TestExtensions.create(kind));
            }
        }

        byte[] bytes = FitsFileWriter.toBytes(original.toRecords(Selection.FULL));
        Nifits loaded = Nifits.load(read(bytes));

        assertThat(loaded.getPopulatedKinds()).isEqualTo(subset);
        assertThat(loaded.getLoadReport().missing())
                .isEqualTo(EnumSet.complementOf(EnumSet.copyOf(subset)));
        for (ExtensionKind kind : subset) {
            assertThat(payloadOf(loaded.getExtension(kind)))
                    .as(kind.extensionName())
                    .isEqualTo(payloadOf(original.getExtension(kind)));
        }
    }

    @Test
    void testCustomHeaderCardsSurviveRoundTrip() {
        Nifits original = new Nifits();
        original.getHeader().set("OBSERVER", "Jane Doe", "who observed");
        TransferMatrix catm = TestExtensions.transferMatrix();
        catm.getHeader().set("CATMNOTE", "simulated");
        catm.getHeader().addCommentary("HISTORY", "created by the test suite");
        original.setTransferMatrix(catm);

        Nifits loaded = Nifits.load(read(FitsFileWriter.toBytes(original.toRecords(Selection.FULL))));

        assertThat(loaded.getHeader().getString("OBSERVER")).isEqualTo("Jane Doe");
        Header header = loaded.getTransferMatrix().getHeader();
        assertThat(header.getString("CATMNOTE")).isEqualTo("simulated");
        assertThat(header.getString("EXTNAME")).isEqualTo("NI_CATM");
        assertThat(header.getLong("NAXIS1")).isEqualTo(TestExtensions.INPUTS);
        assertThat(header.getLong("NAXIS4")).isEqualTo(2);
        assertThat(header.getCards()).anyMatch(card -> card.keyword().equals("HISTORY")
                && "created by the test suite".equals(card.comment()));
    }

    // ==================== Manifest Tests ====================

    @Test
    void testStaticOnlySaveOfStaticContainer() throws Exception {
        Nifits original = new Nifits();
        for (ExtensionKind kind : List.of(ExtensionKind.ARRAY_GEOMETRY, ExtensionKind.WAVELENGTH_GRID,
                ExtensionKind.TRANSFER_MATRIX, ExtensionKind.FIELD_OF_VIEW)) {
            original.setExtension(TestExtensions.create(kind));
        }
        Path file = tempDir.resolve("static.nifits");
        original.write(file, WriteOptions.defaults());

        Nifits loaded = Nifits.load(file);
        assertThat(loaded.getLoadReport().missing()).hasSize(6);
        assertThat(loaded.getLoadReport().present()).hasSize(4);

        List<FitsRecord> records = loaded.toRecords(Selection.STATIC_ONLY);
        assertThat(records).extracting(FitsRecord::name)
                .containsExactly("PRIMARY", "OI_ARRAY", "OI_WAVELENGTH", "NI_CATM", "NI_FOV");

        Header primary = records.get(0).header();
        long notIncluded = primary.getCards().stream()
                .filter(card -> Nifits.NOT_INCLUDED.equals(card.value()))
                .count();
        assertThat(notIncluded).isEqualTo(6);
        assertThat(primary.getString("OI_ARRAY")).isEqualTo(Nifits.INCLUDED);
        assertThat(primary.getString("NI_KMAT")).isEqualTo(Nifits.NOT_INCLUDED);
        for (int i = 1; i < records.size(); i++) {
            ExtensionKind kind = ExtensionKind.fromExtensionName(records.get(i).name()).orElseThrow();
            assertThat(records.get(i).payload()).isEqualTo(payloadOf(original.getExtension(kind)));
        }
    }

    @ParameterizedTest
    @EnumSource(Selection.class)
    void testSelectionEmitsOnlyItsPartition(Selection selection) {
        List<FitsRecord> records = TestExtensions.full().toRecords(selection);

        List<ExtensionKind> emitted = records.subList(1, records.size()).stream()
                .map(record -> ExtensionKind.fromExtensionName(record.name()).orElseThrow())
                .toList();
        assertThat(emitted).containsExactlyElementsOf(selection.kinds());
        for (ExtensionKind kind : ExtensionKind.values()) {
            assertThat(records.get(0).header().getString(kind.extensionName()))
                    .isEqualTo(selection.includes(kind) ? Nifits.INCLUDED : Nifits.NOT_INCLUDED);
        }
    }

    @Test
    void testToRecordsDoesNotModifyContainerHeader() {
        Nifits nifits = TestExtensions.full();
        nifits.toRecords(Selection.FULL, "abc123");

        assertThat(nifits.getHeader().isEmpty()).isTrue();
    }

    @Test
    void testStaticHashWrittenToPrimaryHeader() {
        List<FitsRecord> records = TestExtensions.full().toRecords(Selection.DYNAMIC_ONLY, "5f2e9a");

        assertThat(records.get(0).header().getString(Nifits.STATIC_HASH_KEYWORD)).isEqualTo("5f2e9a");
        assertThat(TestExtensions.full().toRecords(Selection.FULL).get(0).header()
                .contains(Nifits.STATIC_HASH_KEYWORD)).isFalse();
    }

    @Test
    void testSelectionRejectsStaticAndDynamicOnly() {
        assertThatThrownBy(() -> Selection.of(true, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("static only and dynamic only");
        assertThat(Selection.of(true, false)).isEqualTo(Selection.STATIC_ONLY);
        assertThat(Selection.of(false, true)).isEqualTo(Selection.DYNAMIC_ONLY);
        assertThat(Selection.of(false, false)).isEqualTo(Selection.FULL);
    }

    @Test
    void testSelectionKindsFollowPartitions() {
        assertThat(Selection.STATIC_ONLY.kinds()).containsExactlyElementsOf(ExtensionKind.ofPartition(Partition.STATIC));
        assertThat(Selection.DYNAMIC_ONLY.kinds()).containsExactlyElementsOf(ExtensionKind.ofPartition(Partition.DYNAMIC));
    }

    // ==================== Load Tests ====================

    @Test
    void testEmptyContainerLoadsWithAllKindsMissing() {
        Nifits loaded = Nifits.load(read(FitsFileWriter.toBytes(new Nifits().toRecords(Selection.FULL))));

        assertThat(loaded.getPopulatedKinds()).isEmpty();
        assertThat(loaded.getLoadReport().missing()).containsExactlyInAnyOrder(ExtensionKind.values());
        assertThat(loaded.getLoadReport().status(ExtensionKind.OUTPUT_COVARIANCE)).isEqualTo(LoadReport.Status.MISSING);
    }

    @Test
    void testStructuralErrorFailsStrictLoad() {
        List<FitsRecord> records = List.of(
                FitsRecord.primary(new Header()),
                new FitsRecord("NI_CATM", new Header(), NdArray.zeros(3, 2, 2, 2)),
                new FitsRecord("NI_KMAT", new Header(), TestExtensions.wavelengthGrid().getTable()));

        assertThatThrownBy(() -> Nifits.load(records, LoadOptions.strict()))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("NI_CATM")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    @Test
    void testStructuralErrorRecordedInLenientLoad() {
        List<FitsRecord> records = List.of(
                FitsRecord.primary(new Header()),
                new FitsRecord("NI_CATM", new Header(), NdArray.zeros(3, 2, 2, 2)),
                TestExtensions.kernelMatrix().toRecord());

        Nifits loaded = Nifits.load(records, LoadOptions.lenient());

        assertThat(loaded.hasExtension(ExtensionKind.TRANSFER_MATRIX)).isFalse();
        assertThat(loaded.getKernelMatrix()).isNotNull();
        LoadReport report = loaded.getLoadReport();
        assertThat(report.status(ExtensionKind.TRANSFER_MATRIX)).isEqualTo(LoadReport.Status.FAILED);
        assertThat(report.failures().get(ExtensionKind.TRANSFER_MATRIX)).hasMessageContaining("2 layers");
        assertThat(report.status(ExtensionKind.KERNEL_MATRIX)).isEqualTo(LoadReport.Status.PRESENT);
    }

    @Test
    void testExtensionNamesMatchedCaseInsensitively() {
        List<FitsRecord> records = List.of(
                FitsRecord.primary(new Header()),
                new FitsRecord("ni_kmat", new Header(), TestExtensions.kernelMatrix().getArray()));

        assertThat(Nifits.load(records).getKernelMatrix().matrix())
                .isEqualTo(TestExtensions.kernelMatrix().matrix());
    }

    @Test
    void testUnknownExtensionsIgnored() {
        List<FitsRecord> records = List.of(
                FitsRecord.primary(new Header()),
                new FitsRecord("OI_VIS2", new Header(), NdArray.zeros(2)),
                TestExtensions.wavelengthGrid().toRecord());

        Nifits loaded = Nifits.load(records);

        assertThat(loaded.getPopulatedKinds()).containsExactly(ExtensionKind.WAVELENGTH_GRID);
    }

    // ==================== Write Tests ====================

    @Test
    void testWriteRefusesExistingFileUnlessOverwrite() throws Exception {
        Path file = tempDir.resolve("existing.nifits");
        Files.writeString(file, "placeholder");
        Nifits nifits = TestExtensions.full();

        assertThatThrownBy(() -> nifits.write(file, WriteOptions.defaults().withOverwrite(false)))
                .isInstanceOf(FileAlreadyExistsException.class);

        nifits.write(file, WriteOptions.defaults().withOverwrite(true));
        assertThat(FitsFileReader.open(file).getRecords()).hasSize(ExtensionKind.values().length + 1);
    }

    @Test
    void testInMemoryLoadReportFollowsSlots() {
        Nifits nifits = new Nifits();
        assertThat(nifits.getLoadReport().missing()).containsExactlyInAnyOrder(ExtensionKind.values());

        nifits.setExtension(TestExtensions.kernelMatrix());

        LoadReport report = nifits.getLoadReport();
        assertThat(report.present()).containsExactly(ExtensionKind.KERNEL_MATRIX);
        assertThat(report.status(ExtensionKind.KERNEL_MATRIX)).isEqualTo(LoadReport.Status.PRESENT);
        assertThat(report.missing()).hasSize(ExtensionKind.values().length - 1);
        assertThat(report.failed()).isEmpty();
    }

    @Test
    void testSlotAccessors() {
        Nifits nifits = new Nifits();
        TransferMatrix catm = TestExtensions.transferMatrix();

        nifits.setTransferMatrix(catm);
        assertThat(nifits.getTransferMatrix()).isSameAs(catm);
        assertThat(nifits.getExtension(ExtensionKind.TRANSFER_MATRIX, TransferMatrix.class)).isSameAs(catm);

        nifits.setTransferMatrix(null);
        assertThat(nifits.hasExtension(ExtensionKind.TRANSFER_MATRIX)).isFalse();
        assertThat(nifits.getTransferMatrix()).isNull();
    }

    private static List<FitsRecord> read(byte[] bytes) {
        try {
            return FitsFileReader.read(bytes);
        }
        catch (Exception e) {
            throw new AssertionError(e);
        }
    }

    static Object payloadOf(NifitsExtension extension) {
        if (extension instanceof TableExtension table) {
            return table.getTable();
        }
        if (extension instanceof ArrayExtension array) {
            return array.getArray();
        }
        return ((ComplexArrayExtension) extension).getArray().toPlanes();
    }
}
