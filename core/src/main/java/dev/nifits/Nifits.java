/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import dev.nifits.extension.ArrayGeometry;
import dev.nifits.extension.ExtensionCodec;
import dev.nifits.extension.ExtensionKind;
import dev.nifits.extension.FieldOfView;
import dev.nifits.extension.KernelMatrix;
import dev.nifits.extension.KernelOutput;
import dev.nifits.extension.ModulationSeries;
import dev.nifits.extension.NifitsExtension;
import dev.nifits.extension.OutputCovariance;
import dev.nifits.extension.RawOutput;
import dev.nifits.extension.StructuralException;
import dev.nifits.extension.TargetList;
import dev.nifits.extension.TransferMatrix;
import dev.nifits.extension.WavelengthGrid;
import dev.nifits.io.FitsFileReader;
import dev.nifits.io.FitsFileWriter;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * A NIFITS container: a primary header plus at most one extension of each
 * {@link ExtensionKind}.
 * <p>
 * Usage example:
 * </p>
 * <pre>{@code
 * Nifits nifits = Nifits.load(Path.of("observation.nifits"));
 * TransferMatrix catm = nifits.getTransferMatrix();
 *
 * nifits.write(Path.of("static.nifits"), WriteOptions.defaults().withSelection(Selection.STATIC_ONLY));
 * }</pre>
 * <p>
 * On save, the primary header carries one manifest card per kind, named after the
 * extension and valued {@value #INCLUDED} or {@value #NOT_INCLUDED}.
 * </p>
 */
public final class Nifits {

    private static final System.Logger LOG = System.getLogger(Nifits.class.getName());

    public static final String INCLUDED = "Included";
    public static final String NOT_INCLUDED = "Not included";
    public static final String STATIC_HASH_KEYWORD = "STATHASH";

    private final Map<ExtensionKind, NifitsExtension> extensions = new EnumMap<>(ExtensionKind.class);
    private Header header;
    private LoadReport loadReport;

    /**
     * Creates an empty container with an empty primary header.
     */
    public Nifits() {
        this(new Header());
    }

    public Nifits(Header header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    // ==================== Loading ====================

    public static Nifits load(Path path) throws IOException {
        return load(path, LoadOptions.defaults());
    }

    public static Nifits load(Path path, LoadOptions options) throws IOException {
        LOG.log(System.Logger.Level.DEBUG, "Loading NIFITS file ''{0}''", path);
        return load(FitsFileReader.open(path).getRecords(), options);
    }

    public static Nifits load(List<FitsRecord> records) {
        return load(records, LoadOptions.defaults());
    }

    /**
     * Binds the records to a container. The first record is the primary HDU; its header
     * is kept as is. Each kind is looked up by extension name (case-insensitive, first
     * match wins); kinds that are absent leave their slot empty.
     *
     * @throws StructuralException if an extension does not fit its kind and
     *                             {@link LoadOptions#failOnStructuralError()} is set; failures
     *                             of other kinds are attached as suppressed exceptions
     */
    public static Nifits load(List<FitsRecord> records, LoadOptions options) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("No primary HDU");
        }
        Nifits nifits = new Nifits(records.get(0).header().copy());
        LoadReport report = new LoadReport();
        StructuralException firstFailure = null;

        for (ExtensionKind kind : ExtensionKind.values()) {
            FitsRecord record = find(records, kind);
            if (record == null) {
                LOG.log(System.Logger.Level.INFO, "Missing {0}", kind.extensionName());
                report.recordMissing(kind);
                continue;
            }
            try {
                nifits.extensions.put(kind, ExtensionCodec.decode(kind, record));
                report.recordPresent(kind);
            }
            catch (StructuralException e) {
                report.recordFailure(kind, e);
                if (options.failOnStructuralError()) {
                    if (firstFailure == null) {
                        firstFailure = e;
                    }
                    else {
                        firstFailure.addSuppressed(e);
                    }
                }
                else {
                    LOG.log(System.Logger.Level.ERROR, "Skipping invalid extension: " + e.getMessage(), e);
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        nifits.loadReport = report;
        return nifits;
    }

    private static FitsRecord find(List<FitsRecord> records, ExtensionKind kind) {
        for (int i = 1; i < records.size(); i++) {
            FitsRecord record = records.get(i);
            if (record.hasName(kind.extensionName())) {
                return record;
            }
        }
        return null;
    }

    // ==================== Saving ====================

    public List<FitsRecord> toRecords(Selection selection) {
        return toRecords(selection, "");
    }

    /**
     * Encodes the selected, populated extensions in the fixed kind order, preceded by a
     * primary record whose header is a copy of this container's header plus the manifest.
     * Nothing is written to disk. The headers of the encoded extensions are resynchronized
     * with their payloads.
     *
     * @param staticHash written as {@value #STATIC_HASH_KEYWORD} if not empty
     */
    public List<FitsRecord> toRecords(Selection selection, String staticHash) {
        Objects.requireNonNull(selection, "selection");
        Header primary = header.copy();
        if (staticHash != null && !staticHash.isEmpty()) {
            primary.set(STATIC_HASH_KEYWORD, staticHash, "Hash of the static extensions");
        }

        List<FitsRecord> extensionRecords = new ArrayList<>();
        for (ExtensionKind kind : ExtensionKind.values()) {
            NifitsExtension extension = extensions.get(kind);
            if (extension != null && selection.includes(kind)) {
                extensionRecords.add(ExtensionCodec.encode(extension));
                primary.set(kind.extensionName(), INCLUDED);
            }
            else {
                if (selection.includes(kind)) {
                    LOG.log(System.Logger.Level.INFO, "{0} not included, no such extension", kind.extensionName());
                }
                else {
                    LOG.log(System.Logger.Level.DEBUG, "{0} not included by selection {1}", kind.extensionName(), selection);
                }
                primary.set(kind.extensionName(), NOT_INCLUDED);
            }
        }

        List<FitsRecord> records = new ArrayList<>(extensionRecords.size() + 1);
        records.add(FitsRecord.primary(primary));
        records.addAll(extensionRecords);
        return records;
    }

    public void write(Path path) throws IOException {
        write(path, WriteOptions.defaults());
    }

    /**
     * Writes the records produced by {@link #toRecords(Selection, String)} to a file.
     *
     * @throws java.nio.file.FileAlreadyExistsException if the file exists and
     *                                                  {@link WriteOptions#overwrite()} is not set
     */
    public void write(Path path, WriteOptions options) throws IOException {
        List<FitsRecord> records = toRecords(options.selection(), options.staticHash());
        FitsFileWriter.write(records, path, options.overwrite());
        LOG.log(System.Logger.Level.DEBUG, "Wrote {0} extensions to ''{1}''", records.size() - 1, path);
    }

    // ==================== Slots ====================

    public Header getHeader() {
        return header;
    }

    public void setHeader(Header header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    /**
     * Returns what the load that created this container found. Containers built in memory
     * report their currently populated kinds as present and the others as missing.
     */
    public LoadReport getLoadReport() {
        return loadReport != null ? loadReport : LoadReport.of(extensions.keySet());
    }

    /**
     * @return the extension of the given kind, or null if the slot is empty
     */
    public NifitsExtension getExtension(ExtensionKind kind) {
        return extensions.get(kind);
    }

    /**
     * @return the extension of the given kind cast to {@code type}, or null if the slot is empty
     */
    public <T extends NifitsExtension> T getExtension(ExtensionKind kind, Class<T> type) {
        return type.cast(extensions.get(kind));
    }

    /**
     * Binds an extension to the slot of its kind, replacing any previous one.
     */
    public void setExtension(NifitsExtension extension) {
        extensions.put(extension.kind(), extension);
    }

    /**
     * @return the removed extension, or null if the slot was empty
     */
    public NifitsExtension removeExtension(ExtensionKind kind) {
        return extensions.remove(kind);
    }

    public boolean hasExtension(ExtensionKind kind) {
        return extensions.containsKey(kind);
    }

    public Set<ExtensionKind> getPopulatedKinds() {
        return Collections.unmodifiableSet(extensions.isEmpty()
                ? EnumSet.noneOf(ExtensionKind.class)
                : EnumSet.copyOf(extensions.keySet()));
    }

    private void bind(ExtensionKind kind, NifitsExtension extension) {
        if (extension == null) {
            extensions.remove(kind);
        }
        else {
            extensions.put(kind, extension);
        }
    }

    public ArrayGeometry getArrayGeometry() {
        return getExtension(ExtensionKind.ARRAY_GEOMETRY, ArrayGeometry.class);
    }

    public void setArrayGeometry(ArrayGeometry arrayGeometry) {
        bind(ExtensionKind.ARRAY_GEOMETRY, arrayGeometry);
    }

    public WavelengthGrid getWavelengthGrid() {
        return getExtension(ExtensionKind.WAVELENGTH_GRID, WavelengthGrid.class);
    }

    public void setWavelengthGrid(WavelengthGrid wavelengthGrid) {
        bind(ExtensionKind.WAVELENGTH_GRID, wavelengthGrid);
    }

    public TransferMatrix getTransferMatrix() {
        return getExtension(ExtensionKind.TRANSFER_MATRIX, TransferMatrix.class);
    }

    public void setTransferMatrix(TransferMatrix transferMatrix) {
        bind(ExtensionKind.TRANSFER_MATRIX, transferMatrix);
    }

    public FieldOfView getFieldOfView() {
        return getExtension(ExtensionKind.FIELD_OF_VIEW, FieldOfView.class);
    }

    public void setFieldOfView(FieldOfView fieldOfView) {
        bind(ExtensionKind.FIELD_OF_VIEW, fieldOfView);
    }

    public KernelMatrix getKernelMatrix() {
        return getExtension(ExtensionKind.KERNEL_MATRIX, KernelMatrix.class);
    }

    public void setKernelMatrix(KernelMatrix kernelMatrix) {
        bind(ExtensionKind.KERNEL_MATRIX, kernelMatrix);
    }

    public ModulationSeries getModulationSeries() {
        return getExtension(ExtensionKind.MODULATION_SERIES, ModulationSeries.class);
    }

    public void setModulationSeries(ModulationSeries modulationSeries) {
        bind(ExtensionKind.MODULATION_SERIES, modulationSeries);
    }

    public RawOutput getRawOutput() {
        return getExtension(ExtensionKind.RAW_OUTPUT, RawOutput.class);
    }

    public void setRawOutput(RawOutput rawOutput) {
        bind(ExtensionKind.RAW_OUTPUT, rawOutput);
    }

    public KernelOutput getKernelOutput() {
        return getExtension(ExtensionKind.KERNEL_OUTPUT, KernelOutput.class);
    }

    public void setKernelOutput(KernelOutput kernelOutput) {
        bind(ExtensionKind.KERNEL_OUTPUT, kernelOutput);
    }

    public OutputCovariance getOutputCovariance() {
        return getExtension(ExtensionKind.OUTPUT_COVARIANCE, OutputCovariance.class);
    }

    public void setOutputCovariance(OutputCovariance outputCovariance) {
        bind(ExtensionKind.OUTPUT_COVARIANCE, outputCovariance);
    }

    public TargetList getTargetList() {
        return getExtension(ExtensionKind.TARGET_LIST, TargetList.class);
    }

    public void setTargetList(TargetList targetList) {
        bind(ExtensionKind.TARGET_LIST, targetList);
    }

    @Override
    public String toString() {
        return "Nifits" + extensions.keySet();
    }
}
