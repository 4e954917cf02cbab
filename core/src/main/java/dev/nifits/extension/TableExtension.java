/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

import java.util.Objects;

import dev.nifits.data.Table;
import dev.nifits.internal.fits.StructuralKeywords;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;

/**
 * Base of extensions whose payload is a binary table. Rows are the time-series unit of
 * the dynamic table kinds.
 */
public abstract sealed class TableExtension implements NifitsExtension
        permits ArrayGeometry, WavelengthGrid, FieldOfView, ModulationSeries, RawOutput, KernelOutput, TargetList {

    private Table table;
    private Header header;

    protected TableExtension(Table table, Header header) {
        this.table = Objects.requireNonNull(table, "table");
        this.header = header != null ? header : new Header();
    }

    /**
     * Returns the table itself; changes to it are reflected when the extension is encoded.
     */
    public Table getTable() {
        return table;
    }

    public void setTable(Table table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public Header getHeader() {
        return header;
    }

    @Override
    public void setHeader(Header header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    public int getRowCount() {
        return table.getRowCount();
    }

    @Override
    public FitsRecord toRecord() {
        header = StructuralKeywords.resync(header, kind().extensionName(), table, false);
        return new FitsRecord(kind().extensionName(), header.copy(), table.copy());
    }

    /**
     * Extracts a copy of the table held by a record.
     *
     * @throws StructuralException if the record does not hold a table
     */
    static Table decodeTable(FitsRecord record, ExtensionKind kind) {
        if (!(record.payload() instanceof Table table)) {
            throw new StructuralException(kind, "expected a binary table, found " + record.payload());
        }
        return table.copy();
    }

    @Override
    public String toString() {
        return kind().extensionName() + "(" + table.getRowCount() + " rows)";
    }
}
