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

import dev.nifits.data.NdArray;
import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * The {@code OI_ARRAY} extension: the stations of the interferometer, one per row.
 * <p>
 * The table revision is held in the {@code OI_REVN} header keyword. Revision 2 adds
 * the {@code FOV} and {@code FOVTYPE} columns; an unset field of view is stored as
 * {@code NaN} and an empty string.
 * </p>
 */
public final class ArrayGeometry extends TableExtension {

    private static final String TEL_NAME = "TEL_NAME";
    private static final String STA_NAME = "STA_NAME";
    private static final String STA_INDEX = "STA_INDEX";
    private static final String DIAMETER = "DIAMETER";
    private static final String STAXYZ = "STAXYZ";
    private static final String FOV = "FOV";
    private static final String FOVTYPE = "FOVTYPE";

    public ArrayGeometry(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.ARRAY_GEOMETRY;
    }

    public static ArrayGeometry fromRecord(FitsRecord record) {
        return new ArrayGeometry(decodeTable(record, ExtensionKind.ARRAY_GEOMETRY), record.header().copy());
    }

    /**
     * Builds the table from station descriptors, which must all share one revision.
     *
     * @param arrayName value of the {@code ARRNAME} keyword
     */
    public static ArrayGeometry fromStations(String arrayName, List<Station> stations) {
        int revision = stations.isEmpty() ? 1 : stations.get(0).getRevision();
        for (Station station : stations) {
            if (station.getRevision() != revision) {
                throw new IllegalArgumentException("Stations of mixed OI_ARRAY revisions: " + revision
                        + " and " + station.getRevision());
            }
        }
        boolean withFov = revision >= 2;

        List<ColumnSchema> columns = new ArrayList<>();
        columns.add(ColumnSchema.scalar(TEL_NAME, ColumnType.STRING));
        columns.add(ColumnSchema.scalar(STA_NAME, ColumnType.STRING));
        columns.add(ColumnSchema.scalar(STA_INDEX, ColumnType.INT16));
        columns.add(ColumnSchema.scalar(DIAMETER, ColumnType.FLOAT64).withUnit("m"));
        columns.add(ColumnSchema.array(STAXYZ, ColumnType.FLOAT64, 3).withUnit("m"));
        if (withFov) {
            columns.add(ColumnSchema.scalar(FOV, ColumnType.FLOAT64).withUnit("arcsec"));
            columns.add(ColumnSchema.scalar(FOVTYPE, ColumnType.STRING));
        }
        Table table = new Table(columns);
        for (int i = 0; i < stations.size(); i++) {
            Station station = stations.get(i);
            List<Object> row = new ArrayList<>(List.of(station.getTelescopeName(), station.getStationName(),
                    i + 1, station.getDiameter(), station.getPosition()));
            if (withFov) {
                row.add(station.getFov() != null ? station.getFov() : Double.NaN);
                row.add(station.getFovType() != null ? station.getFovType() : "");
            }
            table.addRow(row.toArray());
        }

        Header header = new Header();
        header.set("OI_REVN", (long) revision, "Revision number of the table definition");
        header.set("ARRNAME", arrayName, "Array name");
        header.set("FRAME", "GEOCENTRIC", "Coordinate frame");
        header.set("ARRAYX", 0.0, "[m] Array center x coordinate");
        header.set("ARRAYY", 0.0, "[m] Array center y coordinate");
        header.set("ARRAYZ", 0.0, "[m] Array center z coordinate");
        return new ArrayGeometry(table, header);
    }

    /**
     * @return the {@code OI_REVN} keyword, 1 if absent
     */
    public int revision() {
        return (int) getHeader().getLong("OI_REVN", 1);
    }

    public String arrayName() {
        return getHeader().getString("ARRNAME", null);
    }

    /**
     * Reads the rows back as station descriptors of this table's revision.
     */
    public List<Station> stations() {
        Table table = getTable();
        int revision = revision();
        boolean withFov = table.hasColumn(FOV);
        NdArray positions = table.getDoubleColumn(STAXYZ);
        List<Station> stations = new ArrayList<>(table.getRowCount());
        for (int row = 0; row < table.getRowCount(); row++) {
            Double fov = null;
            String fovType = null;
            if (withFov) {
                double value = ((Number) table.getValue(row, FOV)).doubleValue();
                fov = Double.isNaN(value) ? null : value;
                String type = table.hasColumn(FOVTYPE) ? (String) table.getValue(row, FOVTYPE) : "";
                fovType = type.isEmpty() ? null : type;
            }
            stations.add(new Station(
                    (String) table.getValue(row, TEL_NAME),
                    (String) table.getValue(row, STA_NAME),
                    ((Number) table.getValue(row, DIAMETER)).doubleValue(),
                    positions.slice(row).toArray(),
                    fov,
                    fovType,
                    revision));
        }
        return Collections.unmodifiableList(stations);
    }
}
