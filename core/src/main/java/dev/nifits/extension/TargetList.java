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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import dev.nifits.data.Table;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * The {@code OI_TARGET} extension: the list of observed targets.
 * <p>
 * Target identifiers are not checked for uniqueness when rows are added; use
 * {@link #findDuplicateIds()} to detect clashes.
 * </p>
 */
public final class TargetList extends TableExtension {

    private static final List<ColumnSchema> COLUMNS = List.of(
            ColumnSchema.scalar("TARGET_ID", ColumnType.INT32),
            ColumnSchema.scalar("TARGET", ColumnType.STRING),
            ColumnSchema.scalar("RAEP0", ColumnType.FLOAT64).withUnit("deg"),
            ColumnSchema.scalar("DECEP0", ColumnType.FLOAT64).withUnit("deg"),
            ColumnSchema.scalar("EQUINOX", ColumnType.FLOAT64).withUnit("yr"),
            ColumnSchema.scalar("RA_ERR", ColumnType.FLOAT64).withUnit("deg"),
            ColumnSchema.scalar("DEC_ERR", ColumnType.FLOAT64).withUnit("deg"),
            ColumnSchema.scalar("SYSVEL", ColumnType.FLOAT64).withUnit("m/s"),
            ColumnSchema.scalar("VELTYP", ColumnType.STRING),
            ColumnSchema.scalar("VELDEF", ColumnType.STRING),
            ColumnSchema.scalar("PMRA", ColumnType.FLOAT64).withUnit("deg/yr"),
            ColumnSchema.scalar("PMDEC", ColumnType.FLOAT64).withUnit("deg/yr"),
            ColumnSchema.scalar("PMRA_ERR", ColumnType.FLOAT64).withUnit("deg/yr"),
            ColumnSchema.scalar("PMDEC_ERR", ColumnType.FLOAT64).withUnit("deg/yr"),
            ColumnSchema.scalar("PARALLAX", ColumnType.FLOAT64).withUnit("deg"),
            ColumnSchema.scalar("PARA_ERR", ColumnType.FLOAT64).withUnit("deg"),
            ColumnSchema.scalar("SPECTYP", ColumnType.STRING),
            ColumnSchema.scalar("CATEGORY", ColumnType.STRING));

    public TargetList(Table table, Header header) {
        super(table, header);
    }

    @Override
    public ExtensionKind kind() {
        return ExtensionKind.TARGET_LIST;
    }

    public static TargetList fromRecord(FitsRecord record) {
        return new TargetList(decodeTable(record, ExtensionKind.TARGET_LIST), record.header().copy());
    }

    /**
     * Creates a target list with an empty table of the 18 standard columns.
     * Use {@link #addTarget(Target)} to fill it.
     */
    public static TargetList fromScratch() {
        return new TargetList(new Table(COLUMNS), new Header());
    }

    public static List<ColumnSchema> columns() {
        return COLUMNS;
    }

    /**
     * Appends a row with every field at its default value.
     */
    public void addTarget() {
        addTarget(Target.builder().build());
    }

    /**
     * Appends one row. Identifiers already present in the table are accepted.
     */
    public void addTarget(Target target) {
        getTable().addRow(target.targetId(), target.target(), target.raep0(), target.decep0(),
                target.equinox(), target.raErr(), target.decErr(),
                target.sysvel(), target.veltyp(), target.veldef(),
                target.pmra(), target.pmdec(), target.pmraErr(), target.pmdecErr(),
                target.parallax(), target.paraErr(), target.spectyp(), target.category());
    }

    /**
     * Reads the rows back as targets.
     */
    public List<Target> targets() {
        Table table = getTable();
        List<Target> targets = new ArrayList<>(table.getRowCount());
        for (int row = 0; row < table.getRowCount(); row++) {
            targets.add(new Target(
                    (int) number(row, "TARGET_ID"),
                    (String) table.getValue(row, "TARGET"),
                    number(row, "RAEP0"),
                    number(row, "DECEP0"),
                    number(row, "EQUINOX"),
                    number(row, "RA_ERR"),
                    number(row, "DEC_ERR"),
                    number(row, "SYSVEL"),
                    (String) table.getValue(row, "VELTYP"),
                    (String) table.getValue(row, "VELDEF"),
                    number(row, "PMRA"),
                    number(row, "PMDEC"),
                    number(row, "PMRA_ERR"),
                    number(row, "PMDEC_ERR"),
                    number(row, "PARALLAX"),
                    number(row, "PARA_ERR"),
                    (String) table.getValue(row, "SPECTYP"),
                    (String) table.getValue(row, "CATEGORY")));
        }
        return Collections.unmodifiableList(targets);
    }

    private double number(int row, String column) {
        return ((Number) getTable().getValue(row, column)).doubleValue();
    }

    /**
     * @return identifiers that occur in more than one row, in ascending order
     */
    public Set<Long> findDuplicateIds() {
        Set<Long> seen = new HashSet<>();
        Set<Long> duplicates = new TreeSet<>();
        for (long id : getTable().getLongColumn("TARGET_ID")) {
            if (!seen.add(id)) {
                duplicates.add(id);
            }
        }
        return duplicates;
    }
}
