/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.internal.fits;

import java.util.Set;
import java.util.regex.Pattern;

import dev.nifits.data.EmptyPayload;
import dev.nifits.data.NdArray;
import dev.nifits.data.Payload;
import dev.nifits.data.Table;
import dev.nifits.metadata.Header;
import dev.nifits.metadata.HeaderCard;
import dev.nifits.schema.ColumnSchema;
import dev.nifits.schema.ColumnType;

/**
 * Derives the shape-dependent header keywords of an HDU from its payload.
 * <p>
 * A record header is treated as a cached view: the structural keywords
 * ({@code SIMPLE}/{@code XTENSION}, {@code BITPIX}, {@code NAXISn}, {@code PCOUNT},
 * {@code GCOUNT}, {@code TFIELDS}, the per-column {@code TTYPEn}/{@code TFORMn}/
 * {@code TDIMn}/{@code TUNITn} and {@code EXTNAME}) are always recomputed from the
 * payload, every other card passes through unchanged and in order. Scaling keywords
 * ({@code BSCALE}/{@code BZERO}, {@code TSCALn}/{@code TZEROn}) are dropped as well: payloads
 * hold physical values, which are written unscaled.
 * </p>
 */
public final class StructuralKeywords {

    private static final Set<String> FIXED = Set.of("SIMPLE", "XTENSION", "BITPIX", "NAXIS", "EXTEND", "PCOUNT",
            "GCOUNT", "TFIELDS", "EXTNAME", "THEAP", "BSCALE", "BZERO", "GROUPS", "END");

    private static final Pattern INDEXED = Pattern.compile("(NAXIS|TTYPE|TFORM|TDIM|TUNIT|TNULL|TSCAL|TZERO|TDISP)[0-9]+");

    private StructuralKeywords() {
    }

    public static boolean isStructural(String keyword) {
        return FIXED.contains(keyword) || INDEXED.matcher(keyword).matches();
    }

    /**
     * Builds the header to emit for a payload: structural keywords derived from the
     * payload first, then the non-structural cards of {@code header}.
     *
     * @param name the extension name; ignored for the primary HDU
     */
    public static Header resync(Header header, String name, Payload payload, boolean primary) {
        Header result = new Header();
        if (primary) {
            result.set("SIMPLE", true, "conforms to FITS standard");
        }
        if (payload instanceof Table table) {
            if (primary) {
                throw new IllegalArgumentException("The primary HDU cannot hold a table");
            }
            appendTable(result, table);
        }
        else if (payload instanceof NdArray array) {
            appendImage(result, array, primary);
        }
        else if (payload == EmptyPayload.INSTANCE) {
            if (!primary) {
                result.set("XTENSION", "IMAGE", "Image extension");
            }
            result.set("BITPIX", 8L, "array data type");
            result.set("NAXIS", 0L, "number of array dimensions");
            appendExtensionTail(result, primary);
        }
        if (!primary) {
            result.set("EXTNAME", name, "extension name");
        }
        if (header != null) {
            for (HeaderCard card : header) {
                if (card.isCommentary() || !isStructural(card.keyword())) {
                    result.add(card);
                }
            }
        }
        return result;
    }

    private static void appendImage(Header result, NdArray array, boolean primary) {
        if (!primary) {
            result.set("XTENSION", "IMAGE", "Image extension");
        }
        result.set("BITPIX", -64L, "array data type");
        int[] shape = array.shape();
        result.set("NAXIS", (long) shape.length, "number of array dimensions");
        for (int axis = 1; axis <= shape.length; axis++) {
            result.set("NAXIS" + axis, (long) shape[shape.length - axis]);
        }
        appendExtensionTail(result, primary);
    }

    private static void appendExtensionTail(Header result, boolean primary) {
        if (primary) {
            result.set("EXTEND", true);
        }
        else {
            result.set("PCOUNT", 0L, "number of parameters");
            result.set("GCOUNT", 1L, "number of groups");
        }
    }

    private static void appendTable(Header result, Table table) {
        int columnCount = table.getColumnCount();
        int[] repeats = new int[columnCount];
        long rowLength = 0;
        for (int i = 0; i < columnCount; i++) {
            ColumnSchema column = table.getColumn(i);
            repeats[i] = column.type() == ColumnType.STRING ? stringWidth(table, column) : column.cellSize();
            rowLength += (long) repeats[i] * column.type().getElementSize();
        }
        result.set("XTENSION", "BINTABLE", "binary table extension");
        result.set("BITPIX", 8L, "array data type");
        result.set("NAXIS", 2L, "number of array dimensions");
        result.set("NAXIS1", rowLength, "length of dimension 1");
        result.set("NAXIS2", (long) table.getRowCount(), "length of dimension 2");
        result.set("PCOUNT", 0L, "number of group parameters");
        result.set("GCOUNT", 1L, "number of groups");
        result.set("TFIELDS", (long) columnCount, "number of table fields");
        for (int i = 0; i < columnCount; i++) {
            ColumnSchema column = table.getColumn(i);
            int n = i + 1;
            result.set("TTYPE" + n, column.name());
            result.set("TFORM" + n, tform(column, repeats[i]));
            if (column.unit() != null) {
                result.set("TUNIT" + n, column.unit());
            }
            if (!column.isScalar()) {
                result.set("TDIM" + n, tdim(column.cellShape()));
            }
        }
    }

    static String tform(ColumnSchema column, int repeat) {
        char code = column.type().getTformCode();
        return repeat == 1 && column.type() != ColumnType.STRING ? String.valueOf(code) : repeat + String.valueOf(code);
    }

    /**
     * Formats a row-major cell shape as a {@code TDIMn} value, fastest axis first.
     */
    static String tdim(int[] shape) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = shape.length - 1; i >= 0; i--) {
            sb.append(shape[i]);
            if (i > 0) {
                sb.append(',');
            }
        }
        return sb.append(')').toString();
    }

    private static int stringWidth(Table table, ColumnSchema column) {
        int width = 1;
        for (String value : table.getStringColumn(column.name())) {
            width = Math.max(width, value.length());
        }
        return width;
    }
}
