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
import dev.nifits.io.FitsFormatException;
import dev.nifits.io.FitsRecord;
import dev.nifits.metadata.Header;
import dev.nifits.metadata.HeaderCard;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.ImageHDU;
import nom.tam.util.ArrayFuncs;

/**
 * Converts between {@link FitsRecord} and nom.tam header-data units.
 * <p>
 * On write, the header is resynchronized with the payload first. Keywords that describe
 * the data layout ({@code BITPIX}, {@code NAXISn}, {@code TFORMn}, ...) are then taken from
 * nom.tam, which derives them from the data; all other cards are copied in order.
 * Images are read into doubles with {@code BSCALE}/{@code BZERO} applied and are always
 * written as IEEE doubles.
 * </p>
 */
public final class HduConverter {

    private static final System.Logger LOG = System.getLogger(HduConverter.class.getName());

    private static final Set<String> DATA_LAYOUT = Set.of("SIMPLE", "XTENSION", "BITPIX", "NAXIS", "EXTEND",
            "PCOUNT", "GCOUNT", "TFIELDS", "THEAP", "GROUPS");

    private static final Pattern INDEXED_DATA_LAYOUT = Pattern.compile("(NAXIS|TFORM)[0-9]+");

    private HduConverter() {
    }

    public static FitsRecord toRecord(BasicHDU<?> hdu, boolean primary) throws FitsException, FitsFormatException {
        Header header = HeaderConverter.toHeader(hdu.getHeader());
        Payload payload;
        if (hdu instanceof BinaryTableHDU tableHdu) {
            payload = BinaryTableConverter.read(tableHdu.getData(), header);
        }
        else if (hdu instanceof ImageHDU imageHdu) {
            payload = readImage(imageHdu, header);
        }
        else {
            throw new FitsFormatException("Unsupported HDU type: " + hdu.getClass().getSimpleName());
        }
        String name = primary ? FitsRecord.PRIMARY : header.getString("EXTNAME", "");
        LOG.log(System.Logger.Level.DEBUG, "Decoded HDU ''{0}'' ({1})", name, payload.getClass().getSimpleName());
        return new FitsRecord(name, header, payload);
    }

    private static Payload readImage(ImageHDU hdu, Header header) throws FitsException, FitsFormatException {
        Object kernel = hdu.getKernel();
        if (kernel == null || header.getLong("NAXIS", 0) == 0) {
            return EmptyPayload.INSTANCE;
        }
        int[] shape = ArrayFuncs.getDimensions(kernel);
        double[] values = pixels(ArrayFuncs.flatten(kernel));
        double scale = header.getDouble("BSCALE", 1.0);
        double zero = header.getDouble("BZERO", 0.0);
        if (scale != 1.0 || zero != 0.0) {
            for (int i = 0; i < values.length; i++) {
                values[i] = values[i] * scale + zero;
            }
        }
        return new NdArray(shape, values);
    }

    private static double[] pixels(Object flat) throws FitsFormatException {
        double[] values;
        if (flat instanceof double[] array) {
            values = array.clone();
        }
        else if (flat instanceof float[] array) {
            values = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
        }
        else if (flat instanceof long[] array) {
            values = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
        }
        else if (flat instanceof int[] array) {
            values = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
        }
        else if (flat instanceof short[] array) {
            values = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i];
            }
        }
        else if (flat instanceof byte[] array) {
            // BITPIX 8 is unsigned
            values = new double[array.length];
            for (int i = 0; i < array.length; i++) {
                values[i] = array[i] & 0xFF;
            }
        }
        else {
            throw new FitsFormatException("Unsupported image data: " + flat.getClass().getName());
        }
        return values;
    }

    /**
     * Builds the HDU for a record.
     *
     * @param primary whether the record is written as the primary HDU, which cannot hold a table
     */
    public static BasicHDU<?> toHdu(FitsRecord record, boolean primary) throws FitsException {
        Payload payload = record.payload();
        Header synced = StructuralKeywords.resync(record.header(), record.name(), payload, primary);
        BasicHDU<?> hdu;
        if (payload instanceof Table table) {
            BinaryTableHDU tableHdu = (BinaryTableHDU) Fits.makeHDU(BinaryTableConverter.write(table));
            if (table.getRowCount() == 0) {
                tableHdu.deleteRows(0, 1);
            }
            hdu = tableHdu;
            copyDescriptiveCards(synced, hdu.getHeader());
        }
        else if (payload instanceof NdArray array) {
            hdu = Fits.makeHDU(ArrayFuncs.curl(array.toArray(), array.shape()));
            copyDescriptiveCards(synced, hdu.getHeader());
        }
        else {
            nom.tam.fits.Header header = new nom.tam.fits.Header();
            for (HeaderCard card : synced) {
                HeaderConverter.addCard(header, card);
            }
            hdu = Fits.makeHDU(header);
        }
        LOG.log(System.Logger.Level.DEBUG, "Encoded HDU ''{0}''", record.name());
        return hdu;
    }

    private static void copyDescriptiveCards(Header source, nom.tam.fits.Header target) throws FitsException {
        for (HeaderCard card : source) {
            if (card.isCommentary() || !isDataLayout(card.keyword())) {
                HeaderConverter.addCard(target, card);
            }
        }
    }

    static boolean isDataLayout(String keyword) {
        return DATA_LAYOUT.contains(keyword) || INDEXED_DATA_LAYOUT.matcher(keyword).matches();
    }
}
