/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.io;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import dev.nifits.internal.fits.HduConverter;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.util.FitsOutputStream;

/**
 * Writes records as a FITS file. The first record is written as the primary HDU and
 * must not hold a table.
 */
public final class FitsFileWriter {

    private FitsFileWriter() {
    }

    /**
     * Writes the records to a file.
     *
     * @param overwrite whether an existing file may be replaced; if {@code false} and the
     *                  file exists, a {@link java.nio.file.FileAlreadyExistsException} is thrown
     */
    public static void write(List<FitsRecord> records, Path path, boolean overwrite) throws IOException {
        StandardOpenOption[] options = overwrite
                ? new StandardOpenOption[]{ StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE }
                : new StandardOpenOption[]{ StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE };
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path, options))) {
            write(records, out);
        }
    }

    /**
     * Writes the records to a stream, which is flushed but not closed.
     */
    public static void write(List<FitsRecord> records, OutputStream out) throws IOException {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("At least one record (the primary HDU) is required");
        }
        Fits fits = new Fits();
        try {
            for (int i = 0; i < records.size(); i++) {
                fits.addHDU(HduConverter.toHdu(records.get(i), i == 0));
            }
            FitsOutputStream stream = new FitsOutputStream(out);
            fits.write(stream);
            stream.flush();
        }
        catch (FitsException e) {
            throw new IOException("Could not encode FITS records: " + e.getMessage(), e);
        }
    }

    public static byte[] toBytes(List<FitsRecord> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(records, out);
        }
        catch (IOException e) {
            throw new IllegalStateException("In-memory write failed", e);
        }
        return out.toByteArray();
    }
}
