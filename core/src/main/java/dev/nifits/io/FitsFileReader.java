/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.io;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import dev.nifits.internal.fits.HduConverter;
import dev.nifits.internal.reader.FileReadEvent;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

/**
 * Reader for FITS files holding images and binary tables.
 * <p>
 * All header-data units are decoded by {@link #open(Path)}, and the file is closed
 * before it returns; the reader then exposes them as an ordered list of records.
 * </p>
 * <pre>{@code
 * FitsFileReader reader = FitsFileReader.open(path);
 * List<FitsRecord> records = reader.getRecords();
 * }</pre>
 */
public class FitsFileReader {

    private static final System.Logger LOG = System.getLogger(FitsFileReader.class.getName());

    private final Path path;
    private final List<FitsRecord> records;

    private FitsFileReader(Path path, List<FitsRecord> records) {
        this.path = path;
        this.records = records;
    }

    public static FitsFileReader open(Path path) throws IOException {
        FileReadEvent event = new FileReadEvent();
        event.begin();

        List<FitsRecord> records;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            records = read(in);
        }

        event.path = path.toString();
        event.size = Files.size(path);
        event.records = records.size();
        event.commit();

        LOG.log(System.Logger.Level.DEBUG, "Read {0} records from ''{1}''", records.size(), path);
        return new FitsFileReader(path, records);
    }

    /**
     * Decodes all header-data units of a FITS stream. The stream is not closed.
     */
    public static List<FitsRecord> read(InputStream in) throws IOException {
        try {
            BasicHDU<?>[] hdus = new Fits(in).read();
            if (hdus == null || hdus.length == 0) {
                throw new FitsFormatException("No header-data unit found");
            }
            List<FitsRecord> records = new ArrayList<>(hdus.length);
            for (int i = 0; i < hdus.length; i++) {
                records.add(HduConverter.toRecord(hdus[i], i == 0));
            }
            return List.copyOf(records);
        }
        catch (FitsException e) {
            throw new FitsFormatException("Malformed FITS data: " + e.getMessage(), e);
        }
        catch (IllegalArgumentException | IllegalStateException | ArithmeticException e) {
            throw new FitsFormatException("Malformed HDU: " + e.getMessage(), e);
        }
    }

    public static List<FitsRecord> read(byte[] bytes) throws IOException {
        return read(new ByteArrayInputStream(bytes));
    }

    public Path getPath() {
        return path;
    }

    public List<FitsRecord> getRecords() {
        return records;
    }

    public FitsRecord getPrimary() {
        return records.get(0);
    }

    public boolean contains(String name) {
        return getRecord(name).isPresent();
    }

    /**
     * Case-insensitive lookup of the first record with the given name.
     */
    public Optional<FitsRecord> getRecord(String name) {
        for (FitsRecord record : records) {
            if (record.hasName(name)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }
}
