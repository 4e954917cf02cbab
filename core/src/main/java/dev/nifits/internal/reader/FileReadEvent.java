/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when a FITS file has been read and decoded into records.
 */
@Name("dev.nifits.FileRead")
@Label("FITS File Read")
@Category({"NIFITS", "I/O"})
@Description("Reading and decoding of a FITS file")
public class FileReadEvent extends Event {

    @Label("File Path")
    @Description("Path to the file being read")
    public String path;

    @Label("Size")
    @Description("Size of the file (bytes)")
    public long size;

    @Label("Records")
    @Description("Number of header-data units decoded from the file")
    public int records;
}
