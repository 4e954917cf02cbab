/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.io;

import java.io.IOException;

/**
 * Thrown when a byte sequence does not follow the FITS layout this library understands.
 */
public class FitsFormatException extends IOException {

    public FitsFormatException(String message) {
        super(message);
    }

    public FitsFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
