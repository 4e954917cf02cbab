/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

/**
 * In-memory representation of an extension's data.
 */
public enum PayloadVariant {
    TABLE,
    ARRAY,
    /**
     * Complex array, stored on disk as a real image with a leading (real, imag) axis.
     */
    COMPLEX_ARRAY
}
