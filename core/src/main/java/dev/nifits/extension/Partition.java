/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

/**
 * Whether an extension describes the instrument (static) or the observation (dynamic).
 */
public enum Partition {
    /**
     * Fixed instrument properties: geometry, optics, wavelength grid, targets.
     */
    STATIC,
    /**
     * Time-varying observation data: modulation state, recorded outputs and their statistics.
     */
    DYNAMIC
}
