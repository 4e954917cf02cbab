/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.data;

/**
 * Body of a FITS record: a binary table, a real-valued image, or nothing at all
 * (the primary HDU of a NIFITS file carries no data).
 */
public sealed interface Payload permits Table, NdArray, EmptyPayload {
}
