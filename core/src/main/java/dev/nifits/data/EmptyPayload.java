/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.data;

/**
 * Payload of a record without data ({@code NAXIS = 0}).
 */
public enum EmptyPayload implements Payload {
    INSTANCE
}
