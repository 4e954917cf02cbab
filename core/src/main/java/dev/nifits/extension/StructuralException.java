/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.extension;

/**
 * Thrown when a record's payload does not have the variant or shape its extension kind requires.
 */
public class StructuralException extends IllegalArgumentException {

    private final ExtensionKind kind;

    public StructuralException(ExtensionKind kind, String message) {
        super(kind.extensionName() + ": " + message);
        this.kind = kind;
    }

    public StructuralException(ExtensionKind kind, String message, Throwable cause) {
        super(kind.extensionName() + ": " + message, cause);
        this.kind = kind;
    }

    public ExtensionKind getKind() {
        return kind;
    }
}
