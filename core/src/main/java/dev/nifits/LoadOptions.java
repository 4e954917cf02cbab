/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits;

/**
 * Options for {@link Nifits#load}.
 *
 * @param failOnStructuralError whether a structurally invalid extension fails the load;
 *                              if {@code false} it is recorded in the {@link LoadReport}
 *                              and its slot stays empty
 */
public record LoadOptions(boolean failOnStructuralError) {

    static final String FAIL_ON_STRUCTURAL_ERROR_PROPERTY = "nifits.failOnStructuralError";

    /**
     * Options from system properties; {@code nifits.failOnStructuralError} defaults to {@code true}.
     */
    public static LoadOptions defaults() {
        return new LoadOptions(!"false".equalsIgnoreCase(System.getProperty(FAIL_ON_STRUCTURAL_ERROR_PROPERTY)));
    }

    public static LoadOptions strict() {
        return new LoadOptions(true);
    }

    public static LoadOptions lenient() {
        return new LoadOptions(false);
    }
}
