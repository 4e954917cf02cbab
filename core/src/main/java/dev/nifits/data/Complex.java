/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.nifits.data;

/**
 * A complex number, used for scalar cells of complex table columns.
 */
public record Complex(double real, double imag) {

    public static final Complex ZERO = new Complex(0.0, 0.0);

    public double abs() {
        return Math.hypot(real, imag);
    }

    public double arg() {
        return Math.atan2(imag, real);
    }

    public static Complex polar(double modulus, double phase) {
        return new Complex(modulus * Math.cos(phase), modulus * Math.sin(phase));
    }

    @Override
    public String toString() {
        return "(" + real + (imag < 0 || Double.doubleToRawLongBits(imag) == Long.MIN_VALUE ? "" : "+") + imag + "j)";
    }
}
