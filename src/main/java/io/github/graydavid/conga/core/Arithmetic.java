/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

/**
 * The numeric semantics of add and mul. Two integral operands (byte, short, int, or long) produce a long, failing on
 * overflow; anything else is promoted to double.
 */
class Arithmetic {
    private Arithmetic() {}

    static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte;
    }

    /** @throws ArithmeticException if both operands are integral and the sum overflows a long. */
    static Number add(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Math.addExact(a.longValue(), b.longValue());
        }
        return a.doubleValue() + b.doubleValue();
    }

    /** @throws ArithmeticException if both operands are integral and the product overflows a long. */
    static Number multiply(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Math.multiplyExact(a.longValue(), b.longValue());
        }
        return a.doubleValue() * b.doubleValue();
    }
}
