/*
 * Copyright 2021 David Gray
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.github.graydavid.conga.core;

import java.util.Objects;

/**
 * Decides when two values are "equal" for assertions and expected values. Integral numbers compare exactly. Any other
 * pair of numbers compares equal when their difference is within the relative tolerance (scaled by the larger
 * magnitude) or within the absolute tolerance, whichever is larger. Non-numbers compare with
 * {@link Object#equals(Object)}.
 */
public final class Tolerance {
    /** Relative tolerance of 1e-9 and absolute tolerance of 1e-12. */
    public static final Tolerance DEFAULT = new Tolerance(1e-9, 1e-12);

    private final double relative;
    private final double absolute;

    private Tolerance(double relative, double absolute) {
        this.relative = requireValidTolerance(relative, "relative");
        this.absolute = requireValidTolerance(absolute, "absolute");
    }

    private static double requireValidTolerance(double tolerance, String name) {
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException(
                    "The " + name + " tolerance must be a finite, non-negative number but was " + tolerance);
        }
        return tolerance;
    }

    /**
     * Creates a Tolerance.
     *
     * @throws IllegalArgumentException if either tolerance is negative, infinite, or NaN.
     */
    public static Tolerance of(double relative, double absolute) {
        return new Tolerance(relative, absolute);
    }

    /** A Tolerance that only accepts exactly equal values. */
    public static Tolerance exact() {
        return new Tolerance(0, 0);
    }

    public double getRelative() {
        return relative;
    }

    public double getAbsolute() {
        return absolute;
    }

    /** Whether a and b are equal within this tolerance. Neither may be null. */
    public boolean isClose(Number a, Number b) {
        if (Arithmetic.isIntegral(a) && Arithmetic.isIntegral(b)) {
            return a.longValue() == b.longValue();
        }

        double x = a.doubleValue();
        double y = b.doubleValue();
        if (x == y) {
            return true;
        }
        if (Double.isInfinite(x) || Double.isInfinite(y)) {
            return false;
        }
        double difference = Math.abs(x - y);
        return difference <= Math.max(relative * Math.max(Math.abs(x), Math.abs(y)), absolute);
    }

    /** Same as {@link #isClose(Number, Number)} for numbers; equals for anything else. */
    public boolean matches(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return isClose((Number) a, (Number) b);
        }
        return Objects.equals(a, b);
    }

    @Override
    public boolean equals(Object object) {
        if (!(object instanceof Tolerance)) {
            return false;
        }

        Tolerance other = (Tolerance) object;
        return Double.compare(relative, other.relative) == 0 && Double.compare(absolute, other.absolute) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(relative, absolute);
    }

    @Override
    public String toString() {
        return "Tolerance(relative=" + relative + ", absolute=" + absolute + ")";
    }
}
