/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import org.apache.commons.lang3.math.Fraction;

/**
 * Text form of times in quarter notes: a whole number, or numerator and denominator of the reduced fraction
 */
final class TimeFormat {

    private TimeFormat() {}

    static String format(Fraction time) {
        Fraction reduced = time.reduce();
        if (reduced.getDenominator() == 1)
            return Integer.toString(reduced.getNumerator());
        return reduced.getNumerator() + "/" + reduced.getDenominator();
    }
}
