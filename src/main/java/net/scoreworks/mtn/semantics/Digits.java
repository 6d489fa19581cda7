/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Digits that appear as glyphs on the score, as in time signatures and tuplet numbers
 */
public enum Digits implements Vocabulary {
    DIGIT_0, DIGIT_1, DIGIT_2, DIGIT_3, DIGIT_4, DIGIT_5, DIGIT_6, DIGIT_7, DIGIT_8, DIGIT_9;

    public int getDigit() {
        return ordinal();
    }

    @Override
    public String getValue() {
        return Integer.toString(ordinal());
    }

    public static Digits fromDigit(int digit) {
        if (digit < 0 || digit > 9)
            throw new IllegalArgumentException(digit + " is not a digit");
        return values()[digit];
    }
}
