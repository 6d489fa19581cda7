/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Clef symbols as they are drawn. Each one anchors a named pitch on a reference line of the staff
 */
public enum ClefType implements Vocabulary {
    G("G", NamedPitch.G, 4, 4),
    C("C", NamedPitch.C, 6, 4),
    F("F", NamedPitch.F, 8, 3),
    PERCUSSION("percussion", NamedPitch.G, 4, 4);

    private final String value;
    /** pitch the clef sign stands for */
    private final NamedPitch sign;
    /** staff position the sign sits on if nothing else is given, the bottom line being 2 */
    private final int defaultPosition;
    private final int defaultOctave;

    ClefType(String value, NamedPitch sign, int defaultPosition, int defaultOctave) {
        this.value = value;
        this.sign = sign;
        this.defaultPosition = defaultPosition;
        this.defaultOctave = defaultOctave;
    }

    @Override
    public String getValue() {
        return value;
    }

    public NamedPitch getSign() {
        return sign;
    }

    public int getDefaultPosition() {
        return defaultPosition;
    }

    public int getDefaultOctave() {
        return defaultOctave;
    }
}
