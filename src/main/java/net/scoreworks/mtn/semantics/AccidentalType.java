/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

public enum AccidentalType implements Vocabulary {
    SHARP("sharp"),
    NATURAL("natural"),
    FLAT("flat"),
    DOUBLE_SHARP("double_sharp"),
    DOUBLE_FLAT("double_flat"),
    QUARTER_FLAT("quarter_flat"),
    QUARTER_SHARP("quarter_sharp");

    private final String value;

    AccidentalType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
