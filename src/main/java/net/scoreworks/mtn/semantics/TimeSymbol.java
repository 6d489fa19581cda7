/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * A time signature drawn as a single glyph
 */
public enum TimeSymbol implements Vocabulary {
    COMMON("common"),
    CUT("cut");

    private final String value;

    TimeSymbol(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
