/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

public enum BarlineType implements Vocabulary {
    REGULAR("regular"),
    DOTTED("dotted"),
    DASHED("dashed"),
    HEAVY("heavy"),
    TICK("tick"),
    SHORT("short");

    private final String value;

    BarlineType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
