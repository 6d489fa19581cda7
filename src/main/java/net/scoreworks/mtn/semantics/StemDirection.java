/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

public enum StemDirection implements Vocabulary {
    UP("up"),
    DOWN("down");

    private final String value;

    StemDirection(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
