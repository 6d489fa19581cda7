/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

public enum WedgeType implements Vocabulary {
    CRESCENDO("crescendo"),
    DIMINUENDO("diminuendo"),
    STOP("stop");

    private final String value;

    WedgeType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
