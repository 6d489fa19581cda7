/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Starting or ending side of an element that spans several notes
 */
public enum StartStop implements Vocabulary {
    START("start"),
    STOP("stop");

    private final String value;

    StartStop(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
