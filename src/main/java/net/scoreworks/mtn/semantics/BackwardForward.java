/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Direction a repeat sign points to
 */
public enum BackwardForward implements Vocabulary {
    BACKWARD("backward"),
    FORWARD("forward");

    private final String value;

    BackwardForward(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
