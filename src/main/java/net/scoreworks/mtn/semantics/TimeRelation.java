/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Symbol joining the parts of an interchangeable time signature
 */
public enum TimeRelation implements Vocabulary {
    EQUALS("equals");

    private final String value;

    TimeRelation(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
