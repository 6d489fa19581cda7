/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * A closed set of symbols that are written out by a fixed textual value. All token modifier values that are enum
 * constants implement this interface
 */
public interface Vocabulary {

    String getValue();

    /**
     * Look up the constant of an enum whose value equals the given text.
     * @return the matching constant or null if there is none
     */
    static <E extends Enum<E> & Vocabulary> E fromValue(Class<E> clazz, String value) {
        for (E constant : clazz.getEnumConstants()) {
            if (constant.getValue().equals(value))
                return constant;
        }
        return null;
    }

    /**
     * Textual form of a modifier value, which is either a vocabulary constant or a plain object
     */
    static String valueOf(Object modifier) {
        if (modifier instanceof Vocabulary)
            return ((Vocabulary) modifier).getValue();
        return String.valueOf(modifier);
    }
}
