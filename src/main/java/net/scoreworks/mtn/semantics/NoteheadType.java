/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

public enum NoteheadType implements Vocabulary {
    BLACK("black"),
    WHITE("white"),
    MAXIMA("maxima"),
    LONG("long"),
    BREVE("breve"),
    CROSS("cross"),
    TRIANGLE("triangle"),
    INVERTED_TRIANGLE("inverted-triangle"),
    DIAMOND("diamond");

    private final String value;

    NoteheadType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * The notehead a note of the given type is drawn with when nothing else is specified
     */
    public static NoteheadType fromNoteType(NoteType type) {
        switch (type) {
            case MAXIMA:
                return MAXIMA;
            case LONG:
                return LONG;
            case BREVE:
                return BREVE;
            case WHOLE:
            case HALF:
                return WHITE;
            default:
                return BLACK;
        }
    }
}
