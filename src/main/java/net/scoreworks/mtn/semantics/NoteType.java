/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

import org.apache.commons.lang3.math.Fraction;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Graphical note types with their duration measured in whole notes
 */
public enum NoteType implements Vocabulary {
    MAXIMA("maxima", Fraction.getFraction(8, 1)),
    LONG("long", Fraction.getFraction(4, 1)),
    BREVE("breve", Fraction.getFraction(2, 1)),
    WHOLE("whole", Fraction.ONE),
    HALF("half", Fraction.ONE_HALF),
    QUARTER("quarter", Fraction.ONE_QUARTER),
    EIGHTH("eighth", Fraction.getFraction(1, 8)),
    N16TH("16th", Fraction.getFraction(1, 16)),
    N32ND("32nd", Fraction.getFraction(1, 32)),
    N64TH("64th", Fraction.getFraction(1, 64)),
    N128TH("128th", Fraction.getFraction(1, 128)),
    N256TH("256th", Fraction.getFraction(1, 256)),
    N512TH("512th", Fraction.getFraction(1, 512)),
    N1024TH("1024th", Fraction.getFraction(1, 1024));

    private static final Map<Fraction, NoteType> DURATION2TYPE = new HashMap<>();
    private static final Map<Integer, NoteType> BEAMS2TYPE = new HashMap<>();
    private static final Map<NoteType, Integer> TYPE2BEAMS = new EnumMap<>(NoteType.class);

    static {
        for (NoteType type : values())
            DURATION2TYPE.put(type.duration, type);
        // quarter has no beam, every further halving adds one
        for (int beams = 0; beams <= 8; beams++) {
            NoteType type = DURATION2TYPE.get(Fraction.getFraction(1, 1 << (beams + 2)));
            BEAMS2TYPE.put(beams, type);
            TYPE2BEAMS.put(type, beams);
        }
    }

    private final String value;
    private final Fraction duration;

    NoteType(String value, Fraction duration) {
        this.value = value;
        this.duration = duration;
    }

    @Override
    public String getValue() {
        return value;
    }

    public Fraction getDuration() {
        return duration;
    }

    /**
     * Find the note type for a duration given in whole notes. Durations that do not match a type exactly are rounded
     * up to the next power of two. Anything outside the table becomes a whole note
     */
    public static NoteType fromDuration(Fraction duration) {
        Fraction reduced = duration.reduce();
        NoteType exact = DURATION2TYPE.get(reduced);
        if (exact != null)
            return exact;
        if (reduced.compareTo(MAXIMA.duration) > 0 || reduced.compareTo(N1024TH.duration) < 0)
            return WHOLE;
        NoteType closest = MAXIMA;
        for (NoteType type : values()) {
            if (type.duration.compareTo(reduced) >= 0)
                closest = type;
        }
        return closest;
    }

    public static NoteType fromBeams(int beams) {
        NoteType type = BEAMS2TYPE.get(beams);
        if (type == null)
            throw new IllegalArgumentException("no note type has " + beams + " beams");
        return type;
    }

    /**
     * @return the number of beams or flags this type is drawn with, null for types longer than a quarter
     */
    public Integer getBeams() {
        return TYPE2BEAMS.get(this);
    }
}
