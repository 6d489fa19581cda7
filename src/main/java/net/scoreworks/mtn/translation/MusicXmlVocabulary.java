/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.exceptions.UnsupportedElementException;
import net.scoreworks.mtn.semantics.AccidentalType;
import net.scoreworks.mtn.semantics.BackwardForward;
import net.scoreworks.mtn.semantics.BarlineType;
import net.scoreworks.mtn.semantics.ClefType;
import net.scoreworks.mtn.semantics.DynamicsType;
import net.scoreworks.mtn.semantics.NoteType;
import net.scoreworks.mtn.semantics.NoteheadType;
import net.scoreworks.mtn.semantics.StartStop;
import net.scoreworks.mtn.semantics.StemDirection;
import net.scoreworks.mtn.semantics.TokenType;
import net.scoreworks.mtn.semantics.Vocabulary;
import net.scoreworks.mtn.semantics.WedgeType;
import org.apache.commons.collections4.SetUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * How MusicXML values map onto the vocabulary of the music tree. Lookups of values that cannot be represented fail
 * with an {@link UnsupportedElementException}
 */
final class MusicXmlVocabulary {
    /** Accidentals, with the compound ones split into the glyphs they are drawn with */
    private static final Map<String, List<AccidentalType>> ACCIDENTALS = new HashMap<>();
    private static final Map<String, NoteheadType> NOTEHEADS = new HashMap<>();
    private static final Map<String, StemDirection> STEMS = new HashMap<>();
    private static final Map<String, List<BarlineType>> BAR_STYLES = new HashMap<>();
    private static final Map<String, ClefType> CLEFS = new HashMap<>();
    private static final Map<String, WedgeType> WEDGES = new HashMap<>();
    private static final Map<String, Integer> BEAM_PRECEDENCE = new HashMap<>();

    /** Notations that come as a start and a stop marker */
    static final Map<String, TokenType> POINT_TO_POINT = new HashMap<>();
    static final Map<String, TokenType> ORNAMENTS = new HashMap<>();
    static final Map<String, TokenType> ARTICULATIONS = new HashMap<>();

    static final Set<String> UNSUPPORTED_CLEFS = SetUtils.unmodifiableSet("TAB", "jianpu");
    static final Set<String> UNSUPPORTED_TIME_SYMBOLS = SetUtils.unmodifiableSet("note", "dotted-note",
            "single-number");

    static {
        ACCIDENTALS.put("sharp", Collections.singletonList(AccidentalType.SHARP));
        ACCIDENTALS.put("natural", Collections.singletonList(AccidentalType.NATURAL));
        ACCIDENTALS.put("flat", Collections.singletonList(AccidentalType.FLAT));
        ACCIDENTALS.put("double-sharp", Collections.singletonList(AccidentalType.DOUBLE_SHARP));
        ACCIDENTALS.put("flat-flat", Collections.singletonList(AccidentalType.DOUBLE_FLAT));
        ACCIDENTALS.put("quarter-flat", Collections.singletonList(AccidentalType.QUARTER_FLAT));
        ACCIDENTALS.put("quarter-sharp", Collections.singletonList(AccidentalType.QUARTER_SHARP));
        ACCIDENTALS.put("natural-sharp", Arrays.asList(AccidentalType.NATURAL, AccidentalType.SHARP));
        ACCIDENTALS.put("natural-flat", Arrays.asList(AccidentalType.NATURAL, AccidentalType.FLAT));
        ACCIDENTALS.put("sharp-sharp", Arrays.asList(AccidentalType.SHARP, AccidentalType.SHARP));

        NOTEHEADS.put("x", NoteheadType.CROSS);
        NOTEHEADS.put("cross", NoteheadType.CROSS);
        NOTEHEADS.put("diamond", NoteheadType.DIAMOND);
        NOTEHEADS.put("triangle", NoteheadType.TRIANGLE);
        NOTEHEADS.put("inverted triangle", NoteheadType.INVERTED_TRIANGLE);

        STEMS.put("up", StemDirection.UP);
        STEMS.put("down", StemDirection.DOWN);

        BAR_STYLES.put("regular", Collections.singletonList(BarlineType.REGULAR));
        BAR_STYLES.put("dotted", Collections.singletonList(BarlineType.DOTTED));
        BAR_STYLES.put("dashed", Collections.singletonList(BarlineType.DASHED));
        BAR_STYLES.put("heavy", Collections.singletonList(BarlineType.HEAVY));
        BAR_STYLES.put("tick", Collections.singletonList(BarlineType.TICK));
        BAR_STYLES.put("short", Collections.singletonList(BarlineType.SHORT));
        BAR_STYLES.put("heavy-heavy", Arrays.asList(BarlineType.HEAVY, BarlineType.HEAVY));
        BAR_STYLES.put("heavy-light", Arrays.asList(BarlineType.HEAVY, BarlineType.REGULAR));
        BAR_STYLES.put("light-light", Arrays.asList(BarlineType.REGULAR, BarlineType.REGULAR));
        BAR_STYLES.put("light-heavy", Arrays.asList(BarlineType.REGULAR, BarlineType.HEAVY));

        CLEFS.put("G", ClefType.G);
        CLEFS.put("F", ClefType.F);
        CLEFS.put("C", ClefType.C);
        CLEFS.put("percussion", ClefType.PERCUSSION);
        // no clef is drawn, notes are placed as if it were a treble clef
        CLEFS.put("none", ClefType.G);

        WEDGES.put("crescendo", WedgeType.CRESCENDO);
        WEDGES.put("diminuendo", WedgeType.DIMINUENDO);
        WEDGES.put("stop", WedgeType.STOP);

        BEAM_PRECEDENCE.put("begin", 0);
        BEAM_PRECEDENCE.put("continue", 1);
        BEAM_PRECEDENCE.put("forward hook", 2);
        BEAM_PRECEDENCE.put("backward hook", 3);
        BEAM_PRECEDENCE.put("end", 4);

        POINT_TO_POINT.put("glissando", TokenType.GLISSANDO);
        POINT_TO_POINT.put("slide", TokenType.SLIDE);
        POINT_TO_POINT.put("slur", TokenType.SLUR);
        POINT_TO_POINT.put("wavy-line", TokenType.WAVY_LINE);

        ORNAMENTS.put("trill-mark", TokenType.TRILL);
        ORNAMENTS.put("turn", TokenType.TURN);
        ORNAMENTS.put("mordent", TokenType.MORDENT);
        ORNAMENTS.put("schleifer", TokenType.SCHLEIFER);
        ORNAMENTS.put("haydn", TokenType.HAYDN);

        ARTICULATIONS.put("accent", TokenType.ACCENT);
        ARTICULATIONS.put("strong-accent", TokenType.ACCENT);
        ARTICULATIONS.put("staccato", TokenType.STACCATO);
        ARTICULATIONS.put("tenuto", TokenType.TENUTO);
        ARTICULATIONS.put("staccatissimo", TokenType.STACCATO);
        ARTICULATIONS.put("caesura", TokenType.CAESURA);
    }

    private MusicXmlVocabulary() {}

    static NoteType noteType(String value) {
        return require("note type", value, Vocabulary.fromValue(NoteType.class, value));
    }

    static List<AccidentalType> accidentals(String value) {
        return require("accidental", value, ACCIDENTALS.get(value));
    }

    /**
     * @return the notehead or null for the regular one that follows from the note type
     */
    static NoteheadType notehead(String value) {
        if ("normal".equals(value))
            return null;
        return require("notehead", value, NOTEHEADS.get(value));
    }

    static StemDirection stem(String value) {
        return require("stem", value, STEMS.get(value));
    }

    static List<BarlineType> barStyle(String value) {
        return require("bar style", value, BAR_STYLES.get(value));
    }

    static ClefType clef(String sign) {
        return require("clef", sign, CLEFS.get(sign));
    }

    static DynamicsType dynamics(String value) {
        return require("dynamics", value, Vocabulary.fromValue(DynamicsType.class, value));
    }

    static WedgeType wedge(String value) {
        return require("wedge", value, WEDGES.get(value));
    }

    static StartStop startStop(String value) {
        return require("start-stop", value, Vocabulary.fromValue(StartStop.class, value));
    }

    static BackwardForward repeatDirection(String value) {
        return require("repeat direction", value, Vocabulary.fromValue(BackwardForward.class, value));
    }

    static int beamPrecedence(String value) {
        return require("beam", value, BEAM_PRECEDENCE.get(value));
    }

    private static <V> V require(String element, String value, V mapped) {
        if (mapped == null)
            throw new UnsupportedElementException(element, value);
        return mapped;
    }
}
