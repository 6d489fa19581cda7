/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Every kind of leaf symbol a score can contain
 */
public enum TokenType implements Vocabulary {
    ACCENT("accent"),
    ACCIDENTAL("accidental"),
    ARPEGGIATE("arpeggiate"),
    BARLINE("barline_tok"),
    BEAM("beam"),
    CAESURA("caesura"),
    CLEF("clef"),
    CODA("coda"),
    DELTA("delta"),
    DOT("dot"),
    DYN("dyn"),
    EOF("eof"),
    FERMATA("fermata"),
    FLAG("flag"),
    GLISSANDO("glissando"),
    HAYDN("haydn"),
    MORDENT("mordent"),
    NOTEHEAD("notehead"),
    NUMBER("number"),
    OVER("over"),
    PEDAL("pedal"),
    PLUS("plus"),
    REPEAT("repeat"),
    REST("rest"),
    SCHLEIFER("schleifer"),
    SEGNO("segno"),
    SLIDE("slide"),
    SLUR("slur"),
    STACCATO("staccato"),
    STEM("stem"),
    TENUTO("tenuto"),
    TIED("tied"),
    TIME_RELATION("time_relation"),
    TIMESIG("timesig"),
    TRILL("trill"),
    TUPLET("tuplet"),
    TURN("turn"),
    UNKNOWN("unknown"),
    WAVY_LINE("wavy_line"),
    WEDGE("wedge");

    private final String value;

    TokenType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }
}
