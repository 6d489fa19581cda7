/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.ClefType;
import net.scoreworks.mtn.semantics.NamedPitch;
import net.scoreworks.mtn.semantics.NotePitch;
import net.scoreworks.mtn.semantics.StaffPosition;

/**
 * A clef anchors a pitch ({@link #sign} in {@link #octave}) to a staff position. Default clefs are not drawn and have
 * no token
 */
public class Clef implements SyntaxNode {
    private final Token clefToken;
    private final NamedPitch sign;
    private final int octave;
    private final StaffPosition position;

    public Clef(Token clefToken, NamedPitch sign, int octave, StaffPosition position) {
        this.clefToken = clefToken;
        this.sign = sign;
        this.octave = octave;
        this.position = position;
    }

    /**
     * Treble clef on the given staff
     */
    public static Clef defaultClef(int staff) {
        return new Clef(null, ClefType.G.getSign(), ClefType.G.getDefaultOctave(),
                new StaffPosition(staff, ClefType.G.getDefaultPosition()));
    }

    /**
     * Staff position a pitch is drawn at under this clef
     */
    public int pitch2pos(NotePitch pitch) {
        return pitch.projectOnto(sign, octave, position.getPosition());
    }

    public Token getClefToken() {
        return clefToken;
    }

    public NamedPitch getSign() {
        return sign;
    }

    public int getOctave() {
        return octave;
    }

    public StaffPosition getPosition() {
        return position;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitClef(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Clef))
            return false;
        Clef clef = (Clef) other;
        return NodeComparison.maybe(clefToken, clef.clefToken)
                && sign == clef.sign
                && octave == clef.octave
                && position.equals(clef.position);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Clef clef = NodeComparison.sameKind(Clef.class, other);
        NodeComparison.maybeRaise("Clef", "token", clefToken, clef.clefToken);
        NodeComparison.fieldRaise("Clef", "sign", sign, clef.sign);
        NodeComparison.fieldRaise("Clef", "octave", octave, clef.octave);
        NodeComparison.fieldRaise("Clef", "position", position, clef.position);
    }

    @Override
    public String toString() {
        return "Clef " + sign + octave + " @" + position;
    }
}
