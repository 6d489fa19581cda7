/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.InvariantViolationException;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.StemDirection;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Notes that are struck together and share a stem. Notes are kept sorted from the lowest staff position up
 */
public class Chord implements GroupElement {
    private static final Comparator<Note> BY_POSITION = Comparator.comparing(Note::getPosition);

    private final Fraction delta;
    private final Token stem;
    private final List<Note> notes;

    public Chord(Fraction delta, Token stem, List<Note> notes) {
        if (notes.isEmpty())
            throw new InvariantViolationException(Chord.class, "needs at least one note");
        this.delta = delta;
        this.stem = stem;
        this.notes = new ArrayList<>(notes);
        for (Note note : this.notes)
            note.setParent(this);
    }

    public Fraction getDelta() {
        return delta;
    }

    public Token getStem() {
        return stem;
    }

    public List<Note> getNotes() {
        return notes;
    }

    public void addNote(Note note) {
        note.setParent(this);
        notes.add(note);
        notes.sort(BY_POSITION);
    }

    public StaffPosition getPosition() {
        return notes.get(0).getPosition();
    }

    public boolean isStemUpwards() {
        if (stem == null)
            return false;
        Object direction = stem.getModifier("type");
        if (direction == null)
            throw new InvariantViolationException(Chord.class, "has a stem without direction");
        return direction == StemDirection.UP;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitChord(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Chord))
            return false;
        Chord chord = (Chord) other;
        return NodeComparison.maybe(stem, chord.stem)
                && NodeComparison.sameTime(delta, chord.delta)
                && NodeComparison.lists(notes, chord.notes);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Chord chord = NodeComparison.sameKind(Chord.class, other);
        NodeComparison.fieldRaise("Chord", "delta", delta, chord.delta);
        NodeComparison.maybeRaise("Chord", "stem", stem, chord.stem);
        NodeComparison.listsRaise("Chord", "notes", notes, chord.notes);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Stem: ").append(stem);
        for (Note note : notes)
            builder.append('\n').append(note);
        return builder.toString();
    }
}
