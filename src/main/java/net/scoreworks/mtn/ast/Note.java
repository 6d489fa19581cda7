/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.StaffPosition;
import org.apache.commons.lang3.math.Fraction;

import java.util.List;

/**
 * A notehead with its dots, accidentals and attached markings. The enclosing {@link Chord} owns the note and sets
 * itself as its parent when the note is added
 */
public class Note implements SyntaxNode {
    private final Token notehead;
    private final List<Token> dots;
    private final List<Token> accidentals;
    private final List<NoteModifier> modifiers;
    private Chord parent;

    public Note(Token notehead, List<Token> dots, List<Token> accidentals, List<NoteModifier> modifiers) {
        this.notehead = notehead;
        this.dots = dots;
        this.accidentals = accidentals;
        this.modifiers = modifiers;
    }

    public Token getNotehead() {
        return notehead;
    }

    public List<Token> getDots() {
        return dots;
    }

    public List<Token> getAccidentals() {
        return accidentals;
    }

    public List<NoteModifier> getModifiers() {
        return modifiers;
    }

    public Chord getParent() {
        return parent;
    }

    void setParent(Chord parent) {
        this.parent = parent;
    }

    public StaffPosition getPosition() {
        return notehead.getPosition();
    }

    /**
     * @return time of the chord this note belongs to or null if the note was not added to one yet
     */
    public Fraction getDelta() {
        return parent == null ? null : parent.getDelta();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitNote(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Note))
            return false;
        Note note = (Note) other;
        return notehead.compare(note.notehead)
                && NodeComparison.lists(dots, note.dots)
                && NodeComparison.lists(accidentals, note.accidentals)
                && NodeComparison.lists(modifiers, note.modifiers);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Note note = NodeComparison.sameKind(Note.class, other);
        notehead.compareRaise(note.notehead);
        NodeComparison.listsRaise("Note", "dots", dots, note.dots);
        NodeComparison.listsRaise("Note", "accidentals", accidentals, note.accidentals);
        NodeComparison.listsRaise("Note", "modifiers", modifiers, note.modifiers);
    }

    @Override
    public String toString() {
        return "Note @" + getPosition() + ": " + notehead + " with " + dots.size() + " dots, "
                + accidentals.size() + " accidentals and " + modifiers.size() + " modifiers";
    }
}
