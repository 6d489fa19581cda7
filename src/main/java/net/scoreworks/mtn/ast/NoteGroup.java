/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.StaffPosition;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Chords that are beamed together, possibly in nested beam levels. The appendages hold the beam or flag tokens
 * drawn for the group
 */
public class NoteGroup extends TopLevel implements GroupElement {
    private List<GroupElement> children;
    private final List<Token> appendages;

    public NoteGroup(Fraction delta, List<GroupElement> children, List<Token> appendages) {
        super(delta);
        this.children = new ArrayList<>(children);
        this.appendages = new ArrayList<>(appendages);
    }

    public List<GroupElement> getChildren() {
        return children;
    }

    public List<Token> getAppendages() {
        return appendages;
    }

    /**
     * Append the children and appendages of another group to this one
     */
    public NoteGroup merge(NoteGroup other) {
        children.addAll(other.children);
        appendages.addAll(other.appendages);
        return this;
    }

    /**
     * Take over the children of a nested group and add its appendages to this one's
     */
    public NoteGroup absorb(NoteGroup other) {
        children = new ArrayList<>(other.children);
        appendages.addAll(other.appendages);
        return this;
    }

    /**
     * Collapse every level of nesting that holds nothing but a single nested group
     */
    public NoteGroup simplify() {
        for (GroupElement child : children) {
            if (child instanceof NoteGroup)
                ((NoteGroup) child).simplify();
        }
        if (children.size() == 1 && children.get(0) instanceof NoteGroup)
            absorb((NoteGroup) children.get(0));
        return this;
    }

    /**
     * @return the chord that comes first in the tree or null if the group holds no chord
     */
    public Chord getFirstChord() {
        for (GroupElement child : children) {
            if (child instanceof Chord)
                return (Chord) child;
            Chord nested = ((NoteGroup) child).getFirstChord();
            if (nested != null)
                return nested;
        }
        return null;
    }

    @Override
    protected int getPrecedence() {
        return 5;
    }

    @Override
    public StaffPosition getPosition() {
        Chord first = getFirstChord();
        return first == null ? StaffPosition.UNSET : first.getPosition();
    }

    /**
     * Groups whose first chord is stemmed upwards go first
     */
    @Override
    protected int tieBreak(TopLevel other) {
        if (!(other instanceof NoteGroup))
            return 0;
        return Boolean.compare(!isStemUpwards(), !((NoteGroup) other).isStemUpwards());
    }

    private boolean isStemUpwards() {
        Chord first = getFirstChord();
        return first != null && first.isStemUpwards();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitNoteGroup(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof NoteGroup))
            return false;
        NoteGroup group = (NoteGroup) other;
        return compareDelta(group)
                && NodeComparison.lists(children, group.children)
                && NodeComparison.lists(appendages, group.appendages);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        NoteGroup group = NodeComparison.sameKind(NoteGroup.class, other);
        compareDeltaRaise(group);
        NodeComparison.listsRaise("NoteGroup", "children", children, group.children);
        NodeComparison.listsRaise("NoteGroup", "appendages", appendages, group.appendages);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("Note Group (Delta ").append(delta).append("):");
        for (GroupElement child : children)
            builder.append("\n\t").append(child);
        return builder.toString();
    }
}
