/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.AccidentalType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * A key signature: the accidentals drawn for it, the naturals cancelling the previous one and the alteration it
 * applies to each diatonic step. Standard keys also know their position on the circle of fifths
 */
public class Key implements SyntaxNode {
    private static final Comparator<Token> BY_POSITION = Comparator.comparing(Token::getPosition);

    private List<Token> accidentals;
    private List<Token> naturals;
    private final AccidentalType[] alterations;
    private final Integer fifths;

    public Key(List<Token> accidentals, List<Token> naturals, AccidentalType[] alterations, Integer fifths) {
        this.accidentals = new ArrayList<>(accidentals);
        this.naturals = new ArrayList<>(naturals);
        this.alterations = Arrays.copyOf(alterations, 7);
        this.fifths = fifths;
        sort();
    }

    /**
     * Key without any accidental
     */
    public static Key defaultKey() {
        return new Key(new ArrayList<>(), new ArrayList<>(), new AccidentalType[7], 0);
    }

    public void sort() {
        accidentals.sort(BY_POSITION);
        naturals.sort(BY_POSITION);
    }

    public List<Token> getAccidentals() {
        return accidentals;
    }

    public void setAccidentals(List<Token> accidentals) {
        this.accidentals = new ArrayList<>(accidentals);
        sort();
    }

    public List<Token> getNaturals() {
        return naturals;
    }

    public void setNaturals(List<Token> naturals) {
        this.naturals = new ArrayList<>(naturals);
        sort();
    }

    public AccidentalType[] getAlterations() {
        return alterations;
    }

    public Integer getFifths() {
        return fifths;
    }

    public boolean isEmpty() {
        return accidentals.isEmpty() && naturals.isEmpty();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitKey(this);
    }

    /**
     * Keys are equal if they are drawn the same way
     */
    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Key))
            return false;
        Key key = (Key) other;
        return NodeComparison.lists(naturals, key.naturals) && NodeComparison.lists(accidentals, key.accidentals);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Key key = NodeComparison.sameKind(Key.class, other);
        NodeComparison.listsRaise("Key", "naturals", naturals, key.naturals);
        NodeComparison.listsRaise("Key", "accidentals", accidentals, key.accidentals);
    }

    @Override
    public String toString() {
        return "Key " + (fifths == null ? Arrays.toString(alterations) : fifths + " fifths") + ": " + accidentals
                + " " + naturals;
    }
}
