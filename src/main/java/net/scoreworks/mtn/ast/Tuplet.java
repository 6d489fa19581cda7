/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * One end of a tuplet bracket, optionally with the number written over it
 */
public class Tuplet implements NoteModifier {
    private final Numeral number;
    private final Token tuplet;

    public Tuplet(Numeral number, Token tuplet) {
        this.number = number;
        this.tuplet = tuplet;
    }

    public Numeral getNumber() {
        return number;
    }

    public Token getTuplet() {
        return tuplet;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitTuplet(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Tuplet))
            return false;
        Tuplet t = (Tuplet) other;
        return NodeComparison.maybe(number, t.number) && tuplet.compare(t.tuplet);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Tuplet t = NodeComparison.sameKind(Tuplet.class, other);
        NodeComparison.maybeRaise("Tuplet", "number", number, t.number);
        tuplet.compareRaise(t.tuplet);
    }

    @Override
    public String toString() {
        return "Tuplet: " + tuplet + " | " + number;
    }
}
