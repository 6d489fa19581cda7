/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import org.apache.commons.lang3.math.Fraction;

import java.util.List;

/**
 * A barline drawn with one or more glyphs, plus repeat signs, fermatas and the like placed on it
 */
public class Barline extends TopLevel {
    private final List<Token> barlines;
    private final List<Token> modifiers;

    public Barline(Fraction delta, List<Token> barlines, List<Token> modifiers) {
        super(delta);
        this.barlines = barlines;
        this.modifiers = modifiers;
    }

    public List<Token> getBarlines() {
        return barlines;
    }

    public List<Token> getModifiers() {
        return modifiers;
    }

    @Override
    protected int getPrecedence() {
        return 1;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBarline(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Barline))
            return false;
        Barline barline = (Barline) other;
        return compareDelta(barline)
                && NodeComparison.lists(barlines, barline.barlines)
                && NodeComparison.lists(modifiers, barline.modifiers);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Barline barline = NodeComparison.sameKind(Barline.class, other);
        compareDeltaRaise(barline);
        NodeComparison.listsRaise("Barline", "barlines", barlines, barline.barlines);
        NodeComparison.listsRaise("Barline", "modifiers", modifiers, barline.modifiers);
    }

    @Override
    public String toString() {
        return "Barline (Delta " + delta + "): " + barlines + " " + modifiers;
    }
}
