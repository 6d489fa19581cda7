/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.Digits;

import java.util.List;

/**
 * A number written with digit tokens, most significant digit first
 */
public class Numeral implements NumeratorElement {
    private final List<Token> digits;

    public Numeral(List<Token> digits) {
        this.digits = digits;
    }

    public List<Token> getDigits() {
        return digits;
    }

    public int getValue() {
        int value = 0;
        for (Token digit : digits)
            value = value * 10 + ((Digits) digit.getModifier("type")).getDigit();
        return value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitNumeral(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        return other instanceof Numeral && NodeComparison.lists(digits, ((Numeral) other).digits);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Numeral numeral = NodeComparison.sameKind(Numeral.class, other);
        NodeComparison.listsRaise("Numeral", "digits", digits, numeral.digits);
    }

    @Override
    public String toString() {
        return Integer.toString(getValue());
    }
}
